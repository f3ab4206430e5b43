package com.example.inventory.application.port.in;

import com.example.inventory.application.dto.ReconciliationResult;
import com.example.inventory.domain.model.InventoryKey;

/**
 * Inbound port for rebuilding projections from the ledger.
 */
public interface ReconcileUseCase {

    /**
     * Rebuilds the projection of a key from its full history and overwrites the live projection.
     * Clears any quarantine on the key.
     */
    ReconciliationResult reconcile(InventoryKey key);

    /**
     * Rebuilds the projection of a key and compares it with the live one without repairing.
     *
     * @throws com.example.inventory.domain.exception.ProjectionDivergenceException if they differ;
     *         the key is then closed for writes until reconciled
     */
    ReconciliationResult verify(InventoryKey key);
}

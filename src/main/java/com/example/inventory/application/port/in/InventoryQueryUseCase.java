package com.example.inventory.application.port.in;

import com.example.inventory.application.dto.LedgerEntry;
import com.example.inventory.application.dto.StockLevel;
import com.example.inventory.domain.model.InventoryKey;

import java.util.List;

/**
 * Inbound port for reading quantities and history.
 */
public interface InventoryQueryUseCase {

    /**
     * Returns the projected quantity of a key. A key with no history has quantity zero.
     */
    StockLevel getQuantity(InventoryKey key);

    /**
     * Returns the events of a key with an id greater than {@code sinceEventId}, in event id order.
     *
     * @param limit maximum number of events, null for the configured maximum
     */
    List<LedgerEntry> getHistory(InventoryKey key, long sinceEventId, Integer limit);
}

package com.example.inventory.application.dto;

import com.example.inventory.domain.model.InventoryChangeEvent;

import java.time.Instant;

/**
 * An admitted ledger event as returned to callers.
 * {@code quantityBefore}/{@code quantityAfter} are audit metadata recorded at admission.
 */
public record LedgerEntry(
        long eventId,
        long warehouseId,
        long productId,
        String changeType,
        int quantityDelta,
        String reference,
        Instant occurredAt,
        long quantityBefore,
        long quantityAfter
) {
    public static LedgerEntry from(InventoryChangeEvent event) {
        return new LedgerEntry(
                event.getEventId(),
                event.getKey().getWarehouseId(),
                event.getKey().getProductId(),
                event.getChangeType().code(),
                event.getQuantityDelta(),
                event.getReference(),
                event.getOccurredAt(),
                event.getQuantityBefore(),
                event.getQuantityAfter());
    }
}

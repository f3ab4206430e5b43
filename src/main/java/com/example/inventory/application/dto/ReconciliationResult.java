package com.example.inventory.application.dto;

/**
 * Outcome of rebuilding one key from its ledger history.
 *
 * @param previousQuantity quantity of the live projection before the rebuild was compared
 * @param eventsReplayed   number of events applied while rebuilding, catch-up included
 * @param diverged         true if the rebuilt state differed from the live projection
 * @param repaired         true if the live projection was overwritten with the rebuilt state
 */
public record ReconciliationResult(
        long warehouseId,
        long productId,
        long currentQuantity,
        long reservedQuantity,
        long lastAppliedEventId,
        long previousQuantity,
        int eventsReplayed,
        boolean diverged,
        boolean repaired
) {
}

package com.example.inventory.domain.exception;

import com.example.inventory.domain.model.InventoryKey;

/**
 * Exception thrown when a release exceeds the quantity still reserved on a key.
 */
public class OverReleaseException extends DomainException {

    private final InventoryKey key;
    private final int attemptedDelta;
    private final long outstandingReserved;

    public OverReleaseException(InventoryKey key, int attemptedDelta, long outstandingReserved, long currentQuantity) {
        super("OVER_RELEASE",
                String.format("Cannot release %d for %s: only %d reserved",
                        attemptedDelta, key, outstandingReserved),
                details(
                        "warehouseId", key.getWarehouseId(),
                        "productId", key.getProductId(),
                        "changeType", "released",
                        "attemptedDelta", attemptedDelta,
                        "outstandingReserved", outstandingReserved,
                        "currentQuantity", currentQuantity));
        this.key = key;
        this.attemptedDelta = attemptedDelta;
        this.outstandingReserved = outstandingReserved;
    }

    public InventoryKey getKey() {
        return key;
    }

    public int getAttemptedDelta() {
        return attemptedDelta;
    }

    public long getOutstandingReserved() {
        return outstandingReserved;
    }
}

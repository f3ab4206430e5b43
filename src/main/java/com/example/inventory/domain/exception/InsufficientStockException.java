package com.example.inventory.domain.exception;

import com.example.inventory.domain.model.ChangeType;
import com.example.inventory.domain.model.InventoryKey;

/**
 * Exception thrown when a sale or reservation would take the quantity of a key below zero.
 */
public class InsufficientStockException extends DomainException {

    private final InventoryKey key;
    private final int attemptedDelta;
    private final long currentQuantity;

    public InsufficientStockException(InventoryKey key, ChangeType changeType, int attemptedDelta, long currentQuantity) {
        super("INSUFFICIENT_STOCK",
                String.format("Insufficient stock for %s: %s %d requested, %d on hand",
                        key, changeType.code(), -attemptedDelta, currentQuantity),
                details(
                        "warehouseId", key.getWarehouseId(),
                        "productId", key.getProductId(),
                        "changeType", changeType.code(),
                        "attemptedDelta", attemptedDelta,
                        "currentQuantity", currentQuantity));
        this.key = key;
        this.attemptedDelta = attemptedDelta;
        this.currentQuantity = currentQuantity;
    }

    public InventoryKey getKey() {
        return key;
    }

    public int getAttemptedDelta() {
        return attemptedDelta;
    }

    public long getCurrentQuantity() {
        return currentQuantity;
    }
}

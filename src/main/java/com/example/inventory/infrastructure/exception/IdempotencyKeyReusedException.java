package com.example.inventory.infrastructure.exception;

import com.example.inventory.domain.model.InventoryKey;

/**
 * An idempotency key was sent for a different inventory key than the one it was first claimed for.
 */
public class IdempotencyKeyReusedException extends RuntimeException {

    private final String idempotencyKey;

    public IdempotencyKeyReusedException(String idempotencyKey, long claimedWarehouseId, long claimedProductId,
                                         InventoryKey requested) {
        super(String.format("Idempotency key %s belongs to W%d/P%d, not %s",
                idempotencyKey, claimedWarehouseId, claimedProductId, requested));
        this.idempotencyKey = idempotencyKey;
    }

    public String getIdempotencyKey() {
        return idempotencyKey;
    }
}

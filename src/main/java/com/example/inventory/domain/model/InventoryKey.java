package com.example.inventory.domain.model;

import java.util.Objects;

/**
 * Value Object identifying one trackable stock position: a product in a warehouse.
 */
public final class InventoryKey {

    private final long warehouseId;
    private final long productId;

    private InventoryKey(long warehouseId, long productId) {
        this.warehouseId = warehouseId;
        this.productId = productId;
    }

    /**
     * Creates a new InventoryKey.
     *
     * @param warehouseId the warehouse identifier (must be positive)
     * @param productId   the product identifier (must be positive)
     * @return new InventoryKey instance
     * @throws IllegalArgumentException if either identifier is not positive
     */
    public static InventoryKey of(long warehouseId, long productId) {
        if (warehouseId <= 0) {
            throw new IllegalArgumentException("WarehouseId must be positive: " + warehouseId);
        }
        if (productId <= 0) {
            throw new IllegalArgumentException("ProductId must be positive: " + productId);
        }
        return new InventoryKey(warehouseId, productId);
    }

    public long getWarehouseId() {
        return warehouseId;
    }

    public long getProductId() {
        return productId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        InventoryKey that = (InventoryKey) o;
        return warehouseId == that.warehouseId && productId == that.productId;
    }

    @Override
    public int hashCode() {
        return Objects.hash(warehouseId, productId);
    }

    @Override
    public String toString() {
        return "W" + warehouseId + "/P" + productId;
    }
}

package com.example.inventory.infrastructure.persistence.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

import java.io.Serializable;
import java.util.Objects;

/**
 * Composite primary key of the projection table.
 */
@Embeddable
public class InventoryKeyId implements Serializable {

    @Column(name = "warehouse_id", nullable = false)
    private long warehouseId;

    @Column(name = "product_id", nullable = false)
    private long productId;

    protected InventoryKeyId() {
    }

    public InventoryKeyId(long warehouseId, long productId) {
        this.warehouseId = warehouseId;
        this.productId = productId;
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
        InventoryKeyId that = (InventoryKeyId) o;
        return warehouseId == that.warehouseId && productId == that.productId;
    }

    @Override
    public int hashCode() {
        return Objects.hash(warehouseId, productId);
    }
}

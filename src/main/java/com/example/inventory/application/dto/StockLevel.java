package com.example.inventory.application.dto;

import com.example.inventory.domain.model.InventoryProjection;

/**
 * Current quantity of one inventory key.
 */
public record StockLevel(
        long warehouseId,
        long productId,
        long currentQuantity,
        long reservedQuantity,
        long lastAppliedEventId,
        String status
) {
    public static StockLevel from(InventoryProjection projection) {
        return new StockLevel(
                projection.getKey().getWarehouseId(),
                projection.getKey().getProductId(),
                projection.getCurrentQuantity(),
                projection.getReservedQuantity(),
                projection.getLastAppliedEventId(),
                projection.getStatus().name());
    }
}

package com.example.inventory.application.dto;

import java.util.List;

/**
 * Low-stock alerts of one warehouse.
 */
public record LowStockReport(
        long warehouseId,
        List<LowStockAlert> alerts,
        int totalAlerts
) {
    public static LowStockReport of(long warehouseId, List<LowStockAlert> alerts) {
        return new LowStockReport(warehouseId, List.copyOf(alerts), alerts.size());
    }
}

package com.example.inventory.application.port.in;

import com.example.inventory.application.dto.LowStockReport;

/**
 * Inbound port for low-stock alerts.
 */
public interface LowStockAlertUseCase {

    LowStockReport lowStockAlerts(long warehouseId);
}

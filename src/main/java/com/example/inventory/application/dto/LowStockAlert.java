package com.example.inventory.application.dto;

/**
 * A stocked product running low at a warehouse while still selling.
 *
 * @param daysUntilStockout current stock divided by the average daily sales of the window, rounded up
 */
public record LowStockAlert(
        long productId,
        String productName,
        String sku,
        long warehouseId,
        long currentStock,
        int threshold,
        long daysUntilStockout,
        SupplierContact supplier
) {
    public record SupplierContact(long id, String name, String contactEmail) {
    }
}

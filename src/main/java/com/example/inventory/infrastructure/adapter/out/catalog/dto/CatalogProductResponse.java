package com.example.inventory.infrastructure.adapter.out.catalog.dto;

/**
 * Product as returned by the remote catalog service.
 */
public record CatalogProductResponse(
        long id,
        String sku,
        String name,
        boolean bundle,
        String status,
        Integer lowStockThreshold,
        SupplierResponse supplier
) {
    public record SupplierResponse(
            long id,
            String name,
            String contactEmail
    ) {
    }
}

package com.example.inventory.application.dto;

import java.util.List;

/**
 * Availability of a product at a warehouse and the leaf quantities it was derived from.
 */
public record BundleAvailabilityResult(
        long productId,
        long warehouseId,
        boolean bundle,
        long availability,
        List<LeafQuantity> leafQuantities
) {
    public record LeafQuantity(long productId, long currentQuantity) {
    }
}

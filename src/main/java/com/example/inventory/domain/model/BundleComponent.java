package com.example.inventory.domain.model;

/**
 * One component line of a bundle: how many units of a product one bundle consumes.
 * <p>
 * Lines are carried as the catalog states them; {@link com.example.inventory.domain.service.BundleGraph}
 * rejects non-positive ids and quantities as an invalid bundle definition.
 */
public record BundleComponent(
        long componentProductId,
        int quantityPerBundle
) {
}

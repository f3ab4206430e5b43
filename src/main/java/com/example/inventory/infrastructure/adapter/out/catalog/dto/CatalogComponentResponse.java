package com.example.inventory.infrastructure.adapter.out.catalog.dto;

/**
 * One component line of a bundle as returned by the remote catalog service.
 */
public record CatalogComponentResponse(
        long componentProductId,
        int quantityPerBundle
) {
}

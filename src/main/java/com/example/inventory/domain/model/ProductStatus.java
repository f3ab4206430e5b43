package com.example.inventory.domain.model;

/**
 * Lifecycle of a catalog product. Retirement is a flag, never a delete.
 */
public enum ProductStatus {
    ACTIVE,
    RETIRED
}

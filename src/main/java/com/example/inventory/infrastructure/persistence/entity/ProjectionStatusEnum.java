package com.example.inventory.infrastructure.persistence.entity;

/**
 * Projection status as stored in the projection table.
 */
public enum ProjectionStatusEnum {
    ACTIVE,
    DIVERGED
}

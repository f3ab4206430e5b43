package com.example.inventory.domain.model;

/**
 * Health of a projection row.
 */
public enum ProjectionStatus {

    /**
     * Projection agrees with the ledger; writes are admitted.
     */
    ACTIVE,

    /**
     * A rebuild disagreed with the live projection. Writes are rejected until the key is reconciled.
     */
    DIVERGED
}

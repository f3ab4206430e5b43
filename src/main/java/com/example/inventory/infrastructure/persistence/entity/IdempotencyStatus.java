package com.example.inventory.infrastructure.persistence.entity;

/**
 * State of an idempotency claim. A rejected submission deletes its claim.
 */
public enum IdempotencyStatus {
    IN_PROGRESS,
    COMPLETED
}

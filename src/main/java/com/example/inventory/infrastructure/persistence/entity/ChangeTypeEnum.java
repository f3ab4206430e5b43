package com.example.inventory.infrastructure.persistence.entity;

/**
 * Change type as stored in the ledger table.
 */
public enum ChangeTypeEnum {
    RECEIVED,
    SOLD,
    ADJUSTMENT,
    RESERVED,
    RELEASED
}

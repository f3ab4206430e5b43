package com.example.inventory.domain.model;

import java.util.Locale;

/**
 * Kinds of inventory change admitted to the ledger.
 */
public enum ChangeType {

    /**
     * Stock arriving at the warehouse. Delta must be positive.
     */
    RECEIVED(DeltaSign.POSITIVE),

    /**
     * Stock leaving through a sale. Delta must be negative.
     */
    SOLD(DeltaSign.NEGATIVE),

    /**
     * Manual correction. Any non-zero delta, always with a reference.
     */
    ADJUSTMENT(DeltaSign.ANY),

    /**
     * Stock held for a pending order. Delta must be negative.
     */
    RESERVED(DeltaSign.NEGATIVE),

    /**
     * A reservation handed back. Delta must be positive.
     */
    RELEASED(DeltaSign.POSITIVE);

    private final DeltaSign requiredSign;

    ChangeType(DeltaSign requiredSign) {
        this.requiredSign = requiredSign;
    }

    /**
     * Parses the lowercase wire code (e.g. {@code "received"}).
     *
     * @param code the wire code
     * @return the matching change type
     * @throws IllegalArgumentException if the code is unknown
     */
    public static ChangeType fromCode(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("Change type is required");
        }
        try {
            return ChangeType.valueOf(code.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown change type: " + code, e);
        }
    }

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean acceptsDelta(int delta) {
        return switch (requiredSign) {
            case POSITIVE -> delta > 0;
            case NEGATIVE -> delta < 0;
            case ANY -> delta != 0;
        };
    }

    public DeltaSign requiredSign() {
        return requiredSign;
    }

    /**
     * Returns true if admitting this change may take the quantity below zero
     * and therefore needs a stock-sufficiency check.
     */
    public boolean consumesStock() {
        return this == SOLD || this == RESERVED;
    }

    public enum DeltaSign {
        POSITIVE,
        NEGATIVE,
        ANY
    }
}

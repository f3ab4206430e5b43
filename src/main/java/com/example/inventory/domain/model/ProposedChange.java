package com.example.inventory.domain.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A change request that has not been admitted to the ledger yet.
 * Carries no event id; the ledger assigns one on admission.
 */
public final class ProposedChange {

    private final InventoryKey key;
    private final ChangeType changeType;
    private final int quantityDelta;
    private final String reference;
    private final Instant occurredAt;

    private ProposedChange(InventoryKey key, ChangeType changeType, int quantityDelta,
                           String reference, Instant occurredAt) {
        this.key = Objects.requireNonNull(key, "InventoryKey cannot be null");
        this.changeType = Objects.requireNonNull(changeType, "ChangeType cannot be null");
        this.occurredAt = Objects.requireNonNull(occurredAt, "OccurredAt cannot be null");
        this.quantityDelta = quantityDelta;
        this.reference = reference;
    }

    /**
     * Creates a proposed change occurring now.
     *
     * @param key           the inventory key
     * @param changeType    the change type
     * @param quantityDelta the signed quantity delta
     * @param reference     opaque reference (order id, PO number...), may be null
     * @return new ProposedChange instance
     */
    public static ProposedChange of(InventoryKey key, ChangeType changeType, int quantityDelta, String reference) {
        return of(key, changeType, quantityDelta, reference, null);
    }

    /**
     * Creates a proposed change.
     *
     * @param occurredAt business timestamp of the change; defaults to now when null
     */
    public static ProposedChange of(InventoryKey key, ChangeType changeType, int quantityDelta,
                                    String reference, Instant occurredAt) {
        return new ProposedChange(key, changeType, quantityDelta, reference,
                occurredAt != null ? occurredAt : Instant.now());
    }

    public boolean hasReference() {
        return reference != null && !reference.isBlank();
    }

    public InventoryKey getKey() {
        return key;
    }

    public ChangeType getChangeType() {
        return changeType;
    }

    public int getQuantityDelta() {
        return quantityDelta;
    }

    public String getReference() {
        return reference;
    }

    public Instant getOccurredAt() {
        return occurredAt;
    }

    @Override
    public String toString() {
        return "ProposedChange{" +
                "key=" + key +
                ", changeType=" + changeType.code() +
                ", quantityDelta=" + quantityDelta +
                ", reference='" + reference + '\'' +
                '}';
    }
}

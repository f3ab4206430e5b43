package com.example.inventory.domain.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable ledger entry. Once admitted it is never mutated or removed;
 * the events of a key ordered by event id are the only source of truth for its quantity.
 */
public final class InventoryChangeEvent {

    private final long eventId;
    private final InventoryKey key;
    private final ChangeType changeType;
    private final int quantityDelta;
    private final Instant occurredAt;
    private final String reference;
    private final long quantityBefore;
    private final long quantityAfter;

    private InventoryChangeEvent(long eventId, InventoryKey key, ChangeType changeType, int quantityDelta,
                                 Instant occurredAt, String reference, long quantityBefore, long quantityAfter) {
        if (eventId <= 0) {
            throw new IllegalArgumentException("EventId must be positive: " + eventId);
        }
        if (quantityDelta == 0) {
            throw new IllegalArgumentException("QuantityDelta cannot be zero");
        }
        this.eventId = eventId;
        this.key = Objects.requireNonNull(key, "InventoryKey cannot be null");
        this.changeType = Objects.requireNonNull(changeType, "ChangeType cannot be null");
        this.occurredAt = Objects.requireNonNull(occurredAt, "OccurredAt cannot be null");
        this.quantityDelta = quantityDelta;
        this.reference = reference;
        this.quantityBefore = quantityBefore;
        this.quantityAfter = quantityAfter;
    }

    /**
     * Reconstitutes an admitted event from the ledger.
     *
     * @param quantityBefore projected quantity just before admission (audit metadata)
     * @param quantityAfter  projected quantity just after admission (audit metadata)
     */
    public static InventoryChangeEvent reconstitute(long eventId, InventoryKey key, ChangeType changeType,
                                                    int quantityDelta, Instant occurredAt, String reference,
                                                    long quantityBefore, long quantityAfter) {
        return new InventoryChangeEvent(eventId, key, changeType, quantityDelta, occurredAt, reference,
                quantityBefore, quantityAfter);
    }

    public long getEventId() {
        return eventId;
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

    public Instant getOccurredAt() {
        return occurredAt;
    }

    public String getReference() {
        return reference;
    }

    public long getQuantityBefore() {
        return quantityBefore;
    }

    public long getQuantityAfter() {
        return quantityAfter;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        InventoryChangeEvent that = (InventoryChangeEvent) o;
        return eventId == that.eventId;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(eventId);
    }

    @Override
    public String toString() {
        return "InventoryChangeEvent{" +
                "eventId=" + eventId +
                ", key=" + key +
                ", changeType=" + changeType.code() +
                ", quantityDelta=" + quantityDelta +
                '}';
    }
}

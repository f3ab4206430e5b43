package com.example.inventory.domain.model;

import java.util.Objects;

/**
 * Derived current-quantity view of one inventory key.
 * <p>
 * {@code currentQuantity} is the sum of the deltas of every event applied so far and
 * {@code lastAppliedEventId} the id of the newest of them. Applying an event whose id is
 * not greater than {@code lastAppliedEventId} is a no-op, so replays never double-count.
 */
public final class InventoryProjection {

    private final InventoryKey key;
    private long currentQuantity;
    private long reservedQuantity;
    private long lastAppliedEventId;
    private ProjectionStatus status;

    private InventoryProjection(InventoryKey key, long currentQuantity, long reservedQuantity,
                                long lastAppliedEventId, ProjectionStatus status) {
        this.key = Objects.requireNonNull(key, "InventoryKey cannot be null");
        this.status = Objects.requireNonNull(status, "Status cannot be null");
        if (lastAppliedEventId < 0) {
            throw new IllegalArgumentException("LastAppliedEventId cannot be negative: " + lastAppliedEventId);
        }
        this.currentQuantity = currentQuantity;
        this.reservedQuantity = reservedQuantity;
        this.lastAppliedEventId = lastAppliedEventId;
    }

    /**
     * Creates the projection of a key with no history.
     */
    public static InventoryProjection empty(InventoryKey key) {
        return new InventoryProjection(key, 0, 0, 0, ProjectionStatus.ACTIVE);
    }

    /**
     * Reconstitutes a projection from persistence.
     */
    public static InventoryProjection reconstitute(InventoryKey key, long currentQuantity, long reservedQuantity,
                                                   long lastAppliedEventId, ProjectionStatus status) {
        return new InventoryProjection(key, currentQuantity, reservedQuantity, lastAppliedEventId, status);
    }

    /**
     * Applies an admitted event.
     *
     * @param event the event to apply (must belong to this key)
     * @return true if the event changed the projection, false if it was already applied
     * @throws IllegalArgumentException if the event belongs to another key
     */
    public boolean apply(InventoryChangeEvent event) {
        Objects.requireNonNull(event, "Event cannot be null");
        if (!key.equals(event.getKey())) {
            throw new IllegalArgumentException(
                    "Event " + event.getEventId() + " belongs to " + event.getKey() + ", not " + key);
        }
        if (event.getEventId() <= lastAppliedEventId) {
            return false;
        }

        int delta = event.getQuantityDelta();
        currentQuantity += delta;
        // reserved carries a negative delta, released a positive one
        if (event.getChangeType() == ChangeType.RESERVED || event.getChangeType() == ChangeType.RELEASED) {
            reservedQuantity -= delta;
        }
        lastAppliedEventId = event.getEventId();
        return true;
    }

    /**
     * Returns true if both projections hold the same derived state.
     * Status is not compared.
     */
    public boolean sameStateAs(InventoryProjection other) {
        return other != null
                && key.equals(other.key)
                && currentQuantity == other.currentQuantity
                && reservedQuantity == other.reservedQuantity
                && lastAppliedEventId == other.lastAppliedEventId;
    }

    public void markDiverged() {
        this.status = ProjectionStatus.DIVERGED;
    }

    public void markActive() {
        this.status = ProjectionStatus.ACTIVE;
    }

    public boolean isWriteBlocked() {
        return status == ProjectionStatus.DIVERGED;
    }

    public InventoryKey getKey() {
        return key;
    }

    public long getCurrentQuantity() {
        return currentQuantity;
    }

    /**
     * Outstanding reserved quantity: units reserved and not yet released.
     */
    public long getReservedQuantity() {
        return reservedQuantity;
    }

    public long getLastAppliedEventId() {
        return lastAppliedEventId;
    }

    public ProjectionStatus getStatus() {
        return status;
    }

    @Override
    public String toString() {
        return "InventoryProjection{" +
                "key=" + key +
                ", currentQuantity=" + currentQuantity +
                ", reservedQuantity=" + reservedQuantity +
                ", lastAppliedEventId=" + lastAppliedEventId +
                ", status=" + status +
                '}';
    }
}

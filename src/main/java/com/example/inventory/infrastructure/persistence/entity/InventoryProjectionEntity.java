package com.example.inventory.infrastructure.persistence.entity;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * JPA Entity for the projection of one inventory key.
 * Only ever written in the same transaction as the ledger rows it reflects.
 */
@Entity
@Table(name = "inventory_projections", indexes = {
    @Index(name = "idx_inventory_projections_updated", columnList = "updated_at"),
    @Index(name = "idx_inventory_projections_status", columnList = "status")
})
public class InventoryProjectionEntity {

    @EmbeddedId
    private InventoryKeyId id;

    @Column(name = "current_quantity", nullable = false)
    private long currentQuantity;

    @Column(name = "reserved_quantity", nullable = false)
    private long reservedQuantity;

    @Column(name = "last_applied_event_id", nullable = false)
    private long lastAppliedEventId;

    @Column(name = "status", length = 16, nullable = false)
    @Enumerated(EnumType.STRING)
    private ProjectionStatusEnum status;

    @Version
    @Column(name = "version")
    private Long version;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    @PreUpdate
    protected void onWrite() {
        updatedAt = Instant.now();
    }

    // Getters and Setters
    public InventoryKeyId getId() {
        return id;
    }

    public void setId(InventoryKeyId id) {
        this.id = id;
    }

    public long getCurrentQuantity() {
        return currentQuantity;
    }

    public void setCurrentQuantity(long currentQuantity) {
        this.currentQuantity = currentQuantity;
    }

    public long getReservedQuantity() {
        return reservedQuantity;
    }

    public void setReservedQuantity(long reservedQuantity) {
        this.reservedQuantity = reservedQuantity;
    }

    public long getLastAppliedEventId() {
        return lastAppliedEventId;
    }

    public void setLastAppliedEventId(long lastAppliedEventId) {
        this.lastAppliedEventId = lastAppliedEventId;
    }

    public ProjectionStatusEnum getStatus() {
        return status;
    }

    public void setStatus(ProjectionStatusEnum status) {
        this.status = status;
    }

    public Long getVersion() {
        return version;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }
}

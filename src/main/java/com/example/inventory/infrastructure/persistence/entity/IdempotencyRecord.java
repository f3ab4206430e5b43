package com.example.inventory.infrastructure.persistence.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;

import java.time.Instant;

/**
 * Claim of an idempotency key by one change submission.
 * A completed claim points at the admitted ledger event; the event itself is the stored result.
 */
@Entity
@Table(name = "idempotency_records", indexes = {
        @Index(name = "idx_idempotency_expires", columnList = "expires_at")
})
public class IdempotencyRecord {

    @Id
    @Column(name = "idempotency_key", length = 64)
    private String idempotencyKey;

    @Column(name = "warehouse_id", nullable = false)
    private long warehouseId;

    @Column(name = "product_id", nullable = false)
    private long productId;

    // Null while IN_PROGRESS
    @Column(name = "event_id")
    private Long eventId;

    @Column(name = "status", length = 16, nullable = false)
    @Enumerated(EnumType.STRING)
    private IdempotencyStatus status;

    @Column(name = "claimed_at", nullable = false)
    private Instant claimedAt;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    protected IdempotencyRecord() {
    }

    public static IdempotencyRecord claim(String idempotencyKey, long warehouseId, long productId, Instant expiresAt) {
        IdempotencyRecord record = new IdempotencyRecord();
        record.idempotencyKey = idempotencyKey;
        record.warehouseId = warehouseId;
        record.productId = productId;
        record.status = IdempotencyStatus.IN_PROGRESS;
        record.expiresAt = expiresAt;
        return record;
    }

    @PrePersist
    protected void onClaim() {
        claimedAt = Instant.now();
    }

    public void complete(long admittedEventId) {
        this.eventId = admittedEventId;
        this.status = IdempotencyStatus.COMPLETED;
    }

    public boolean isFor(long warehouseId, long productId) {
        return this.warehouseId == warehouseId && this.productId == productId;
    }

    public boolean isExpired(Instant now) {
        return !expiresAt.isAfter(now);
    }

    public String getIdempotencyKey() {
        return idempotencyKey;
    }

    public long getWarehouseId() {
        return warehouseId;
    }

    public long getProductId() {
        return productId;
    }

    public Long getEventId() {
        return eventId;
    }

    public IdempotencyStatus getStatus() {
        return status;
    }

    public Instant getClaimedAt() {
        return claimedAt;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }
}

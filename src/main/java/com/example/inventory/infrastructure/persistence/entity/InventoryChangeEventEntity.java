package com.example.inventory.infrastructure.persistence.entity;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * JPA Entity for one ledger event. Rows are inserted once and never updated or deleted.
 * Events refer to warehouses and products by id only, so catalog retirement never touches them.
 */
@Entity
@Table(name = "inventory_changes", indexes = {
    @Index(name = "idx_inventory_changes_key", columnList = "warehouse_id, product_id, id"),
    @Index(name = "idx_inventory_changes_sales", columnList = "warehouse_id, change_type, occurred_at")
})
public class InventoryChangeEventEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @Column(name = "warehouse_id", nullable = false, updatable = false)
    private long warehouseId;

    @Column(name = "product_id", nullable = false, updatable = false)
    private long productId;

    @Column(name = "change_type", length = 16, nullable = false, updatable = false)
    @Enumerated(EnumType.STRING)
    private ChangeTypeEnum changeType;

    @Column(name = "quantity_delta", nullable = false, updatable = false)
    private int quantityDelta;

    @Column(name = "occurred_at", nullable = false, updatable = false)
    private Instant occurredAt;

    @Column(name = "reference", length = 255, updatable = false)
    private String reference;

    @Column(name = "quantity_before", nullable = false, updatable = false)
    private long quantityBefore;

    @Column(name = "quantity_after", nullable = false, updatable = false)
    private long quantityAfter;

    @Column(name = "recorded_at", nullable = false, updatable = false)
    private Instant recordedAt;

    @PrePersist
    protected void onCreate() {
        recordedAt = Instant.now();
    }

    // Getters and Setters
    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public long getWarehouseId() {
        return warehouseId;
    }

    public void setWarehouseId(long warehouseId) {
        this.warehouseId = warehouseId;
    }

    public long getProductId() {
        return productId;
    }

    public void setProductId(long productId) {
        this.productId = productId;
    }

    public ChangeTypeEnum getChangeType() {
        return changeType;
    }

    public void setChangeType(ChangeTypeEnum changeType) {
        this.changeType = changeType;
    }

    public int getQuantityDelta() {
        return quantityDelta;
    }

    public void setQuantityDelta(int quantityDelta) {
        this.quantityDelta = quantityDelta;
    }

    public Instant getOccurredAt() {
        return occurredAt;
    }

    public void setOccurredAt(Instant occurredAt) {
        this.occurredAt = occurredAt;
    }

    public String getReference() {
        return reference;
    }

    public void setReference(String reference) {
        this.reference = reference;
    }

    public long getQuantityBefore() {
        return quantityBefore;
    }

    public void setQuantityBefore(long quantityBefore) {
        this.quantityBefore = quantityBefore;
    }

    public long getQuantityAfter() {
        return quantityAfter;
    }

    public void setQuantityAfter(long quantityAfter) {
        this.quantityAfter = quantityAfter;
    }

    public Instant getRecordedAt() {
        return recordedAt;
    }
}

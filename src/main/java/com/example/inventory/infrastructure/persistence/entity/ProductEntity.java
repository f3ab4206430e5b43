package com.example.inventory.infrastructure.persistence.entity;

import jakarta.persistence.*;

/**
 * JPA Entity for a catalog product. Ids are assigned by the catalog owner.
 * Retirement sets {@code status}; rows are never deleted while ledger history refers to them.
 */
@Entity
@Table(name = "products")
public class ProductEntity {

    @Id
    @Column(name = "id")
    private Long id;

    @Column(name = "sku", length = 64, nullable = false, unique = true, updatable = false)
    private String sku;

    @Column(name = "name", length = 255)
    private String name;

    @Column(name = "is_bundle", nullable = false)
    private boolean bundle;

    @Column(name = "status", length = 16, nullable = false)
    private String status = "ACTIVE";

    @Column(name = "low_stock_threshold")
    private Integer lowStockThreshold;

    @Column(name = "supplier_id")
    private Long supplierId;

    // Getters and Setters
    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public String getSku() {
        return sku;
    }

    public void setSku(String sku) {
        this.sku = sku;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public boolean isBundle() {
        return bundle;
    }

    public void setBundle(boolean bundle) {
        this.bundle = bundle;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public Integer getLowStockThreshold() {
        return lowStockThreshold;
    }

    public void setLowStockThreshold(Integer lowStockThreshold) {
        this.lowStockThreshold = lowStockThreshold;
    }

    public Long getSupplierId() {
        return supplierId;
    }

    public void setSupplierId(Long supplierId) {
        this.supplierId = supplierId;
    }
}

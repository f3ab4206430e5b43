package com.example.inventory.infrastructure.persistence.entity;

import jakarta.persistence.*;

/**
 * JPA Entity for one bundle component line.
 * Both sides refer to products by id only; there is no cascading relation.
 */
@Entity
@Table(name = "product_bundles", uniqueConstraints = {
    @UniqueConstraint(name = "uk_product_bundles_line", columnNames = {"bundle_id", "component_product_id"})
})
public class BundleComponentEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @Column(name = "bundle_id", nullable = false)
    private long bundleId;

    @Column(name = "component_product_id", nullable = false)
    private long componentProductId;

    @Column(name = "quantity_per_bundle", nullable = false)
    private int quantityPerBundle;

    @Column(name = "position", nullable = false)
    private int position;

    public BundleComponentEntity() {
    }

    public BundleComponentEntity(long bundleId, long componentProductId, int quantityPerBundle, int position) {
        this.bundleId = bundleId;
        this.componentProductId = componentProductId;
        this.quantityPerBundle = quantityPerBundle;
        this.position = position;
    }

    public Long getId() {
        return id;
    }

    public long getBundleId() {
        return bundleId;
    }

    public long getComponentProductId() {
        return componentProductId;
    }

    public int getQuantityPerBundle() {
        return quantityPerBundle;
    }

    public int getPosition() {
        return position;
    }
}

package com.example.inventory.infrastructure.persistence.entity;

import jakarta.persistence.*;

/**
 * JPA Entity for supplier reference data.
 */
@Entity
@Table(name = "suppliers")
public class SupplierEntity {

    @Id
    @Column(name = "id")
    private Long id;

    @Column(name = "name", length = 255, nullable = false)
    private String name;

    @Column(name = "contact_email", length = 255)
    private String contactEmail;

    public SupplierEntity() {
    }

    public SupplierEntity(Long id, String name, String contactEmail) {
        this.id = id;
        this.name = name;
        this.contactEmail = contactEmail;
    }

    public Long getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getContactEmail() {
        return contactEmail;
    }
}

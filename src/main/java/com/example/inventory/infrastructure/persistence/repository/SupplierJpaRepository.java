package com.example.inventory.infrastructure.persistence.repository;

import com.example.inventory.infrastructure.persistence.entity.SupplierEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * JPA Repository for suppliers.
 */
@Repository
public interface SupplierJpaRepository extends JpaRepository<SupplierEntity, Long> {
}

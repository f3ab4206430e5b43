package com.example.inventory.infrastructure.persistence.repository;

import com.example.inventory.infrastructure.persistence.entity.ProductEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * JPA Repository for catalog products.
 */
@Repository
public interface ProductJpaRepository extends JpaRepository<ProductEntity, Long> {
}

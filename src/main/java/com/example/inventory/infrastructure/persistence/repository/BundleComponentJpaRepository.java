package com.example.inventory.infrastructure.persistence.repository;

import com.example.inventory.infrastructure.persistence.entity.BundleComponentEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * JPA Repository for bundle component lines.
 */
@Repository
public interface BundleComponentJpaRepository extends JpaRepository<BundleComponentEntity, Long> {

    List<BundleComponentEntity> findByBundleIdOrderByPositionAscIdAsc(long bundleId);
}

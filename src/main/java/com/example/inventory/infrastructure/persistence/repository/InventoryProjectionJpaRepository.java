package com.example.inventory.infrastructure.persistence.repository;

import com.example.inventory.infrastructure.persistence.entity.InventoryKeyId;
import com.example.inventory.infrastructure.persistence.entity.InventoryProjectionEntity;
import com.example.inventory.infrastructure.persistence.entity.ProjectionStatusEnum;
import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * JPA Repository for projections.
 */
@Repository
public interface InventoryProjectionJpaRepository extends JpaRepository<InventoryProjectionEntity, InventoryKeyId> {

    /**
     * Loads a projection row holding a database write lock until the transaction ends.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "3000"))
    @Query("SELECT p FROM InventoryProjectionEntity p WHERE p.id = :id")
    Optional<InventoryProjectionEntity> findForUpdate(@Param("id") InventoryKeyId id);

    @Query("SELECT p FROM InventoryProjectionEntity p " +
           "WHERE p.id.warehouseId = :warehouseId AND p.id.productId IN :productIds")
    List<InventoryProjectionEntity> findSnapshot(@Param("warehouseId") long warehouseId,
                                                 @Param("productIds") Collection<Long> productIds);

    List<InventoryProjectionEntity> findByIdWarehouseIdOrderByIdProductIdAsc(long warehouseId);

    @Query("SELECT p.id FROM InventoryProjectionEntity p WHERE p.updatedAt >= :since ORDER BY p.updatedAt ASC")
    List<InventoryKeyId> findKeysUpdatedSince(@Param("since") Instant since, Pageable pageable);

    long countByStatus(ProjectionStatusEnum status);
}

package com.example.inventory.infrastructure.persistence.repository;

import com.example.inventory.infrastructure.persistence.entity.ChangeTypeEnum;
import com.example.inventory.infrastructure.persistence.entity.InventoryChangeEventEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

/**
 * JPA Repository for the ledger. Insert and read only.
 */
@Repository
public interface InventoryChangeJpaRepository extends JpaRepository<InventoryChangeEventEntity, Long> {

    @Query("SELECT e FROM InventoryChangeEventEntity e " +
           "WHERE e.warehouseId = :warehouseId AND e.productId = :productId AND e.id > :since " +
           "ORDER BY e.id ASC")
    List<InventoryChangeEventEntity> findPage(@Param("warehouseId") long warehouseId,
                                              @Param("productId") long productId,
                                              @Param("since") long sinceEventId,
                                              Pageable pageable);

    @Query("SELECT e FROM InventoryChangeEventEntity e " +
           "WHERE e.warehouseId = :warehouseId AND e.productId = :productId AND e.id > :since " +
           "ORDER BY e.id ASC")
    List<InventoryChangeEventEntity> findAllAfter(@Param("warehouseId") long warehouseId,
                                                  @Param("productId") long productId,
                                                  @Param("since") long sinceEventId);

    @Query("SELECT COALESCE(MAX(e.id), 0) FROM InventoryChangeEventEntity e " +
           "WHERE e.warehouseId = :warehouseId AND e.productId = :productId")
    long findMaxEventId(@Param("warehouseId") long warehouseId, @Param("productId") long productId);

    @Query("SELECT e.productId AS productId, SUM(e.quantityDelta) AS netDelta FROM InventoryChangeEventEntity e " +
           "WHERE e.warehouseId = :warehouseId AND e.changeType = :changeType AND e.occurredAt >= :since " +
           "GROUP BY e.productId")
    List<ProductDelta> sumDeltaByProduct(@Param("warehouseId") long warehouseId,
                                         @Param("changeType") ChangeTypeEnum changeType,
                                         @Param("since") Instant since);

    /**
     * Summed delta per product.
     */
    interface ProductDelta {
        Long getProductId();

        Long getNetDelta();
    }
}

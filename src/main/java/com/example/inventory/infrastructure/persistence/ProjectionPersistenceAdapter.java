package com.example.inventory.infrastructure.persistence;

import com.example.inventory.application.port.out.ProjectionPort;
import com.example.inventory.domain.exception.SnapshotUnavailableException;
import com.example.inventory.domain.model.InventoryChangeEvent;
import com.example.inventory.domain.model.InventoryKey;
import com.example.inventory.domain.model.InventoryProjection;
import com.example.inventory.domain.service.QuantityProjector;
import com.example.inventory.infrastructure.persistence.entity.InventoryProjectionEntity;
import com.example.inventory.infrastructure.persistence.entity.ProjectionStatusEnum;
import com.example.inventory.infrastructure.persistence.mapper.LedgerPersistenceMapper;
import com.example.inventory.infrastructure.persistence.repository.InventoryChangeJpaRepository;
import com.example.inventory.infrastructure.persistence.repository.InventoryProjectionJpaRepository;
import io.github.resilience4j.retry.annotation.Retry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Projection adapter over JPA.
 */
@Component
public class ProjectionPersistenceAdapter implements ProjectionPort {

    private static final Logger log = LoggerFactory.getLogger(ProjectionPersistenceAdapter.class);

    private final InventoryProjectionJpaRepository projectionRepository;
    private final InventoryChangeJpaRepository changeRepository;
    private final LedgerPersistenceMapper mapper;
    private final TransactionTemplate snapshotTx;

    public ProjectionPersistenceAdapter(
            InventoryProjectionJpaRepository projectionRepository,
            InventoryChangeJpaRepository changeRepository,
            LedgerPersistenceMapper mapper,
            PlatformTransactionManager transactionManager) {
        this.projectionRepository = projectionRepository;
        this.changeRepository = changeRepository;
        this.mapper = mapper;
        this.snapshotTx = new TransactionTemplate(transactionManager);
        this.snapshotTx.setReadOnly(true);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<InventoryProjection> find(InventoryKey key) {
        return projectionRepository.findById(mapper.toId(key))
                .map(mapper::toDomain);
    }

    /**
     * All quantities come from one SELECT in one read-only transaction, so they were valid at the same time.
     * Failures are raised outside the transaction so the caller sees the snapshot failure, not a rollback.
     */
    @Override
    public Map<Long, Long> snapshotQuantities(long warehouseId, Collection<Long> productIds) {
        if (productIds.isEmpty()) {
            return Map.of();
        }
        try {
            Map<Long, Long> quantities = snapshotTx.execute(status -> {
                Map<Long, Long> result = new HashMap<>();
                for (InventoryProjectionEntity row : projectionRepository.findSnapshot(warehouseId, productIds)) {
                    result.put(row.getId().getProductId(), row.getCurrentQuantity());
                }
                return result;
            });
            return quantities != null ? quantities : Map.of();
        } catch (DataAccessException | TransactionException e) {
            log.warn("Snapshot read failed for warehouse {}: {}", warehouseId, e.getMessage());
            throw new SnapshotUnavailableException(warehouseId, e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<InventoryProjection> findByWarehouse(long warehouseId) {
        return projectionRepository.findByIdWarehouseIdOrderByIdProductIdAsc(warehouseId).stream()
                .map(mapper::toDomain)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<InventoryKey> findRecentlyUpdated(Instant since, int limit) {
        return projectionRepository.findKeysUpdatedSince(since, PageRequest.of(0, limit)).stream()
                .map(mapper::toKey)
                .toList();
    }

    @Override
    @Retry(name = "ledgerWrite")
    @Transactional
    public RebuildOutcome completeRebuild(InventoryProjection rebuilt, boolean repair) {
        InventoryKey key = rebuilt.getKey();
        InventoryProjectionEntity row = projectionRepository.findForUpdate(mapper.toId(key)).orElse(null);
        InventoryProjection live = row != null ? mapper.toDomain(row) : InventoryProjection.empty(key);

        // One tail serves both sides; apply skips events a side has already seen
        long from = Math.min(live.getLastAppliedEventId(), rebuilt.getLastAppliedEventId());
        List<InventoryChangeEvent> tail = changeRepository
                .findAllAfter(key.getWarehouseId(), key.getProductId(), from)
                .stream()
                .map(mapper::toDomain)
                .toList();
        int caughtUp = QuantityProjector.applyAll(rebuilt, tail);

        // A live projection that is only behind the ledger is pending, not diverged
        long liveBehindFrom = live.getLastAppliedEventId();
        int recovered = QuantityProjector.applyAll(live, tail);
        if (recovered > 0) {
            log.warn("[RECOVERY] key={} replayed {} pending event(s) after event {} during rebuild",
                    key, recovered, liveBehindFrom);
        }
        boolean diverged = !live.sameStateAs(rebuilt);

        if (repair) {
            if (row != null || rebuilt.getLastAppliedEventId() > 0) {
                rebuilt.markActive();
                projectionRepository.save(mapper.copyOnto(rebuilt, row));
            }
        } else if (diverged) {
            live.markDiverged();
            projectionRepository.save(mapper.copyOnto(live, row));
        } else if (recovered > 0 && row != null) {
            projectionRepository.save(mapper.copyOnto(live, row));
        }

        return new RebuildOutcome(live, rebuilt, caughtUp, diverged);
    }

    @Override
    @Transactional(readOnly = true)
    public long countDiverged() {
        return projectionRepository.countByStatus(ProjectionStatusEnum.DIVERGED);
    }
}

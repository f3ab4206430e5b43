package com.example.inventory.infrastructure.persistence;

import com.example.inventory.application.port.out.LedgerPort;
import com.example.inventory.domain.model.InventoryChangeEvent;
import com.example.inventory.domain.model.InventoryKey;
import com.example.inventory.domain.model.InventoryProjection;
import com.example.inventory.domain.model.ProposedChange;
import com.example.inventory.domain.service.QuantityProjector;
import com.example.inventory.infrastructure.persistence.entity.ChangeTypeEnum;
import com.example.inventory.infrastructure.persistence.entity.InventoryChangeEventEntity;
import com.example.inventory.infrastructure.persistence.entity.InventoryKeyId;
import com.example.inventory.infrastructure.persistence.entity.InventoryProjectionEntity;
import com.example.inventory.infrastructure.persistence.mapper.LedgerPersistenceMapper;
import com.example.inventory.infrastructure.persistence.repository.InventoryChangeJpaRepository;
import com.example.inventory.infrastructure.persistence.repository.InventoryChangeJpaRepository.ProductDelta;
import com.example.inventory.infrastructure.persistence.repository.InventoryProjectionJpaRepository;
import io.github.resilience4j.retry.annotation.Retry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Ledger adapter over JPA.
 * <p>
 * {@link #appendAndApply} inserts the event and updates the projection row in one transaction while
 * holding a {@code PESSIMISTIC_WRITE} lock on that row. Lock timeouts and insert races on the row are
 * retried by the {@code ledgerWrite} retry, which wraps the whole transaction.
 */
@Component
public class LedgerPersistenceAdapter implements LedgerPort {

    private static final Logger log = LoggerFactory.getLogger(LedgerPersistenceAdapter.class);

    private final InventoryChangeJpaRepository changeRepository;
    private final InventoryProjectionJpaRepository projectionRepository;
    private final LedgerPersistenceMapper mapper;

    public LedgerPersistenceAdapter(
            InventoryChangeJpaRepository changeRepository,
            InventoryProjectionJpaRepository projectionRepository,
            LedgerPersistenceMapper mapper) {
        this.changeRepository = changeRepository;
        this.projectionRepository = projectionRepository;
        this.mapper = mapper;
    }

    @Override
    @Retry(name = "ledgerWrite")
    @Transactional
    public InventoryChangeEvent appendAndApply(ProposedChange change, AdmissionCheck check) {
        InventoryKey key = change.getKey();
        InventoryProjectionEntity row = lockOrCreateRow(key);
        InventoryProjection projection = mapper.toDomain(row);

        recoverGap(projection);
        check.check(projection);

        long before = projection.getCurrentQuantity();
        long after = before + change.getQuantityDelta();
        InventoryChangeEventEntity saved = changeRepository.saveAndFlush(mapper.toEntity(change, before, after));
        InventoryChangeEvent event = mapper.toDomain(saved);

        projection.apply(event);
        projectionRepository.save(mapper.copyOnto(projection, row));

        log.debug("Appended event {} for {}, projection at {}", event.getEventId(), key, projection.getCurrentQuantity());
        return event;
    }

    /**
     * Locks the projection row of a key. A key seen for the first time gets an empty row, inserted and
     * flushed so a concurrent first writer on another instance collides on the primary key.
     */
    private InventoryProjectionEntity lockOrCreateRow(InventoryKey key) {
        InventoryKeyId id = mapper.toId(key);
        return projectionRepository.findForUpdate(id)
                .orElseGet(() -> {
                    log.debug("First change for {}, creating projection row", key);
                    return projectionRepository.saveAndFlush(
                            mapper.copyOnto(InventoryProjection.empty(key), null));
                });
    }

    /**
     * Replays ledger events the projection has not applied yet.
     */
    private void recoverGap(InventoryProjection projection) {
        InventoryKey key = projection.getKey();
        long applied = projection.getLastAppliedEventId();
        long latest = changeRepository.findMaxEventId(key.getWarehouseId(), key.getProductId());
        if (latest <= applied) {
            return;
        }

        List<InventoryChangeEvent> pending = changeRepository
                .findAllAfter(key.getWarehouseId(), key.getProductId(), applied)
                .stream()
                .map(mapper::toDomain)
                .toList();
        int replayed = QuantityProjector.applyAll(projection, pending);
        log.warn("[RECOVERY] key={} projection was behind the ledger ({} < {}), replayed {} events",
                key, applied, latest, replayed);
    }

    @Override
    @Transactional(readOnly = true)
    public List<InventoryChangeEvent> readFrom(InventoryKey key, long sinceEventId, int limit) {
        return changeRepository
                .findPage(key.getWarehouseId(), key.getProductId(), sinceEventId, PageRequest.of(0, limit))
                .stream()
                .map(mapper::toDomain)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public long latestEventId(InventoryKey key) {
        return changeRepository.findMaxEventId(key.getWarehouseId(), key.getProductId());
    }

    @Override
    @Transactional(readOnly = true)
    public Map<Long, Long> unitsSoldSince(long warehouseId, Instant since) {
        Map<Long, Long> units = new HashMap<>();
        for (ProductDelta row : changeRepository.sumDeltaByProduct(warehouseId, ChangeTypeEnum.SOLD, since)) {
            if (row.getNetDelta() != null && row.getNetDelta() < 0) {
                units.put(row.getProductId(), -row.getNetDelta());
            }
        }
        return units;
    }
}

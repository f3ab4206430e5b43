package com.example.inventory.application.service;

import com.example.inventory.application.dto.LedgerEntry;
import com.example.inventory.application.dto.ReconciliationResult;
import com.example.inventory.application.dto.StockLevel;
import com.example.inventory.application.port.in.InventoryQueryUseCase;
import com.example.inventory.application.port.in.ReconcileUseCase;
import com.example.inventory.application.port.out.LedgerPort;
import com.example.inventory.application.port.out.ProjectionPort;
import com.example.inventory.application.port.out.ProjectionPort.RebuildOutcome;
import com.example.inventory.domain.exception.ProjectionDivergenceException;
import com.example.inventory.domain.model.InventoryChangeEvent;
import com.example.inventory.domain.model.InventoryKey;
import com.example.inventory.domain.model.InventoryProjection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Application service for quantity reads, history and reconciliation.
 * <p>
 * A rebuild replays history up to a boundary event id without holding the key lock, in pages of
 * {@code ledger.reconcile.batch-size}. Only the final catch-up and comparison run under the lock.
 */
@Service
public class QuantityProjectionService implements InventoryQueryUseCase, ReconcileUseCase {

    private static final Logger log = LoggerFactory.getLogger(QuantityProjectionService.class);

    private final LedgerPort ledgerPort;
    private final ProjectionPort projectionPort;
    private final KeyLockRegistry keyLocks;
    private final int batchSize;
    private final int maxHistoryLimit;

    public QuantityProjectionService(
            LedgerPort ledgerPort,
            ProjectionPort projectionPort,
            KeyLockRegistry keyLocks,
            @Value("${ledger.reconcile.batch-size:1000}") int batchSize,
            @Value("${ledger.history.max-limit:1000}") int maxHistoryLimit) {
        this.ledgerPort = ledgerPort;
        this.projectionPort = projectionPort;
        this.keyLocks = keyLocks;
        this.batchSize = batchSize;
        this.maxHistoryLimit = maxHistoryLimit;
    }

    @Override
    public StockLevel getQuantity(InventoryKey key) {
        InventoryProjection projection = projectionPort.find(key)
                .orElseGet(() -> InventoryProjection.empty(key));
        return StockLevel.from(projection);
    }

    @Override
    public List<LedgerEntry> getHistory(InventoryKey key, long sinceEventId, Integer limit) {
        if (sinceEventId < 0) {
            throw new IllegalArgumentException("sinceEventId cannot be negative: " + sinceEventId);
        }
        if (limit != null && limit <= 0) {
            throw new IllegalArgumentException("limit must be positive: " + limit);
        }
        int effectiveLimit = limit == null ? maxHistoryLimit : Math.min(limit, maxHistoryLimit);

        return ledgerPort.readFrom(key, sinceEventId, effectiveLimit).stream()
                .map(LedgerEntry::from)
                .toList();
    }

    @Override
    public ReconciliationResult reconcile(InventoryKey key) {
        log.info("Reconciling {}", key);
        ReconciliationResult result = rebuild(key, true);
        log.info("Reconciled {}: quantity {} at event {} ({} events replayed)",
                key, result.currentQuantity(), result.lastAppliedEventId(), result.eventsReplayed());
        return result;
    }

    @Override
    public ReconciliationResult verify(InventoryKey key) {
        log.debug("Verifying projection of {}", key);
        return rebuild(key, false);
    }

    private ReconciliationResult rebuild(InventoryKey key, boolean repair) {
        long boundary = ledgerPort.latestEventId(key);
        InventoryProjection rebuilt = InventoryProjection.empty(key);
        int replayed = 0;

        long cursor = 0;
        while (cursor < boundary) {
            List<InventoryChangeEvent> page = ledgerPort.readFrom(key, cursor, batchSize);
            if (page.isEmpty()) {
                break;
            }
            for (InventoryChangeEvent event : page) {
                if (event.getEventId() > boundary) {
                    break;
                }
                if (rebuilt.apply(event)) {
                    replayed++;
                }
            }
            cursor = page.get(page.size() - 1).getEventId();
        }
        log.debug("Replayed {} events of {} up to boundary {}", replayed, key, boundary);

        RebuildOutcome outcome = keyLocks.withLock(key, () -> projectionPort.completeRebuild(rebuilt, repair));
        InventoryProjection live = outcome.live();
        InventoryProjection result = outcome.rebuilt();

        if (outcome.diverged()) {
            log.error("[PROJECTION_DIVERGENCE] key={} live(quantity={}, reserved={}, lastEvent={}) "
                            + "rebuilt(quantity={}, reserved={}, lastEvent={}) action={}",
                    key, live.getCurrentQuantity(), live.getReservedQuantity(), live.getLastAppliedEventId(),
                    result.getCurrentQuantity(), result.getReservedQuantity(), result.getLastAppliedEventId(),
                    repair ? "REPAIRED" : "QUARANTINED");
            if (!repair) {
                throw ProjectionDivergenceException.detected(live, result);
            }
        }

        return new ReconciliationResult(
                key.getWarehouseId(),
                key.getProductId(),
                result.getCurrentQuantity(),
                result.getReservedQuantity(),
                result.getLastAppliedEventId(),
                live.getCurrentQuantity(),
                replayed + outcome.caughtUp(),
                outcome.diverged(),
                repair);
    }
}

package com.example.inventory.application.port.out;

import com.example.inventory.domain.model.InventoryChangeEvent;
import com.example.inventory.domain.model.InventoryKey;
import com.example.inventory.domain.model.InventoryProjection;
import com.example.inventory.domain.model.ProposedChange;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Outbound port for the append-only ledger.
 */
public interface LedgerPort {

    /**
     * Appends a change and applies it to the projection of its key in one unit of work.
     * <p>
     * The projection row is held exclusively for the duration. Any events the projection has not
     * applied yet are replayed first, then {@code check} runs against the up-to-date projection.
     * If the check throws, nothing is persisted.
     *
     * @param change the validated change
     * @param check  rules evaluated against the current projection
     * @return the admitted event with its assigned id
     */
    InventoryChangeEvent appendAndApply(ProposedChange change, AdmissionCheck check);

    /**
     * Reads events of a key with an id greater than {@code sinceEventId}, in event id order.
     */
    List<InventoryChangeEvent> readFrom(InventoryKey key, long sinceEventId, int limit);

    /**
     * Returns the greatest event id of a key, 0 if it has no history.
     */
    long latestEventId(InventoryKey key);

    /**
     * Units sold per product at a warehouse since the given instant, as positive numbers.
     * Products without sales are absent.
     */
    Map<Long, Long> unitsSoldSince(long warehouseId, Instant since);

    /**
     * Rule evaluation hook run under the per-key lock.
     */
    @FunctionalInterface
    interface AdmissionCheck {
        void check(InventoryProjection current);
    }
}

package com.example.inventory.domain.service;

import com.example.inventory.domain.model.InventoryChangeEvent;
import com.example.inventory.domain.model.InventoryKey;
import com.example.inventory.domain.model.InventoryProjection;

/**
 * Derives projections from ledger history.
 * Rebuilding and incremental application share {@link InventoryProjection#apply}, so both produce
 * the same state for the same events in the same order.
 */
public final class QuantityProjector {

    private QuantityProjector() {
    }

    /**
     * Replays a full history from an empty projection.
     */
    public static InventoryProjection rebuild(InventoryKey key, Iterable<InventoryChangeEvent> history) {
        InventoryProjection projection = InventoryProjection.empty(key);
        applyAll(projection, history);
        return projection;
    }

    /**
     * Applies events in order, skipping those already applied.
     *
     * @return the number of events that changed the projection
     */
    public static int applyAll(InventoryProjection target, Iterable<InventoryChangeEvent> events) {
        int applied = 0;
        for (InventoryChangeEvent event : events) {
            if (target.apply(event)) {
                applied++;
            }
        }
        return applied;
    }
}

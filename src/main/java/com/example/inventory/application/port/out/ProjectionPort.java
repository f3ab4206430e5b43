package com.example.inventory.application.port.out;

import com.example.inventory.domain.model.InventoryKey;
import com.example.inventory.domain.model.InventoryProjection;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Outbound port for the projection table.
 */
public interface ProjectionPort {

    Optional<InventoryProjection> find(InventoryKey key);

    /**
     * Reads the current quantity of several products at one warehouse from a single consistent read view.
     * Products with no projection are absent from the result.
     *
     * @throws com.example.inventory.domain.exception.SnapshotUnavailableException if the read view cannot be pinned
     */
    Map<Long, Long> snapshotQuantities(long warehouseId, Collection<Long> productIds);

    List<InventoryProjection> findByWarehouse(long warehouseId);

    /**
     * Keys whose projection changed since the given instant, oldest change first.
     */
    List<InventoryKey> findRecentlyUpdated(Instant since, int limit);

    /**
     * Finishes a rebuild under the projection row lock: catches up events appended after the rebuild
     * boundary, replays into the live projection any events it has not applied yet, compares both and
     * either overwrites the live one ({@code repair}) or, on difference, marks the key diverged.
     * A live projection that was only behind the ledger is caught up and stored, never quarantined.
     */
    RebuildOutcome completeRebuild(InventoryProjection rebuilt, boolean repair);

    long countDiverged();

    /**
     * Result of {@link #completeRebuild}.
     *
     * @param live       the live projection, caught up with pending events, as compared
     * @param rebuilt    the rebuilt projection, caught up to the latest event
     * @param caughtUp   events applied after the boundary
     * @param diverged   true if live and rebuilt state differ
     */
    record RebuildOutcome(
            InventoryProjection live,
            InventoryProjection rebuilt,
            int caughtUp,
            boolean diverged
    ) {
    }
}

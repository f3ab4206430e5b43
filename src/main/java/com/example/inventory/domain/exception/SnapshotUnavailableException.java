package com.example.inventory.domain.exception;

/**
 * A consistent read view over the component quantities of a bundle could not be pinned.
 * The query fails as a whole and may be retried.
 */
public class SnapshotUnavailableException extends DomainException {

    public SnapshotUnavailableException(long warehouseId, Throwable cause) {
        super("SNAPSHOT_UNAVAILABLE",
                "Could not read a consistent inventory snapshot for warehouse " + warehouseId,
                details("warehouseId", warehouseId),
                cause);
    }
}

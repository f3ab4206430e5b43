package com.example.inventory.domain.exception;

import java.util.List;
import java.util.stream.Collectors;

/**
 * The catalog defines a bundle that (transitively) contains itself.
 * A configuration error: the query is rejected, nothing is resolved.
 */
public class BundleCycleDetectedException extends DomainException {

    private final List<Long> cycle;

    public BundleCycleDetectedException(long rootProductId, List<Long> cycle) {
        super("BUNDLE_CYCLE_DETECTED",
                "Bundle cycle detected: " + cycle.stream().map(String::valueOf).collect(Collectors.joining(" -> ")),
                details("bundleId", rootProductId, "cycle", List.copyOf(cycle)));
        this.cycle = List.copyOf(cycle);
    }

    /**
     * Product ids along the cycle; the first id is repeated at the end.
     */
    public List<Long> getCycle() {
        return cycle;
    }
}

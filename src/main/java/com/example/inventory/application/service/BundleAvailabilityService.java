package com.example.inventory.application.service;

import com.example.inventory.application.dto.BundleAvailabilityResult;
import com.example.inventory.application.dto.BundleAvailabilityResult.LeafQuantity;
import com.example.inventory.application.port.in.BundleAvailabilityUseCase;
import com.example.inventory.application.port.out.ProjectionPort;
import com.example.inventory.application.port.out.ReferenceCatalogPort;
import com.example.inventory.domain.exception.BundleCycleDetectedException;
import com.example.inventory.domain.exception.InvalidBundleDefinitionException;
import com.example.inventory.domain.service.BundleGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Resolves the availability of a bundle at a warehouse.
 * The graph is built from the catalog on every query; all leaf quantities come from one snapshot read.
 */
@Service
public class BundleAvailabilityService implements BundleAvailabilityUseCase {

    private static final Logger log = LoggerFactory.getLogger(BundleAvailabilityService.class);

    private final ReferenceCatalogPort catalogPort;
    private final ProjectionPort projectionPort;

    public BundleAvailabilityService(ReferenceCatalogPort catalogPort, ProjectionPort projectionPort) {
        this.catalogPort = catalogPort;
        this.projectionPort = projectionPort;
    }

    @Override
    public BundleAvailabilityResult getBundleAvailability(long bundleId, long warehouseId) {
        if (warehouseId <= 0) {
            throw new IllegalArgumentException("WarehouseId must be positive: " + warehouseId);
        }

        BundleGraph graph;
        try {
            graph = BundleGraph.build(bundleId, catalogPort::getProduct, catalogPort::getComponents);
        } catch (BundleCycleDetectedException | InvalidBundleDefinitionException e) {
            log.error("Catalog configuration error for bundle {}: [{}] {}", bundleId, e.getRule(), e.getMessage());
            throw e;
        }

        List<Long> leaves = graph.leafProductIds();
        Map<Long, Long> quantities = projectionPort.snapshotQuantities(warehouseId, leaves);
        long availability = graph.availability(quantities);

        log.debug("Availability of {} at warehouse {}: {} (from {} leaves)",
                bundleId, warehouseId, availability, leaves.size());

        List<LeafQuantity> leafQuantities = leaves.stream()
                .map(id -> new LeafQuantity(id, quantities.getOrDefault(id, 0L)))
                .toList();
        return new BundleAvailabilityResult(bundleId, warehouseId, graph.getRoot().isBundle(),
                availability, leafQuantities);
    }
}

package com.example.inventory.application.port.in;

import com.example.inventory.application.dto.BundleAvailabilityResult;

/**
 * Inbound port for bundle availability queries.
 */
public interface BundleAvailabilityUseCase {

    BundleAvailabilityResult getBundleAvailability(long bundleId, long warehouseId);
}

package com.example.inventory.application.service;

import com.example.inventory.application.dto.LowStockAlert;
import com.example.inventory.application.dto.LowStockAlert.SupplierContact;
import com.example.inventory.application.dto.LowStockReport;
import com.example.inventory.application.port.in.LowStockAlertUseCase;
import com.example.inventory.application.port.out.LedgerPort;
import com.example.inventory.application.port.out.ProjectionPort;
import com.example.inventory.application.port.out.ReferenceCatalogPort;
import com.example.inventory.domain.model.InventoryProjection;
import com.example.inventory.domain.model.Product;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds low-stock alerts for a warehouse.
 * A product alerts when its quantity is below its catalog threshold and it sold at least one unit
 * during the last {@code alerts.recent-sales-days} days.
 */
@Service
public class LowStockAlertService implements LowStockAlertUseCase {

    private static final Logger log = LoggerFactory.getLogger(LowStockAlertService.class);

    private final ProjectionPort projectionPort;
    private final LedgerPort ledgerPort;
    private final ReferenceCatalogPort catalogPort;
    private final int recentSalesDays;

    public LowStockAlertService(
            ProjectionPort projectionPort,
            LedgerPort ledgerPort,
            ReferenceCatalogPort catalogPort,
            @Value("${alerts.recent-sales-days:30}") int recentSalesDays) {
        this.projectionPort = projectionPort;
        this.ledgerPort = ledgerPort;
        this.catalogPort = catalogPort;
        this.recentSalesDays = recentSalesDays;
    }

    @Override
    public LowStockReport lowStockAlerts(long warehouseId) {
        if (warehouseId <= 0) {
            throw new IllegalArgumentException("WarehouseId must be positive: " + warehouseId);
        }

        Instant since = Instant.now().minus(recentSalesDays, ChronoUnit.DAYS);
        Map<Long, Long> unitsSold = ledgerPort.unitsSoldSince(warehouseId, since);

        List<LowStockAlert> alerts = new ArrayList<>();
        for (InventoryProjection projection : projectionPort.findByWarehouse(warehouseId)) {
            long productId = projection.getKey().getProductId();
            long sold = unitsSold.getOrDefault(productId, 0L);
            if (sold <= 0) {
                continue;
            }

            Optional<Product> product = catalogPort.getProduct(productId);
            if (product.isEmpty()) {
                log.warn("Stocked product {} at warehouse {} is missing from the catalog", productId, warehouseId);
                continue;
            }
            Optional<Integer> threshold = product.get().getLowStockThreshold();
            if (threshold.isEmpty() || projection.getCurrentQuantity() >= threshold.get()) {
                continue;
            }

            alerts.add(toAlert(product.get(), projection, threshold.get(), sold));
        }

        log.info("Warehouse {}: {} low-stock alerts", warehouseId, alerts.size());
        return LowStockReport.of(warehouseId, alerts);
    }

    private LowStockAlert toAlert(Product product, InventoryProjection projection, int threshold, long sold) {
        long current = projection.getCurrentQuantity();
        SupplierContact supplier = product.getSupplier()
                .map(s -> new SupplierContact(s.supplierId(), s.name(), s.contactEmail()))
                .orElse(null);

        return new LowStockAlert(
                product.getProductId(),
                product.getName(),
                product.getSku(),
                projection.getKey().getWarehouseId(),
                current,
                threshold,
                daysUntilStockout(current, sold),
                supplier);
    }

    /**
     * ceil(current / (sold / days)), computed in integers.
     */
    long daysUntilStockout(long current, long sold) {
        if (current <= 0) {
            return 0;
        }
        long numerator = current * recentSalesDays;
        return (numerator + sold - 1) / sold;
    }
}

package com.example.inventory.infrastructure.adapter.in.web;

import com.example.inventory.application.dto.LowStockReport;
import com.example.inventory.application.port.in.LowStockAlertUseCase;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * REST controller for warehouse alerts.
 */
@RestController
@RequestMapping("/api/warehouses")
@Tag(name = "Alerts", description = "Low-stock alerts API")
public class AlertController {

    private final LowStockAlertUseCase lowStockAlertUseCase;

    public AlertController(LowStockAlertUseCase lowStockAlertUseCase) {
        this.lowStockAlertUseCase = lowStockAlertUseCase;
    }

    @Operation(
            summary = "Low-stock alerts of a warehouse",
            description = "Products below their threshold that sold during the recent-sales window, with supplier contact."
    )
    @GetMapping("/{warehouseId}/alerts/low-stock")
    public Mono<LowStockReport> lowStockAlerts(@PathVariable long warehouseId) {
        return Mono.fromCallable(() -> lowStockAlertUseCase.lowStockAlerts(warehouseId))
                .subscribeOn(Schedulers.boundedElastic());
    }
}

package com.example.inventory.infrastructure.adapter.in.web;

import com.example.inventory.application.dto.BundleAvailabilityResult;
import com.example.inventory.application.port.in.BundleAvailabilityUseCase;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * REST controller for bundle availability.
 */
@RestController
@RequestMapping("/api/bundles")
@Tag(name = "Bundles", description = "Bundle availability API")
public class BundleController {

    private final BundleAvailabilityUseCase availabilityUseCase;

    public BundleController(BundleAvailabilityUseCase availabilityUseCase) {
        this.availabilityUseCase = availabilityUseCase;
    }

    @Operation(
            summary = "Availability of a bundle at a warehouse",
            description = """
                    min over components of floor(component availability / quantity per bundle),
                    resolved recursively for nested bundles from one consistent snapshot.
                    """
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Availability computed"),
            @ApiResponse(responseCode = "404", description = "Product not in the catalog"),
            @ApiResponse(responseCode = "422", description = "Bundle cycle or invalid bundle definition"),
            @ApiResponse(responseCode = "503", description = "Snapshot or catalog unavailable, retry")
    })
    @GetMapping("/{bundleId}/availability")
    public Mono<BundleAvailabilityResult> getAvailability(
            @PathVariable long bundleId,
            @RequestParam long warehouseId) {
        return Mono.fromCallable(() -> availabilityUseCase.getBundleAvailability(bundleId, warehouseId))
                .subscribeOn(Schedulers.boundedElastic());
    }
}

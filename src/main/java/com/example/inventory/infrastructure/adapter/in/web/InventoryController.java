package com.example.inventory.infrastructure.adapter.in.web;

import com.example.inventory.application.dto.LedgerEntry;
import com.example.inventory.application.dto.ReconciliationResult;
import com.example.inventory.application.dto.StockLevel;
import com.example.inventory.application.dto.SubmitChangeCommand;
import com.example.inventory.application.port.in.InventoryQueryUseCase;
import com.example.inventory.application.port.in.ReconcileUseCase;
import com.example.inventory.application.port.in.SubmitChangeUseCase;
import com.example.inventory.domain.model.InventoryKey;
import com.example.inventory.infrastructure.adapter.in.web.dto.ChangeEventResponse;
import com.example.inventory.infrastructure.adapter.in.web.dto.HistoryResponse;
import com.example.inventory.infrastructure.adapter.in.web.dto.SubmitChangeRequest;
import com.example.inventory.infrastructure.adapter.in.web.mapper.InventoryWebMapper;
import com.example.inventory.infrastructure.config.AdmissionDrainCoordinator;
import com.example.inventory.infrastructure.service.IdempotencyService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Optional;

/**
 * REST controller for inventory keys: change submission, quantity, history and reconciliation.
 * Supports idempotent submission via the X-Idempotency-Key header.
 */
@RestController
@RequestMapping("/api/inventory")
@Tag(name = "Inventory", description = "Inventory ledger API")
public class InventoryController {

    private static final Logger log = LoggerFactory.getLogger(InventoryController.class);

    private final SubmitChangeUseCase submitChangeUseCase;
    private final InventoryQueryUseCase queryUseCase;
    private final ReconcileUseCase reconcileUseCase;
    private final InventoryWebMapper mapper;
    private final IdempotencyService idempotencyService;
    private final AdmissionDrainCoordinator drainCoordinator;

    public InventoryController(
            SubmitChangeUseCase submitChangeUseCase,
            InventoryQueryUseCase queryUseCase,
            ReconcileUseCase reconcileUseCase,
            InventoryWebMapper mapper,
            IdempotencyService idempotencyService,
            AdmissionDrainCoordinator drainCoordinator) {
        this.submitChangeUseCase = submitChangeUseCase;
        this.queryUseCase = queryUseCase;
        this.reconcileUseCase = reconcileUseCase;
        this.mapper = mapper;
        this.idempotencyService = idempotencyService;
        this.drainCoordinator = drainCoordinator;
    }

    @Operation(
            summary = "Submit an inventory change",
            description = """
                    Validates a change against its change-type rules and the current quantity of the key,
                    then appends it to the ledger and updates the projection atomically.

                    | changeType | delta | extra rule |
                    |---|---|---|
                    | received | > 0 | |
                    | sold | < 0 | quantity may not go below zero |
                    | reserved | < 0 | quantity may not go below zero |
                    | released | > 0 | at most the outstanding reserved quantity |
                    | adjustment | != 0 | reference required |

                    **Idempotency**: with an X-Idempotency-Key header a repeated submission returns the
                    originally admitted event with 200.
                    """
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "201", description = "Change admitted"),
            @ApiResponse(responseCode = "200", description = "Idempotent repeat, original event returned"),
            @ApiResponse(responseCode = "400", description = "Malformed change (zero delta, wrong sign, missing reference)"),
            @ApiResponse(responseCode = "404", description = "Product not in the catalog"),
            @ApiResponse(
                    responseCode = "409",
                    description = "Insufficient stock, over-release, quarantined key or submission in progress",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON_VALUE,
                            examples = @ExampleObject(value = """
                                    {
                                      "error": "INSUFFICIENT_STOCK",
                                      "message": "Insufficient stock for W1/P1: sold 80 requested, 70 on hand",
                                      "details": {
                                        "warehouseId": 1,
                                        "productId": 1,
                                        "changeType": "sold",
                                        "attemptedDelta": -80,
                                        "currentQuantity": 70
                                      },
                                      "timestamp": "2024-05-01T12:00:00Z"
                                    }
                                    """)
                    )
            ),
            @ApiResponse(responseCode = "503", description = "Key busy, database contention or service draining")
    })
    @PostMapping("/{warehouseId}/{productId}/changes")
    public Mono<ResponseEntity<ChangeEventResponse>> submitChange(
            @Parameter(description = "Idempotency key for safe client retries")
            @RequestHeader(value = "X-Idempotency-Key", required = false) String idempotencyKey,
            @PathVariable long warehouseId,
            @PathVariable long productId,
            @Valid @RequestBody SubmitChangeRequest request) {

        SubmitChangeCommand command = mapper.toCommand(warehouseId, productId, request);
        log.info("Received {} {} for W{}/P{}, idempotencyKey: {}",
                command.changeType(), command.quantityDelta(), warehouseId, productId, idempotencyKey);

        return Mono.fromCallable(() -> submit(idempotencyKey, command))
                .subscribeOn(Schedulers.boundedElastic());
    }

    private ResponseEntity<ChangeEventResponse> submit(String idempotencyKey, SubmitChangeCommand command) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            LedgerEntry entry = drainCoordinator.track(() -> submitChangeUseCase.submitChange(command));
            return ResponseEntity.status(HttpStatus.CREATED).body(mapper.toResponse(entry));
        }

        InventoryKey key = InventoryKey.of(command.warehouseId(), command.productId());
        Optional<Long> admitted = idempotencyService.findAdmittedEventId(idempotencyKey, key);
        if (admitted.isPresent()) {
            log.info("Returning event {} for repeated idempotency key: {}", admitted.get(), idempotencyKey);
            return ResponseEntity.ok(mapper.toResponse(admittedEvent(key, admitted.get())));
        }

        if (!idempotencyService.claim(idempotencyKey, key)) {
            log.warn("Submission already in progress for idempotency key: {}", idempotencyKey);
            throw new ResponseStatusException(HttpStatus.CONFLICT, "Request is already being processed");
        }

        LedgerEntry entry;
        try {
            entry = drainCoordinator.track(() -> submitChangeUseCase.submitChange(command));
        } catch (RuntimeException e) {
            idempotencyService.release(idempotencyKey);
            throw e;
        }
        // The event is admitted at this point; the response stays 201 even if the claim cannot be completed
        try {
            idempotencyService.complete(idempotencyKey, entry.eventId());
        } catch (RuntimeException e) {
            log.error("[IDEMPOTENCY] Could not bind key {} to admitted event {} of W{}/P{}; "
                            + "the claim stays in progress until it expires: {}",
                    idempotencyKey, entry.eventId(), command.warehouseId(), command.productId(),
                    e.getMessage(), e);
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(mapper.toResponse(entry));
    }

    private LedgerEntry admittedEvent(InventoryKey key, long eventId) {
        return queryUseCase.getHistory(key, eventId - 1, 1).stream()
                .filter(entry -> entry.eventId() == eventId)
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("Admitted event " + eventId + " missing from ledger of " + key));
    }

    @Operation(summary = "Current quantity of an inventory key",
            description = "A key with no history has quantity 0. Retired products stay readable.")
    @GetMapping("/{warehouseId}/{productId}")
    public Mono<StockLevel> getQuantity(@PathVariable long warehouseId, @PathVariable long productId) {
        return Mono.fromCallable(() -> queryUseCase.getQuantity(InventoryKey.of(warehouseId, productId)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @Operation(summary = "Ledger history of an inventory key",
            description = "Events with an id greater than sinceEventId, in event id order.")
    @GetMapping("/{warehouseId}/{productId}/history")
    public Mono<HistoryResponse> getHistory(
            @PathVariable long warehouseId,
            @PathVariable long productId,
            @RequestParam(defaultValue = "0") long sinceEventId,
            @RequestParam(required = false) Integer limit) {
        return Mono.fromCallable(() -> {
                    List<LedgerEntry> entries = queryUseCase.getHistory(
                            InventoryKey.of(warehouseId, productId), sinceEventId, limit);
                    return mapper.toHistoryResponse(warehouseId, productId, sinceEventId, entries);
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    @Operation(summary = "Rebuild a projection from the ledger",
            description = "Replays the full history, overwrites the live projection and clears any quarantine.")
    @PostMapping("/{warehouseId}/{productId}/reconcile")
    public Mono<ReconciliationResult> reconcile(@PathVariable long warehouseId, @PathVariable long productId) {
        return Mono.fromCallable(() -> reconcileUseCase.reconcile(InventoryKey.of(warehouseId, productId)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @Operation(summary = "Verify a projection against the ledger",
            description = "Rebuilds without repairing. On divergence the key is quarantined and 409 is returned.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Projection matches the ledger"),
            @ApiResponse(responseCode = "409", description = "Projection diverged, key quarantined")
    })
    @GetMapping("/{warehouseId}/{productId}/verify")
    public Mono<ReconciliationResult> verify(@PathVariable long warehouseId, @PathVariable long productId) {
        return Mono.fromCallable(() -> reconcileUseCase.verify(InventoryKey.of(warehouseId, productId)))
                .subscribeOn(Schedulers.boundedElastic());
    }
}

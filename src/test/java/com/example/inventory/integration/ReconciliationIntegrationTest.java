package com.example.inventory.integration;

import com.example.inventory.application.dto.ReconciliationResult;
import com.example.inventory.application.port.out.ProjectionPort;
import com.example.inventory.application.port.out.ProjectionPort.RebuildOutcome;
import com.example.inventory.domain.model.ChangeType;
import com.example.inventory.domain.model.InventoryKey;
import com.example.inventory.domain.model.InventoryProjection;
import com.example.inventory.domain.model.ProposedChange;
import com.example.inventory.infrastructure.persistence.entity.InventoryChangeEventEntity;
import com.example.inventory.infrastructure.persistence.entity.InventoryKeyId;
import com.example.inventory.infrastructure.persistence.entity.InventoryProjectionEntity;
import com.example.inventory.infrastructure.persistence.mapper.LedgerPersistenceMapper;
import com.example.inventory.support.LedgerTestSupport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Integration tests for projection rebuild, verification and gap recovery.
 *
 * Scenarios:
 * - reconcile after 10,000 mixed events equals the incremental projection
 * - a tampered projection is detected, quarantined and repaired by reconcile
 * - events missing from the projection are replayed before the next admission
 * - a rebuild catches up events appended after its boundary
 */
@DisplayName("Reconciliation Integration Tests")
class ReconciliationIntegrationTest extends LedgerTestSupport {

    private static final long W = 7;
    private static final long P = 300;

    @Autowired
    private LedgerPersistenceMapper mapper;

    @Autowired
    private ProjectionPort projectionPort;

    @Test
    @DisplayName("should_rebuild_10000_events_to_the_incremental_projection")
    void should_rebuild_10000_events_to_the_incremental_projection() {
        // Given: 10,000 mixed events written straight to the ledger
        InventoryKey key = InventoryKey.of(W, P);
        List<InventoryChangeEventEntity> saved = changeRepository.saveAll(mixedHistory(key, 10_000, new Random(2024)));

        InventoryProjection incremental = InventoryProjection.empty(key);
        saved.stream().map(mapper::toDomain).forEach(incremental::apply);

        // When
        ReconciliationResult result = webTestClient.post()
                .uri("/api/inventory/{w}/{p}/reconcile", W, P)
                .exchange()
                .expectStatus().isOk()
                .expectBody(ReconciliationResult.class)
                .returnResult()
                .getResponseBody();

        // Then
        assertThat(result).isNotNull();
        assertThat(result.eventsReplayed()).isEqualTo(10_000);
        assertThat(result.currentQuantity()).isEqualTo(incremental.getCurrentQuantity());
        assertThat(result.reservedQuantity()).isEqualTo(incremental.getReservedQuantity());
        assertThat(result.lastAppliedEventId()).isEqualTo(incremental.getLastAppliedEventId());
        assertThat(result.repaired()).isTrue();

        // And: the stored projection now verifies clean
        webTestClient.get()
                .uri("/api/inventory/{w}/{p}/verify", W, P)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.diverged").isEqualTo(false)
                .jsonPath("$.eventsReplayed").isEqualTo(10_000);
    }

    @Test
    @DisplayName("should_report_no_divergence_for_admitted_history")
    void should_report_no_divergence_for_admitted_history() {
        givenProduct(P, "BOLT");
        submit(W, P, "received", 100, "PO-1").expectStatus().isCreated();
        submit(W, P, "reserved", -20, "SO-1").expectStatus().isCreated();
        submit(W, P, "released", 5, "SO-1").expectStatus().isCreated();
        submit(W, P, "sold", -15, "SO-1").expectStatus().isCreated();

        webTestClient.post()
                .uri("/api/inventory/{w}/{p}/reconcile", W, P)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.currentQuantity").isEqualTo(70)
                .jsonPath("$.reservedQuantity").isEqualTo(15)
                .jsonPath("$.previousQuantity").isEqualTo(70)
                .jsonPath("$.diverged").isEqualTo(false)
                .jsonPath("$.eventsReplayed").isEqualTo(4);
    }

    @Test
    @DisplayName("should_quarantine_diverged_key_until_reconciled")
    void should_quarantine_diverged_key_until_reconciled() {
        // Given: an admitted history and a projection row corrupted behind the ledger's back
        givenProduct(P, "BOLT");
        submit(W, P, "received", 100, "PO-1").expectStatus().isCreated();
        submit(W, P, "sold", -30, "SO-1").expectStatus().isCreated();

        InventoryProjectionEntity row = projectionRepository.findById(new InventoryKeyId(W, P)).orElseThrow();
        row.setCurrentQuantity(999);
        projectionRepository.save(row);

        // When: verification runs
        webTestClient.get()
                .uri("/api/inventory/{w}/{p}/verify", W, P)
                .exchange()
                .expectStatus().isEqualTo(409)
                .expectBody()
                .jsonPath("$.error").isEqualTo("PROJECTION_DIVERGENCE")
                .jsonPath("$.details.liveQuantity").isEqualTo(999)
                .jsonPath("$.details.rebuiltQuantity").isEqualTo(70);

        // Then: the key is closed for writes
        getQuantity(W, P)
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("DIVERGED");
        submit(W, P, "received", 1, "PO-2")
                .expectStatus().isEqualTo(409)
                .expectBody()
                .jsonPath("$.error").isEqualTo("PROJECTION_DIVERGENCE");
        webTestClient.get()
                .uri("/actuator/ledger")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.divergedKeys").isEqualTo(1)
                .jsonPath("$.status").isEqualTo("IDLE");

        // When: reconciled
        webTestClient.post()
                .uri("/api/inventory/{w}/{p}/reconcile", W, P)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.previousQuantity").isEqualTo(999)
                .jsonPath("$.currentQuantity").isEqualTo(70)
                .jsonPath("$.diverged").isEqualTo(true)
                .jsonPath("$.repaired").isEqualTo(true);

        // Then: writes resume from the rebuilt quantity
        getQuantity(W, P)
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("ACTIVE");
        submit(W, P, "sold", -70, "SO-2").expectStatus().isCreated();
        expectQuantity(W, P, 0);
    }

    @Test
    @DisplayName("should_replay_ledger_gap_before_next_admission")
    void should_replay_ledger_gap_before_next_admission() {
        // Given: the projection knows 10 units; a later receipt of 5 reached the ledger only
        givenProduct(P, "BOLT");
        submit(W, P, "received", 10, "PO-1").expectStatus().isCreated();
        changeRepository.save(mapper.toEntity(
                ProposedChange.of(InventoryKey.of(W, P), ChangeType.RECEIVED, 5, "PO-2"), 10, 15));

        // When: a sale of 12 arrives
        submit(W, P, "sold", -12, "SO-1")
                .expectStatus().isCreated()
                .expectBody()
                .jsonPath("$.quantityBefore").isEqualTo(15)
                .jsonPath("$.quantityAfter").isEqualTo(3);

        // Then
        expectQuantity(W, P, 3);
        webTestClient.get()
                .uri("/api/inventory/{w}/{p}/verify", W, P)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.diverged").isEqualTo(false);
    }

    @Test
    @DisplayName("should_catch_up_lagging_projection_on_verify_without_quarantine")
    void should_catch_up_lagging_projection_on_verify_without_quarantine() {
        // Given: the projection knows 10 units; a later receipt of 5 reached the ledger only
        givenProduct(P, "BOLT");
        submit(W, P, "received", 10, "PO-1").expectStatus().isCreated();
        changeRepository.save(mapper.toEntity(
                ProposedChange.of(InventoryKey.of(W, P), ChangeType.RECEIVED, 5, "PO-2"), 10, 15));

        // When: verification runs before any further admission
        webTestClient.get()
                .uri("/api/inventory/{w}/{p}/verify", W, P)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.diverged").isEqualTo(false)
                .jsonPath("$.currentQuantity").isEqualTo(15)
                .jsonPath("$.eventsReplayed").isEqualTo(2);

        // Then: the caught-up projection is stored and the key stays open
        InventoryProjectionEntity row = projectionRepository.findById(new InventoryKeyId(W, P)).orElseThrow();
        assertThat(row.getCurrentQuantity()).isEqualTo(15);
        getQuantity(W, P)
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("ACTIVE");
        submit(W, P, "sold", -1, "SO-1").expectStatus().isCreated();
        expectQuantity(W, P, 14);
    }

    @Test
    @DisplayName("should_catch_up_rebuild_with_events_appended_after_boundary")
    void should_catch_up_rebuild_with_events_appended_after_boundary() {
        // Given: a rebuild that replayed only the first of three admitted events
        givenProduct(P, "BOLT");
        submit(W, P, "received", 100, "PO-1").expectStatus().isCreated();
        submit(W, P, "reserved", -20, "SO-1").expectStatus().isCreated();
        submit(W, P, "sold", -30, "SO-2").expectStatus().isCreated();

        InventoryKey key = InventoryKey.of(W, P);
        InventoryProjection partial = InventoryProjection.empty(key);
        changeRepository.findAllAfter(W, P, 0).stream()
                .limit(1)
                .map(mapper::toDomain)
                .forEach(partial::apply);

        // When
        RebuildOutcome outcome = projectionPort.completeRebuild(partial, false);

        // Then
        assertThat(outcome.caughtUp()).isEqualTo(2);
        assertThat(outcome.diverged()).isFalse();
        assertThat(outcome.rebuilt().getCurrentQuantity()).isEqualTo(50);
        assertThat(outcome.rebuilt().getReservedQuantity()).isEqualTo(20);
        expectQuantity(W, P, 50);
    }

    @Test
    @DisplayName("should_reconcile_unseen_key_to_zero_without_creating_it")
    void should_reconcile_unseen_key_to_zero_without_creating_it() {
        webTestClient.post()
                .uri("/api/inventory/{w}/{p}/reconcile", W, 9999)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.currentQuantity").isEqualTo(0)
                .jsonPath("$.eventsReplayed").isEqualTo(0);

        assertThat(projectionRepository.findById(new InventoryKeyId(W, 9999))).isEmpty();
    }

    /**
     * Valid history: sales and reservations never exceed stock, releases never exceed reservations.
     */
    private List<InventoryChangeEventEntity> mixedHistory(InventoryKey key, int size, Random random) {
        List<InventoryChangeEventEntity> events = new ArrayList<>(size);
        long quantity = 0;
        long reserved = 0;
        for (int i = 0; i < size; i++) {
            int roll = random.nextInt(10);
            ChangeType type;
            int delta;
            if (quantity < 10 || roll < 3) {
                type = ChangeType.RECEIVED;
                delta = 1 + random.nextInt(40);
            } else if (roll < 6) {
                type = ChangeType.SOLD;
                delta = -(1 + random.nextInt((int) Math.min(quantity, 15)));
            } else if (roll < 8) {
                type = ChangeType.RESERVED;
                delta = -(1 + random.nextInt((int) Math.min(quantity, 8)));
            } else if (reserved > 0) {
                type = ChangeType.RELEASED;
                delta = 1 + random.nextInt((int) Math.min(reserved, 8));
            } else {
                type = ChangeType.ADJUSTMENT;
                delta = random.nextBoolean() ? 3 : -3;
            }
            long before = quantity;
            quantity += delta;
            if (type == ChangeType.RESERVED || type == ChangeType.RELEASED) {
                reserved -= delta;
            }
            events.add(mapper.toEntity(ProposedChange.of(key, type, delta, "REF-" + i), before, quantity));
        }
        return events;
    }
}

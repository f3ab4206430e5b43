package com.example.inventory.unit.web;

import com.example.inventory.application.dto.LedgerEntry;
import com.example.inventory.application.dto.SubmitChangeCommand;
import com.example.inventory.application.port.in.InventoryQueryUseCase;
import com.example.inventory.application.port.in.ReconcileUseCase;
import com.example.inventory.application.port.in.SubmitChangeUseCase;
import com.example.inventory.domain.exception.InsufficientStockException;
import com.example.inventory.domain.model.ChangeType;
import com.example.inventory.domain.model.InventoryKey;
import com.example.inventory.infrastructure.adapter.in.web.InventoryController;
import com.example.inventory.infrastructure.adapter.in.web.dto.SubmitChangeRequest;
import com.example.inventory.infrastructure.adapter.in.web.mapper.InventoryWebMapper;
import com.example.inventory.infrastructure.config.AdmissionDrainCoordinator;
import com.example.inventory.infrastructure.service.IdempotencyService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.http.HttpStatus;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for idempotent change submission around the admission use case.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("InventoryController Unit Tests")
class InventoryControllerTest {

    private static final InventoryKey KEY = InventoryKey.of(1, 5);

    @Mock
    private SubmitChangeUseCase submitChangeUseCase;

    @Mock
    private InventoryQueryUseCase queryUseCase;

    @Mock
    private ReconcileUseCase reconcileUseCase;

    @Mock
    private IdempotencyService idempotencyService;

    private InventoryController controller;

    private final SubmitChangeRequest request = new SubmitChangeRequest("received", 10, "PO-1", null);
    private final LedgerEntry admitted = new LedgerEntry(42, 1, 5, "received", 10, "PO-1",
            Instant.parse("2026-01-05T10:00:00Z"), 0, 10);

    @BeforeEach
    void setUp() {
        controller = new InventoryController(submitChangeUseCase, queryUseCase, reconcileUseCase,
                new InventoryWebMapper(), idempotencyService, new AdmissionDrainCoordinator(25));
    }

    @Test
    @DisplayName("should_return_201_when_claim_cannot_be_completed_after_admission")
    void should_return_201_when_claim_cannot_be_completed_after_admission() {
        // Given: the change is admitted as event 42, then binding the claim fails
        when(idempotencyService.findAdmittedEventId("idem-1", KEY)).thenReturn(Optional.empty());
        when(idempotencyService.claim("idem-1", KEY)).thenReturn(true);
        when(submitChangeUseCase.submitChange(any(SubmitChangeCommand.class))).thenReturn(admitted);
        doThrow(new CannotAcquireLockException("lock wait timeout"))
                .when(idempotencyService).complete("idem-1", 42);

        // When & Then
        StepVerifier.create(controller.submitChange("idem-1", 1, 5, request))
                .assertNext(response -> {
                    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CREATED);
                    assertThat(response.getBody()).isNotNull();
                    assertThat(response.getBody().eventId()).isEqualTo(42);
                })
                .verifyComplete();

        // The admitted event's claim is never released for re-admission
        verify(idempotencyService, never()).release("idem-1");
    }

    @Test
    @DisplayName("should_release_claim_when_admission_is_rejected")
    void should_release_claim_when_admission_is_rejected() {
        when(idempotencyService.findAdmittedEventId("idem-2", KEY)).thenReturn(Optional.empty());
        when(idempotencyService.claim("idem-2", KEY)).thenReturn(true);
        when(submitChangeUseCase.submitChange(any(SubmitChangeCommand.class)))
                .thenThrow(new InsufficientStockException(KEY, ChangeType.SOLD, -10, 0));

        StepVerifier.create(controller.submitChange("idem-2", 1, 5, request))
                .expectError(InsufficientStockException.class)
                .verify();

        verify(idempotencyService).release("idem-2");
        verify(idempotencyService, never()).complete(any(), anyLong());
    }
}

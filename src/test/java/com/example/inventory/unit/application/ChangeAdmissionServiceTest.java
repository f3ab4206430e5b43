package com.example.inventory.unit.application;

import com.example.inventory.application.dto.LedgerEntry;
import com.example.inventory.application.dto.SubmitChangeCommand;
import com.example.inventory.application.port.out.LedgerPort;
import com.example.inventory.application.port.out.LedgerPort.AdmissionCheck;
import com.example.inventory.application.port.out.ReferenceCatalogPort;
import com.example.inventory.application.service.ChangeAdmissionService;
import com.example.inventory.application.service.KeyLockRegistry;
import com.example.inventory.domain.exception.InsufficientStockException;
import com.example.inventory.domain.exception.UnknownProductException;
import com.example.inventory.domain.exception.ValidationException;
import com.example.inventory.domain.model.ChangeType;
import com.example.inventory.domain.model.InventoryChangeEvent;
import com.example.inventory.domain.model.InventoryKey;
import com.example.inventory.domain.model.InventoryProjection;
import com.example.inventory.domain.model.Product;
import com.example.inventory.domain.model.ProjectionStatus;
import com.example.inventory.domain.model.ProposedChange;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("Change Admission Service Tests")
class ChangeAdmissionServiceTest {

    private static final InventoryKey KEY = InventoryKey.of(1, 1);

    @Mock
    LedgerPort ledgerPort;
    @Mock
    ReferenceCatalogPort catalogPort;

    ChangeAdmissionService service;

    @BeforeEach
    void setUp() {
        service = new ChangeAdmissionService(ledgerPort, catalogPort, new KeyLockRegistry(1000));
    }

    /**
     * Makes the ledger run the admission check against {@code current} and admit the change as event 7.
     */
    private void givenLedgerAt(long quantity) {
        InventoryProjection current = InventoryProjection.reconstitute(KEY, quantity, 0, 6, ProjectionStatus.ACTIVE);
        when(ledgerPort.appendAndApply(any(), any())).thenAnswer(invocation -> {
            ProposedChange change = invocation.getArgument(0);
            AdmissionCheck check = invocation.getArgument(1);
            check.check(current);
            return InventoryChangeEvent.reconstitute(7, change.getKey(), change.getChangeType(),
                    change.getQuantityDelta(), change.getOccurredAt(), change.getReference(),
                    quantity, quantity + change.getQuantityDelta());
        });
    }

    @Test
    @DisplayName("should_admit_sale_within_current_quantity")
    void should_admit_sale_within_current_quantity() {
        when(catalogPort.getProduct(1)).thenReturn(Optional.of(Product.of(1, "SKU-1", false)));
        givenLedgerAt(100);

        LedgerEntry entry = service.submitChange(new SubmitChangeCommand(1, 1, "sold", -30, "SO-1"));

        assertThat(entry.eventId()).isEqualTo(7);
        assertThat(entry.changeType()).isEqualTo("sold");
        assertThat(entry.quantityBefore()).isEqualTo(100);
        assertThat(entry.quantityAfter()).isEqualTo(70);
    }

    @Test
    @DisplayName("should_propagate_insufficient_stock_from_admission_check")
    void should_propagate_insufficient_stock_from_admission_check() {
        when(catalogPort.getProduct(1)).thenReturn(Optional.of(Product.of(1, "SKU-1", false)));
        givenLedgerAt(70);

        assertThatThrownBy(() -> service.submitChange(new SubmitChangeCommand(1, 1, "sold", -80, "SO-2")))
                .isInstanceOf(InsufficientStockException.class);
    }

    @Test
    @DisplayName("should_reject_malformed_change_before_catalog_and_ledger")
    void should_reject_malformed_change_before_catalog_and_ledger() {
        assertThatThrownBy(() -> service.submitChange(new SubmitChangeCommand(1, 1, "received", 0, null)))
                .isInstanceOf(ValidationException.class);

        verifyNoInteractions(catalogPort, ledgerPort);
    }

    @Test
    @DisplayName("should_reject_unknown_change_type")
    void should_reject_unknown_change_type() {
        assertThatThrownBy(() -> service.submitChange(new SubmitChangeCommand(1, 1, "stolen", -1, null)))
                .isInstanceOf(ValidationException.class)
                .extracting("rule")
                .isEqualTo("UNKNOWN_CHANGE_TYPE");

        verifyNoInteractions(catalogPort, ledgerPort);
    }

    @Test
    @DisplayName("should_reject_product_missing_from_catalog")
    void should_reject_product_missing_from_catalog() {
        when(catalogPort.getProduct(1)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.submitChange(new SubmitChangeCommand(1, 1, "received", 5, null)))
                .isInstanceOf(UnknownProductException.class);

        verifyNoInteractions(ledgerPort);
    }

    @Test
    @DisplayName("should_parse_change_type_case_insensitively")
    void should_parse_change_type_case_insensitively() {
        when(catalogPort.getProduct(1)).thenReturn(Optional.of(Product.of(1, "SKU-1", false)));
        givenLedgerAt(0);

        LedgerEntry entry = service.submitChange(new SubmitChangeCommand(1, 1, "RECEIVED", 5, "PO-1"));

        assertThat(entry.changeType()).isEqualTo(ChangeType.RECEIVED.code());
        verify(ledgerPort).appendAndApply(argThat(change -> change.getChangeType() == ChangeType.RECEIVED), any());
    }
}

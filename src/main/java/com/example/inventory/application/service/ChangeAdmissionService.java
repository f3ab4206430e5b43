package com.example.inventory.application.service;

import com.example.inventory.application.dto.LedgerEntry;
import com.example.inventory.application.dto.SubmitChangeCommand;
import com.example.inventory.application.port.in.SubmitChangeUseCase;
import com.example.inventory.application.port.out.LedgerPort;
import com.example.inventory.application.port.out.ReferenceCatalogPort;
import com.example.inventory.domain.exception.DomainException;
import com.example.inventory.domain.exception.UnknownProductException;
import com.example.inventory.domain.exception.ValidationException;
import com.example.inventory.domain.model.ChangeType;
import com.example.inventory.domain.model.InventoryChangeEvent;
import com.example.inventory.domain.model.InventoryKey;
import com.example.inventory.domain.model.Product;
import com.example.inventory.domain.model.ProposedChange;
import com.example.inventory.domain.service.ChangeAdmissionPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Application service that admits inventory changes.
 * Shape and catalog checks run first; the stock checks and the append run under the per-key lock.
 */
@Service
public class ChangeAdmissionService implements SubmitChangeUseCase {

    private static final Logger log = LoggerFactory.getLogger(ChangeAdmissionService.class);

    private final LedgerPort ledgerPort;
    private final ReferenceCatalogPort catalogPort;
    private final KeyLockRegistry keyLocks;

    public ChangeAdmissionService(
            LedgerPort ledgerPort,
            ReferenceCatalogPort catalogPort,
            KeyLockRegistry keyLocks) {
        this.ledgerPort = ledgerPort;
        this.catalogPort = catalogPort;
        this.keyLocks = keyLocks;
    }

    @Override
    public LedgerEntry submitChange(SubmitChangeCommand command) {
        InventoryKey key = InventoryKey.of(command.warehouseId(), command.productId());
        ProposedChange change = toProposedChange(key, command);

        try {
            ChangeAdmissionPolicy.validate(change);

            Product product = catalogPort.getProduct(key.getProductId())
                    .orElseThrow(() -> new UnknownProductException(key.getProductId()));
            ChangeAdmissionPolicy.checkProduct(change, product);

            InventoryChangeEvent event = keyLocks.withLock(key, () ->
                    ledgerPort.appendAndApply(change,
                            current -> ChangeAdmissionPolicy.checkAgainst(change, current)));

            log.info("[ADMITTED] event={} key={} type={} delta={} quantity {} -> {}",
                    event.getEventId(), key, event.getChangeType().code(), event.getQuantityDelta(),
                    event.getQuantityBefore(), event.getQuantityAfter());
            return LedgerEntry.from(event);
        } catch (DomainException e) {
            log.warn("[REJECTED] key={} rule={} details={}", key, e.getRule(), e.getDetails());
            throw e;
        }
    }

    private ProposedChange toProposedChange(InventoryKey key, SubmitChangeCommand command) {
        ChangeType type;
        try {
            type = ChangeType.fromCode(command.changeType());
        } catch (IllegalArgumentException e) {
            ValidationException rejection = ValidationException.unknownChangeType(key, command.changeType());
            log.warn("[REJECTED] key={} rule={} details={}", key, rejection.getRule(), rejection.getDetails());
            throw rejection;
        }
        return ProposedChange.of(key, type, command.quantityDelta(), command.reference(), command.occurredAt());
    }
}

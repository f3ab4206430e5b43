package com.example.inventory.application.port.in;

import com.example.inventory.application.dto.LedgerEntry;
import com.example.inventory.application.dto.SubmitChangeCommand;

/**
 * Inbound port for admitting inventory changes.
 */
public interface SubmitChangeUseCase {

    /**
     * Validates a proposed change and, if every rule passes, appends it to the ledger and applies it
     * to the projection as one unit. On rejection nothing is persisted.
     *
     * @param command the proposed change
     * @return the admitted event
     * @throws com.example.inventory.domain.exception.DomainException naming the violated rule
     */
    LedgerEntry submitChange(SubmitChangeCommand command);
}

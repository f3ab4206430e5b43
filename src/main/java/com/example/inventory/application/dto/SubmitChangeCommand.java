package com.example.inventory.application.dto;

import java.time.Instant;

/**
 * Command to submit one inventory change.
 * The change type is the lowercase wire code, parsed during admission.
 *
 * @param occurredAt business time of the change, null for now
 */
public record SubmitChangeCommand(
        long warehouseId,
        long productId,
        String changeType,
        int quantityDelta,
        String reference,
        Instant occurredAt
) {
    public SubmitChangeCommand(long warehouseId, long productId, String changeType, int quantityDelta, String reference) {
        this(warehouseId, productId, changeType, quantityDelta, reference, null);
    }
}

package com.example.inventory.infrastructure.adapter.in.web.dto;

import java.time.Instant;

/**
 * Response DTO for one ledger event.
 */
public record ChangeEventResponse(
        long eventId,
        long warehouseId,
        long productId,
        String changeType,
        int quantityDelta,
        String reference,
        Instant occurredAt,
        long quantityBefore,
        long quantityAfter
) {
}

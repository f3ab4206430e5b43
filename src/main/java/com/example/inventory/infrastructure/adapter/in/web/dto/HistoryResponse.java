package com.example.inventory.infrastructure.adapter.in.web.dto;

import java.util.List;

/**
 * Response DTO for a page of ledger history.
 *
 * @param nextSinceEventId value to pass as {@code sinceEventId} to read the next page
 */
public record HistoryResponse(
        long warehouseId,
        long productId,
        List<ChangeEventResponse> events,
        long nextSinceEventId
) {
}

package com.example.inventory.infrastructure.adapter.in.web.mapper;

import com.example.inventory.application.dto.LedgerEntry;
import com.example.inventory.application.dto.SubmitChangeCommand;
import com.example.inventory.infrastructure.adapter.in.web.dto.ChangeEventResponse;
import com.example.inventory.infrastructure.adapter.in.web.dto.HistoryResponse;
import com.example.inventory.infrastructure.adapter.in.web.dto.SubmitChangeRequest;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Mapper between web DTOs and application DTOs.
 */
@Component
public class InventoryWebMapper {

    public SubmitChangeCommand toCommand(long warehouseId, long productId, SubmitChangeRequest request) {
        return new SubmitChangeCommand(
                warehouseId,
                productId,
                request.changeType(),
                request.quantityDelta(),
                request.reference(),
                request.occurredAt());
    }

    public ChangeEventResponse toResponse(LedgerEntry entry) {
        return new ChangeEventResponse(
                entry.eventId(),
                entry.warehouseId(),
                entry.productId(),
                entry.changeType(),
                entry.quantityDelta(),
                entry.reference(),
                entry.occurredAt(),
                entry.quantityBefore(),
                entry.quantityAfter());
    }

    public HistoryResponse toHistoryResponse(long warehouseId, long productId, long sinceEventId,
                                             List<LedgerEntry> entries) {
        List<ChangeEventResponse> events = entries.stream()
                .map(this::toResponse)
                .toList();
        long next = entries.isEmpty() ? sinceEventId : entries.get(entries.size() - 1).eventId();
        return new HistoryResponse(warehouseId, productId, events, next);
    }
}

package com.example.inventory.infrastructure.adapter.in.web.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;

/**
 * Request DTO for submitting an inventory change.
 * Sign and reference rules depend on the change type and are checked during admission.
 */
public record SubmitChangeRequest(
        @Schema(description = "received, sold, adjustment, reserved or released", example = "sold")
        @NotBlank(message = "Change type is required")
        String changeType,

        @Schema(description = "Signed, non-zero quantity delta", example = "-30")
        @NotNull(message = "Quantity delta is required")
        Integer quantityDelta,

        @Schema(description = "Order id, PO number or adjustment reason", example = "SO-2024-0042")
        String reference,

        @Schema(description = "Business time of the change, defaults to now")
        Instant occurredAt
) {
}

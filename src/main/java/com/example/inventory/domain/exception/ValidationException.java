package com.example.inventory.domain.exception;

import com.example.inventory.domain.model.ChangeType;
import com.example.inventory.domain.model.InventoryKey;
import com.example.inventory.domain.model.ProposedChange;

import java.util.Map;

/**
 * Malformed change request. Raised before anything is persisted; the caller may retry with corrected input.
 */
public class ValidationException extends DomainException {

    public ValidationException(String rule, String message, Map<String, Object> details) {
        super(rule, message, details);
    }

    public static ValidationException zeroDelta(ProposedChange change) {
        return new ValidationException("ZERO_DELTA",
                "Quantity delta cannot be zero for " + change.getKey(),
                describe(change));
    }

    public static ValidationException signMismatch(ProposedChange change) {
        ChangeType type = change.getChangeType();
        return new ValidationException("SIGN_MISMATCH",
                String.format("Change type %s requires a %s delta, got %d",
                        type.code(), type.requiredSign().name().toLowerCase(), change.getQuantityDelta()),
                describe(change));
    }

    public static ValidationException missingReference(ProposedChange change) {
        return new ValidationException("MISSING_REFERENCE",
                "An adjustment must carry a non-empty reference",
                describe(change));
    }

    public static ValidationException referenceTooLong(ProposedChange change, int maxLength) {
        Map<String, Object> details = describe(change);
        details.put("maxLength", maxLength);
        return new ValidationException("REFERENCE_TOO_LONG",
                "Reference exceeds " + maxLength + " characters",
                details);
    }

    public static ValidationException bundleNotStockable(ProposedChange change) {
        return new ValidationException("BUNDLE_NOT_STOCKABLE",
                "Product " + change.getKey().getProductId() + " is a bundle; bundles are not stocked directly",
                describe(change));
    }

    public static ValidationException productRetired(ProposedChange change) {
        return new ValidationException("PRODUCT_RETIRED",
                "Product " + change.getKey().getProductId() + " is retired and accepts no "
                        + change.getChangeType().code() + " changes",
                describe(change));
    }

    public static ValidationException unknownChangeType(InventoryKey key, String code) {
        return new ValidationException("UNKNOWN_CHANGE_TYPE",
                "Unknown change type: " + code,
                details("warehouseId", key.getWarehouseId(), "productId", key.getProductId(), "changeType", code));
    }

    private static Map<String, Object> describe(ProposedChange change) {
        return details(
                "warehouseId", change.getKey().getWarehouseId(),
                "productId", change.getKey().getProductId(),
                "changeType", change.getChangeType().code(),
                "attemptedDelta", change.getQuantityDelta(),
                "reference", change.getReference());
    }
}

package com.example.inventory.domain.service;

import com.example.inventory.domain.exception.InsufficientStockException;
import com.example.inventory.domain.exception.OverReleaseException;
import com.example.inventory.domain.exception.ProjectionDivergenceException;
import com.example.inventory.domain.exception.ValidationException;
import com.example.inventory.domain.model.ChangeType;
import com.example.inventory.domain.model.InventoryProjection;
import com.example.inventory.domain.model.Product;
import com.example.inventory.domain.model.ProposedChange;

/**
 * Change-type rules applied to a proposed change before it is admitted to the ledger.
 * <p>
 * The checks run in three stages:
 * <ol>
 *   <li>{@link #validate} - shape of the request, before any lock or persistence</li>
 *   <li>{@link #checkProduct} - catalog state of the product</li>
 *   <li>{@link #checkAgainst} - the current projection, under the per-key lock</li>
 * </ol>
 */
public final class ChangeAdmissionPolicy {

    public static final int MAX_REFERENCE_LENGTH = 255;

    private ChangeAdmissionPolicy() {
    }

    /**
     * Validates the shape of a proposed change.
     *
     * @throws ValidationException on zero delta, wrong sign or a missing/oversized reference
     */
    public static void validate(ProposedChange change) {
        int delta = change.getQuantityDelta();
        if (delta == 0) {
            throw ValidationException.zeroDelta(change);
        }
        if (!change.getChangeType().acceptsDelta(delta)) {
            throw ValidationException.signMismatch(change);
        }
        if (change.getChangeType() == ChangeType.ADJUSTMENT && !change.hasReference()) {
            throw ValidationException.missingReference(change);
        }
        if (change.getReference() != null && change.getReference().length() > MAX_REFERENCE_LENGTH) {
            throw ValidationException.referenceTooLong(change, MAX_REFERENCE_LENGTH);
        }
    }

    /**
     * Checks the catalog state of the product the change targets.
     * Bundles are never stocked; retired products only wind down their remaining stock.
     */
    public static void checkProduct(ProposedChange change, Product product) {
        if (product.isBundle()) {
            throw ValidationException.bundleNotStockable(change);
        }
        if (product.isRetired()) {
            ChangeType type = change.getChangeType();
            if (type == ChangeType.RECEIVED || type == ChangeType.RESERVED) {
                throw ValidationException.productRetired(change);
            }
        }
    }

    /**
     * Checks a change against the current projection of its key.
     * Must be called while the key is held exclusively.
     *
     * @throws ProjectionDivergenceException if the key is quarantined
     * @throws InsufficientStockException    if a sale or reservation would take the quantity below zero
     * @throws OverReleaseException          if a release exceeds the outstanding reservations
     */
    public static void checkAgainst(ProposedChange change, InventoryProjection projection) {
        if (projection.isWriteBlocked()) {
            throw ProjectionDivergenceException.writesBlocked(projection.getKey());
        }

        int delta = change.getQuantityDelta();
        ChangeType type = change.getChangeType();

        if (type.consumesStock() && projection.getCurrentQuantity() + delta < 0) {
            throw new InsufficientStockException(change.getKey(), type, delta, projection.getCurrentQuantity());
        }
        if (type == ChangeType.RELEASED && delta > projection.getReservedQuantity()) {
            throw new OverReleaseException(change.getKey(), delta,
                    projection.getReservedQuantity(), projection.getCurrentQuantity());
        }
    }
}

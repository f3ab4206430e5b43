package com.example.inventory.domain.exception;

import com.example.inventory.domain.model.InventoryKey;
import com.example.inventory.domain.model.InventoryProjection;

import java.util.Map;

/**
 * The live projection of a key disagrees with its ledger history.
 * The key stays closed for writes until it is reconciled.
 */
public class ProjectionDivergenceException extends DomainException {

    private final InventoryKey key;

    private ProjectionDivergenceException(InventoryKey key, String message, Object... extra) {
        super("PROJECTION_DIVERGENCE", message, withKey(key, extra));
        this.key = key;
    }

    /**
     * A rebuild produced a different state than the live projection.
     */
    public static ProjectionDivergenceException detected(InventoryProjection live, InventoryProjection rebuilt) {
        return new ProjectionDivergenceException(live.getKey(),
                String.format("Projection of %s diverged from ledger: live quantity %d, rebuilt quantity %d",
                        live.getKey(), live.getCurrentQuantity(), rebuilt.getCurrentQuantity()),
                "liveQuantity", live.getCurrentQuantity(),
                "rebuiltQuantity", rebuilt.getCurrentQuantity(),
                "liveReserved", live.getReservedQuantity(),
                "rebuiltReserved", rebuilt.getReservedQuantity(),
                "liveLastAppliedEventId", live.getLastAppliedEventId(),
                "rebuiltLastAppliedEventId", rebuilt.getLastAppliedEventId());
    }

    /**
     * A write was attempted on a key that is quarantined after a divergence.
     */
    public static ProjectionDivergenceException writesBlocked(InventoryKey key) {
        return new ProjectionDivergenceException(key,
                "Writes to " + key + " are blocked until the key is reconciled");
    }

    public InventoryKey getKey() {
        return key;
    }

    private static Map<String, Object> withKey(InventoryKey key, Object... extra) {
        Object[] all = new Object[extra.length + 4];
        all[0] = "warehouseId";
        all[1] = key.getWarehouseId();
        all[2] = "productId";
        all[3] = key.getProductId();
        System.arraycopy(extra, 0, all, 4, extra.length);
        return details(all);
    }
}

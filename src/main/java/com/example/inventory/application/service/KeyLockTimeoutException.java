package com.example.inventory.application.service;

import com.example.inventory.domain.model.InventoryKey;

/**
 * The per-key write lock could not be acquired in time. Nothing was persisted; the caller may retry.
 */
public class KeyLockTimeoutException extends RuntimeException {

    private final InventoryKey key;
    private final long timeoutMs;

    public KeyLockTimeoutException(InventoryKey key, long timeoutMs) {
        super("Timed out after " + timeoutMs + " ms waiting for write access to " + key);
        this.key = key;
        this.timeoutMs = timeoutMs;
    }

    public KeyLockTimeoutException(InventoryKey key, long timeoutMs, Throwable cause) {
        super("Interrupted while waiting for write access to " + key, cause);
        this.key = key;
        this.timeoutMs = timeoutMs;
    }

    public InventoryKey getKey() {
        return key;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }
}

package com.example.inventory.application.service;

import com.example.inventory.domain.model.InventoryKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * In-process exclusive lock per inventory key.
 * <p>
 * One writer per key at a time; distinct keys never contend. Locks are reference-counted and
 * removed once no thread holds or waits for them, so the map only contains keys in use.
 * The database row lock taken inside the transaction covers writers in other instances.
 */
@Component
public class KeyLockRegistry {

    private static final Logger log = LoggerFactory.getLogger(KeyLockRegistry.class);

    private final ConcurrentHashMap<InventoryKey, KeyLock> locks = new ConcurrentHashMap<>();
    private final long timeoutMs;

    public KeyLockRegistry(@Value("${ledger.admission.lock-timeout-ms:5000}") long timeoutMs) {
        this.timeoutMs = timeoutMs;
    }

    /**
     * Runs {@code action} while holding the lock of {@code key}.
     *
     * @throws KeyLockTimeoutException if the lock is not acquired within the configured timeout
     */
    public <T> T withLock(InventoryKey key, Supplier<T> action) {
        KeyLock keyLock = locks.compute(key, (k, existing) -> {
            KeyLock lock = existing != null ? existing : new KeyLock();
            lock.users++;
            return lock;
        });

        try {
            acquire(key, keyLock.lock);
            try {
                return action.get();
            } finally {
                keyLock.lock.unlock();
            }
        } finally {
            locks.computeIfPresent(key, (k, lock) -> --lock.users == 0 ? null : lock);
        }
    }

    private void acquire(InventoryKey key, ReentrantLock lock) {
        try {
            if (!lock.tryLock(timeoutMs, TimeUnit.MILLISECONDS)) {
                log.warn("Lock wait for {} exceeded {} ms", key, timeoutMs);
                throw new KeyLockTimeoutException(key, timeoutMs);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new KeyLockTimeoutException(key, timeoutMs, e);
        }
    }

    /**
     * Number of keys currently locked or awaited.
     */
    public int activeKeys() {
        return locks.size();
    }

    private static final class KeyLock {
        private final ReentrantLock lock = new ReentrantLock(true);
        private int users;
    }
}

package com.example.inventory.infrastructure.service;

import com.example.inventory.domain.model.InventoryKey;
import com.example.inventory.infrastructure.exception.IdempotencyKeyReusedException;
import com.example.inventory.infrastructure.persistence.entity.IdempotencyRecord;
import com.example.inventory.infrastructure.persistence.entity.IdempotencyStatus;
import com.example.inventory.infrastructure.persistence.repository.IdempotencyRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

/**
 * Idempotent change submission.
 * <p>
 * A key is claimed before admission and bound to one inventory key. It is completed with the id of
 * the admitted event, or released when the submission is rejected so the caller can retry with
 * corrected input. A repeated submission is answered from the ledger, which never changes an
 * admitted event.
 */
@Service
public class IdempotencyService {

    private static final Logger log = LoggerFactory.getLogger(IdempotencyService.class);

    private final IdempotencyRepository repository;
    private final int expiryHours;

    public IdempotencyService(
            IdempotencyRepository repository,
            @Value("${idempotency.expiry-hours:24}") int expiryHours) {
        this.repository = repository;
        this.expiryHours = expiryHours;
    }

    /**
     * Returns the event admitted under a completed, unexpired claim.
     *
     * @throws IdempotencyKeyReusedException if the claim belongs to another inventory key
     */
    @Transactional(readOnly = true)
    public Optional<Long> findAdmittedEventId(String idempotencyKey, InventoryKey key) {
        return repository.findById(idempotencyKey)
                .filter(record -> !record.isExpired(Instant.now()))
                .map(record -> requireSameKey(record, key))
                .filter(record -> record.getStatus() == IdempotencyStatus.COMPLETED)
                .map(IdempotencyRecord::getEventId);
    }

    /**
     * Claims a key before admission. Not transactional: a lost insert race must not poison a
     * surrounding transaction.
     *
     * @return true if claimed, false if another submission holds it
     */
    public boolean claim(String idempotencyKey, InventoryKey key) {
        Instant now = Instant.now();
        Optional<IdempotencyRecord> existing = repository.findById(idempotencyKey);
        if (existing.isPresent()) {
            if (!existing.get().isExpired(now)) {
                requireSameKey(existing.get(), key);
                log.debug("Idempotency key {} already claimed", idempotencyKey);
                return false;
            }
            repository.delete(existing.get());
        }

        try {
            repository.saveAndFlush(IdempotencyRecord.claim(idempotencyKey,
                    key.getWarehouseId(), key.getProductId(), now.plus(expiryHours, ChronoUnit.HOURS)));
        } catch (DataIntegrityViolationException e) {
            log.debug("Lost claim race for idempotency key {}", idempotencyKey);
            return false;
        }
        log.debug("Claimed idempotency key {} for {}", idempotencyKey, key);
        return true;
    }

    /**
     * Binds a claimed key to the event admitted for it.
     */
    @Transactional
    public void complete(String idempotencyKey, long eventId) {
        repository.findById(idempotencyKey)
                .ifPresentOrElse(
                        record -> {
                            record.complete(eventId);
                            log.debug("Idempotency key {} completed with event {}", idempotencyKey, eventId);
                        },
                        () -> log.warn("Idempotency claim {} vanished before event {} was recorded",
                                idempotencyKey, eventId));
    }

    /**
     * Releases a claimed key after a rejected submission. Completed claims are kept.
     */
    @Transactional
    public void release(String idempotencyKey) {
        if (repository.deleteByKeyAndStatus(idempotencyKey, IdempotencyStatus.IN_PROGRESS) > 0) {
            log.debug("Released idempotency key {}", idempotencyKey);
        }
    }

    @Scheduled(fixedRate = 3600000)
    @Transactional
    public void purgeExpired() {
        int deleted = repository.deleteExpired(Instant.now());
        if (deleted > 0) {
            log.info("Purged {} expired idempotency claims", deleted);
        }
    }

    private static IdempotencyRecord requireSameKey(IdempotencyRecord record, InventoryKey key) {
        if (!record.isFor(key.getWarehouseId(), key.getProductId())) {
            throw new IdempotencyKeyReusedException(
                    record.getIdempotencyKey(), record.getWarehouseId(), record.getProductId(), key);
        }
        return record;
    }
}

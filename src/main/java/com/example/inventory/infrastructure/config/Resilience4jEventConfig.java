package com.example.inventory.infrastructure.config;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.core.registry.EntryAddedEvent;
import io.github.resilience4j.core.registry.EntryRemovedEvent;
import io.github.resilience4j.core.registry.EntryReplacedEvent;
import io.github.resilience4j.core.registry.RegistryEventConsumer;
import io.github.resilience4j.retry.Retry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Tagged logs for the ledger write retry and the catalog client.
 * <p>
 * Listeners attach when an instance enters its registry, so instances created lazily by the
 * annotations are covered as well as the configured ones.
 */
@Configuration
public class Resilience4jEventConfig {

    private static final Logger log = LoggerFactory.getLogger(Resilience4jEventConfig.class);

    static final String LEDGER_WRITE = "ledgerWrite";

    @Bean
    public RegistryEventConsumer<Retry> retryEventLogger() {
        return new RegistryEventConsumer<>() {
            @Override
            public void onEntryAddedEvent(EntryAddedEvent<Retry> entryAddedEvent) {
                attach(entryAddedEvent.getAddedEntry());
            }

            @Override
            public void onEntryRemovedEvent(EntryRemovedEvent<Retry> entryRemoveEvent) {
            }

            @Override
            public void onEntryReplacedEvent(EntryReplacedEvent<Retry> entryReplacedEvent) {
                attach(entryReplacedEvent.getNewEntry());
            }
        };
    }

    @Bean
    public RegistryEventConsumer<CircuitBreaker> circuitBreakerEventLogger() {
        return new RegistryEventConsumer<>() {
            @Override
            public void onEntryAddedEvent(EntryAddedEvent<CircuitBreaker> entryAddedEvent) {
                attach(entryAddedEvent.getAddedEntry());
            }

            @Override
            public void onEntryRemovedEvent(EntryRemovedEvent<CircuitBreaker> entryRemoveEvent) {
            }

            @Override
            public void onEntryReplacedEvent(EntryReplacedEvent<CircuitBreaker> entryReplacedEvent) {
                attach(entryReplacedEvent.getNewEntry());
            }
        };
    }

    private static void attach(Retry retry) {
        // Write contention on a key is routine; catalog retries mean the catalog is struggling
        boolean ledger = LEDGER_WRITE.equals(retry.getName());
        retry.getEventPublisher()
                .onRetry(event -> {
                    String cause = event.getLastThrowable() == null ? "N/A"
                            : event.getLastThrowable().getClass().getSimpleName();
                    if (ledger) {
                        log.debug("[RETRY] name={}, attempt={}, waitDuration={}ms, cause={}",
                                event.getName(), event.getNumberOfRetryAttempts(),
                                event.getWaitInterval().toMillis(), cause);
                    } else {
                        log.info("[RETRY] name={}, attempt={}, waitDuration={}ms, cause={}",
                                event.getName(), event.getNumberOfRetryAttempts(),
                                event.getWaitInterval().toMillis(), cause);
                    }
                })
                .onError(event -> log.error("[RETRY_EXHAUSTED] name={}, attempts={}, error={}",
                        event.getName(),
                        event.getNumberOfRetryAttempts(),
                        event.getLastThrowable() == null ? "N/A" : event.getLastThrowable().getMessage()));
    }

    private static void attach(CircuitBreaker circuitBreaker) {
        circuitBreaker.getEventPublisher()
                .onStateTransition(event -> {
                    CircuitBreaker.State to = event.getStateTransition().getToState();
                    if (to == CircuitBreaker.State.OPEN || to == CircuitBreaker.State.FORCED_OPEN) {
                        log.warn("[CB_STATE] name={}, from={}, to={}, catalog lookups fail fast until it closes",
                                event.getCircuitBreakerName(), event.getStateTransition().getFromState(), to);
                    } else {
                        log.info("[CB_STATE] name={}, from={}, to={}",
                                event.getCircuitBreakerName(), event.getStateTransition().getFromState(), to);
                    }
                })
                .onCallNotPermitted(event -> log.warn("[CB_REJECTED] name={}, catalog call short-circuited",
                        event.getCircuitBreakerName()));
    }
}

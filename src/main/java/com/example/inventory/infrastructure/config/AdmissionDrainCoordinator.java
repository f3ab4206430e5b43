package com.example.inventory.infrastructure.config;

import com.example.inventory.infrastructure.exception.ServiceUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationListener;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Tracks in-flight admissions and drains them on shutdown.
 * Once the context starts closing, new admissions are refused and the shutdown waits for the running ones.
 */
@Component
public class AdmissionDrainCoordinator implements ApplicationListener<ContextClosedEvent> {

    private static final Logger log = LoggerFactory.getLogger(AdmissionDrainCoordinator.class);

    private final AtomicInteger inFlight = new AtomicInteger(0);
    private final AtomicBoolean draining = new AtomicBoolean(false);
    private final int maxWaitSeconds;

    public AdmissionDrainCoordinator(@Value("${ledger.shutdown.max-wait-seconds:25}") int maxWaitSeconds) {
        this.maxWaitSeconds = maxWaitSeconds;
    }

    /**
     * Runs an admission, counting it as in flight.
     *
     * @throws ServiceUnavailableException if the service is draining
     */
    public <T> T track(Supplier<T> admission) {
        inFlight.incrementAndGet();
        try {
            if (draining.get()) {
                throw new ServiceUnavailableException("ledger", "Service is shutting down, no new changes are admitted");
            }
            return admission.get();
        } finally {
            inFlight.decrementAndGet();
        }
    }

    public int getInFlightCount() {
        return inFlight.get();
    }

    public boolean isDraining() {
        return draining.get();
    }

    @Override
    public void onApplicationEvent(ContextClosedEvent event) {
        draining.set(true);
        log.info("Shutdown signal received. In-flight admissions: {}", inFlight.get());

        int waitSeconds = maxWaitSeconds;
        while (inFlight.get() > 0 && waitSeconds > 0) {
            log.info("Waiting for {} in-flight admission(s)... ({} seconds remaining)",
                    inFlight.get(), waitSeconds);
            try {
                Thread.sleep(1000);
                waitSeconds--;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Shutdown interrupted while waiting for admissions to complete");
                break;
            }
        }

        if (inFlight.get() > 0) {
            log.warn("Drain timeout. {} admission(s) may be interrupted and rolled back.", inFlight.get());
        } else {
            log.info("Drain complete. No admissions in flight.");
        }
    }
}

package com.example.inventory.unit.infrastructure;

import com.example.inventory.infrastructure.config.AdmissionDrainCoordinator;
import com.example.inventory.infrastructure.exception.ServiceUnavailableException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.support.GenericApplicationContext;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("AdmissionDrainCoordinator Unit Tests")
class AdmissionDrainCoordinatorTest {

    @Test
    @DisplayName("should_count_admission_only_while_running")
    void should_count_admission_only_while_running() {
        AdmissionDrainCoordinator coordinator = new AdmissionDrainCoordinator(1);

        Integer seen = coordinator.track(coordinator::getInFlightCount);

        assertThat(seen).isEqualTo(1);
        assertThat(coordinator.getInFlightCount()).isZero();
    }

    @Test
    @DisplayName("should_refuse_new_admissions_once_draining")
    void should_refuse_new_admissions_once_draining() {
        AdmissionDrainCoordinator coordinator = new AdmissionDrainCoordinator(1);
        AtomicBoolean ran = new AtomicBoolean(false);

        coordinator.onApplicationEvent(new ContextClosedEvent(new GenericApplicationContext()));

        assertThat(coordinator.isDraining()).isTrue();
        assertThatThrownBy(() -> coordinator.track(() -> ran.getAndSet(true)))
                .isInstanceOf(ServiceUnavailableException.class);
        assertThat(ran).isFalse();
        assertThat(coordinator.getInFlightCount()).isZero();
    }

    @Test
    @DisplayName("should_wait_for_in_flight_admission_before_completing_drain")
    void should_wait_for_in_flight_admission_before_completing_drain() throws Exception {
        // Given: one admission blocked in flight
        AdmissionDrainCoordinator coordinator = new AdmissionDrainCoordinator(5);
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        Thread admission = new Thread(() -> coordinator.track(() -> {
            started.countDown();
            try {
                return release.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }));
        admission.start();
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

        // When: shutdown begins and the admission finishes shortly after
        Thread finisher = new Thread(() -> {
            try {
                Thread.sleep(300);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            release.countDown();
        });
        finisher.start();
        coordinator.onApplicationEvent(new ContextClosedEvent(new GenericApplicationContext()));

        // Then
        assertThat(coordinator.getInFlightCount()).isZero();
        admission.join(5000);
        finisher.join(5000);
    }
}

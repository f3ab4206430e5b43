package com.example.inventory.infrastructure.audit;

import com.example.inventory.application.port.in.ReconcileUseCase;
import com.example.inventory.application.port.out.ProjectionPort;
import com.example.inventory.domain.exception.ProjectionDivergenceException;
import com.example.inventory.domain.model.InventoryKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Background check of recently changed projections against the ledger.
 * A diverged key is quarantined by the verification itself; this job only reports it.
 */
@Component
@ConditionalOnProperty(name = "ledger.audit.enabled", havingValue = "true")
public class ProjectionAuditor {

    private static final Logger log = LoggerFactory.getLogger(ProjectionAuditor.class);

    private final ProjectionPort projectionPort;
    private final ReconcileUseCase reconcileUseCase;
    private final int windowMinutes;
    private final int batchSize;

    public ProjectionAuditor(
            ProjectionPort projectionPort,
            ReconcileUseCase reconcileUseCase,
            @Value("${ledger.audit.window-minutes:10}") int windowMinutes,
            @Value("${ledger.audit.batch-size:100}") int batchSize) {
        this.projectionPort = projectionPort;
        this.reconcileUseCase = reconcileUseCase;
        this.windowMinutes = windowMinutes;
        this.batchSize = batchSize;
    }

    @Scheduled(fixedDelayString = "${ledger.audit.interval-ms:60000}")
    public void auditRecentKeys() {
        Instant since = Instant.now().minus(windowMinutes, ChronoUnit.MINUTES);
        List<InventoryKey> keys = projectionPort.findRecentlyUpdated(since, batchSize);
        if (keys.isEmpty()) {
            return;
        }

        int diverged = 0;
        for (InventoryKey key : keys) {
            try {
                reconcileUseCase.verify(key);
            } catch (ProjectionDivergenceException e) {
                diverged++;
            } catch (RuntimeException e) {
                log.warn("Audit of {} skipped: {}", key, e.getMessage());
            }
        }

        if (diverged > 0) {
            log.error("Projection audit: {} of {} recently changed keys diverged and are quarantined", diverged, keys.size());
        } else {
            log.info("Projection audit: {} recently changed keys verified", keys.size());
        }
    }
}

package com.example.inventory.infrastructure.config;

import com.example.inventory.application.port.out.ProjectionPort;
import com.example.inventory.application.service.KeyLockRegistry;
import org.springframework.boot.actuate.endpoint.annotation.Endpoint;
import org.springframework.boot.actuate.endpoint.annotation.ReadOperation;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Actuator endpoint exposing admission activity and quarantined keys.
 */
@Component
@Endpoint(id = "ledger")
public class LedgerEndpoint {

    private final AdmissionDrainCoordinator drainCoordinator;
    private final KeyLockRegistry keyLocks;
    private final ProjectionPort projectionPort;

    public LedgerEndpoint(
            AdmissionDrainCoordinator drainCoordinator,
            KeyLockRegistry keyLocks,
            ProjectionPort projectionPort) {
        this.drainCoordinator = drainCoordinator;
        this.keyLocks = keyLocks;
        this.projectionPort = projectionPort;
    }

    @ReadOperation
    public Map<String, Object> ledger() {
        int inFlight = drainCoordinator.getInFlightCount();
        String status = drainCoordinator.isDraining() ? "DRAINING" : inFlight > 0 ? "BUSY" : "IDLE";
        return Map.of(
                "inFlightAdmissions", inFlight,
                "lockedKeys", keyLocks.activeKeys(),
                "divergedKeys", projectionPort.countDiverged(),
                "status", status
        );
    }
}

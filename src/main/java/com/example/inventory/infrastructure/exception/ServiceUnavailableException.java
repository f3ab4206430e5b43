package com.example.inventory.infrastructure.exception;

/**
 * Exception thrown when a dependency is unavailable after all recovery attempts:
 * retries exhausted, circuit breaker open, or the service draining for shutdown.
 */
public class ServiceUnavailableException extends RuntimeException {

    private final String serviceName;

    public ServiceUnavailableException(String serviceName, String message) {
        super(message);
        this.serviceName = serviceName;
    }

    public ServiceUnavailableException(String serviceName, String message, Throwable cause) {
        super(message, cause);
        this.serviceName = serviceName;
    }

    public String getServiceName() {
        return serviceName;
    }
}

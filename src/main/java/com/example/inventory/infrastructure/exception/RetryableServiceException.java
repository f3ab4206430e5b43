package com.example.inventory.infrastructure.exception;

/**
 * Exception for remote-call errors that should trigger a retry.
 * Thrown for 5xx responses and transport failures.
 */
public class RetryableServiceException extends RuntimeException {

    private final String serviceName;
    private final int statusCode;

    public RetryableServiceException(String serviceName, int statusCode, String message) {
        super(message);
        this.serviceName = serviceName;
        this.statusCode = statusCode;
    }

    public RetryableServiceException(String serviceName, String message, Throwable cause) {
        super(message, cause);
        this.serviceName = serviceName;
        this.statusCode = 0;
    }

    public String getServiceName() {
        return serviceName;
    }

    /**
     * HTTP status of the failed call, 0 when no response was received.
     */
    public int getStatusCode() {
        return statusCode;
    }
}

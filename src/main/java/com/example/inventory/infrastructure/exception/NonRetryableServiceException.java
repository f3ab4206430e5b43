package com.example.inventory.infrastructure.exception;

/**
 * Exception for remote-call errors that should NOT trigger a retry.
 * Thrown for 4xx responses other than 404, which means "not found" to the catalog client.
 */
public class NonRetryableServiceException extends RuntimeException {

    private final String serviceName;
    private final int statusCode;

    public NonRetryableServiceException(String serviceName, int statusCode, String message) {
        super(message);
        this.serviceName = serviceName;
        this.statusCode = statusCode;
    }

    public String getServiceName() {
        return serviceName;
    }

    public int getStatusCode() {
        return statusCode;
    }
}

package com.example.inventory.infrastructure.exception;

import com.example.inventory.application.service.KeyLockTimeoutException;
import com.example.inventory.domain.exception.BundleCycleDetectedException;
import com.example.inventory.domain.exception.DomainException;
import com.example.inventory.domain.exception.InsufficientStockException;
import com.example.inventory.domain.exception.InvalidBundleDefinitionException;
import com.example.inventory.domain.exception.OverReleaseException;
import com.example.inventory.domain.exception.ProjectionDivergenceException;
import com.example.inventory.domain.exception.SnapshotUnavailableException;
import com.example.inventory.domain.exception.UnknownProductException;
import com.example.inventory.domain.exception.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebInputException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Global exception handler for REST API.
 * Rejections carry the violated rule and the values that caused it.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(ValidationException ex) {
        log.warn("Validation error [{}]: {}", ex.getRule(), ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(body("VALIDATION_ERROR", ex));
    }

    @ExceptionHandler(UnknownProductException.class)
    public ResponseEntity<Map<String, Object>> handleUnknownProduct(UnknownProductException ex) {
        log.warn("Unknown product: {}", ex.getProductId());
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(body(ex.getRule(), ex));
    }

    @ExceptionHandler({InsufficientStockException.class, OverReleaseException.class})
    public ResponseEntity<Map<String, Object>> handleStockRule(DomainException ex) {
        log.warn("Business rule rejection [{}]: {}", ex.getRule(), ex.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(body(ex.getRule(), ex));
    }

    @ExceptionHandler(ProjectionDivergenceException.class)
    public ResponseEntity<Map<String, Object>> handleDivergence(ProjectionDivergenceException ex) {
        log.error("Projection divergence on {}: {}", ex.getKey(), ex.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(body(ex.getRule(), ex));
    }

    @ExceptionHandler({BundleCycleDetectedException.class, InvalidBundleDefinitionException.class})
    public ResponseEntity<Map<String, Object>> handleBundleConfiguration(DomainException ex) {
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(body(ex.getRule(), ex));
    }

    @ExceptionHandler(SnapshotUnavailableException.class)
    public ResponseEntity<Map<String, Object>> handleSnapshotUnavailable(SnapshotUnavailableException ex) {
        log.error("Snapshot unavailable: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(body(ex.getRule(), ex));
    }

    @ExceptionHandler(DomainException.class)
    public ResponseEntity<Map<String, Object>> handleDomainException(DomainException ex) {
        log.warn("Domain error [{}]: {}", ex.getRule(), ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(body(ex.getRule(), ex));
    }

    @ExceptionHandler(KeyLockTimeoutException.class)
    public ResponseEntity<Map<String, Object>> handleKeyBusy(KeyLockTimeoutException ex) {
        log.warn("Key busy: {}", ex.getMessage());
        Map<String, Object> body = body("KEY_BUSY", ex.getMessage());
        body.put("details", Map.of(
                "warehouseId", ex.getKey().getWarehouseId(),
                "productId", ex.getKey().getProductId(),
                "timeoutMs", ex.getTimeoutMs()));
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }

    @ExceptionHandler(ConcurrencyFailureException.class)
    public ResponseEntity<Map<String, Object>> handleConcurrencyFailure(ConcurrencyFailureException ex) {
        log.error("Write contention persisted after retries: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(body("WRITE_CONTENTION", "The inventory key is under heavy contention, please retry"));
    }

    @ExceptionHandler(ServiceUnavailableException.class)
    public ResponseEntity<Map<String, Object>> handleServiceUnavailable(ServiceUnavailableException ex) {
        log.error("Service unavailable: {} - {}", ex.getServiceName(), ex.getMessage());
        Map<String, Object> body = body("SERVICE_UNAVAILABLE", ex.getMessage());
        body.put("service", ex.getServiceName());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }

    @ExceptionHandler(NonRetryableServiceException.class)
    public ResponseEntity<Map<String, Object>> handleNonRetryableService(NonRetryableServiceException ex) {
        log.error("Non-retryable service error: {} - {} - {}",
                ex.getServiceName(), ex.getStatusCode(), ex.getMessage());
        Map<String, Object> body = body("SERVICE_ERROR", ex.getMessage());
        body.put("service", ex.getServiceName());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(body);
    }

    @ExceptionHandler(IdempotencyKeyReusedException.class)
    public ResponseEntity<Map<String, Object>> handleIdempotencyKeyReused(IdempotencyKeyReusedException ex) {
        log.warn("[REJECTED] {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(body("IDEMPOTENCY_KEY_REUSED", ex.getMessage()));
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<Map<String, Object>> handleBind(WebExchangeBindException ex) {
        List<String> errors = ex.getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .toList();
        log.warn("Invalid request body: {}", errors);
        Map<String, Object> body = body("VALIDATION_ERROR", "Request body is invalid");
        body.put("details", Map.of("fieldErrors", errors));
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<Map<String, Object>> handleInput(ServerWebInputException ex) {
        log.warn("Invalid request input: {}", ex.getReason());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(body("INVALID_REQUEST", ex.getReason() != null ? ex.getReason() : "Invalid request"));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<Map<String, Object>> handleResponseStatus(ResponseStatusException ex) {
        log.warn("Request rejected with {}: {}", ex.getStatusCode(), ex.getReason());
        String error = ex.getStatusCode().value() == HttpStatus.CONFLICT.value() ? "REQUEST_IN_PROGRESS" : "REQUEST_REJECTED";
        return ResponseEntity.status(ex.getStatusCode())
                .body(body(error, ex.getReason() != null ? ex.getReason() : ex.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Invalid argument: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(body("INVALID_REQUEST", ex.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception ex) {
        log.error("Unexpected error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(body("INTERNAL_ERROR", "An unexpected error occurred"));
    }

    private Map<String, Object> body(String error, DomainException ex) {
        Map<String, Object> body = body(error, ex.getMessage());
        body.put("rule", ex.getRule());
        body.put("details", ex.getDetails());
        return body;
    }

    private Map<String, Object> body(String error, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error);
        body.put("message", message);
        body.put("timestamp", Instant.now().toString());
        return body;
    }
}

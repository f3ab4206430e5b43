package com.example.inventory.domain.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base class for domain rule violations.
 * Every rejection names the violated rule and carries the values needed to reproduce the decision.
 */
public abstract class DomainException extends RuntimeException {

    private final String rule;
    private final Map<String, Object> details;

    protected DomainException(String rule, String message, Map<String, Object> details) {
        super(message);
        this.rule = rule;
        this.details = Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    protected DomainException(String rule, String message, Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.rule = rule;
        this.details = Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    /**
     * Machine-readable name of the violated rule (e.g. {@code INSUFFICIENT_STOCK}).
     */
    public String getRule() {
        return rule;
    }

    public Map<String, Object> getDetails() {
        return details;
    }

    /**
     * Ordered details builder that skips null values.
     */
    protected static Map<String, Object> details(Object... keyValues) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            if (keyValues[i + 1] != null) {
                map.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
            }
        }
        return map;
    }
}

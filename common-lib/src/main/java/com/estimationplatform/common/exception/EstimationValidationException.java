package com.estimationplatform.common.exception;

/**
 * Raised when a caller hands the engine an input that breaks its contract:
 * negative or non-finite numbers, an unknown complexity tier, a blank feature name,
 * a non-positive timeline. Aborts only the offending request.
 */
public class EstimationValidationException extends RuntimeException {
    private final String field;

    public EstimationValidationException(String field, String message) {
        super("[" + field + "] " + message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}

package com.lantern.filter;

/**
 * Base exception for filters rejected while a metric query is being composed.
 *
 * Validation failures are raised synchronously, before the store is contacted,
 * and are never retried. Callers surface them as request-validation errors.
 */
public class FilterValidationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /**
     * Dashboard-facing column the rejected filter referenced, if known
     */
    private final String column;

    public FilterValidationException(String message, String column) {
        super(message);
        this.column = column;
    }

    public FilterValidationException(String message, String column, Throwable cause) {
        super(message, cause);
        this.column = column;
    }

    public String getColumn() {
        return column;
    }
}

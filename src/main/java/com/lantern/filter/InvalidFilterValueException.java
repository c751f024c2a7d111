package com.lantern.filter;

/**
 * Thrown when a filter value cannot be coerced to the type of its column.
 */
public class InvalidFilterValueException extends FilterValidationException {

    private static final long serialVersionUID = 1L;

    public InvalidFilterValueException(String column, String message) {
        super("Invalid value for filter column '" + column + "': " + message, column);
    }

    public InvalidFilterValueException(String column, String message, Throwable cause) {
        super("Invalid value for filter column '" + column + "': " + message, column, cause);
    }
}

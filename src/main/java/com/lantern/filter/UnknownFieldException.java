package com.lantern.filter;

/**
 * Thrown when a filter references a column that is not in the column catalog.
 */
public class UnknownFieldException extends FilterValidationException {

    private static final long serialVersionUID = 1L;

    public UnknownFieldException(String column) {
        super("Unknown filter column: '" + column + "'", column);
    }
}

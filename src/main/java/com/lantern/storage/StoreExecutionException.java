package com.lantern.storage;

/**
 * Exception thrown when a query against the event store fails, or when its result
 * cannot be read. Carries the failing SQL when known.
 */
public class StoreExecutionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String query;

    public StoreExecutionException(String message) {
        super(message);
        this.query = null;
    }

    public StoreExecutionException(String message, Throwable cause) {
        super(message, cause);
        this.query = null;
    }

    public StoreExecutionException(String message, String query, Throwable cause) {
        super(message, cause);
        this.query = query;
    }

    public String getQuery() {
        return query;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder(super.getMessage());
        if (query != null) {
            sb.append(" [Query: ").append(query).append("]");
        }
        return sb.toString();
    }
}

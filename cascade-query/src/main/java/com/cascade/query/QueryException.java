package com.cascade.query;

/**
 * Base of query failures. Carries the queried path.
 */
public class QueryException extends RuntimeException {

    private final String path;

    public QueryException(String path, String message, Throwable cause) {
        super(message, cause);
        this.path = path;
    }

    /** Path that was queried. */
    public String getPath() {
        return path;
    }
}

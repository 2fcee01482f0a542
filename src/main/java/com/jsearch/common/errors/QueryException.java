package com.jsearch.common.errors;

/**
 * Thrown for a malformed query: unknown query type, missing payload, unknown
 * field or an invalid limit/offset.
 */
public class QueryException extends IllegalArgumentException {
    public QueryException(String message) {
        super(message);
    }

    public QueryException(String message, Throwable cause) {
        super(message, cause);
    }
}

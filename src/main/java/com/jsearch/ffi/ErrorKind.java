package com.jsearch.ffi;

import com.jsearch.common.errors.CommitFailedException;
import com.jsearch.common.errors.CorruptIndexException;
import com.jsearch.common.errors.DocumentException;
import com.jsearch.common.errors.IndexAlreadyExistsException;
import com.jsearch.common.errors.IndexNotFoundException;
import com.jsearch.common.errors.QueryException;
import com.jsearch.common.errors.SchemaException;

import java.io.IOException;

/**
 * Category of a failure reported across the bridge.
 */
public enum ErrorKind {
    SCHEMA(1),
    DOCUMENT(2),
    QUERY(3),
    IO(4),
    COMMIT(5),
    CORRUPT(6),
    ALREADY_EXISTS(7),
    NOT_FOUND(8),
    INVALID_HANDLE(9),
    /** An unexpected runtime failure inside the engine. */
    INTERNAL(10);

    private final int value;

    ErrorKind(int value) {
        this.value = value;
    }

    /**
     * Stable numeric code for callers that cannot use the enum.
     */
    public int getValue() {
        return value;
    }

    public static ErrorKind fromValue(int value) {
        for (ErrorKind kind : values()) {
            if (kind.value == value) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown error kind value: " + value);
    }

    /**
     * Maps an exception thrown by the engine to its category.
     */
    public static ErrorKind of(Throwable error) {
        if (error instanceof SchemaException) {
            return SCHEMA;
        }
        if (error instanceof DocumentException) {
            return DOCUMENT;
        }
        if (error instanceof QueryException) {
            return QUERY;
        }
        if (error instanceof CommitFailedException) {
            return COMMIT;
        }
        if (error instanceof CorruptIndexException) {
            return CORRUPT;
        }
        if (error instanceof IndexAlreadyExistsException) {
            return ALREADY_EXISTS;
        }
        if (error instanceof IndexNotFoundException) {
            return NOT_FOUND;
        }
        if (error instanceof IOException) {
            return IO;
        }
        return INTERNAL;
    }
}

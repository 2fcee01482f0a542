package com.jsearch.common.errors;

import java.io.IOException;

/**
 * Thrown when another writer already holds the index write lock.
 */
public class LockObtainFailedException extends IOException {
    public LockObtainFailedException(String message) {
        super(message);
    }

    public LockObtainFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}

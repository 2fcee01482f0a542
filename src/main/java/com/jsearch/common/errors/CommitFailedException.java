package com.jsearch.common.errors;

import java.io.IOException;

/**
 * Thrown when the manifest of a commit could not be written. The previously
 * published segment set stays current and the pending changes are retained.
 */
public class CommitFailedException extends IOException {
    public CommitFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}

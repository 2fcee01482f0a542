package com.jsearch.common.errors;

import java.io.IOException;

/**
 * Thrown by open when no index (manifest or schema) is found at the path.
 */
public class IndexNotFoundException extends IOException {
    public IndexNotFoundException(String message) {
        super(message);
    }
}

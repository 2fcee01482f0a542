package com.jsearch.common.errors;

/**
 * Thrown when a document does not conform to the index schema.
 */
public class DocumentException extends IllegalArgumentException {
    public DocumentException(String message) {
        super(message);
    }

    public DocumentException(String message, Throwable cause) {
        super(message, cause);
    }
}

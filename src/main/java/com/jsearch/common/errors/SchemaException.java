package com.jsearch.common.errors;

/**
 * Thrown when a schema definition is invalid: empty field set, duplicate
 * field names, unknown field types or tokenizers.
 */
public class SchemaException extends IllegalArgumentException {
    public SchemaException(String message) {
        super(message);
    }

    public SchemaException(String message, Throwable cause) {
        super(message, cause);
    }
}

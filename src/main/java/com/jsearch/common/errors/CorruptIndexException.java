package com.jsearch.common.errors;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Thrown when persisted index state cannot be read back: bad magic number,
 * checksum mismatch, truncated file or unparsable manifest.
 */
public class CorruptIndexException extends IOException {
    public CorruptIndexException(String message, Path resource) {
        super(message + " (resource=" + resource + ")");
    }

    public CorruptIndexException(String message, Path resource, Throwable cause) {
        super(message + " (resource=" + resource + ")", cause);
    }
}

package com.jsearch.common.errors;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Thrown by create when the target directory already holds an index.
 */
public class IndexAlreadyExistsException extends IOException {
    public IndexAlreadyExistsException(Path path) {
        super("Index already exists at " + path);
    }
}

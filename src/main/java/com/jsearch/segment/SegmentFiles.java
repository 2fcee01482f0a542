package com.jsearch.segment;

import com.jsearch.common.IndexConstants;
import com.jsearch.common.io.AtomicFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Creates segment directories: everything is written under
 * {@code <name>.tmp/}, then the directory is renamed into place, so a
 * segment directory without the suffix is always complete.
 */
public final class SegmentFiles {
    private static final Logger logger = LoggerFactory.getLogger(SegmentFiles.class);

    /**
     * Writes the files of a segment into the directory it is given.
     */
    @FunctionalInterface
    public interface Body {
        void writeTo(Path directory) throws IOException;
    }

    private SegmentFiles() {
    }

    /**
     * Runs {@code body} against a fresh temp directory and publishes it as
     * {@code <indexDirectory>/<name>}. On failure the temp directory is
     * removed and the exception propagates.
     */
    public static Path write(Path indexDirectory, String name, Body body) throws IOException {
        Path target = indexDirectory.resolve(name);
        if (Files.exists(target)) {
            throw new FileAlreadyExistsException(target.toString());
        }
        Path temp = indexDirectory.resolve(name + IndexConstants.TEMP_SUFFIX);
        try {
            Files.createDirectory(temp);
            body.writeTo(temp);
            AtomicFiles.fsyncDirectory(temp);
            AtomicFiles.move(temp, target);
        } catch (IOException | RuntimeException e) {
            try {
                AtomicFiles.deleteRecursively(temp);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            logger.warn("Failed to write segment {}", name, e);
            throw e;
        }
        AtomicFiles.fsyncDirectory(indexDirectory);
        return target;
    }
}

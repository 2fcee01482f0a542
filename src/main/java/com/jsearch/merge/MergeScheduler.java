package com.jsearch.merge;

import java.io.Closeable;
import java.io.IOException;

/**
 * Runs the merges a {@link MergeSource} asks for, either in the calling
 * thread or in the background.
 */
public interface MergeScheduler extends Closeable {
    /**
     * Runs merges until the source has none left.
     */
    void merge(MergeSource source);

    /**
     * Waits for running merges to finish and releases threads.
     */
    @Override
    void close() throws IOException;
}

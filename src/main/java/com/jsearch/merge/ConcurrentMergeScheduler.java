package com.jsearch.merge;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Runs merges on a single background thread so that commits return without
 * waiting for them. Requests that arrive while a merge runs queue up behind
 * it.
 */
public class ConcurrentMergeScheduler implements MergeScheduler {
    private static final Logger logger = LoggerFactory.getLogger(ConcurrentMergeScheduler.class);

    private final ExecutorService executor = Executors.newSingleThreadExecutor(runnable -> {
        Thread thread = new Thread(runnable, "jsearch-merge");
        thread.setDaemon(true);
        return thread;
    });

    @Override
    public void merge(MergeSource source) {
        try {
            executor.execute(() -> SerialMergeScheduler.runMerges(source));
        } catch (RejectedExecutionException e) {
            logger.debug("Merge scheduler closed, skipping merge request");
        }
    }

    /**
     * Blocks until every queued merge has run.
     */
    public void sync() throws IOException {
        try {
            executor.submit(() -> { }).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while waiting for merges");
        } catch (ExecutionException e) {
            throw new IOException("Merge thread failed", e.getCause());
        } catch (RejectedExecutionException e) {
            throw new IllegalStateException("Merge scheduler is closed", e);
        }
    }

    @Override
    public void close() throws IOException {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(1, TimeUnit.MINUTES)) {
                logger.warn("Background merges did not finish within a minute; abandoning them");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while waiting for merges");
        }
    }
}

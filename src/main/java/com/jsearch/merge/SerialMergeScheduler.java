package com.jsearch.merge;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Runs merges in the thread that asks for them, right after the commit that
 * triggered them.
 */
public class SerialMergeScheduler implements MergeScheduler {
    private static final Logger logger = LoggerFactory.getLogger(SerialMergeScheduler.class);

    @Override
    public synchronized void merge(MergeSource source) {
        runMerges(source);
    }

    static void runMerges(MergeSource source) {
        OneMerge merge;
        while ((merge = source.getNextMerge()) != null) {
            try {
                source.merge(merge);
            } catch (IOException e) {
                logger.error("Merge of {} failed", merge, e);
                source.onMergeFailure(merge, e);
                return;
            }
        }
    }

    @Override
    public void close() {
        // nothing to release
    }
}

package com.jsearch.merge;

import com.jsearch.segment.SegmentInfo;

import java.util.List;

/**
 * Keeps the segment count bounded. Once there are more than
 * {@code maxSegmentCount} segments it merges the window of
 * {@code mergeFactor} adjacent segments holding the fewest live documents.
 */
public class LogDocMergePolicy implements MergePolicy {
    private final int maxSegmentCount;
    private final int mergeFactor;

    public LogDocMergePolicy(int maxSegmentCount, int mergeFactor) {
        if (maxSegmentCount < 1) {
            throw new IllegalArgumentException("maxSegmentCount must be at least 1");
        }
        if (mergeFactor < 2) {
            throw new IllegalArgumentException("mergeFactor must be at least 2");
        }
        this.maxSegmentCount = maxSegmentCount;
        this.mergeFactor = mergeFactor;
    }

    @Override
    public OneMerge findMerge(List<SegmentInfo> segments) {
        if (segments.size() <= maxSegmentCount) {
            return null;
        }
        return smallestWindow(segments, Math.min(mergeFactor, segments.size()));
    }

    @Override
    public OneMerge findForcedMerge(List<SegmentInfo> segments, int maxSegmentCount) {
        if (maxSegmentCount < 1) {
            throw new IllegalArgumentException("maxSegmentCount must be at least 1");
        }
        if (segments.size() <= maxSegmentCount) {
            return null;
        }
        int window = Math.min(mergeFactor, segments.size() - maxSegmentCount + 1);
        return smallestWindow(segments, window);
    }

    private static OneMerge smallestWindow(List<SegmentInfo> segments, int window) {
        long windowDocs = 0;
        for (int i = 0; i < window; i++) {
            windowDocs += segments.get(i).getLiveDocs();
        }
        long bestDocs = windowDocs;
        int bestStart = 0;
        for (int start = 1; start + window <= segments.size(); start++) {
            windowDocs += segments.get(start + window - 1).getLiveDocs() - segments.get(start - 1).getLiveDocs();
            if (windowDocs < bestDocs) {
                bestDocs = windowDocs;
                bestStart = start;
            }
        }
        return new OneMerge(segments.subList(bestStart, bestStart + window));
    }

    public int getMaxSegmentCount() {
        return maxSegmentCount;
    }

    public int getMergeFactor() {
        return mergeFactor;
    }
}

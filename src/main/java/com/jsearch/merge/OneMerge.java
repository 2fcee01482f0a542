package com.jsearch.merge;

import com.jsearch.segment.SegmentInfo;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A contiguous run of segments chosen to be merged into one.
 */
public final class OneMerge {
    private final List<SegmentInfo> segments;

    public OneMerge(List<SegmentInfo> segments) {
        if (segments.size() < 2) {
            throw new IllegalArgumentException("A merge needs at least two segments, got " + segments.size());
        }
        this.segments = Collections.unmodifiableList(new ArrayList<>(segments));
    }

    public List<SegmentInfo> getSegments() {
        return segments;
    }

    public int totalLiveDocs() {
        int total = 0;
        for (SegmentInfo segment : segments) {
            total += segment.getLiveDocs();
        }
        return total;
    }

    @Override
    public String toString() {
        return "merge" + segments;
    }
}

package com.jsearch.merge;

import com.jsearch.segment.SegmentInfo;

import java.util.Collections;
import java.util.List;

/**
 * Outcome of {@link SegmentMerger#merge}: the new segment, or null when no
 * input doc survived, and per input the old-to-new doc map (-1 for dropped
 * docs).
 */
public final class MergeResult {
    private final SegmentInfo segment;
    private final List<int[]> docMaps;

    MergeResult(SegmentInfo segment, List<int[]> docMaps) {
        this.segment = segment;
        this.docMaps = Collections.unmodifiableList(docMaps);
    }

    public SegmentInfo getSegment() {
        return segment;
    }

    public int[] getDocMap(int inputIndex) {
        return docMaps.get(inputIndex);
    }
}

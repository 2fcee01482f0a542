package com.jsearch.query;

import com.jsearch.segment.SegmentReader;

/**
 * One segment of a search together with the snapshot-wide statistics.
 */
public final class LeafContext {
    private final SegmentReader reader;
    private final SearchStats stats;

    public LeafContext(SegmentReader reader, SearchStats stats) {
        this.reader = reader;
        this.stats = stats;
    }

    public SegmentReader getReader() {
        return reader;
    }

    public SearchStats getStats() {
        return stats;
    }

    /**
     * Field length used for length normalization; fields without norms
     * count as average length.
     */
    double fieldLength(int fieldOrdinal, int doc) {
        int[] norms = reader.norms(fieldOrdinal);
        return norms == null ? stats.averageFieldLength(fieldOrdinal) : norms[doc];
    }
}

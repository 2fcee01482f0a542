package com.jsearch.merge;

import com.jsearch.segment.SegmentInfo;

import java.util.List;

/**
 * Decides which segments to merge. Implementations only ever pick
 * contiguous runs, so merged documents keep their relative order.
 */
public interface MergePolicy {
    /**
     * Called after every publication.
     *
     * @param segments the published segment set, in order
     * @return The next merge to run, or null if the set is fine as it is
     */
    OneMerge findMerge(List<SegmentInfo> segments);

    /**
     * @return The next merge needed to get down to {@code maxSegmentCount}
     *         segments, or null once there
     */
    OneMerge findForcedMerge(List<SegmentInfo> segments, int maxSegmentCount);
}

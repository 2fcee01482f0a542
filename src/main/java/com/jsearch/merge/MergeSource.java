package com.jsearch.merge;

import java.io.IOException;

/**
 * The index as seen by a {@link MergeScheduler}.
 */
public interface MergeSource {
    /**
     * @return The next merge the policy asks for, or null
     */
    OneMerge getNextMerge();

    /**
     * Runs and publishes one merge.
     */
    void merge(OneMerge merge) throws IOException;

    /**
     * Records a merge that failed while running in the background.
     */
    void onMergeFailure(OneMerge merge, IOException failure);
}

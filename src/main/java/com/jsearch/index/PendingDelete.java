package com.jsearch.index;

import com.jsearch.segment.DeleteTerm;

/**
 * A delete waiting for the next commit. It applies to every published
 * segment and to the pending segments flushed before it was issued.
 */
final class PendingDelete {
    private final DeleteTerm term;
    private final int pendingSegmentLimit;

    PendingDelete(DeleteTerm term, int pendingSegmentLimit) {
        this.term = term;
        this.pendingSegmentLimit = pendingSegmentLimit;
    }

    DeleteTerm getTerm() {
        return term;
    }

    boolean appliesToPending(int pendingIndex) {
        return pendingIndex < pendingSegmentLimit;
    }

    @Override
    public String toString() {
        return term + " (pending segments < " + pendingSegmentLimit + ")";
    }
}

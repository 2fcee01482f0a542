package com.jsearch.index;

/**
 * Commit state of the writer side of an index.
 */
public enum WriterState {
    /** Nothing written since the last publication. */
    OPEN,
    /** Buffered documents, pending segments or pending deletes exist. */
    PENDING,
    /** A manifest write is in progress. */
    COMMITTING
}

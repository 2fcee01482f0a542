package com.jsearch.query;

import java.io.IOException;

/**
 * A compiled query. Evaluated one segment at a time; deleted documents may
 * appear in the result and are filtered by the searcher.
 */
public abstract class Query {
    /**
     * @return The matching docs of the segment with their scores
     * @throws IOException If postings cannot be read
     */
    public abstract DocScores execute(LeafContext leaf) throws IOException;
}

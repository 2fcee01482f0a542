package com.jsearch.query;

import java.io.IOException;

/**
 * Matches what the wrapped query matches, with a fixed score.
 */
public class ConstantScoreQuery extends Query {
    private final Query query;
    private final double score;

    public ConstantScoreQuery(Query query, double score) {
        this.query = query;
        this.score = score;
    }

    @Override
    public DocScores execute(LeafContext leaf) throws IOException {
        return query.execute(leaf).withConstantScore(score);
    }

    @Override
    public String toString() {
        return "constant(" + query + ", " + score + ")";
    }
}

package com.jsearch.query;

/**
 * Every document, score 1.0.
 */
public class MatchAllQuery extends Query {
    @Override
    public DocScores execute(LeafContext leaf) {
        int maxDoc = leaf.getReader().maxDoc();
        DocScores.Builder builder = new DocScores.Builder(maxDoc);
        for (int doc = 0; doc < maxDoc; doc++) {
            builder.add(doc, 1.0);
        }
        return builder.build();
    }

    @Override
    public String toString() {
        return "all()";
    }
}

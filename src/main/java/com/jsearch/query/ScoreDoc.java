package com.jsearch.query;

/**
 * A hit before its stored fields are loaded.
 */
public final class ScoreDoc {
    private final int doc;
    private final double score;

    public ScoreDoc(int doc, double score) {
        this.doc = doc;
        this.score = score;
    }

    /**
     * Global doc id within the snapshot.
     */
    public int getDoc() {
        return doc;
    }

    public double getScore() {
        return score;
    }

    /**
     * Result order: higher score first, then lower doc id.
     */
    static int compareRank(ScoreDoc a, ScoreDoc b) {
        int cmp = Double.compare(b.score, a.score);
        return cmp != 0 ? cmp : Integer.compare(a.doc, b.doc);
    }

    @Override
    public String toString() {
        return "doc=" + doc + " score=" + score;
    }
}

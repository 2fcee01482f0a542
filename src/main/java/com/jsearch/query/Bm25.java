package com.jsearch.query;

/**
 * Okapi BM25 with the usual defaults.
 */
public final class Bm25 {
    public static final double K1 = 1.2;
    public static final double B = 0.75;

    private Bm25() {
    }

    /**
     * @param docCount documents in the collection, {@code N}
     * @param docFreq documents containing the term
     */
    public static double idf(long docCount, long docFreq) {
        return Math.log(1.0 + (docCount - docFreq + 0.5) / (docFreq + 0.5));
    }

    /**
     * @param fieldLength token count of the field in this doc
     * @param averageFieldLength average token count over the collection
     */
    public static double score(double idf, double termFreq, double fieldLength, double averageFieldLength) {
        double lengthRatio = averageFieldLength > 0 ? fieldLength / averageFieldLength : 1.0;
        double norm = K1 * (1.0 - B + B * lengthRatio);
        return idf * (termFreq * (K1 + 1.0)) / (termFreq + norm);
    }
}

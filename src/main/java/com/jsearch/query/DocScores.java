package com.jsearch.query;

import java.util.Arrays;
import java.util.BitSet;

/**
 * Matches of a query in one segment: ascending local doc ids with their
 * scores.
 */
public final class DocScores {
    private static final DocScores EMPTY = new DocScores(new int[0], new double[0], 0);

    private final int[] docs;
    private final double[] scores;
    private final int size;

    private DocScores(int[] docs, double[] scores, int size) {
        this.docs = docs;
        this.scores = scores;
        this.size = size;
    }

    public static DocScores empty() {
        return EMPTY;
    }

    /**
     * The set docs of {@code docs}, all with the same score.
     */
    public static DocScores of(BitSet docs, double score) {
        Builder builder = new Builder(docs.cardinality());
        for (int doc = docs.nextSetBit(0); doc >= 0; doc = docs.nextSetBit(doc + 1)) {
            builder.add(doc, score);
        }
        return builder.build();
    }

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    public int doc(int index) {
        return docs[index];
    }

    public double score(int index) {
        return scores[index];
    }

    /**
     * Docs in both, scores summed.
     */
    public DocScores intersect(DocScores other) {
        Builder builder = new Builder(Math.min(size, other.size));
        int i = 0;
        int j = 0;
        while (i < size && j < other.size) {
            int a = docs[i];
            int b = other.docs[j];
            if (a == b) {
                builder.add(a, scores[i] + other.scores[j]);
                i++;
                j++;
            } else if (a < b) {
                i++;
            } else {
                j++;
            }
        }
        return builder.build();
    }

    /**
     * Docs in either, scores summed where both match.
     */
    public DocScores union(DocScores other) {
        Builder builder = new Builder(size + other.size);
        int i = 0;
        int j = 0;
        while (i < size || j < other.size) {
            if (j == other.size || (i < size && docs[i] < other.docs[j])) {
                builder.add(docs[i], scores[i]);
                i++;
            } else if (i == size || other.docs[j] < docs[i]) {
                builder.add(other.docs[j], other.scores[j]);
                j++;
            } else {
                builder.add(docs[i], scores[i] + other.scores[j]);
                i++;
                j++;
            }
        }
        return builder.build();
    }

    /**
     * This set with the scores of {@code other} added where it matches too.
     */
    public DocScores boost(DocScores other) {
        Builder builder = new Builder(size);
        int j = 0;
        for (int i = 0; i < size; i++) {
            while (j < other.size && other.docs[j] < docs[i]) {
                j++;
            }
            double extra = j < other.size && other.docs[j] == docs[i] ? other.scores[j] : 0.0;
            builder.add(docs[i], scores[i] + extra);
        }
        return builder.build();
    }

    /**
     * This set without the docs of {@code other}.
     */
    public DocScores exclude(DocScores other) {
        Builder builder = new Builder(size);
        int j = 0;
        for (int i = 0; i < size; i++) {
            while (j < other.size && other.docs[j] < docs[i]) {
                j++;
            }
            if (j < other.size && other.docs[j] == docs[i]) {
                continue;
            }
            builder.add(docs[i], scores[i]);
        }
        return builder.build();
    }

    /**
     * The same docs, every score replaced by {@code score}.
     */
    public DocScores withConstantScore(double score) {
        double[] constant = new double[size];
        Arrays.fill(constant, score);
        return new DocScores(docs, constant, size);
    }

    /**
     * Collects docs in ascending order.
     */
    public static final class Builder {
        private int[] docs;
        private double[] scores;
        private int size;

        public Builder() {
            this(16);
        }

        public Builder(int expectedSize) {
            int capacity = Math.max(1, expectedSize);
            this.docs = new int[capacity];
            this.scores = new double[capacity];
        }

        public Builder add(int doc, double score) {
            if (size > 0 && doc <= docs[size - 1]) {
                throw new IllegalArgumentException("Docs must be added in ascending order: " + doc
                    + " after " + docs[size - 1]);
            }
            if (size == docs.length) {
                docs = Arrays.copyOf(docs, size * 2);
                scores = Arrays.copyOf(scores, size * 2);
            }
            docs[size] = doc;
            scores[size] = score;
            size++;
            return this;
        }

        public DocScores build() {
            return size == 0 ? EMPTY : new DocScores(docs, scores, size);
        }
    }
}

package com.jsearch.segment;

/**
 * Decoded postings list of one term in one segment: ascending doc ids, the
 * term frequency in each doc and the positions of every occurrence.
 */
public final class Postings {
    private final int[] docs;
    private final int[] freqs;
    private final int[] positions;
    private final int[] positionStarts;

    /**
     * @param positionStarts offsets into {@code positions}, one per doc plus a
     *                       final end offset
     */
    public Postings(int[] docs, int[] freqs, int[] positions, int[] positionStarts) {
        this.docs = docs;
        this.freqs = freqs;
        this.positions = positions;
        this.positionStarts = positionStarts;
    }

    public int size() {
        return docs.length;
    }

    public int doc(int index) {
        return docs[index];
    }

    public int freq(int index) {
        return freqs[index];
    }

    /**
     * Positions of the term in the doc at {@code index}, ascending.
     */
    public int[] positions(int index) {
        int start = positionStarts[index];
        int end = positionStarts[index + 1];
        int[] result = new int[end - start];
        System.arraycopy(positions, start, result, 0, result.length);
        return result;
    }

    public long totalTermFreq() {
        long total = 0;
        for (int freq : freqs) {
            total += freq;
        }
        return total;
    }
}

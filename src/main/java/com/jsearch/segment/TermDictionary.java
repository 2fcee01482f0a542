package com.jsearch.segment;

import java.util.Arrays;

/**
 * Sorted terms of one field in one segment with, per term, its document
 * frequency and the location of its postings. Terms sort by
 * {@link String#compareTo}.
 */
public final class TermDictionary {
    private final int fieldOrdinal;
    private final String[] terms;
    private final int[] docFreqs;
    private final long[] postingsOffsets;
    private final int[] postingsLengths;
    private final int docCount;
    private final long sumTotalTermFreq;

    TermDictionary(int fieldOrdinal, String[] terms, int[] docFreqs, long[] postingsOffsets,
                   int[] postingsLengths, int docCount, long sumTotalTermFreq) {
        this.fieldOrdinal = fieldOrdinal;
        this.terms = terms;
        this.docFreqs = docFreqs;
        this.postingsOffsets = postingsOffsets;
        this.postingsLengths = postingsLengths;
        this.docCount = docCount;
        this.sumTotalTermFreq = sumTotalTermFreq;
    }

    public int getFieldOrdinal() {
        return fieldOrdinal;
    }

    public int size() {
        return terms.length;
    }

    /**
     * Number of documents with at least one term in this field.
     */
    public int getDocCount() {
        return docCount;
    }

    /**
     * Total number of tokens indexed for this field across all documents.
     */
    public long getSumTotalTermFreq() {
        return sumTotalTermFreq;
    }

    /**
     * @return The index of the term, or -1 if absent
     */
    public int find(String term) {
        int index = Arrays.binarySearch(terms, term);
        return index >= 0 ? index : -1;
    }

    /**
     * Index of the first term greater than or equal to {@code term}.
     */
    public int ceiling(String term) {
        int index = Arrays.binarySearch(terms, term);
        return index >= 0 ? index : -index - 1;
    }

    public String term(int index) {
        return terms[index];
    }

    public int docFreq(int index) {
        return docFreqs[index];
    }

    long postingsOffset(int index) {
        return postingsOffsets[index];
    }

    int postingsLength(int index) {
        return postingsLengths[index];
    }
}

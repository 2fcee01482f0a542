package com.jsearch.query;

import com.jsearch.segment.Postings;
import com.jsearch.segment.SegmentReader;
import com.jsearch.segment.TermDictionary;

import java.io.IOException;
import java.util.Arrays;

/**
 * Docs where the terms occur at the given relative positions. Scored with
 * BM25 using the phrase frequency and the summed idf of its terms.
 */
public class PhraseQuery extends Query {
    private final int fieldOrdinal;
    private final String[] terms;
    private final int[] offsets;

    /**
     * @param offsets position of each term relative to the first one
     */
    public PhraseQuery(int fieldOrdinal, String[] terms, int[] offsets) {
        if (terms.length != offsets.length || terms.length < 2) {
            throw new IllegalArgumentException("A phrase needs at least two terms with one offset each");
        }
        this.fieldOrdinal = fieldOrdinal;
        this.terms = terms.clone();
        this.offsets = offsets.clone();
    }

    @Override
    public DocScores execute(LeafContext leaf) throws IOException {
        SegmentReader reader = leaf.getReader();
        TermDictionary dictionary = reader.terms(fieldOrdinal);
        if (dictionary == null) {
            return DocScores.empty();
        }
        Postings[] postings = new Postings[terms.length];
        for (int t = 0; t < terms.length; t++) {
            int index = dictionary.find(terms[t]);
            if (index < 0) {
                return DocScores.empty();
            }
            postings[t] = reader.postings(dictionary, index);
        }
        double idf = 0;
        for (String term : terms) {
            idf += leaf.getStats().idf(fieldOrdinal, term);
        }
        double averageLength = leaf.getStats().averageFieldLength(fieldOrdinal);

        DocScores.Builder builder = new DocScores.Builder();
        int[] cursors = new int[terms.length];
        outer:
        for (int lead = 0; lead < postings[0].size(); lead++) {
            int doc = postings[0].doc(lead);
            cursors[0] = lead;
            for (int t = 1; t < terms.length; t++) {
                while (cursors[t] < postings[t].size() && postings[t].doc(cursors[t]) < doc) {
                    cursors[t]++;
                }
                if (cursors[t] == postings[t].size()) {
                    break outer;
                }
                if (postings[t].doc(cursors[t]) != doc) {
                    continue outer;
                }
            }
            int phraseFreq = phraseFreq(postings, cursors);
            if (phraseFreq > 0) {
                builder.add(doc, Bm25.score(idf, phraseFreq, leaf.fieldLength(fieldOrdinal, doc), averageLength));
            }
        }
        return builder.build();
    }

    private int phraseFreq(Postings[] postings, int[] cursors) {
        int[][] positions = new int[terms.length][];
        for (int t = 0; t < terms.length; t++) {
            positions[t] = postings[t].positions(cursors[t]);
        }
        int freq = 0;
        for (int start : positions[0]) {
            int origin = start - offsets[0];
            boolean all = true;
            for (int t = 1; t < terms.length && all; t++) {
                all = Arrays.binarySearch(positions[t], origin + offsets[t]) >= 0;
            }
            if (all) {
                freq++;
            }
        }
        return freq;
    }

    @Override
    public String toString() {
        return "phrase(" + fieldOrdinal + ":\"" + String.join(" ", terms) + "\")";
    }
}

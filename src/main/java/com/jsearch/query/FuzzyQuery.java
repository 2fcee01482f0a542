package com.jsearch.query;

import com.jsearch.segment.SegmentReader;
import com.jsearch.segment.TermDictionary;

import java.io.IOException;
import java.util.BitSet;

/**
 * Docs with a term within {@code maxEdits} Damerau-Levenshtein edits of the
 * word; constant score 1.0.
 */
public class FuzzyQuery extends Query {
    private final int fieldOrdinal;
    private final String word;
    private final int maxEdits;

    public FuzzyQuery(int fieldOrdinal, String word, int maxEdits) {
        this.fieldOrdinal = fieldOrdinal;
        this.word = word;
        this.maxEdits = maxEdits;
    }

    @Override
    public DocScores execute(LeafContext leaf) throws IOException {
        SegmentReader reader = leaf.getReader();
        TermDictionary dictionary = reader.terms(fieldOrdinal);
        if (dictionary == null) {
            return DocScores.empty();
        }
        BitSet docs = new BitSet(reader.maxDoc());
        for (int i = 0; i < dictionary.size(); i++) {
            if (EditDistance.withinDistance(word, dictionary.term(i), maxEdits)) {
                PrefixQuery.addDocs(reader.postings(dictionary, i), docs);
            }
        }
        return DocScores.of(docs, 1.0);
    }

    @Override
    public String toString() {
        return "fuzzy(" + fieldOrdinal + ":" + word + "~" + maxEdits + ")";
    }
}

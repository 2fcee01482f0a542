package com.jsearch.query;

import com.jsearch.segment.Postings;
import com.jsearch.segment.SegmentReader;
import com.jsearch.segment.TermDictionary;

import java.io.IOException;

/**
 * Docs containing an exact term, scored with BM25.
 */
public class TermQuery extends Query {
    private final int fieldOrdinal;
    private final String term;

    public TermQuery(int fieldOrdinal, String term) {
        this.fieldOrdinal = fieldOrdinal;
        this.term = term;
    }

    public int getFieldOrdinal() {
        return fieldOrdinal;
    }

    public String getTerm() {
        return term;
    }

    @Override
    public DocScores execute(LeafContext leaf) throws IOException {
        SegmentReader reader = leaf.getReader();
        TermDictionary dictionary = reader.terms(fieldOrdinal);
        if (dictionary == null) {
            return DocScores.empty();
        }
        int index = dictionary.find(term);
        if (index < 0) {
            return DocScores.empty();
        }
        Postings postings = reader.postings(dictionary, index);
        double idf = leaf.getStats().idf(fieldOrdinal, term);
        double averageLength = leaf.getStats().averageFieldLength(fieldOrdinal);
        DocScores.Builder builder = new DocScores.Builder(postings.size());
        for (int i = 0; i < postings.size(); i++) {
            int doc = postings.doc(i);
            builder.add(doc, Bm25.score(idf, postings.freq(i), leaf.fieldLength(fieldOrdinal, doc), averageLength));
        }
        return builder.build();
    }

    @Override
    public String toString() {
        return "term(" + fieldOrdinal + ":" + term + ")";
    }
}

package com.jsearch.query;

import com.jsearch.segment.Postings;
import com.jsearch.segment.SegmentReader;
import com.jsearch.segment.TermDictionary;

import java.io.IOException;
import java.util.BitSet;

/**
 * Docs with any term starting with the prefix; constant score 1.0.
 */
public class PrefixQuery extends Query {
    private final int fieldOrdinal;
    private final String prefix;

    public PrefixQuery(int fieldOrdinal, String prefix) {
        this.fieldOrdinal = fieldOrdinal;
        this.prefix = prefix;
    }

    @Override
    public DocScores execute(LeafContext leaf) throws IOException {
        SegmentReader reader = leaf.getReader();
        TermDictionary dictionary = reader.terms(fieldOrdinal);
        if (dictionary == null) {
            return DocScores.empty();
        }
        BitSet docs = new BitSet(reader.maxDoc());
        for (int i = dictionary.ceiling(prefix); i < dictionary.size() && dictionary.term(i).startsWith(prefix); i++) {
            addDocs(reader.postings(dictionary, i), docs);
        }
        return DocScores.of(docs, 1.0);
    }

    static void addDocs(Postings postings, BitSet docs) {
        for (int i = 0; i < postings.size(); i++) {
            docs.set(postings.doc(i));
        }
    }

    @Override
    public String toString() {
        return "prefix(" + fieldOrdinal + ":" + prefix + "*)";
    }
}

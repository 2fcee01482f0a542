package com.jsearch.query;

import com.jsearch.segment.SegmentReader;
import com.jsearch.segment.TermDictionary;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Collection statistics for scoring, taken over every segment of a
 * snapshot. Counts are physical: tombstoned documents still count until a
 * merge removes them.
 */
public final class SearchStats {
    private final List<SegmentReader> readers;
    private final long maxDoc;
    private final Map<Integer, Double> averageLengths = new HashMap<>();

    public SearchStats(List<SegmentReader> readers) {
        this.readers = readers;
        long total = 0;
        for (SegmentReader reader : readers) {
            total += reader.maxDoc();
        }
        this.maxDoc = total;
    }

    public long maxDoc() {
        return maxDoc;
    }

    public long docFreq(int fieldOrdinal, String term) {
        long docFreq = 0;
        for (SegmentReader reader : readers) {
            TermDictionary dictionary = reader.terms(fieldOrdinal);
            if (dictionary == null) {
                continue;
            }
            int index = dictionary.find(term);
            if (index >= 0) {
                docFreq += dictionary.docFreq(index);
            }
        }
        return docFreq;
    }

    public double idf(int fieldOrdinal, String term) {
        return Bm25.idf(maxDoc, docFreq(fieldOrdinal, term));
    }

    /**
     * Tokens indexed in the field divided by all documents.
     */
    public synchronized double averageFieldLength(int fieldOrdinal) {
        return averageLengths.computeIfAbsent(fieldOrdinal, ordinal -> {
            long tokens = 0;
            for (SegmentReader reader : readers) {
                TermDictionary dictionary = reader.terms(ordinal);
                if (dictionary != null) {
                    tokens += dictionary.getSumTotalTermFreq();
                }
            }
            return maxDoc == 0 ? 0.0 : (double) tokens / maxDoc;
        });
    }
}

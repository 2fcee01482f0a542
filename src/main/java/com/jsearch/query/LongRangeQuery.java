package com.jsearch.query;

import com.jsearch.segment.NumericColumn;

/**
 * Docs whose i64 column value lies in an inclusive range; constant score 1.0.
 */
public class LongRangeQuery extends Query {
    private final int fieldOrdinal;
    private final long min;
    private final long max;

    public LongRangeQuery(int fieldOrdinal, long min, long max) {
        this.fieldOrdinal = fieldOrdinal;
        this.min = min;
        this.max = max;
    }

    @Override
    public DocScores execute(LeafContext leaf) {
        NumericColumn column = leaf.getReader().column(fieldOrdinal);
        if (column == null || min > max) {
            return DocScores.empty();
        }
        DocScores.Builder builder = new DocScores.Builder();
        for (int doc = 0; doc < column.size(); doc++) {
            if (column.has(doc)) {
                long value = column.longValue(doc);
                if (value >= min && value <= max) {
                    builder.add(doc, 1.0);
                }
            }
        }
        return builder.build();
    }

    @Override
    public String toString() {
        return "range(" + fieldOrdinal + ":[" + min + " TO " + max + "])";
    }
}

package com.jsearch.query;

import com.jsearch.segment.NumericColumn;

/**
 * Docs whose f64 column value lies in an inclusive range; constant score 1.0.
 * NaN values never match.
 */
public class DoubleRangeQuery extends Query {
    private final int fieldOrdinal;
    private final double min;
    private final double max;

    public DoubleRangeQuery(int fieldOrdinal, double min, double max) {
        this.fieldOrdinal = fieldOrdinal;
        this.min = min;
        this.max = max;
    }

    @Override
    public DocScores execute(LeafContext leaf) {
        NumericColumn column = leaf.getReader().column(fieldOrdinal);
        if (column == null || !(min <= max)) {
            return DocScores.empty();
        }
        DocScores.Builder builder = new DocScores.Builder();
        for (int doc = 0; doc < column.size(); doc++) {
            if (column.has(doc)) {
                double value = column.doubleValue(doc);
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

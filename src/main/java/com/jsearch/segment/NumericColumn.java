package com.jsearch.segment;

import com.jsearch.common.schema.FieldType;

import java.util.BitSet;

/**
 * Per-document value of one numeric field in one segment. Values are raw
 * longs: the value itself for i64, the IEEE bits for f64.
 */
public final class NumericColumn {
    private final FieldType type;
    private final long[] values;
    private final BitSet present;

    public NumericColumn(FieldType type, long[] values, BitSet present) {
        this.type = type;
        this.values = values;
        this.present = present;
    }

    public FieldType getType() {
        return type;
    }

    public int size() {
        return values.length;
    }

    public boolean has(int doc) {
        return present.get(doc);
    }

    public long rawValue(int doc) {
        return values[doc];
    }

    public long longValue(int doc) {
        return values[doc];
    }

    public double doubleValue(int doc) {
        return Double.longBitsToDouble(values[doc]);
    }

    BitSet present() {
        return present;
    }
}

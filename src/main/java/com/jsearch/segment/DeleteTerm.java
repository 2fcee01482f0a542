package com.jsearch.segment;

import com.jsearch.common.errors.QueryException;
import com.jsearch.common.schema.Field;
import com.jsearch.common.schema.FieldType;
import com.jsearch.common.schema.Schema;

import java.io.IOException;
import java.util.BitSet;
import java.util.Objects;

/**
 * Selects the documents to delete: those holding an exact indexed term of a
 * text or string field, or those whose numeric column equals a value. Text
 * terms are matched as given, without analysis.
 */
public final class DeleteTerm {
    private final Field field;
    private final String term;
    private final long numericValue;

    private DeleteTerm(Field field, String term, long numericValue) {
        this.field = field;
        this.term = term;
        this.numericValue = numericValue;
    }

    /**
     * @throws QueryException If the field is unknown, not searchable, or the value has the wrong type
     */
    public static DeleteTerm of(Schema schema, String fieldName, Object value) {
        if (fieldName == null || !schema.hasField(fieldName)) {
            throw new QueryException("Unknown field '" + fieldName + "'");
        }
        Objects.requireNonNull(value, "value cannot be null");
        Field field = schema.getField(fieldName);
        if (field.getType().isTextual()) {
            if (!field.hasPostings()) {
                throw new QueryException("Field '" + fieldName + "' is not indexed");
            }
            if (!(value instanceof String)) {
                throw new QueryException("Field '" + fieldName + "' needs a string term, got " + value);
            }
            return new DeleteTerm(field, (String) value, 0L);
        }
        if (!field.hasColumn()) {
            throw new QueryException("Field '" + fieldName + "' is neither indexed nor fast");
        }
        if (!(value instanceof Number)) {
            throw new QueryException("Field '" + fieldName + "' needs a numeric value, got " + value);
        }
        Number number = (Number) value;
        long raw = field.getType() == FieldType.I64
            ? number.longValue()
            : Double.doubleToLongBits(number.doubleValue());
        return new DeleteTerm(field, null, raw);
    }

    public Field getField() {
        return field;
    }

    boolean isTextual() {
        return term != null;
    }

    String getTerm() {
        return term;
    }

    /**
     * Numeric equality; f64 values compare as doubles so that 0.0 equals -0.0.
     */
    boolean matchesRaw(long raw) {
        if (field.getType() == FieldType.F64) {
            return Double.longBitsToDouble(raw) == Double.longBitsToDouble(numericValue);
        }
        return raw == numericValue;
    }

    /**
     * Documents of the segment that this term selects, deleted or not.
     */
    public BitSet matchingDocs(SegmentReader reader) throws IOException {
        BitSet matches = new BitSet(reader.maxDoc());
        if (isTextual()) {
            TermDictionary dictionary = reader.terms(field.getOrdinal());
            if (dictionary == null) {
                return matches;
            }
            int index = dictionary.find(term);
            if (index < 0) {
                return matches;
            }
            Postings postings = reader.postings(dictionary, index);
            for (int i = 0; i < postings.size(); i++) {
                matches.set(postings.doc(i));
            }
            return matches;
        }
        NumericColumn column = reader.column(field.getOrdinal());
        if (column == null) {
            return matches;
        }
        for (int doc = 0; doc < column.size(); doc++) {
            if (column.has(doc) && matchesRaw(column.rawValue(doc))) {
                matches.set(doc);
            }
        }
        return matches;
    }

    @Override
    public String toString() {
        return field.getName() + ":" + (isTextual() ? term : String.valueOf(
            field.getType() == FieldType.I64 ? numericValue : Double.longBitsToDouble(numericValue)));
    }
}

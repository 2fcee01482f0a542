package com.jsearch.document;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Everything the segment writer needs from one document: inverted fields,
 * numeric column values and the serialized stored payload.
 */
public class EncodedDocument {
    private final List<EncodedField> fields;
    private final Map<Integer, Long> columnValues;
    private final byte[] storedPayload;

    public EncodedDocument(List<EncodedField> fields, Map<Integer, Long> columnValues, byte[] storedPayload) {
        this.fields = Collections.unmodifiableList(fields);
        this.columnValues = Collections.unmodifiableMap(columnValues);
        this.storedPayload = storedPayload;
    }

    public List<EncodedField> getFields() {
        return fields;
    }

    /**
     * Field ordinal to the raw column value: the long itself for i64 fields,
     * {@link Double#doubleToLongBits} for f64 fields.
     */
    public Map<Integer, Long> getColumnValues() {
        return columnValues;
    }

    public byte[] getStoredPayload() {
        return storedPayload;
    }
}

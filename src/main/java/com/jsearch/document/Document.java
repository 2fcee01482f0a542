package com.jsearch.document;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A document about to be indexed: field name to one or more values. Values
 * are {@link String} for text and string fields, {@link Long} for i64 and
 * {@link Double} for f64 fields.
 */
public class Document {
    private final Map<String, List<Object>> values = new LinkedHashMap<>();

    public Document add(String field, Object value) {
        Objects.requireNonNull(field, "field cannot be null");
        Objects.requireNonNull(value, "value cannot be null");
        values.computeIfAbsent(field, k -> new ArrayList<>()).add(value);
        return this;
    }

    public List<Object> getValues(String field) {
        List<Object> fieldValues = values.get(field);
        return fieldValues == null ? Collections.emptyList() : Collections.unmodifiableList(fieldValues);
    }

    public Object getFirst(String field) {
        List<Object> fieldValues = values.get(field);
        return fieldValues == null || fieldValues.isEmpty() ? null : fieldValues.get(0);
    }

    public Iterable<String> getFieldNames() {
        return Collections.unmodifiableSet(values.keySet());
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    @Override
    public String toString() {
        return "Document" + values;
    }
}

package com.jsearch.common.schema;

import com.jsearch.analysis.TokenizerRegistry;
import com.jsearch.common.errors.SchemaException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Ordered, immutable set of field definitions for one index, plus the fields
 * a text query searches when it names none.
 */
public class Schema {
    private final List<Field> fields;
    private final Map<String, Field> fieldsByName;
    private final List<Field> searchFields;

    private Schema(List<Field> fields, List<Field> searchFields) {
        this.fields = Collections.unmodifiableList(new ArrayList<>(fields));
        Map<String, Field> byName = new LinkedHashMap<>();
        for (Field field : fields) {
            byName.put(field.getName(), field);
        }
        this.fieldsByName = Collections.unmodifiableMap(byName);
        this.searchFields = Collections.unmodifiableList(new ArrayList<>(searchFields));
    }

    public List<Field> getFields() {
        return fields;
    }

    /**
     * Fields searched by text, phrase, prefix and fuzzy queries that do not
     * list their own fields.
     */
    public List<Field> getSearchFields() {
        return searchFields;
    }

    public boolean hasField(String fieldName) {
        return fieldsByName.containsKey(fieldName);
    }

    public Field getField(String fieldName) {
        Field field = fieldsByName.get(fieldName);
        if (field == null) {
            throw new IllegalArgumentException("Field '" + fieldName + "' does not exist");
        }
        return field;
    }

    public Field getField(int ordinal) {
        if (ordinal < 0 || ordinal >= fields.size()) {
            throw new IllegalArgumentException("Field ordinal out of range: " + ordinal);
        }
        return fields.get(ordinal);
    }

    public int size() {
        return fields.size();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("schema {\n");
        for (Field field : fields) {
            sb.append("  ").append(field.toString()).append(";\n");
        }
        sb.append("}");
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Schema that = (Schema) o;
        return fields.equals(that.fields) && searchFields.equals(that.searchFields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fields, searchFields);
    }

    /**
     * Builder class for creating validated Schema instances.
     */
    public static class Builder {
        private final List<Field> fields = new ArrayList<>();
        private final List<String> searchFieldNames = new ArrayList<>();

        public Builder addTextField(String name, boolean stored) {
            return addField(name, FieldType.TEXT, true, stored, false, TokenizerRegistry.DEFAULT);
        }

        public Builder addTextField(String name, boolean stored, String tokenizer) {
            return addField(name, FieldType.TEXT, true, stored, false, tokenizer);
        }

        public Builder addStringField(String name, boolean stored) {
            return addField(name, FieldType.STRING, true, stored, false, TokenizerRegistry.RAW);
        }

        public Builder addI64Field(String name, boolean stored) {
            return addField(name, FieldType.I64, true, stored, false, TokenizerRegistry.DEFAULT);
        }

        public Builder addF64Field(String name, boolean stored) {
            return addField(name, FieldType.F64, true, stored, false, TokenizerRegistry.DEFAULT);
        }

        public Builder addField(String name, FieldType type, boolean indexed, boolean stored, boolean fast,
                                String tokenizer) {
            if (name == null || name.isBlank()) {
                throw new SchemaException("Field name cannot be empty");
            }
            if (type == null) {
                throw new SchemaException("Field '" + name + "' has no type");
            }
            for (Field existing : fields) {
                if (existing.getName().equals(name)) {
                    throw new SchemaException("Duplicate field name: " + name);
                }
            }
            String tokenizerName = tokenizer == null ? TokenizerRegistry.DEFAULT : tokenizer;
            if (!TokenizerRegistry.isKnown(tokenizerName)) {
                throw new SchemaException("Unknown tokenizer '" + tokenizerName + "' for field " + name);
            }
            fields.add(new Field(name, type, indexed, stored, fast, tokenizerName, fields.size()));
            return this;
        }

        public Builder addSearchField(String name) {
            searchFieldNames.add(name);
            return this;
        }

        public Schema build() {
            if (fields.isEmpty()) {
                throw new SchemaException("Schema must define at least one field");
            }
            List<Field> searchFields = new ArrayList<>();
            if (searchFieldNames.isEmpty()) {
                for (Field field : fields) {
                    if (field.getType() == FieldType.TEXT && field.isIndexed()
                            && !TokenizerRegistry.RAW.equals(field.getTokenizer())) {
                        searchFields.add(field);
                    }
                }
            } else {
                for (String name : searchFieldNames) {
                    Field field = fields.stream()
                        .filter(f -> f.getName().equals(name))
                        .findFirst()
                        .orElseThrow(() -> new SchemaException("Unknown search field: " + name));
                    if (!field.hasPostings()) {
                        throw new SchemaException("Search field '" + name + "' is not an indexed text or string field");
                    }
                    if (!searchFields.contains(field)) {
                        searchFields.add(field);
                    }
                }
            }
            return new Schema(fields, searchFields);
        }
    }
}

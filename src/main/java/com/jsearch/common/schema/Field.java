package com.jsearch.common.schema;

import com.jsearch.analysis.TokenizerRegistry;

import java.util.Objects;

/**
 * Represents a field of an index schema: its name, value type and how it is
 * indexed and stored. The ordinal is the field's position in the schema and
 * is how segment files refer to it.
 */
public class Field {
    private final String name;
    private final FieldType type;
    private final boolean indexed;
    private final boolean stored;
    private final boolean fast;
    private final String tokenizer;
    private final int ordinal;

    public Field(String name, FieldType type, boolean indexed, boolean stored, boolean fast,
                 String tokenizer, int ordinal) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.type = Objects.requireNonNull(type, "type cannot be null");
        this.indexed = indexed;
        this.stored = stored;
        this.fast = fast;
        this.tokenizer = type == FieldType.STRING ? TokenizerRegistry.RAW
            : Objects.requireNonNull(tokenizer, "tokenizer cannot be null");
        this.ordinal = ordinal;
    }

    public String getName() {
        return name;
    }

    public FieldType getType() {
        return type;
    }

    public boolean isIndexed() {
        return indexed;
    }

    public boolean isStored() {
        return stored;
    }

    public boolean isFast() {
        return fast;
    }

    public String getTokenizer() {
        return tokenizer;
    }

    public int getOrdinal() {
        return ordinal;
    }

    /**
     * True if the field has an inverted index (term dictionary and postings).
     */
    public boolean hasPostings() {
        return indexed && type.isTextual();
    }

    /**
     * True if the field keeps per-document token counts for length normalization.
     */
    public boolean hasNorms() {
        return hasPostings() && !TokenizerRegistry.RAW.equals(tokenizer);
    }

    /**
     * True if the field keeps a per-document numeric column.
     */
    public boolean hasColumn() {
        return type.isNumeric() && (indexed || fast);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Field field = (Field) o;
        return ordinal == field.ordinal &&
                indexed == field.indexed &&
                stored == field.stored &&
                fast == field.fast &&
                name.equals(field.name) &&
                type == field.type &&
                tokenizer.equals(field.tokenizer);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type, indexed, stored, fast, tokenizer, ordinal);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(type.getJsonName()).append(" ").append(name);
        if (indexed) {
            sb.append(" indexed");
        }
        if (stored) {
            sb.append(" stored");
        }
        if (fast) {
            sb.append(" fast");
        }
        if (type == FieldType.TEXT) {
            sb.append(" (").append(tokenizer).append(")");
        }
        return sb.append(" = ").append(ordinal).toString();
    }
}

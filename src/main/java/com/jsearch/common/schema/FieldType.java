package com.jsearch.common.schema;

import java.util.Locale;

/**
 * The value types a schema field can hold. The numeric value is what the
 * segment files record for a field, so it must never change.
 */
public enum FieldType {
    /** Tokenized full text. */
    TEXT(0, "text"),
    /** Untokenized string matched exactly. */
    STRING(1, "string"),
    /** Signed 64-bit integer. */
    I64(2, "i64"),
    /** 64-bit floating point. */
    F64(3, "f64");

    private final int value;
    private final String jsonName;

    FieldType(int value, String jsonName) {
        this.value = value;
        this.jsonName = jsonName;
    }

    public int getValue() {
        return value;
    }

    public String getJsonName() {
        return jsonName;
    }

    public boolean isNumeric() {
        return this == I64 || this == F64;
    }

    public boolean isTextual() {
        return this == TEXT || this == STRING;
    }

    public static FieldType fromValue(int value) {
        for (FieldType type : values()) {
            if (type.value == value) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown field type value: " + value);
    }

    /**
     * Resolves a schema type name. {@code string-exact} is accepted for
     * {@code string} and {@code numeric} for {@code f64}.
     *
     * @return The type, or null if the name is unknown
     */
    public static FieldType fromJsonName(String name) {
        if (name == null) {
            return null;
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        switch (normalized) {
            case "string-exact":
            case "string_exact":
                return STRING;
            case "numeric":
                return F64;
            default:
                for (FieldType type : values()) {
                    if (type.jsonName.equals(normalized)) {
                        return type;
                    }
                }
                return null;
        }
    }
}

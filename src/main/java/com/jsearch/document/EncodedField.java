package com.jsearch.document;

import java.util.Collections;
import java.util.Map;

/**
 * Inverted form of one indexed text or string field of one document: each
 * distinct term with its positions, and the number of tokens in the field.
 */
public class EncodedField {
    private final int fieldOrdinal;
    private final Map<String, int[]> termPositions;
    private final int length;

    public EncodedField(int fieldOrdinal, Map<String, int[]> termPositions, int length) {
        this.fieldOrdinal = fieldOrdinal;
        this.termPositions = Collections.unmodifiableMap(termPositions);
        this.length = length;
    }

    public int getFieldOrdinal() {
        return fieldOrdinal;
    }

    /**
     * Term to its ascending positions; the array length is the term frequency.
     */
    public Map<String, int[]> getTermPositions() {
        return termPositions;
    }

    public int getLength() {
        return length;
    }
}

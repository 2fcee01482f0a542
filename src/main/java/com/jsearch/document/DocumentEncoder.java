package com.jsearch.document;

import com.jsearch.analysis.Token;
import com.jsearch.analysis.Tokenizer;
import com.jsearch.analysis.TokenizerRegistry;
import com.jsearch.common.schema.Field;
import com.jsearch.common.schema.Schema;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts a validated document into its indexable form. Pure function of
 * the document and the schema.
 */
public class DocumentEncoder {
    /**
     * Gap between the positions of consecutive values of a multi-valued
     * field, so phrases cannot match across values.
     */
    public static final int POSITION_GAP = 100;

    private final Schema schema;

    public DocumentEncoder(Schema schema) {
        this.schema = schema;
    }

    public EncodedDocument encode(Document document) {
        List<EncodedField> encodedFields = new ArrayList<>();
        Map<Integer, Long> columnValues = new HashMap<>();
        Map<Field, List<Object>> stored = new LinkedHashMap<>();

        for (Field field : schema.getFields()) {
            List<Object> values = document.getValues(field.getName());
            if (values.isEmpty()) {
                continue;
            }
            if (field.hasPostings()) {
                encodedFields.add(invert(field, values));
            }
            if (field.hasColumn()) {
                columnValues.put(field.getOrdinal(), toColumnValue(field, values.get(0)));
            }
            if (field.isStored()) {
                stored.put(field, values);
            }
        }
        return new EncodedDocument(encodedFields, columnValues, StoredDocumentCodec.encode(stored));
    }

    private static EncodedField invert(Field field, List<Object> values) {
        Tokenizer tokenizer = TokenizerRegistry.get(field.getTokenizer());
        Map<String, List<Integer>> positions = new HashMap<>();
        int length = 0;
        int nextPosition = 0;
        for (Object value : values) {
            List<Token> tokens = tokenizer.tokenize((String) value, nextPosition);
            for (Token token : tokens) {
                positions.computeIfAbsent(token.getText(), k -> new ArrayList<>()).add(token.getPosition());
                nextPosition = token.getPosition() + 1;
            }
            length += tokens.size();
            nextPosition += POSITION_GAP;
        }
        Map<String, int[]> termPositions = new HashMap<>();
        for (Map.Entry<String, List<Integer>> entry : positions.entrySet()) {
            termPositions.put(entry.getKey(), entry.getValue().stream().mapToInt(Integer::intValue).toArray());
        }
        return new EncodedField(field.getOrdinal(), termPositions, length);
    }

    private static long toColumnValue(Field field, Object value) {
        Number number = (Number) value;
        return switch (field.getType()) {
            case I64 -> number.longValue();
            case F64 -> Double.doubleToLongBits(number.doubleValue());
            default -> throw new IllegalArgumentException("Field " + field.getName() + " has no column");
        };
    }
}

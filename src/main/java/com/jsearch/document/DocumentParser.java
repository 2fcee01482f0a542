package com.jsearch.document;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jsearch.common.errors.DocumentException;
import com.jsearch.common.schema.Field;
import com.jsearch.common.schema.FieldType;
import com.jsearch.common.schema.Schema;

import java.util.Iterator;
import java.util.Map;

/**
 * Converts a JSON object into a {@link Document}, validating every value
 * against the schema. Fields the schema does not define are skipped, or
 * rejected when the parser is strict. JSON nulls are skipped.
 */
public class DocumentParser {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Schema schema;
    private final boolean strict;

    public DocumentParser(Schema schema, boolean strict) {
        this.schema = schema;
        this.strict = strict;
    }

    public Document parse(String json) {
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new DocumentException("Document is not valid JSON: " + e.getOriginalMessage(), e);
        }
        return parse(root);
    }

    public Document parse(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new DocumentException("Document must be a JSON object");
        }
        Document document = new Document();
        Iterator<Map.Entry<String, JsonNode>> entries = root.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            String name = entry.getKey();
            if (!schema.hasField(name)) {
                if (strict) {
                    throw new DocumentException("Field '" + name + "' is not defined in the schema");
                }
                continue;
            }
            Field field = schema.getField(name);
            JsonNode value = entry.getValue();
            if (value.isArray()) {
                if (!field.getType().isTextual()) {
                    throw new DocumentException("Field '" + name + "' of type "
                        + field.getType().getJsonName() + " does not accept arrays");
                }
                for (JsonNode element : value) {
                    addValue(document, field, element);
                }
            } else {
                addValue(document, field, value);
            }
        }
        return document;
    }

    /**
     * Checks a programmatically built document the same way a parsed one is checked.
     */
    public void validate(Document document) {
        for (String name : document.getFieldNames()) {
            if (!schema.hasField(name)) {
                if (strict) {
                    throw new DocumentException("Field '" + name + "' is not defined in the schema");
                }
                continue;
            }
            Field field = schema.getField(name);
            for (Object value : document.getValues(name)) {
                boolean valid = switch (field.getType()) {
                    case TEXT, STRING -> value instanceof String;
                    case I64 -> value instanceof Long || value instanceof Integer;
                    case F64 -> value instanceof Number;
                };
                if (!valid) {
                    throw new DocumentException(String.format("Invalid value for field '%s': expected %s, got %s",
                        name, field.getType().getJsonName(), value.getClass().getSimpleName()));
                }
            }
        }
    }

    private void addValue(Document document, Field field, JsonNode value) {
        if (value.isNull()) {
            return;
        }
        FieldType type = field.getType();
        switch (type) {
            case TEXT:
            case STRING:
                if (!value.isTextual()) {
                    throw typeMismatch(field, value);
                }
                document.add(field.getName(), value.textValue());
                break;
            case I64:
                if (!value.isNumber()) {
                    throw typeMismatch(field, value);
                }
                if (value.isIntegralNumber() && !value.canConvertToLong()) {
                    throw new DocumentException("Value for i64 field '" + field.getName() + "' is out of range: "
                        + value);
                }
                document.add(field.getName(), value.isIntegralNumber() ? value.longValue() : (long) value.doubleValue());
                break;
            case F64:
                if (!value.isNumber()) {
                    throw typeMismatch(field, value);
                }
                document.add(field.getName(), value.doubleValue());
                break;
            default:
                throw new DocumentException("Unsupported field type: " + type);
        }
    }

    private static DocumentException typeMismatch(Field field, JsonNode value) {
        return new DocumentException(String.format("Invalid value for field '%s': expected %s, got %s",
            field.getName(), field.getType().getJsonName(), value.getNodeType().toString().toLowerCase()));
    }
}

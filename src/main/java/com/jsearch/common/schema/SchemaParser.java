package com.jsearch.common.schema;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.jsearch.analysis.TokenizerRegistry;
import com.jsearch.common.errors.SchemaException;

/**
 * Reads and writes the JSON form of a {@link Schema}:
 *
 * <pre>
 * {"fields": [{"name": "title", "type": "text", "stored": true, "indexed": true,
 *              "fast": false, "tokenizer": "default"}],
 *  "search_fields": ["title"]}
 * </pre>
 *
 * Only {@code name} and {@code type} are required per field.
 */
public class SchemaParser {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private SchemaParser() {
    }

    public static Schema parse(String json) {
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new SchemaException("Schema is not valid JSON: " + e.getOriginalMessage(), e);
        }
        return parse(root);
    }

    public static Schema parse(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new SchemaException("Schema must be a JSON object");
        }
        JsonNode fields = root.get("fields");
        if (fields == null || !fields.isArray()) {
            throw new SchemaException("Schema must contain a 'fields' array");
        }
        Schema.Builder builder = new Schema.Builder();
        for (JsonNode fieldNode : fields) {
            if (!fieldNode.isObject()) {
                throw new SchemaException("Field definition must be an object: " + fieldNode);
            }
            String name = requiredText(fieldNode, "name");
            String typeName = requiredText(fieldNode, "type");
            FieldType type = FieldType.fromJsonName(typeName);
            if (type == null) {
                throw new SchemaException("Unknown field type '" + typeName + "' for field " + name);
            }
            boolean indexed = flag(fieldNode, "indexed", true);
            boolean stored = flag(fieldNode, "stored", true);
            boolean fast = flag(fieldNode, "fast", false);
            String tokenizer = fieldNode.hasNonNull("tokenizer")
                ? fieldNode.get("tokenizer").asText()
                : TokenizerRegistry.DEFAULT;
            builder.addField(name, type, indexed, stored, fast, tokenizer);
        }
        JsonNode searchFields = root.get("search_fields");
        if (searchFields != null && !searchFields.isNull()) {
            if (!searchFields.isArray()) {
                throw new SchemaException("'search_fields' must be an array of field names");
            }
            for (JsonNode name : searchFields) {
                if (!name.isTextual()) {
                    throw new SchemaException("Search field names must be strings: " + name);
                }
                builder.addSearchField(name.asText());
            }
        }
        return builder.build();
    }

    public static ObjectNode toJson(Schema schema) {
        ObjectNode root = MAPPER.createObjectNode();
        ArrayNode fields = root.putArray("fields");
        for (Field field : schema.getFields()) {
            ObjectNode node = fields.addObject();
            node.put("name", field.getName());
            node.put("type", field.getType().getJsonName());
            node.put("indexed", field.isIndexed());
            node.put("stored", field.isStored());
            node.put("fast", field.isFast());
            node.put("tokenizer", field.getTokenizer());
        }
        ArrayNode searchFields = root.putArray("search_fields");
        for (Field field : schema.getSearchFields()) {
            searchFields.add(field.getName());
        }
        return root;
    }

    public static byte[] toBytes(Schema schema) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsBytes(toJson(schema));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize schema", e);
        }
    }

    private static String requiredText(JsonNode node, String property) {
        JsonNode value = node.get(property);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            throw new SchemaException("Field definition requires a non-empty '" + property + "': " + node);
        }
        return value.asText();
    }

    private static boolean flag(JsonNode node, String property, boolean defaultValue) {
        JsonNode value = node.get(property);
        if (value == null || value.isNull()) {
            return defaultValue;
        }
        if (!value.isBoolean()) {
            throw new SchemaException("'" + property + "' must be a boolean: " + node);
        }
        return value.booleanValue();
    }
}

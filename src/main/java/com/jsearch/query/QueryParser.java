package com.jsearch.query;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jsearch.analysis.Token;
import com.jsearch.analysis.TokenizerRegistry;
import com.jsearch.common.errors.QueryException;
import com.jsearch.common.schema.Field;
import com.jsearch.common.schema.FieldType;
import com.jsearch.common.schema.Schema;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Parses the JSON query DSL into a {@link SearchRequest}.
 *
 * <pre>
 * {"type": "text", "query": "dark knight", "fields": ["title"], "limit": 10, "offset": 0}
 * {"type": "bool", "must": [{"type": "term_match", "field": "genre", "value": "Drama"}],
 *  "must_not": [{"type": "range_i64", "field": "year", "max": 1990}]}
 * </pre>
 *
 * Supported types: {@code text}, {@code phrase}, {@code prefix},
 * {@code fuzzy}, {@code term_match}, {@code range_i64}, {@code range_f64},
 * {@code bool} and {@code all}. Only the top-level object's {@code limit}
 * and {@code offset} count.
 */
public class QueryParser {
    public static final int DEFAULT_FUZZY_DISTANCE = 2;
    public static final int MAX_FUZZY_DISTANCE = 2;
    /** Words of this many characters or fewer allow at most one edit. */
    public static final int SHORT_WORD_LENGTH = 5;

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Schema schema;
    private final int defaultLimit;

    public QueryParser(Schema schema, int defaultLimit) {
        this.schema = schema;
        this.defaultLimit = defaultLimit;
    }

    public SearchRequest parse(String json) {
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new QueryException("Query is not valid JSON: " + e.getOriginalMessage(), e);
        }
        return parse(root);
    }

    public SearchRequest parse(JsonNode root) {
        Query query = parseQuery(root);
        int limit = intProperty(root, "limit", defaultLimit);
        if (limit < 1) {
            throw new QueryException("'limit' must be positive, got " + limit);
        }
        int offset = intProperty(root, "offset", 0);
        if (offset < 0) {
            throw new QueryException("'offset' cannot be negative, got " + offset);
        }
        return new SearchRequest(query, limit, offset);
    }

    /**
     * Parses one query object, ignoring any page window on it.
     */
    public Query parseQuery(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new QueryException("Query must be a JSON object");
        }
        JsonNode typeNode = node.get("type");
        if (typeNode == null || !typeNode.isTextual()) {
            throw new QueryException("Query requires a string 'type'");
        }
        String type = typeNode.asText();
        return switch (type) {
            case "text" -> textQuery(requiredText(node, "query", type), searchFields(node));
            case "phrase" -> phraseQuery(requiredText(node, "phrase", type), searchFields(node));
            case "prefix" -> prefixQuery(requiredText(node, "prefix", type), searchFields(node));
            case "fuzzy" -> fuzzyQuery(node);
            case "term_match" -> termMatchQuery(node);
            case "range_i64" -> rangeI64Query(node);
            case "range_f64" -> rangeF64Query(node);
            case "bool" -> boolQuery(node);
            case "all" -> new MatchAllQuery();
            default -> throw new QueryException("Unknown query type '" + type + "'");
        };
    }

    private Query textQuery(String text, List<Field> fields) {
        BooleanQuery.Builder builder = new BooleanQuery.Builder();
        for (Field field : fields) {
            Set<String> terms = new LinkedHashSet<>();
            for (Token token : TokenizerRegistry.get(field.getTokenizer()).tokenize(text)) {
                terms.add(token.getText());
            }
            for (String term : terms) {
                builder.addShould(new TermQuery(field.getOrdinal(), term));
            }
        }
        return builder.build();
    }

    private Query phraseQuery(String phrase, List<Field> fields) {
        BooleanQuery.Builder builder = new BooleanQuery.Builder();
        for (Field field : fields) {
            List<Token> tokens = TokenizerRegistry.get(field.getTokenizer()).tokenize(phrase);
            if (tokens.size() < 2) {
                for (Token token : tokens) {
                    builder.addShould(new TermQuery(field.getOrdinal(), token.getText()));
                }
                continue;
            }
            String[] terms = new String[tokens.size()];
            int[] offsets = new int[tokens.size()];
            for (int i = 0; i < tokens.size(); i++) {
                terms[i] = tokens.get(i).getText();
                offsets[i] = tokens.get(i).getPosition() - tokens.get(0).getPosition();
            }
            builder.addShould(new PhraseQuery(field.getOrdinal(), terms, offsets));
        }
        return builder.build();
    }

    private Query prefixQuery(String prefix, List<Field> fields) {
        String lowered = prefix.toLowerCase(Locale.ROOT);
        BooleanQuery.Builder builder = new BooleanQuery.Builder();
        for (Field field : fields) {
            builder.addShould(new PrefixQuery(field.getOrdinal(), lowered));
        }
        return builder.build();
    }

    private Query fuzzyQuery(JsonNode node) {
        String term = requiredText(node, "term", "fuzzy");
        int distance = intProperty(node, "distance", DEFAULT_FUZZY_DISTANCE);
        if (distance < 0 || distance > MAX_FUZZY_DISTANCE) {
            throw new QueryException("'distance' must be between 0 and " + MAX_FUZZY_DISTANCE + ", got " + distance);
        }
        List<Field> fields = searchFields(node);
        BooleanQuery.Builder words = new BooleanQuery.Builder();
        for (String word : fuzzyWords(term)) {
            int wordLength = word.codePointCount(0, word.length());
            int edits = wordLength <= SHORT_WORD_LENGTH ? Math.min(1, distance) : distance;
            BooleanQuery.Builder perField = new BooleanQuery.Builder();
            for (Field field : fields) {
                perField.addShould(new FuzzyQuery(field.getOrdinal(), word, edits));
            }
            words.addMust(new ConstantScoreQuery(perField.build(), 1.0));
        }
        return words.build();
    }

    /**
     * Whitespace-separated words, lowercased, reduced to letters and digits,
     * keeping those longer than one character.
     */
    static List<String> fuzzyWords(String term) {
        List<String> words = new ArrayList<>();
        for (String raw : term.trim().split("\\s+")) {
            StringBuilder word = new StringBuilder();
            raw.toLowerCase(Locale.ROOT).codePoints()
                .filter(Character::isLetterOrDigit)
                .forEach(word::appendCodePoint);
            if (word.codePoints().count() > 1) {
                words.add(word.toString());
            }
        }
        return words;
    }

    private Query termMatchQuery(JsonNode node) {
        Field field = field(node);
        JsonNode value = node.get("value");
        if (value == null || value.isNull()) {
            throw new QueryException("Query of type 'term_match' requires 'value'");
        }
        switch (field.getType()) {
            case TEXT, STRING -> {
                if (!field.hasPostings()) {
                    throw new QueryException("Field '" + field.getName() + "' is not indexed");
                }
                if (!value.isTextual()) {
                    throw new QueryException("Field '" + field.getName() + "' needs a string value");
                }
                return new TermQuery(field.getOrdinal(), value.asText());
            }
            case I64 -> {
                requireColumn(field);
                long exact = longValue(value, field, "value");
                return new LongRangeQuery(field.getOrdinal(), exact, exact);
            }
            default -> {
                requireColumn(field);
                double exact = doubleValue(value, field, "value");
                return new DoubleRangeQuery(field.getOrdinal(), exact, exact);
            }
        }
    }

    private Query rangeI64Query(JsonNode node) {
        Field field = field(node);
        if (field.getType() != FieldType.I64) {
            throw new QueryException("range_i64 needs an i64 field, '" + field.getName() + "' is "
                + field.getType().getJsonName());
        }
        requireColumn(field);
        JsonNode min = node.get("min");
        JsonNode max = node.get("max");
        long low = min == null || min.isNull() ? Long.MIN_VALUE : longValue(min, field, "min");
        long high = max == null || max.isNull() ? Long.MAX_VALUE : longValue(max, field, "max");
        return new LongRangeQuery(field.getOrdinal(), low, high);
    }

    private Query rangeF64Query(JsonNode node) {
        Field field = field(node);
        if (field.getType() != FieldType.F64) {
            throw new QueryException("range_f64 needs an f64 field, '" + field.getName() + "' is "
                + field.getType().getJsonName());
        }
        requireColumn(field);
        JsonNode min = node.get("min");
        JsonNode max = node.get("max");
        double low = min == null || min.isNull() ? Double.NEGATIVE_INFINITY : doubleValue(min, field, "min");
        double high = max == null || max.isNull() ? Double.POSITIVE_INFINITY : doubleValue(max, field, "max");
        return new DoubleRangeQuery(field.getOrdinal(), low, high);
    }

    private Query boolQuery(JsonNode node) {
        BooleanQuery.Builder builder = new BooleanQuery.Builder();
        for (Query clause : clauses(node, "must")) {
            builder.addMust(clause);
        }
        for (Query clause : clauses(node, "should")) {
            builder.addShould(clause);
        }
        for (Query clause : clauses(node, "must_not")) {
            builder.addMustNot(clause);
        }
        return builder.build();
    }

    private List<Query> clauses(JsonNode node, String property) {
        JsonNode array = node.get(property);
        List<Query> clauses = new ArrayList<>();
        if (array == null || array.isNull()) {
            return clauses;
        }
        if (!array.isArray()) {
            throw new QueryException("'" + property + "' must be an array of queries");
        }
        for (JsonNode clause : array) {
            clauses.add(parseQuery(clause));
        }
        return clauses;
    }

    private List<Field> searchFields(JsonNode node) {
        JsonNode names = node.get("fields");
        List<Field> fields = new ArrayList<>();
        if (names != null && !names.isNull()) {
            if (!names.isArray()) {
                throw new QueryException("'fields' must be an array of field names");
            }
            for (JsonNode name : names) {
                if (!name.isTextual()) {
                    throw new QueryException("Field names must be strings: " + name);
                }
                Field field = lookup(name.asText());
                if (!field.hasPostings()) {
                    throw new QueryException("Field '" + field.getName() + "' is not an indexed text or string field");
                }
                if (!fields.contains(field)) {
                    fields.add(field);
                }
            }
        }
        if (fields.isEmpty()) {
            fields.addAll(schema.getSearchFields());
        }
        if (fields.isEmpty()) {
            throw new QueryException("No fields to search: the query names none and the schema has no search fields");
        }
        return fields;
    }

    private Field field(JsonNode node) {
        JsonNode name = node.get("field");
        if (name == null || !name.isTextual()) {
            throw new QueryException("Query of type '" + node.get("type").asText() + "' requires a string 'field'");
        }
        return lookup(name.asText());
    }

    private Field lookup(String name) {
        if (!schema.hasField(name)) {
            throw new QueryException("Unknown field '" + name + "'");
        }
        return schema.getField(name);
    }

    private static void requireColumn(Field field) {
        if (!field.hasColumn()) {
            throw new QueryException("Field '" + field.getName() + "' is neither indexed nor fast");
        }
    }

    private static String requiredText(JsonNode node, String property, String type) {
        JsonNode value = node.get(property);
        if (value == null || !value.isTextual()) {
            throw new QueryException("Query of type '" + type + "' requires a string '" + property + "'");
        }
        return value.asText();
    }

    private static int intProperty(JsonNode node, String property, int defaultValue) {
        JsonNode value = node.get(property);
        if (value == null || value.isNull()) {
            return defaultValue;
        }
        if (!value.isIntegralNumber() || !value.canConvertToInt()) {
            throw new QueryException("'" + property + "' must be an integer, got " + value);
        }
        return value.intValue();
    }

    private static long longValue(JsonNode value, Field field, String property) {
        if (!value.isIntegralNumber() || !value.canConvertToLong()) {
            throw new QueryException("'" + property + "' for i64 field '" + field.getName()
                + "' must be an integer, got " + value);
        }
        return value.longValue();
    }

    private static double doubleValue(JsonNode value, Field field, String property) {
        if (!value.isNumber()) {
            throw new QueryException("'" + property + "' for f64 field '" + field.getName()
                + "' must be a number, got " + value);
        }
        return value.doubleValue();
    }
}

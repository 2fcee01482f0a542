package com.jsearch.common.schema;

import com.jsearch.common.errors.SchemaException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class SchemaParserTest {
    private static final String MOVIE_SCHEMA = "{\"fields\": ["
        + "{\"name\": \"id\", \"type\": \"text\", \"tokenizer\": \"raw\"},"
        + "{\"name\": \"title\", \"type\": \"text\"},"
        + "{\"name\": \"genre\", \"type\": \"string\", \"stored\": false},"
        + "{\"name\": \"year\", \"type\": \"i64\", \"fast\": true},"
        + "{\"name\": \"rating\", \"type\": \"f64\", \"indexed\": false}],"
        + "\"search_fields\": [\"title\"]}";

    @Test
    void shouldParseFieldsWithDefaults() {
        Schema schema = SchemaParser.parse(MOVIE_SCHEMA);

        assertThat(schema.size()).isEqualTo(5);
        Field title = schema.getField("title");
        assertThat(title.getType()).isEqualTo(FieldType.TEXT);
        assertThat(title.isIndexed()).isTrue();
        assertThat(title.isStored()).isTrue();
        assertThat(title.isFast()).isFalse();
        assertThat(title.getTokenizer()).isEqualTo("default");
        assertThat(title.getOrdinal()).isEqualTo(1);

        assertThat(schema.getField("genre").isStored()).isFalse();
        assertThat(schema.getField("year").isFast()).isTrue();
        assertThat(schema.getField("rating").hasColumn()).isFalse();
        assertThat(schema.getSearchFields()).containsExactly(title);
    }

    @Test
    void shouldDeriveFlagsFromTypeAndTokenizer() {
        Schema schema = SchemaParser.parse(MOVIE_SCHEMA);

        assertThat(schema.getField("id").hasPostings()).isTrue();
        assertThat(schema.getField("id").hasNorms()).isFalse();
        assertThat(schema.getField("title").hasNorms()).isTrue();
        assertThat(schema.getField("year").hasPostings()).isFalse();
        assertThat(schema.getField("year").hasColumn()).isTrue();
    }

    @Test
    void shouldDefaultSearchFieldsToTokenizedTextFields() {
        Schema schema = SchemaParser.parse("{\"fields\": ["
            + "{\"name\": \"id\", \"type\": \"text\", \"tokenizer\": \"raw\"},"
            + "{\"name\": \"title\", \"type\": \"text\"},"
            + "{\"name\": \"body\", \"type\": \"text\", \"tokenizer\": \"en_stem\"}]}");

        assertThat(schema.getSearchFields()).extracting(Field::getName).containsExactly("title", "body");
    }

    @Test
    void shouldAcceptTypeAliases() {
        Schema schema = SchemaParser.parse("{\"fields\": ["
            + "{\"name\": \"code\", \"type\": \"string-exact\"},"
            + "{\"name\": \"score\", \"type\": \"numeric\"}]}");

        assertThat(schema.getField("code").getType()).isEqualTo(FieldType.STRING);
        assertThat(schema.getField("score").getType()).isEqualTo(FieldType.F64);
    }

    @Test
    void shouldSurviveJsonRoundTrip() {
        Schema schema = SchemaParser.parse(MOVIE_SCHEMA);

        Schema reparsed = SchemaParser.parse(new String(SchemaParser.toBytes(schema)));

        assertThat(reparsed).isEqualTo(schema);
    }

    @Test
    void shouldRejectInvalidSchemas() {
        assertThatThrownBy(() -> SchemaParser.parse("not json"))
            .isInstanceOf(SchemaException.class).hasMessageContaining("not valid JSON");
        assertThatThrownBy(() -> SchemaParser.parse("{\"fields\": []}"))
            .isInstanceOf(SchemaException.class).hasMessageContaining("at least one field");
        assertThatThrownBy(() -> SchemaParser.parse("{\"fields\": [{\"name\": \"a\", \"type\": \"date\"}]}"))
            .isInstanceOf(SchemaException.class).hasMessageContaining("Unknown field type");
        assertThatThrownBy(() -> SchemaParser.parse(
            "{\"fields\": [{\"name\": \"a\", \"type\": \"text\"}, {\"name\": \"a\", \"type\": \"i64\"}]}"))
            .isInstanceOf(SchemaException.class).hasMessageContaining("Duplicate field name");
        assertThatThrownBy(() -> SchemaParser.parse(
            "{\"fields\": [{\"name\": \"a\", \"type\": \"text\", \"tokenizer\": \"klingon\"}]}"))
            .isInstanceOf(SchemaException.class).hasMessageContaining("Unknown tokenizer");
        assertThatThrownBy(() -> SchemaParser.parse(
            "{\"fields\": [{\"name\": \"a\", \"type\": \"i64\"}], \"search_fields\": [\"a\"]}"))
            .isInstanceOf(SchemaException.class).hasMessageContaining("not an indexed text or string field");
        assertThatThrownBy(() -> SchemaParser.parse(
            "{\"fields\": [{\"name\": \"a\", \"type\": \"text\", \"stored\": \"yes\"}]}"))
            .isInstanceOf(SchemaException.class).hasMessageContaining("must be a boolean");
    }

    @Test
    void shouldBuildSchemaProgrammatically() {
        Schema schema = new Schema.Builder()
            .addTextField("title", true)
            .addStringField("genre", true)
            .addI64Field("year", true)
            .build();

        assertThat(schema.getField(2).getName()).isEqualTo("year");
        assertThat(schema.getField("genre").getTokenizer()).isEqualTo("raw");
        assertThatThrownBy(() -> schema.getField("missing")).isInstanceOf(IllegalArgumentException.class);
    }
}

package com.jsearch.document;

import com.jsearch.common.errors.DocumentException;
import com.jsearch.common.schema.FieldType;
import com.jsearch.common.schema.Schema;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class DocumentParserTest {
    private final Schema schema = new Schema.Builder()
        .addTextField("title", true)
        .addStringField("tags", true)
        .addI64Field("year", true)
        .addField("rating", FieldType.F64, true, true, true, "default")
        .build();

    @Test
    void shouldParseTypedValues() {
        DocumentParser parser = new DocumentParser(schema, false);

        Document document = parser.parse("{\"title\": \"The Matrix\", \"year\": 1999, \"rating\": 9, "
            + "\"tags\": [\"sci-fi\", \"action\"]}");

        assertThat(document.getFirst("title")).isEqualTo("The Matrix");
        assertThat(document.getFirst("year")).isEqualTo(1999L);
        assertThat(document.getFirst("rating")).isEqualTo(9.0);
        assertThat(document.getValues("tags")).containsExactly("sci-fi", "action");
    }

    @Test
    void shouldSkipUnknownFieldsAndNulls() {
        DocumentParser parser = new DocumentParser(schema, false);

        Document document = parser.parse("{\"title\": \"Fight Club\", \"director\": \"Fincher\", \"year\": null}");

        assertThat(document.getFieldNames()).containsExactly("title");
    }

    @Test
    void shouldRejectUnknownFieldsWhenStrict() {
        DocumentParser parser = new DocumentParser(schema, true);

        assertThatThrownBy(() -> parser.parse("{\"title\": \"Fight Club\", \"director\": \"Fincher\"}"))
            .isInstanceOf(DocumentException.class)
            .hasMessageContaining("director");
    }

    @Test
    void shouldRejectTypeMismatches() {
        DocumentParser parser = new DocumentParser(schema, false);

        assertThatThrownBy(() -> parser.parse("{\"year\": \"nineteen\"}"))
            .isInstanceOf(DocumentException.class)
            .hasMessageContaining("Invalid value for field 'year'");
        assertThatThrownBy(() -> parser.parse("{\"title\": 42}"))
            .isInstanceOf(DocumentException.class);
        assertThatThrownBy(() -> parser.parse("{\"year\": [1999, 2000]}"))
            .isInstanceOf(DocumentException.class)
            .hasMessageContaining("does not accept arrays");
        assertThatThrownBy(() -> parser.parse("[1, 2]"))
            .isInstanceOf(DocumentException.class)
            .hasMessageContaining("JSON object");
        assertThatThrownBy(() -> parser.parse("{\"title\": "))
            .isInstanceOf(DocumentException.class)
            .hasMessageContaining("not valid JSON");
    }

    @Test
    void shouldRejectIntegersOutsideLongRange() {
        DocumentParser parser = new DocumentParser(schema, false);

        assertThatThrownBy(() -> parser.parse("{\"year\": 18446744073709551616}"))
            .isInstanceOf(DocumentException.class)
            .hasMessageContaining("out of range");
        assertThat(parser.parse("{\"year\": 9223372036854775807}").getFirst("year")).isEqualTo(Long.MAX_VALUE);
        assertThat(parser.parse("{\"year\": 1e30}").getFirst("year")).isEqualTo(Long.MAX_VALUE);
    }

    @Test
    void shouldValidateProgrammaticDocuments() {
        DocumentParser parser = new DocumentParser(schema, false);

        parser.validate(new Document().add("title", "Heat").add("year", 1995L).add("rating", 8.3));
        assertThatThrownBy(() -> parser.validate(new Document().add("year", "1995")))
            .isInstanceOf(DocumentException.class);
    }
}

package com.jsearch.query;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jsearch.index.IndexConfig;
import com.jsearch.index.SearchIndex;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.*;

class SearchTest {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    @TempDir
    Path tempDir;

    private SearchIndex index;

    @AfterEach
    void tearDown() throws IOException {
        if (index != null) {
            index.close();
        }
    }

    private void createIndex(String schemaJson) throws IOException {
        index = SearchIndex.create(tempDir.resolve("index"), schemaJson, IndexConfig.defaults());
    }

    private JsonNode search(String query) throws IOException {
        return MAPPER.readTree(index.search(query));
    }

    private SearchResults results(String query) throws IOException {
        return index.search(index.getQueryParser().parse(query));
    }

    private static List<Object> field(SearchResults results, String name) {
        return results.getHits().stream().map(hit -> hit.getFirst(name)).collect(Collectors.toList());
    }

    @Test
    void shouldFindSingleCommittedDocument() throws IOException {
        // Arrange
        createIndex("{\"fields\": [{\"name\": \"title\", \"type\": \"text\", \"stored\": true}]}");
        index.addDocument("{\"title\": \"the dark knight\"}");
        index.commit();

        // Act
        JsonNode results = search("{\"type\": \"text\", \"query\": \"knight\", \"limit\": 10}");

        // Assert
        assertThat(results.get("count").asInt()).isEqualTo(1);
        assertThat(results.get("total_count").asInt()).isEqualTo(1);
        assertThat(results.get("results").get(0).get("title").asText()).isEqualTo("the dark knight");
        assertThat(results.get("results").get(0).get("_doc_id").asInt()).isZero();
        assertThat(index.numDocs()).isEqualTo(1);
    }

    @Test
    void shouldScoreWithBm25() throws IOException {
        createIndex("{\"fields\": [{\"name\": \"title\", \"type\": \"text\"}]}");
        index.addDocument("{\"title\": \"the dark knight\"}");
        index.commit();

        double score = search("{\"type\": \"text\", \"query\": \"knight\"}").get("results").get(0).get("_score")
            .asDouble();

        // one doc, term in it once, field of average length
        assertThat(score).isCloseTo(Math.log(1.0 + 0.5 / 1.5), within(1e-9));
    }

    @Test
    void shouldHonorLimitAcrossSegments() throws IOException {
        createIndex("{\"fields\": [{\"name\": \"title\", \"type\": \"text\"}]}");
        index.addDocument("{\"title\": \"knight\"}");
        index.commit();
        index.addDocument("{\"title\": \"the dark knight rises again\"}");
        index.commit();

        JsonNode results = search("{\"type\": \"text\", \"query\": \"knight\", \"limit\": 1}");

        assertThat(results.get("count").asInt()).isEqualTo(1);
        assertThat(results.get("total_count").asInt()).isEqualTo(2);
        assertThat(results.get("limit").asInt()).isEqualTo(1);
        assertThat(results.get("results").get(0).get("title").asText()).isEqualTo("knight");
    }

    @Test
    void shouldRankByScoreThenDocId() throws IOException {
        createIndex("{\"fields\": [{\"name\": \"title\", \"type\": \"text\"}, "
            + "{\"name\": \"n\", \"type\": \"i64\"}]}");
        index.addDocument("{\"title\": \"heat\", \"n\": 0}");
        index.addDocument("{\"title\": \"heat heat heat wave\", \"n\": 1}");
        index.addDocument("{\"title\": \"heat\", \"n\": 2}");
        index.addDocument("{\"title\": \"cold\", \"n\": 3}");
        index.commit();

        SearchResults results = results("{\"type\": \"text\", \"query\": \"heat\"}");

        assertThat(field(results, "n")).containsExactly(1L, 0L, 2L);
        assertThat(results.getHits().get(1).getScore()).isEqualTo(results.getHits().get(2).getScore());
    }

    @Test
    void shouldPageWithOffset() throws IOException {
        createIndex("{\"fields\": [{\"name\": \"n\", \"type\": \"i64\"}]}");
        for (int i = 0; i < 7; i++) {
            index.addDocument("{\"n\": " + i + "}");
        }
        index.commit();

        SearchResults page = results("{\"type\": \"all\", \"limit\": 3, \"offset\": 3}");

        assertThat(field(page, "n")).containsExactly(3L, 4L, 5L);
        assertThat(page.getTotalCount()).isEqualTo(7);
        assertThat(results("{\"type\": \"all\", \"offset\": 10}").getCount()).isZero();
    }

    @Test
    void shouldExcludeTombstonedDocuments() throws IOException {
        createIndex("{\"fields\": [{\"name\": \"id\", \"type\": \"string\"}, {\"name\": \"title\", \"type\": \"text\"}]}");
        index.addDocument("{\"id\": \"a\", \"title\": \"dark knight\"}");
        index.addDocument("{\"id\": \"b\", \"title\": \"dark city\"}");
        index.commit();
        index.deleteDocuments("id", "a");
        index.commit();

        SearchResults results = results("{\"type\": \"text\", \"query\": \"dark\"}");

        assertThat(field(results, "id")).containsExactly("b");
        assertThat(results.getTotalCount()).isEqualTo(1);
        assertThat(results("{\"type\": \"all\"}").getTotalCount()).isEqualTo(1);
    }

    @Test
    void shouldMatchPhrasesOnlyInOrder() throws IOException {
        createIndex("{\"fields\": [{\"name\": \"title\", \"type\": \"text\"}]}");
        index.addDocument("{\"title\": \"The Lord of the Rings\"}");
        index.addDocument("{\"title\": \"Rings of the Lord\"}");
        index.addDocument("{\"title\": [\"lord of\", \"the rings\"]}");
        index.commit();

        SearchResults results = results("{\"type\": \"phrase\", \"phrase\": \"Lord of the Rings\"}");

        assertThat(results.getHits()).extracting(SearchHit::getDocId).containsExactly(0);
        assertThat(results("{\"type\": \"phrase\", \"phrase\": \"rings\"}").getTotalCount()).isEqualTo(3);
    }

    @Test
    void shouldMatchPrefixesAndFuzzyTerms() throws IOException {
        createIndex("{\"fields\": [{\"name\": \"title\", \"type\": \"text\"}]}");
        index.addDocument("{\"title\": \"Star Wars\"}");
        index.addDocument("{\"title\": \"Stardust\"}");
        index.addDocument("{\"title\": \"The Godfather\"}");
        index.addDocument("{\"title\": \"Heat\"}");
        index.commit();

        assertThat(results("{\"type\": \"prefix\", \"prefix\": \"STAR\"}").getTotalCount()).isEqualTo(2);
        assertThat(results("{\"type\": \"fuzzy\", \"term\": \"godfahter\"}").getHits())
            .extracting(SearchHit::getDocId).containsExactly(2);
        // short words allow a single edit
        assertThat(results("{\"type\": \"fuzzy\", \"term\": \"hat\", \"distance\": 2}").getTotalCount()).isEqualTo(1);
        assertThat(results("{\"type\": \"fuzzy\", \"term\": \"ht\", \"distance\": 2}").getTotalCount()).isZero();
        assertThat(results("{\"type\": \"fuzzy\", \"term\": \"star wasr\"}").getHits())
            .extracting(SearchHit::getDocId).containsExactly(0);
        assertThat(results("{\"type\": \"fuzzy\", \"term\": \"godfather\", \"distance\": 0}").getTotalCount())
            .isEqualTo(1);
    }

    @Test
    void shouldMatchExactTermsAndRanges() throws IOException {
        createIndex("{\"fields\": [{\"name\": \"genre\", \"type\": \"string\"},"
            + "{\"name\": \"year\", \"type\": \"i64\", \"fast\": true},"
            + "{\"name\": \"rating\", \"type\": \"f64\", \"fast\": true}]}");
        index.addDocument("{\"genre\": \"Drama\", \"year\": 1994, \"rating\": 9.3}");
        index.addDocument("{\"genre\": \"Crime Drama\", \"year\": 1972, \"rating\": 9.2}");
        index.addDocument("{\"genre\": \"drama\", \"year\": 2008}");
        index.commit();

        assertThat(results("{\"type\": \"term_match\", \"field\": \"genre\", \"value\": \"Drama\"}").getHits())
            .extracting(SearchHit::getDocId).containsExactly(0);
        assertThat(results("{\"type\": \"term_match\", \"field\": \"year\", \"value\": 1972}").getHits())
            .extracting(SearchHit::getDocId).containsExactly(1);
        assertThat(results("{\"type\": \"term_match\", \"field\": \"rating\", \"value\": 9.3}").getTotalCount())
            .isEqualTo(1);
        assertThat(results("{\"type\": \"range_i64\", \"field\": \"year\", \"min\": 1972, \"max\": 1994}")
            .getTotalCount()).isEqualTo(2);
        assertThat(results("{\"type\": \"range_i64\", \"field\": \"year\", \"min\": 2000}").getTotalCount())
            .isEqualTo(1);
        assertThat(results("{\"type\": \"range_f64\", \"field\": \"rating\", \"max\": 9.25}").getHits())
            .extracting(SearchHit::getDocId).containsExactly(1);
        assertThat(results("{\"type\": \"range_i64\", \"field\": \"year\", \"min\": 2000, \"max\": 1990}")
            .getTotalCount()).isZero();
    }

    @Test
    void shouldCombineBooleanClauses() throws IOException {
        createIndex("{\"fields\": [{\"name\": \"title\", \"type\": \"text\"},"
            + "{\"name\": \"year\", \"type\": \"i64\", \"fast\": true}]}");
        index.addDocument("{\"title\": \"The Dark Knight\", \"year\": 2008}");
        index.addDocument("{\"title\": \"The Dark Knight Rises\", \"year\": 2012}");
        index.addDocument("{\"title\": \"Dark City\", \"year\": 1998}");
        index.commit();

        SearchResults mustAndNot = results("{\"type\": \"bool\","
            + "\"must\": [{\"type\": \"text\", \"query\": \"dark\"}],"
            + "\"must_not\": [{\"type\": \"range_i64\", \"field\": \"year\", \"min\": 2010}]}");
        assertThat(mustAndNot.getHits()).extracting(SearchHit::getDocId).containsExactlyInAnyOrder(0, 2);

        SearchResults boosted = results("{\"type\": \"bool\","
            + "\"must\": [{\"type\": \"text\", \"query\": \"dark\"}],"
            + "\"should\": [{\"type\": \"text\", \"query\": \"city\"}]}");
        assertThat(boosted.getHits().get(0).getDocId()).isEqualTo(2);
        assertThat(boosted.getTotalCount()).isEqualTo(3);

        assertThat(results("{\"type\": \"bool\", \"must_not\": [{\"type\": \"all\"}]}").getTotalCount()).isZero();
        assertThat(results("{\"type\": \"bool\"}").getTotalCount()).isZero();
    }

    @Test
    void shouldStemWithEnglishTokenizer() throws IOException {
        createIndex("{\"fields\": [{\"name\": \"body\", \"type\": \"text\", \"tokenizer\": \"en_stem\"}]}");
        index.addDocument("{\"body\": \"Frodo carries the ring\"}");
        index.commit();

        assertThat(results("{\"type\": \"text\", \"query\": \"rings carried\"}").getTotalCount()).isEqualTo(1);
    }

    @Test
    void shouldReturnMultiValuedFieldsAsArrays() throws IOException {
        createIndex("{\"fields\": [{\"name\": \"tags\", \"type\": \"string\"}, {\"name\": \"title\", \"type\": \"text\"}]}");
        index.addDocument("{\"title\": \"Heat\", \"tags\": [\"crime\", \"heist\"]}");
        index.commit();

        JsonNode hit = search("{\"type\": \"text\", \"query\": \"heat\"}").get("results").get(0);

        assertThat(hit.get("tags").isArray()).isTrue();
        assertThat(hit.get("tags").get(1).asText()).isEqualTo("heist");
        assertThat(hit.get("title").isTextual()).isTrue();
    }

    @Test
    void shouldProduceIdenticalResultsForIdenticalIndexes() throws IOException {
        String schema = "{\"fields\": [{\"name\": \"title\", \"type\": \"text\"}]}";
        String[] titles = {"dark knight", "knight of cups", "dark city", "the knight before christmas"};
        String query = "{\"type\": \"text\", \"query\": \"dark knight\"}";

        String[] outputs = new String[2];
        for (int run = 0; run < 2; run++) {
            try (SearchIndex copy = SearchIndex.create(tempDir.resolve("run" + run), schema, IndexConfig.defaults())) {
                for (String title : titles) {
                    copy.addDocument("{\"title\": \"" + title + "\"}");
                }
                copy.commit();
                outputs[run] = copy.search(query);
            }
        }

        assertThat(outputs[0]).isEqualTo(outputs[1]);
    }
}

package com.jsearch.ffi;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

class SearchBridgeTest {
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String SCHEMA = "{\"fields\": ["
        + "{\"name\": \"id\", \"type\": \"string\"},"
        + "{\"name\": \"title\", \"type\": \"text\"},"
        + "{\"name\": \"year\", \"type\": \"i64\", \"fast\": true}]}";

    @TempDir
    Path tempDir;

    private ErrorOut err;
    private long handle;

    @BeforeEach
    void setUp() {
        err = new ErrorOut();
        handle = SearchBridge.createIndex(tempDir.resolve("index").toString(), SCHEMA, err);
        assertThat(err.isSet()).as(err.toString()).isFalse();
        assertThat(handle).isPositive();
    }

    @AfterEach
    void tearDown() {
        SearchBridge.freeIndex(handle);
    }

    @Test
    void shouldIndexCommitAndSearch() throws IOException {
        // Arrange
        assertThat(SearchBridge.addDocument(handle, "{\"id\": \"a\", \"title\": \"the dark knight\", \"year\": 2008}",
            err)).isZero();
        assertThat(SearchBridge.numDocs(handle)).isZero();

        // Act
        int committed = SearchBridge.commit(handle, err);
        String json = SearchBridge.search(handle, "{\"type\": \"text\", \"query\": \"knight\", \"limit\": 10}", err);

        // Assert
        assertThat(committed).isZero();
        assertThat(err.isSet()).isFalse();
        assertThat(SearchBridge.numDocs(handle)).isEqualTo(1);
        JsonNode results = MAPPER.readTree(json);
        assertThat(results.get("count").asInt()).isEqualTo(1);
        assertThat(results.get("results").get(0).get("id").asText()).isEqualTo("a");
    }

    @Test
    void shouldDeleteByStringAndNumericTerms() {
        SearchBridge.addDocument(handle, "{\"id\": \"a\", \"year\": 2008}", err);
        SearchBridge.addDocument(handle, "{\"id\": \"b\", \"year\": 1999}", err);
        SearchBridge.addDocument(handle, "{\"id\": \"c\", \"year\": 1999}", err);
        SearchBridge.commit(handle, err);

        assertThat(SearchBridge.deleteDocuments(handle, "{\"field\": \"id\", \"value\": \"a\"}", err)).isZero();
        assertThat(SearchBridge.deleteDocuments(handle, "{\"field\": \"year\", \"value\": 1999}", err)).isZero();
        assertThat(SearchBridge.numDocs(handle)).isEqualTo(3);
        SearchBridge.commit(handle, err);

        assertThat(err.isSet()).as(err.toString()).isFalse();
        assertThat(SearchBridge.numDocs(handle)).isZero();
    }

    @Test
    void shouldReportErrorKinds() {
        SearchBridge.createIndex(tempDir.resolve("bad").toString(), "{\"fields\": []}", err);
        assertThat(err.getKind()).isEqualTo(ErrorKind.SCHEMA);

        err.clear();
        assertThat(SearchBridge.addDocument(handle, "{\"year\": \"soon\"}", err)).isEqualTo(-1);
        assertThat(err.getKind()).isEqualTo(ErrorKind.DOCUMENT);
        assertThat(err.getMessage()).contains("year");

        err.clear();
        assertThat(SearchBridge.search(handle, "{\"type\": \"nope\"}", err)).isNull();
        assertThat(err.getKind()).isEqualTo(ErrorKind.QUERY);

        err.clear();
        assertThat(SearchBridge.deleteDocuments(handle, "{\"field\": \"id\"}", err)).isEqualTo(-1);
        assertThat(err.getKind()).isEqualTo(ErrorKind.QUERY);

        err.clear();
        assertThat(SearchBridge.deleteDocuments(handle, "{\"field\": \"year\", \"value\": 18446744073709551616}",
            err)).isEqualTo(-1);
        assertThat(err.getKind()).isEqualTo(ErrorKind.QUERY);

        err.clear();
        assertThat(SearchBridge.createIndex(tempDir.resolve("index").toString(), SCHEMA, err)).isZero();
        assertThat(err.getKind()).isEqualTo(ErrorKind.ALREADY_EXISTS);

        err.clear();
        assertThat(SearchBridge.openIndex(tempDir.resolve("missing").toString(), err)).isZero();
        assertThat(err.getKind()).isEqualTo(ErrorKind.NOT_FOUND);

        err.clear();
        assertThat(SearchBridge.createIndex("", SCHEMA, err)).isZero();
        assertThat(err.getKind()).isEqualTo(ErrorKind.INTERNAL);
    }

    @Test
    void shouldRejectUnknownHandles() {
        long unknown = handle + 1_000_000;

        assertThat(SearchBridge.addDocument(unknown, "{}", err)).isEqualTo(-1);
        assertThat(err.getKind()).isEqualTo(ErrorKind.INVALID_HANDLE);
        err.clear();
        assertThat(SearchBridge.commit(unknown, err)).isEqualTo(-1);
        assertThat(err.getKind()).isEqualTo(ErrorKind.INVALID_HANDLE);
        err.clear();
        assertThat(SearchBridge.search(unknown, "{\"type\": \"all\"}", err)).isNull();
        assertThat(err.getKind()).isEqualTo(ErrorKind.INVALID_HANDLE);
        assertThat(SearchBridge.numDocs(unknown)).isZero();
        assertThat(SearchBridge.numDocs(0)).isZero();
    }

    @Test
    void shouldInvalidateHandleOnFreeAndReopen() {
        SearchBridge.addDocument(handle, "{\"id\": \"a\", \"title\": \"heat\"}", err);
        SearchBridge.commit(handle, err);
        int open = SearchBridge.openHandles();

        SearchBridge.freeIndex(handle);
        SearchBridge.freeIndex(handle);

        assertThat(SearchBridge.openHandles()).isEqualTo(open - 1);
        assertThat(SearchBridge.commit(handle, err)).isEqualTo(-1);
        assertThat(err.getKind()).isEqualTo(ErrorKind.INVALID_HANDLE);

        err.clear();
        handle = SearchBridge.openIndex(tempDir.resolve("index").toString(), err);
        assertThat(err.isSet()).isFalse();
        assertThat(SearchBridge.numDocs(handle)).isEqualTo(1);
    }

    @Test
    void shouldMapErrorKindCodes() {
        assertThat(ErrorKind.fromValue(ErrorKind.QUERY.getValue())).isEqualTo(ErrorKind.QUERY);
        assertThat(ErrorKind.of(new IOException("disk"))).isEqualTo(ErrorKind.IO);
        assertThat(ErrorKind.of(new IllegalStateException("bug"))).isEqualTo(ErrorKind.INTERNAL);
    }
}

package com.jsearch.ffi;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jsearch.common.errors.QueryException;
import com.jsearch.index.IndexConfig;
import com.jsearch.index.SearchIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Flat, handle-based entry points for callers outside the JVM's object
 * model (JNI, Panama or a thin RPC shim). Nothing here throws: failures set
 * the {@link ErrorOut} and return 0, -1 or null.
 */
public final class SearchBridge {
    private static final Logger logger = LoggerFactory.getLogger(SearchBridge.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final HandleRegistry<SearchIndex> INDEXES = new HandleRegistry<>();

    private SearchBridge() {
    }

    /**
     * @return A handle to the new index, or 0 on failure
     */
    public static long createIndex(String path, String schemaJson, ErrorOut err) {
        try {
            SearchIndex index = SearchIndex.create(toPath(path), schemaJson == null ? "" : schemaJson,
                IndexConfig.defaults());
            return INDEXES.register(index);
        } catch (Exception e) {
            report(err, e);
            return 0;
        }
    }

    /**
     * @return A handle to the opened index, or 0 on failure
     */
    public static long openIndex(String path, ErrorOut err) {
        try {
            return INDEXES.register(SearchIndex.open(toPath(path)));
        } catch (Exception e) {
            report(err, e);
            return 0;
        }
    }

    /**
     * @return 0 on success, -1 on failure
     */
    public static int addDocument(long handle, String docJson, ErrorOut err) {
        SearchIndex index = lookup(handle, err);
        if (index == null) {
            return -1;
        }
        try {
            index.addDocument(docJson == null ? "" : docJson);
            return 0;
        } catch (Exception e) {
            report(err, e);
            return -1;
        }
    }

    /**
     * Deletes by term, given as {@code {"field": "id", "value": "tt0133093"}}.
     *
     * @return 0 on success, -1 on failure
     */
    public static int deleteDocuments(long handle, String termJson, ErrorOut err) {
        SearchIndex index = lookup(handle, err);
        if (index == null) {
            return -1;
        }
        try {
            JsonNode term = parseTerm(termJson);
            Object value = term.get("value").isNumber() ? term.get("value").numberValue() : term.get("value").asText();
            index.deleteDocuments(term.get("field").asText(), value);
            return 0;
        } catch (Exception e) {
            report(err, e);
            return -1;
        }
    }

    private static JsonNode parseTerm(String termJson) {
        JsonNode term;
        try {
            term = MAPPER.readTree(termJson == null ? "" : termJson);
        } catch (JsonProcessingException e) {
            throw new QueryException("Delete term is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (term == null || !term.isObject() || !term.hasNonNull("field") || !term.get("field").isTextual()
                || !term.hasNonNull("value") || !(term.get("value").isTextual() || term.get("value").isNumber())) {
            throw new QueryException("Delete term must look like {\"field\": \"name\", \"value\": \"term\"}");
        }
        if (term.get("value").isIntegralNumber() && !term.get("value").canConvertToLong()) {
            throw new QueryException("Delete term value is out of the i64 range: " + term.get("value"));
        }
        return term;
    }

    /**
     * @return 0 on success, -1 on failure
     */
    public static int commit(long handle, ErrorOut err) {
        SearchIndex index = lookup(handle, err);
        if (index == null) {
            return -1;
        }
        try {
            index.commit();
            return 0;
        } catch (Exception e) {
            report(err, e);
            return -1;
        }
    }

    /**
     * Live documents in the last commit; 0 for an unknown handle.
     */
    public static long numDocs(long handle) {
        SearchIndex index = INDEXES.get(handle);
        if (index == null) {
            return 0;
        }
        try {
            return index.numDocs();
        } catch (IllegalStateException e) {
            logger.debug("numDocs on closed index handle {}", handle);
            return 0;
        }
    }

    /**
     * @return The results as JSON, or null on failure
     */
    public static String search(long handle, String queryJson, ErrorOut err) {
        SearchIndex index = lookup(handle, err);
        if (index == null) {
            return null;
        }
        try {
            return index.search(queryJson == null ? "" : queryJson);
        } catch (Exception e) {
            report(err, e);
            return null;
        }
    }

    /**
     * Closes the index and invalidates the handle. Unknown handles are ignored.
     */
    public static void freeIndex(long handle) {
        SearchIndex index = INDEXES.release(handle);
        if (index == null) {
            return;
        }
        try {
            index.close();
        } catch (IOException e) {
            logger.error("Failed to close index handle {}", handle, e);
        }
    }

    static int openHandles() {
        return INDEXES.size();
    }

    private static SearchIndex lookup(long handle, ErrorOut err) {
        SearchIndex index = INDEXES.get(handle);
        if (index == null) {
            set(err, ErrorKind.INVALID_HANDLE, "Invalid index handle: " + handle);
        }
        return index;
    }

    private static Path toPath(String path) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("Index path cannot be empty");
        }
        try {
            return Paths.get(path);
        } catch (InvalidPathException e) {
            throw new IllegalArgumentException("Invalid index path: " + path, e);
        }
    }

    private static void report(ErrorOut err, Exception e) {
        ErrorKind kind = ErrorKind.of(e);
        if (kind == ErrorKind.INTERNAL) {
            logger.error("Unexpected failure in bridge call", e);
        } else {
            logger.debug("Bridge call failed: {}", e.toString());
        }
        set(err, kind, e.getMessage());
    }

    private static void set(ErrorOut err, ErrorKind kind, String message) {
        if (err != null) {
            err.set(kind, message);
        }
    }
}

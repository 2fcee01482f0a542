package com.jsearch.index;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jsearch.common.IndexConstants;
import com.jsearch.common.errors.CorruptIndexException;
import com.jsearch.common.errors.IndexNotFoundException;
import com.jsearch.common.errors.SchemaException;
import com.jsearch.common.io.AtomicFiles;
import com.jsearch.common.schema.Schema;
import com.jsearch.common.schema.SchemaParser;
import com.jsearch.segment.SegmentInfo;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Set;

/**
 * Reads and writes the two JSON files at the index root.
 */
public final class ManifestStore {
    private static final ObjectMapper MAPPER = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private ManifestStore() {
    }

    public static boolean exists(Path indexDirectory) {
        return Files.exists(indexDirectory.resolve(IndexConstants.MANIFEST_FILE));
    }

    public static Manifest readManifest(Path indexDirectory) throws IOException {
        Path path = indexDirectory.resolve(IndexConstants.MANIFEST_FILE);
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(path);
        } catch (NoSuchFileException e) {
            throw new IndexNotFoundException("No manifest in " + indexDirectory);
        }
        Manifest manifest;
        try {
            manifest = MAPPER.readValue(bytes, Manifest.class);
        } catch (JsonProcessingException e) {
            throw new CorruptIndexException("Unparsable manifest: " + e.getOriginalMessage(), path, e);
        }
        validate(manifest, path);
        return manifest;
    }

    private static void validate(Manifest manifest, Path path) throws CorruptIndexException {
        if (manifest.getFormatVersion() != IndexConstants.FORMAT_VERSION) {
            throw new CorruptIndexException("Unsupported manifest version " + manifest.getFormatVersion(), path);
        }
        Set<String> names = new HashSet<>();
        for (SegmentInfo segment : manifest.getSegments()) {
            if (!names.add(segment.getName())) {
                throw new CorruptIndexException("Segment " + segment.getName() + " listed twice", path);
            }
            if (segment.getMaxDoc() < 1 || segment.getDelCount() < 0 || segment.getDelCount() >= segment.getMaxDoc()
                    || (segment.getDelGen() == 0) != (segment.getDelCount() == 0)) {
                throw new CorruptIndexException("Invalid segment entry " + segment, path);
            }
        }
    }

    /**
     * Durably replaces the manifest.
     */
    public static void writeManifest(Path indexDirectory, Manifest manifest) throws IOException {
        byte[] bytes = MAPPER.writerWithDefaultPrettyPrinter().writeValueAsBytes(manifest);
        AtomicFiles.write(indexDirectory.resolve(IndexConstants.MANIFEST_FILE), bytes);
    }

    public static Schema readSchema(Path indexDirectory) throws IOException {
        Path path = indexDirectory.resolve(IndexConstants.SCHEMA_FILE);
        String json;
        try {
            json = Files.readString(path, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            throw new IndexNotFoundException("No schema in " + indexDirectory);
        }
        try {
            return SchemaParser.parse(json);
        } catch (SchemaException e) {
            throw new CorruptIndexException("Invalid stored schema: " + e.getMessage(), path, e);
        }
    }

    public static void writeSchema(Path indexDirectory, Schema schema) throws IOException {
        AtomicFiles.write(indexDirectory.resolve(IndexConstants.SCHEMA_FILE), SchemaParser.toBytes(schema));
    }
}

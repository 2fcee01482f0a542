package com.jsearch.segment;

import com.jsearch.common.compression.CompressionCodec;
import com.jsearch.common.schema.FieldType;
import com.jsearch.common.schema.Schema;
import com.jsearch.document.Document;
import com.jsearch.document.DocumentEncoder;

import java.io.IOException;
import java.nio.file.Path;
import java.util.BitSet;

/**
 * Shared schema and helpers for writing small segments in tests.
 */
public final class SegmentTestSupport {
    public static final Schema MOVIES = new Schema.Builder()
        .addField("id", FieldType.TEXT, true, true, false, "raw")
        .addTextField("title", true)
        .addField("year", FieldType.I64, true, true, true, "default")
        .addField("rating", FieldType.F64, true, true, true, "default")
        .build();

    private SegmentTestSupport() {
    }

    public static Document movie(String id, String title, long year, double rating) {
        return new Document().add("id", id).add("title", title).add("year", year).add("rating", rating);
    }

    /**
     * Flushes the documents as one segment and opens a reader on it. Closing
     * the returned reader releases the segment files.
     */
    public static SegmentReader writeSegment(Path indexDirectory, String name, Document... documents)
            throws IOException {
        SegmentWriter writer = new SegmentWriter(MOVIES);
        DocumentEncoder encoder = new DocumentEncoder(MOVIES);
        for (Document document : documents) {
            writer.addDocument(encoder.encode(document));
        }
        SegmentInfo info = writer.flush(indexDirectory, name, CompressionCodec.SNAPPY, 64);
        return open(indexDirectory, info, new BitSet());
    }

    public static SegmentReader open(Path indexDirectory, SegmentInfo info, BitSet deleted) throws IOException {
        SegmentCore core = SegmentCore.open(indexDirectory, info.getName(), info.getMaxDoc(), MOVIES);
        SegmentReader reader = new SegmentReader(core, info, deleted);
        // the reader now holds the only reference
        core.decRef();
        return reader;
    }
}

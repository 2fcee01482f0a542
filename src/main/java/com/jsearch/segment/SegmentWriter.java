package com.jsearch.segment;

import com.jsearch.common.compression.CompressionCodec;
import com.jsearch.common.schema.Field;
import com.jsearch.common.schema.Schema;
import com.jsearch.document.EncodedDocument;
import com.jsearch.document.EncodedField;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * In-memory buffer of encoded documents that flushes into one immutable
 * segment. Not thread safe; the index serializes access.
 */
public class SegmentWriter {
    private static final Logger logger = LoggerFactory.getLogger(SegmentWriter.class);

    private final Schema schema;
    private final List<Field> postingsFields = new ArrayList<>();
    private final Map<Integer, TreeMap<String, PostingsBuffer>> postings = new HashMap<>();
    private final Map<Integer, IntArrayBuffer> lengths = new HashMap<>();
    private final Map<Integer, long[]> columnValues = new HashMap<>();
    private final Map<Integer, BitSet> columnPresence = new HashMap<>();
    private final List<byte[]> storedPayloads = new ArrayList<>();
    private final BitSet deleted = new BitSet();
    private int numDocs;

    public SegmentWriter(Schema schema) {
        this.schema = schema;
        for (Field field : schema.getFields()) {
            if (field.hasPostings()) {
                postingsFields.add(field);
            }
        }
    }

    /**
     * Buffers a document.
     *
     * @return The buffer-local doc id
     */
    public int addDocument(EncodedDocument document) {
        int doc = numDocs++;
        for (EncodedField field : document.getFields()) {
            TreeMap<String, PostingsBuffer> terms = postings.computeIfAbsent(field.getFieldOrdinal(), k -> new TreeMap<>());
            for (Map.Entry<String, int[]> entry : field.getTermPositions().entrySet()) {
                terms.computeIfAbsent(entry.getKey(), k -> new PostingsBuffer()).add(doc, entry.getValue());
            }
            lengths.computeIfAbsent(field.getFieldOrdinal(), k -> new IntArrayBuffer()).set(doc, field.getLength());
        }
        for (Map.Entry<Integer, Long> entry : document.getColumnValues().entrySet()) {
            long[] values = columnValues.computeIfAbsent(entry.getKey(), k -> new long[16]);
            if (doc >= values.length) {
                values = Arrays.copyOf(values, Math.max(values.length * 2, doc + 1));
                columnValues.put(entry.getKey(), values);
            }
            values[doc] = entry.getValue();
            columnPresence.computeIfAbsent(entry.getKey(), k -> new BitSet()).set(doc);
        }
        storedPayloads.add(document.getStoredPayload());
        return doc;
    }

    /**
     * Marks every buffered document the term selects as deleted.
     *
     * @return How many documents were newly marked
     */
    public int deleteDocuments(DeleteTerm term) {
        int before = deleted.cardinality();
        int ordinal = term.getField().getOrdinal();
        if (term.isTextual()) {
            TreeMap<String, PostingsBuffer> terms = postings.get(ordinal);
            PostingsBuffer buffer = terms == null ? null : terms.get(term.getTerm());
            if (buffer != null) {
                for (int i = 0; i < buffer.docCount(); i++) {
                    deleted.set(buffer.doc(i));
                }
            }
        } else {
            BitSet present = columnPresence.get(ordinal);
            if (present != null) {
                long[] values = columnValues.get(ordinal);
                for (int doc = present.nextSetBit(0); doc >= 0; doc = present.nextSetBit(doc + 1)) {
                    if (term.matchesRaw(values[doc])) {
                        deleted.set(doc);
                    }
                }
            }
        }
        return deleted.cardinality() - before;
    }

    public int numBufferedDocs() {
        return numDocs;
    }

    public int numLiveDocs() {
        return numDocs - deleted.cardinality();
    }

    public boolean isEmpty() {
        return numDocs == 0;
    }

    /**
     * Writes the live buffered documents as segment {@code name}. The buffer
     * is left untouched whether this succeeds or fails; call {@link #reset()}
     * once the segment has been accepted.
     *
     * @return The new segment's info, or null if no buffered doc is live
     * @throws IOException If writing fails; no segment directory is left behind
     */
    public SegmentInfo flush(Path indexDirectory, String name, CompressionCodec codec, int storeBlockSize)
            throws IOException {
        int[] docMap = new int[numDocs];
        int maxDoc = 0;
        for (int doc = 0; doc < numDocs; doc++) {
            docMap[doc] = deleted.get(doc) ? -1 : maxDoc++;
        }
        if (maxDoc == 0) {
            logger.debug("Nothing live to flush for {} ({} buffered docs all deleted)", name, numDocs);
            return null;
        }
        final int segmentDocs = maxDoc;
        SegmentFiles.write(indexDirectory, name, directory -> {
            writeTerms(directory, docMap);
            writeNorms(directory, docMap, segmentDocs);
            writeColumns(directory, docMap, segmentDocs);
            try (StoredFieldsWriter stored = new StoredFieldsWriter(directory, codec, storeBlockSize)) {
                for (int doc = 0; doc < numDocs; doc++) {
                    if (docMap[doc] >= 0) {
                        stored.addDocument(storedPayloads.get(doc));
                    }
                }
                stored.finish(segmentDocs);
            }
        });
        logger.info("Flushed segment {} with {} docs", name, maxDoc);
        return SegmentInfo.newSegment(name, maxDoc);
    }

    private void writeTerms(Path directory, int[] docMap) throws IOException {
        try (TermsWriter writer = new TermsWriter(directory, postingsFields.size())) {
            for (Field field : postingsFields) {
                writer.startField(field.getOrdinal());
                BitSet docsWithField = new BitSet();
                TreeMap<String, PostingsBuffer> terms = postings.get(field.getOrdinal());
                if (terms != null) {
                    for (Map.Entry<String, PostingsBuffer> entry : terms.entrySet()) {
                        Postings remapped = entry.getValue().toPostings(docMap);
                        if (remapped == null) {
                            continue;
                        }
                        for (int i = 0; i < remapped.size(); i++) {
                            docsWithField.set(remapped.doc(i));
                        }
                        writer.addTerm(entry.getKey(), remapped);
                    }
                }
                writer.finishField(docsWithField.cardinality());
            }
            writer.finish();
        }
    }

    private void writeNorms(Path directory, int[] docMap, int maxDoc) throws IOException {
        Map<Integer, int[]> norms = new HashMap<>();
        for (Field field : postingsFields) {
            if (!field.hasNorms()) {
                continue;
            }
            IntArrayBuffer fieldLengths = lengths.get(field.getOrdinal());
            int[] remapped = new int[maxDoc];
            for (int doc = 0; doc < numDocs; doc++) {
                if (docMap[doc] >= 0 && fieldLengths != null && doc < fieldLengths.size()) {
                    remapped[docMap[doc]] = fieldLengths.get(doc);
                }
            }
            norms.put(field.getOrdinal(), remapped);
        }
        NormsFile.write(directory, norms, maxDoc);
    }

    private void writeColumns(Path directory, int[] docMap, int maxDoc) throws IOException {
        Map<Integer, NumericColumn> columns = new HashMap<>();
        for (Field field : schema.getFields()) {
            if (!field.hasColumn()) {
                continue;
            }
            long[] values = new long[maxDoc];
            BitSet present = new BitSet(maxDoc);
            BitSet buffered = columnPresence.get(field.getOrdinal());
            if (buffered != null) {
                long[] bufferedValues = columnValues.get(field.getOrdinal());
                for (int doc = buffered.nextSetBit(0); doc >= 0; doc = buffered.nextSetBit(doc + 1)) {
                    if (docMap[doc] >= 0) {
                        values[docMap[doc]] = bufferedValues[doc];
                        present.set(docMap[doc]);
                    }
                }
            }
            columns.put(field.getOrdinal(), new NumericColumn(field.getType(), values, present));
        }
        ColumnsFile.write(directory, columns, maxDoc);
    }

    /**
     * Drops everything buffered.
     */
    public void reset() {
        postings.clear();
        lengths.clear();
        columnValues.clear();
        columnPresence.clear();
        storedPayloads.clear();
        deleted.clear();
        numDocs = 0;
    }
}

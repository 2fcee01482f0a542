package com.jsearch.merge;

import com.jsearch.common.compression.CompressionCodec;
import com.jsearch.common.schema.Field;
import com.jsearch.common.schema.Schema;
import com.jsearch.segment.ColumnsFile;
import com.jsearch.segment.IntArrayBuffer;
import com.jsearch.segment.NormsFile;
import com.jsearch.segment.NumericColumn;
import com.jsearch.segment.Postings;
import com.jsearch.segment.SegmentFiles;
import com.jsearch.segment.SegmentInfo;
import com.jsearch.segment.SegmentReader;
import com.jsearch.segment.StoredFieldsWriter;
import com.jsearch.segment.TermDictionary;
import com.jsearch.segment.TermsWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;

/**
 * Merges segments into one. Surviving documents are renumbered
 * contiguously in input order; tombstoned documents are dropped. Term
 * dictionaries are combined with a k-way merge over per-input term cursors.
 */
public class SegmentMerger {
    private static final Logger logger = LoggerFactory.getLogger(SegmentMerger.class);

    private final Schema schema;
    private final CompressionCodec codec;
    private final int storeBlockSize;

    public SegmentMerger(Schema schema, CompressionCodec codec, int storeBlockSize) {
        this.schema = schema;
        this.codec = codec;
        this.storeBlockSize = storeBlockSize;
    }

    /**
     * Writes the merge of {@code inputs} as segment {@code name}.
     *
     * @throws IOException If reading an input or writing the output fails; no
     *                     output directory is left behind
     */
    public MergeResult merge(Path indexDirectory, String name, List<SegmentReader> inputs) throws IOException {
        List<int[]> docMaps = new ArrayList<>(inputs.size());
        int maxDoc = 0;
        for (SegmentReader input : inputs) {
            int[] docMap = new int[input.maxDoc()];
            for (int doc = 0; doc < docMap.length; doc++) {
                docMap[doc] = input.isDeleted(doc) ? -1 : maxDoc++;
            }
            docMaps.add(docMap);
        }
        if (maxDoc == 0) {
            logger.info("Merge of {} has no live documents, nothing written", inputs);
            return new MergeResult(null, docMaps);
        }
        final int mergedDocs = maxDoc;
        SegmentFiles.write(indexDirectory, name, directory -> {
            mergeTerms(directory, inputs, docMaps);
            mergeNorms(directory, inputs, docMaps, mergedDocs);
            mergeColumns(directory, inputs, docMaps, mergedDocs);
            mergeStoredFields(directory, inputs, docMaps, mergedDocs);
        });
        logger.info("Merged {} segments into {} with {} docs", inputs.size(), name, mergedDocs);
        return new MergeResult(SegmentInfo.newSegment(name, mergedDocs), docMaps);
    }

    private void mergeTerms(Path directory, List<SegmentReader> inputs, List<int[]> docMaps) throws IOException {
        List<Field> postingsFields = new ArrayList<>();
        for (Field field : schema.getFields()) {
            if (field.hasPostings()) {
                postingsFields.add(field);
            }
        }
        try (TermsWriter writer = new TermsWriter(directory, postingsFields.size())) {
            for (Field field : postingsFields) {
                writer.startField(field.getOrdinal());
                writer.finishField(mergeField(writer, field.getOrdinal(), inputs, docMaps));
            }
            writer.finish();
        }
    }

    /**
     * @return Number of merged docs that have the field
     */
    private static int mergeField(TermsWriter writer, int fieldOrdinal, List<SegmentReader> inputs,
                                  List<int[]> docMaps) throws IOException {
        PriorityQueue<TermCursor> queue = new PriorityQueue<>();
        for (int i = 0; i < inputs.size(); i++) {
            TermDictionary dictionary = inputs.get(i).terms(fieldOrdinal);
            if (dictionary != null && dictionary.size() > 0) {
                queue.add(new TermCursor(i, dictionary));
            }
        }
        BitSet docsWithField = new BitSet();
        List<TermCursor> matching = new ArrayList<>();
        while (!queue.isEmpty()) {
            String term = queue.peek().term();
            matching.clear();
            while (!queue.isEmpty() && queue.peek().term().equals(term)) {
                matching.add(queue.poll());
            }
            // the queue breaks ties by input index, so matching is in input order
            IntArrayBuffer docs = new IntArrayBuffer();
            IntArrayBuffer freqs = new IntArrayBuffer();
            IntArrayBuffer positions = new IntArrayBuffer();
            IntArrayBuffer starts = new IntArrayBuffer();
            for (TermCursor cursor : matching) {
                Postings postings = inputs.get(cursor.input).postings(cursor.dictionary, cursor.index);
                int[] docMap = docMaps.get(cursor.input);
                for (int i = 0; i < postings.size(); i++) {
                    int newDoc = docMap[postings.doc(i)];
                    if (newDoc < 0) {
                        continue;
                    }
                    starts.add(positions.size());
                    docs.add(newDoc);
                    freqs.add(postings.freq(i));
                    positions.addAll(postings.positions(i));
                    docsWithField.set(newDoc);
                }
                if (cursor.advance()) {
                    queue.add(cursor);
                }
            }
            if (docs.size() > 0) {
                starts.add(positions.size());
                writer.addTerm(term, new Postings(docs.toArray(), freqs.toArray(), positions.toArray(),
                    starts.toArray()));
            }
        }
        return docsWithField.cardinality();
    }

    private void mergeNorms(Path directory, List<SegmentReader> inputs, List<int[]> docMaps, int maxDoc)
            throws IOException {
        Map<Integer, int[]> merged = new HashMap<>();
        for (Field field : schema.getFields()) {
            if (!field.hasNorms()) {
                continue;
            }
            int[] lengths = new int[maxDoc];
            for (int i = 0; i < inputs.size(); i++) {
                int[] inputLengths = inputs.get(i).norms(field.getOrdinal());
                if (inputLengths == null) {
                    continue;
                }
                int[] docMap = docMaps.get(i);
                for (int doc = 0; doc < docMap.length; doc++) {
                    if (docMap[doc] >= 0) {
                        lengths[docMap[doc]] = inputLengths[doc];
                    }
                }
            }
            merged.put(field.getOrdinal(), lengths);
        }
        NormsFile.write(directory, merged, maxDoc);
    }

    private void mergeColumns(Path directory, List<SegmentReader> inputs, List<int[]> docMaps, int maxDoc)
            throws IOException {
        Map<Integer, NumericColumn> merged = new HashMap<>();
        for (Field field : schema.getFields()) {
            if (!field.hasColumn()) {
                continue;
            }
            long[] values = new long[maxDoc];
            BitSet present = new BitSet(maxDoc);
            for (int i = 0; i < inputs.size(); i++) {
                NumericColumn column = inputs.get(i).column(field.getOrdinal());
                if (column == null) {
                    continue;
                }
                int[] docMap = docMaps.get(i);
                for (int doc = 0; doc < docMap.length; doc++) {
                    if (docMap[doc] >= 0 && column.has(doc)) {
                        values[docMap[doc]] = column.rawValue(doc);
                        present.set(docMap[doc]);
                    }
                }
            }
            merged.put(field.getOrdinal(), new NumericColumn(field.getType(), values, present));
        }
        ColumnsFile.write(directory, merged, maxDoc);
    }

    private void mergeStoredFields(Path directory, List<SegmentReader> inputs, List<int[]> docMaps, int maxDoc)
            throws IOException {
        try (StoredFieldsWriter stored = new StoredFieldsWriter(directory, codec, storeBlockSize)) {
            for (int i = 0; i < inputs.size(); i++) {
                int[] docMap = docMaps.get(i);
                for (int doc = 0; doc < docMap.length; doc++) {
                    if (docMap[doc] >= 0) {
                        stored.addDocument(inputs.get(i).storedPayload(doc));
                    }
                }
            }
            stored.finish(maxDoc);
        }
    }

    private static final class TermCursor implements Comparable<TermCursor> {
        private final int input;
        private final TermDictionary dictionary;
        private int index;

        private TermCursor(int input, TermDictionary dictionary) {
            this.input = input;
            this.dictionary = dictionary;
        }

        String term() {
            return dictionary.term(index);
        }

        boolean advance() {
            return ++index < dictionary.size();
        }

        @Override
        public int compareTo(TermCursor other) {
            int cmp = term().compareTo(other.term());
            return cmp != 0 ? cmp : Integer.compare(input, other.input);
        }
    }
}

package com.jsearch.segment;

import com.jsearch.common.IndexConstants;
import com.jsearch.common.errors.CorruptIndexException;
import com.jsearch.common.io.IndexInput;
import com.jsearch.common.io.IndexOutput;
import com.jsearch.common.schema.FieldType;

import java.io.IOException;
import java.nio.file.Path;
import java.util.BitSet;
import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Numeric columns of a segment. Per field: ordinal, type, presence bitmap
 * words, then the values of the present docs in doc order.
 */
public final class ColumnsFile {
    static final String FILE_TYPE = "columns";

    private ColumnsFile() {
    }

    public static void write(Path directory, Map<Integer, NumericColumn> columns, int maxDoc) throws IOException {
        try (IndexOutput out = IndexOutput.create(directory.resolve(IndexConstants.COLUMNS_FILE))) {
            out.writeHeader(FILE_TYPE);
            out.writeVInt(maxDoc);
            Map<Integer, NumericColumn> sorted = new TreeMap<>(columns);
            out.writeVInt(sorted.size());
            for (Map.Entry<Integer, NumericColumn> entry : sorted.entrySet()) {
                NumericColumn column = entry.getValue();
                out.writeVInt(entry.getKey());
                out.writeVInt(column.getType().getValue());
                long[] words = column.present().toLongArray();
                out.writeVInt(words.length);
                for (long word : words) {
                    out.writeLong(word);
                }
                for (int doc = column.present().nextSetBit(0); doc >= 0 && doc < maxDoc;
                     doc = column.present().nextSetBit(doc + 1)) {
                    out.writeLong(column.rawValue(doc));
                }
            }
            out.writeFooter();
            out.sync();
        }
    }

    public static Map<Integer, NumericColumn> read(Path directory, int expectedMaxDoc) throws IOException {
        Path path = directory.resolve(IndexConstants.COLUMNS_FILE);
        IndexInput in = IndexInput.openVerified(path, FILE_TYPE);
        int maxDoc = in.readVInt();
        if (maxDoc != expectedMaxDoc) {
            throw new CorruptIndexException("Columns cover " + maxDoc + " docs, expected " + expectedMaxDoc, path);
        }
        int fieldCount = in.readVInt();
        Map<Integer, NumericColumn> result = new HashMap<>();
        for (int f = 0; f < fieldCount; f++) {
            int fieldOrdinal = in.readVInt();
            FieldType type;
            try {
                type = FieldType.fromValue(in.readVInt());
            } catch (IllegalArgumentException e) {
                throw new CorruptIndexException(e.getMessage(), path, e);
            }
            long[] words = new long[in.readVInt()];
            for (int w = 0; w < words.length; w++) {
                words[w] = in.readLong();
            }
            BitSet present = BitSet.valueOf(words);
            if (present.length() > maxDoc) {
                throw new CorruptIndexException("Column presence exceeds doc count", path);
            }
            long[] values = new long[maxDoc];
            for (int doc = present.nextSetBit(0); doc >= 0; doc = present.nextSetBit(doc + 1)) {
                values[doc] = in.readLong();
            }
            result.put(fieldOrdinal, new NumericColumn(type, values, present));
        }
        return result;
    }
}

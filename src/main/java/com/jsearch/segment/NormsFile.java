package com.jsearch.segment;

import com.jsearch.common.IndexConstants;
import com.jsearch.common.errors.CorruptIndexException;
import com.jsearch.common.io.IndexInput;
import com.jsearch.common.io.IndexOutput;

import java.io.IOException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Field norms: the token count of every document for each normed field.
 */
public final class NormsFile {
    static final String FILE_TYPE = "norms";

    private NormsFile() {
    }

    public static void write(Path directory, Map<Integer, int[]> lengthsByField, int maxDoc) throws IOException {
        try (IndexOutput out = IndexOutput.create(directory.resolve(IndexConstants.NORMS_FILE))) {
            out.writeHeader(FILE_TYPE);
            out.writeVInt(maxDoc);
            Map<Integer, int[]> sorted = new TreeMap<>(lengthsByField);
            out.writeVInt(sorted.size());
            for (Map.Entry<Integer, int[]> entry : sorted.entrySet()) {
                int[] lengths = entry.getValue();
                if (lengths.length != maxDoc) {
                    throw new IllegalArgumentException("Norms of field " + entry.getKey() + " cover "
                        + lengths.length + " docs, expected " + maxDoc);
                }
                out.writeVInt(entry.getKey());
                for (int length : lengths) {
                    out.writeVInt(length);
                }
            }
            out.writeFooter();
            out.sync();
        }
    }

    public static Map<Integer, int[]> read(Path directory, int expectedMaxDoc) throws IOException {
        Path path = directory.resolve(IndexConstants.NORMS_FILE);
        IndexInput in = IndexInput.openVerified(path, FILE_TYPE);
        int maxDoc = in.readVInt();
        if (maxDoc != expectedMaxDoc) {
            throw new CorruptIndexException("Norms cover " + maxDoc + " docs, expected " + expectedMaxDoc, path);
        }
        int fieldCount = in.readVInt();
        Map<Integer, int[]> result = new HashMap<>();
        for (int f = 0; f < fieldCount; f++) {
            int fieldOrdinal = in.readVInt();
            int[] lengths = new int[maxDoc];
            for (int doc = 0; doc < maxDoc; doc++) {
                lengths[doc] = in.readVInt();
            }
            result.put(fieldOrdinal, lengths);
        }
        return result;
    }
}

package com.jsearch.segment;

import com.jsearch.common.IndexConstants;
import com.jsearch.common.errors.CorruptIndexException;
import com.jsearch.common.io.AtomicFiles;
import com.jsearch.common.io.IndexInput;
import com.jsearch.common.io.IndexOutput;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.BitSet;

/**
 * Deleted-document bitmaps. Each generation is a separate immutable file in
 * the segment directory; the manifest names the generation in effect.
 */
public final class Tombstones {
    static final String FILE_TYPE = "tombstones";

    private Tombstones() {
    }

    /**
     * Writes a new generation of the segment's tombstones.
     */
    public static void write(Path segmentDirectory, long generation, BitSet deleted, int maxDoc) throws IOException {
        if (deleted.length() > maxDoc) {
            throw new IllegalArgumentException("Tombstone for doc " + (deleted.length() - 1)
                + " beyond max doc " + maxDoc);
        }
        Path target = segmentDirectory.resolve(IndexConstants.tombstonesFileName(generation));
        Path temp = target.resolveSibling(target.getFileName() + IndexConstants.TEMP_SUFFIX);
        Files.deleteIfExists(temp);
        try {
            try (IndexOutput out = IndexOutput.create(temp)) {
                out.writeHeader(FILE_TYPE);
                out.writeVInt(maxDoc);
                out.writeVInt(deleted.cardinality());
                long[] words = deleted.toLongArray();
                out.writeVInt(words.length);
                for (long word : words) {
                    out.writeLong(word);
                }
                out.writeFooter();
                out.sync();
            }
            AtomicFiles.move(temp, target);
        } catch (IOException e) {
            try {
                Files.deleteIfExists(temp);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw e;
        }
        AtomicFiles.fsyncDirectory(segmentDirectory);
    }

    /**
     * Reads a generation; generation 0 means no deletions.
     */
    public static BitSet read(Path segmentDirectory, long generation, int maxDoc, int expectedCount)
            throws IOException {
        if (generation == 0) {
            return new BitSet(maxDoc);
        }
        Path path = segmentDirectory.resolve(IndexConstants.tombstonesFileName(generation));
        IndexInput in = IndexInput.openVerified(path, FILE_TYPE);
        int storedMaxDoc = in.readVInt();
        if (storedMaxDoc != maxDoc) {
            throw new CorruptIndexException("Tombstones cover " + storedMaxDoc + " docs, expected " + maxDoc, path);
        }
        int count = in.readVInt();
        long[] words = new long[in.readVInt()];
        for (int i = 0; i < words.length; i++) {
            words[i] = in.readLong();
        }
        BitSet deleted = BitSet.valueOf(words);
        if (deleted.cardinality() != count || count != expectedCount || deleted.length() > maxDoc) {
            throw new CorruptIndexException("Tombstone count " + deleted.cardinality()
                + " does not match recorded " + expectedCount, path);
        }
        return deleted;
    }

    public static void delete(Path segmentDirectory, long generation) throws IOException {
        Files.deleteIfExists(segmentDirectory.resolve(IndexConstants.tombstonesFileName(generation)));
    }
}

package com.jsearch.segment;

import com.jsearch.common.IndexConstants;
import com.jsearch.common.compression.Compressor;
import com.jsearch.common.compression.CompressorFactory;
import com.jsearch.common.errors.CorruptIndexException;
import com.jsearch.common.io.IndexInput;

import java.io.Closeable;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Random access to the stored payloads written by {@link StoredFieldsWriter}.
 * The block index is kept in memory; blocks are read and decompressed per
 * lookup.
 */
public class StoredFieldsReader implements Closeable {
    private static final int FOOTER_AND_INDEX_POINTER = 12 + 8;

    private final Path path;
    private final FileChannel channel;
    private final Compressor compressor;
    private final int[] firstDocs;
    private final long[] offsets;
    private final int[] compressedLengths;
    private final int[] rawLengths;
    private final int[] docCounts;
    private final int maxDoc;

    public StoredFieldsReader(Path directory, int expectedMaxDoc) throws IOException {
        this.path = directory.resolve(IndexConstants.STORE_FILE);
        this.channel = FileChannel.open(path, StandardOpenOption.READ);
        try {
            long bodyStart = IndexInput.verifyChannel(path, channel, StoredFieldsWriter.FILE_TYPE);
            IndexInput codecInput = IndexInput.slice(path, channel, bodyStart, 5);
            try {
                this.compressor = CompressorFactory.forStoredValue(codecInput.readVInt());
            } catch (IllegalArgumentException e) {
                throw new CorruptIndexException(e.getMessage(), path, e);
            }
            long size = channel.size();
            long indexOffset = IndexInput.slice(path, channel, size - FOOTER_AND_INDEX_POINTER, 8).readLong();
            if (indexOffset < bodyStart || indexOffset > size - FOOTER_AND_INDEX_POINTER) {
                throw new CorruptIndexException("Invalid block index offset " + indexOffset, path);
            }
            IndexInput index = IndexInput.slice(path, channel, indexOffset,
                (int) (size - FOOTER_AND_INDEX_POINTER - indexOffset));
            int blockCount = index.readVInt();
            firstDocs = new int[blockCount];
            offsets = new long[blockCount];
            compressedLengths = new int[blockCount];
            rawLengths = new int[blockCount];
            docCounts = new int[blockCount];
            int docs = 0;
            for (int i = 0; i < blockCount; i++) {
                firstDocs[i] = index.readVInt();
                offsets[i] = index.readVLong();
                compressedLengths[i] = index.readVInt();
                rawLengths[i] = index.readVInt();
                docCounts[i] = index.readVInt();
                if (firstDocs[i] != docs) {
                    throw new CorruptIndexException("Stored block " + i + " starts at doc " + firstDocs[i], path);
                }
                docs += docCounts[i];
            }
            if (docs != expectedMaxDoc) {
                throw new CorruptIndexException("Store holds " + docs + " docs, expected " + expectedMaxDoc, path);
            }
            this.maxDoc = docs;
        } catch (IOException e) {
            channel.close();
            throw e;
        }
    }

    /**
     * @return The serialized stored fields of {@code doc}
     */
    public byte[] document(int doc) throws IOException {
        if (doc < 0 || doc >= maxDoc) {
            throw new IllegalArgumentException("Doc " + doc + " out of range [0, " + maxDoc + ")");
        }
        int block = findBlock(doc);
        byte[] compressed = new byte[compressedLengths[block]];
        IndexInput.slice(path, channel, offsets[block], compressed.length).readBytes(compressed);
        byte[] raw = compressor.decompress(compressed, rawLengths[block]);
        IndexInput in = new IndexInput(path, ByteBuffer.wrap(raw));
        for (int skip = firstDocs[block]; skip < doc; skip++) {
            int length = in.readVInt();
            in.seek(in.position() + length);
        }
        byte[] payload = new byte[in.readVInt()];
        in.readBytes(payload);
        return payload;
    }

    private int findBlock(int doc) {
        int low = 0;
        int high = firstDocs.length - 1;
        while (low < high) {
            int mid = (low + high + 1) >>> 1;
            if (firstDocs[mid] <= doc) {
                low = mid;
            } else {
                high = mid - 1;
            }
        }
        return low;
    }

    @Override
    public void close() throws IOException {
        channel.close();
    }
}

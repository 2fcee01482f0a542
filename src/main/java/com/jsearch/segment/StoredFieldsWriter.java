package com.jsearch.segment;

import com.jsearch.common.IndexConstants;
import com.jsearch.common.compression.CompressionCodec;
import com.jsearch.common.compression.Compressor;
import com.jsearch.common.compression.CompressorFactory;
import com.jsearch.common.io.IndexOutput;

import java.io.ByteArrayOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes stored-field payloads into compressed blocks ({@code store.dat}).
 *
 * Layout: header, codec id, the blocks, then a block index (per block: first
 * doc, file offset, compressed length, raw length, doc count), the offset of
 * that index as a long, and the footer. Within a block each payload is
 * prefixed with its vint length.
 */
public class StoredFieldsWriter implements Closeable {
    static final String FILE_TYPE = "store";

    private final IndexOutput out;
    private final Compressor compressor;
    private final int blockSize;
    private final List<long[]> blocks = new ArrayList<>();
    private final ByteArrayOutputStream pending = new ByteArrayOutputStream();
    private int pendingDocs;
    private int nextDoc;

    public StoredFieldsWriter(Path directory, CompressionCodec codec, int blockSize) throws IOException {
        this.compressor = CompressorFactory.getCompressor(codec);
        this.blockSize = blockSize;
        this.out = IndexOutput.create(directory.resolve(IndexConstants.STORE_FILE));
        out.writeHeader(FILE_TYPE);
        out.writeVInt(codec.getValue());
    }

    /**
     * Appends the payload of the next document; docs are numbered in call order.
     */
    public void addDocument(byte[] payload) throws IOException {
        int length = payload.length;
        while ((length & ~0x7F) != 0) {
            pending.write((length & 0x7F) | 0x80);
            length >>>= 7;
        }
        pending.write(length);
        pending.write(payload, 0, payload.length);
        pendingDocs++;
        if (pending.size() >= blockSize) {
            flushBlock();
        }
    }

    private void flushBlock() throws IOException {
        if (pendingDocs == 0) {
            return;
        }
        byte[] raw = pending.toByteArray();
        byte[] compressed = compressor.compress(raw);
        blocks.add(new long[]{nextDoc, out.getFilePointer(), compressed.length, raw.length, pendingDocs});
        out.writeBytes(compressed);
        nextDoc += pendingDocs;
        pendingDocs = 0;
        pending.reset();
    }

    /**
     * Flushes the last block, writes the block index and footer and syncs.
     *
     * @param expectedDocs the segment's document count, checked against what was added
     */
    public void finish(int expectedDocs) throws IOException {
        flushBlock();
        if (nextDoc != expectedDocs) {
            throw new IllegalStateException("Stored " + nextDoc + " documents, expected " + expectedDocs);
        }
        long indexOffset = out.getFilePointer();
        out.writeVInt(blocks.size());
        for (long[] block : blocks) {
            out.writeVInt((int) block[0]);
            out.writeVLong(block[1]);
            out.writeVInt((int) block[2]);
            out.writeVInt((int) block[3]);
            out.writeVInt((int) block[4]);
        }
        out.writeLong(indexOffset);
        out.writeFooter();
        out.sync();
    }

    @Override
    public void close() throws IOException {
        out.close();
    }
}

package com.jsearch.common.compression;

import java.io.IOException;
import java.util.Arrays;

/**
 * Pass-through codec; blocks are stored as they are.
 */
public class UncompressedCompressor implements Compressor {
    @Override
    public byte[] compress(byte[] raw) {
        return Arrays.copyOf(raw, raw.length);
    }

    @Override
    public byte[] decompress(byte[] compressed, int rawLength) throws IOException {
        if (compressed.length != rawLength) {
            throw new IOException("Stored block size mismatch. Expected: " + rawLength
                + ", Got: " + compressed.length);
        }
        return Arrays.copyOf(compressed, compressed.length);
    }
}

package com.jsearch.common.compression;

import org.xerial.snappy.Snappy;

import java.io.IOException;

/**
 * Compressor implementation using Snappy compression.
 */
public class SnappyCompressor implements Compressor {
    @Override
    public byte[] compress(byte[] raw) throws IOException {
        return Snappy.compress(raw);
    }

    @Override
    public byte[] decompress(byte[] compressed, int rawLength) throws IOException {
        byte[] decompressed = Snappy.uncompress(compressed);
        if (decompressed.length != rawLength) {
            throw new IOException("Decompressed size mismatch. Expected: " + rawLength
                + ", Got: " + decompressed.length);
        }
        return decompressed;
    }
}

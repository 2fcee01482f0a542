package com.jsearch.common.compression;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Compressor implementation using GZIP compression.
 */
public class GzipCompressor implements Compressor {
    @Override
    public byte[] compress(byte[] raw) throws IOException {
        ByteArrayOutputStream baos = new ByteArrayOutputStream(Math.max(32, raw.length / 2));
        try (GZIPOutputStream gzos = new GZIPOutputStream(baos)) {
            gzos.write(raw);
        }
        return baos.toByteArray();
    }

    @Override
    public byte[] decompress(byte[] compressed, int rawLength) throws IOException {
        try (GZIPInputStream gzis = new GZIPInputStream(new ByteArrayInputStream(compressed))) {
            byte[] output = gzis.readNBytes(rawLength);
            if (output.length != rawLength || gzis.read() != -1) {
                throw new IOException("Decompressed size mismatch. Expected: " + rawLength);
            }
            return output;
        }
    }
}

package com.jsearch.common.compression;

import com.github.luben.zstd.Zstd;

import java.io.IOException;
import java.util.Arrays;

/**
 * Compressor implementation using Zstandard compression.
 */
public class ZstdCompressor implements Compressor {
    private static final int COMPRESSION_LEVEL = 3;

    @Override
    public byte[] compress(byte[] raw) throws IOException {
        byte[] compressed = new byte[(int) Zstd.compressBound(raw.length)];
        long compressedSize = Zstd.compressByteArray(
            compressed, 0, compressed.length,
            raw, 0, raw.length,
            COMPRESSION_LEVEL
        );
        if (Zstd.isError(compressedSize)) {
            throw new IOException("Failed to compress block with Zstd: "
                + Zstd.getErrorName(compressedSize));
        }
        return Arrays.copyOf(compressed, (int) compressedSize);
    }

    @Override
    public byte[] decompress(byte[] compressed, int rawLength) throws IOException {
        byte[] decompressed = new byte[rawLength];
        long decompressedSize = Zstd.decompressByteArray(
            decompressed, 0, decompressed.length,
            compressed, 0, compressed.length
        );
        if (Zstd.isError(decompressedSize)) {
            throw new IOException("Failed to decompress block with Zstd: "
                + Zstd.getErrorName(decompressedSize));
        }
        if (decompressedSize != rawLength) {
            throw new IOException("Decompressed size mismatch. Expected: " + rawLength
                + ", Got: " + decompressedSize);
        }
        return decompressed;
    }
}

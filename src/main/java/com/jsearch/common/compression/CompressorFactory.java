package com.jsearch.common.compression;

import java.util.EnumMap;
import java.util.Map;

/**
 * Hands out the shared, stateless compressor of each codec.
 */
public class CompressorFactory {
    private static final Map<CompressionCodec, Compressor> COMPRESSORS = new EnumMap<>(CompressionCodec.class);

    static {
        COMPRESSORS.put(CompressionCodec.UNCOMPRESSED, new UncompressedCompressor());
        COMPRESSORS.put(CompressionCodec.SNAPPY, new SnappyCompressor());
        COMPRESSORS.put(CompressionCodec.GZIP, new GzipCompressor());
        COMPRESSORS.put(CompressionCodec.ZSTD, new ZstdCompressor());
    }

    private CompressorFactory() {
    }

    /**
     * @param codec The compression codec to use
     * @return The compressor implementing {@code codec}
     */
    public static Compressor getCompressor(CompressionCodec codec) {
        return COMPRESSORS.get(codec);
    }

    /**
     * Resolves the codec id recorded in a stored-fields file.
     *
     * @throws IllegalArgumentException If the id names no known codec
     */
    public static Compressor forStoredValue(int codecValue) {
        return getCompressor(CompressionCodec.fromValue(codecValue));
    }
}

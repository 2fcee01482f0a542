package com.jsearch.common.compression;

/**
 * Compression codecs available for stored-field blocks. The numeric value is
 * what gets written into the store file header, so it must never change.
 */
public enum CompressionCodec {
    UNCOMPRESSED(0),
    SNAPPY(1),
    GZIP(2),
    ZSTD(6);

    private final int value;

    CompressionCodec(int value) {
        this.value = value;
    }

    public int getValue() {
        return value;
    }

    public static CompressionCodec fromValue(int value) {
        for (CompressionCodec codec : values()) {
            if (codec.value == value) {
                return codec;
            }
        }
        throw new IllegalArgumentException("Unknown compression codec value: " + value);
    }
}

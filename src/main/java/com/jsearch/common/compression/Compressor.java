package com.jsearch.common.compression;

import java.io.IOException;

/**
 * Block compression used by the stored-fields file.
 */
public interface Compressor {
    /**
     * Compresses one block.
     *
     * @param raw The uncompressed block
     * @return The compressed bytes
     * @throws IOException If the codec fails
     */
    byte[] compress(byte[] raw) throws IOException;

    /**
     * Decompresses one block.
     *
     * @param compressed The compressed block
     * @param rawLength The length the block had before compression
     * @return The uncompressed bytes, exactly {@code rawLength} long
     * @throws IOException If the codec fails or the length does not match
     */
    byte[] decompress(byte[] compressed, int rawLength) throws IOException;
}

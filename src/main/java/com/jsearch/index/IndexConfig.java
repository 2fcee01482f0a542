package com.jsearch.index;

import com.jsearch.common.compression.CompressionCodec;

/**
 * Configuration of an open index. Not persisted: each open may use different
 * settings, the on-disk format records what it needs (for example the codec
 * of every store file).
 */
public class IndexConfig {
    private final CompressionCodec compressionCodec;
    private final int storeBlockSize;
    private final int maxBufferedDocs;
    private final int maxSegmentCount;
    private final int mergeFactor;
    private final boolean backgroundMerges;
    private final boolean strictDocuments;
    private final int defaultLimit;

    private IndexConfig(Builder builder) {
        this.compressionCodec = builder.compressionCodec;
        this.storeBlockSize = builder.storeBlockSize;
        this.maxBufferedDocs = builder.maxBufferedDocs;
        this.maxSegmentCount = builder.maxSegmentCount;
        this.mergeFactor = builder.mergeFactor;
        this.backgroundMerges = builder.backgroundMerges;
        this.strictDocuments = builder.strictDocuments;
        this.defaultLimit = builder.defaultLimit;
    }

    public static IndexConfig defaults() {
        return new Builder().build();
    }

    public CompressionCodec getCompressionCodec() {
        return compressionCodec;
    }

    /**
     * Uncompressed size at which a stored-fields block is closed.
     */
    public int getStoreBlockSize() {
        return storeBlockSize;
    }

    /**
     * Buffered document count that triggers a flush into a pending segment.
     */
    public int getMaxBufferedDocs() {
        return maxBufferedDocs;
    }

    public int getMaxSegmentCount() {
        return maxSegmentCount;
    }

    public int getMergeFactor() {
        return mergeFactor;
    }

    public boolean isBackgroundMerges() {
        return backgroundMerges;
    }

    public boolean isStrictDocuments() {
        return strictDocuments;
    }

    public int getDefaultLimit() {
        return defaultLimit;
    }

    public static class Builder {
        private CompressionCodec compressionCodec = CompressionCodec.SNAPPY;
        private int storeBlockSize = 16 * 1024; // 16KB
        private int maxBufferedDocs = 10_000;
        private int maxSegmentCount = 8;
        private int mergeFactor = 4;
        private boolean backgroundMerges = false;
        private boolean strictDocuments = false;
        private int defaultLimit = 100;

        public Builder setCompressionCodec(CompressionCodec compressionCodec) {
            this.compressionCodec = compressionCodec;
            return this;
        }

        public Builder setStoreBlockSize(int storeBlockSize) {
            this.storeBlockSize = storeBlockSize;
            return this;
        }

        public Builder setMaxBufferedDocs(int maxBufferedDocs) {
            this.maxBufferedDocs = maxBufferedDocs;
            return this;
        }

        public Builder setMaxSegmentCount(int maxSegmentCount) {
            this.maxSegmentCount = maxSegmentCount;
            return this;
        }

        public Builder setMergeFactor(int mergeFactor) {
            this.mergeFactor = mergeFactor;
            return this;
        }

        public Builder setBackgroundMerges(boolean backgroundMerges) {
            this.backgroundMerges = backgroundMerges;
            return this;
        }

        public Builder setStrictDocuments(boolean strictDocuments) {
            this.strictDocuments = strictDocuments;
            return this;
        }

        public Builder setDefaultLimit(int defaultLimit) {
            this.defaultLimit = defaultLimit;
            return this;
        }

        public IndexConfig build() {
            if (compressionCodec == null) {
                throw new IllegalArgumentException("Compression codec cannot be null");
            }
            if (storeBlockSize < 1) {
                throw new IllegalArgumentException("Store block size must be positive");
            }
            if (maxBufferedDocs < 1) {
                throw new IllegalArgumentException("Max buffered docs must be positive");
            }
            if (maxSegmentCount < 1) {
                throw new IllegalArgumentException("Max segment count must be positive");
            }
            if (mergeFactor < 2) {
                throw new IllegalArgumentException("Merge factor must be at least 2");
            }
            if (defaultLimit < 1) {
                throw new IllegalArgumentException("Default limit must be positive");
            }
            return new IndexConfig(this);
        }
    }
}

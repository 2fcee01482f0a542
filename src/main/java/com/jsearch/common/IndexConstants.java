package com.jsearch.common;

/**
 * Constants used in the on-disk index format.
 */
public class IndexConstants {
    /**
     * Magic number at the start and end of every segment file.
     * Spelled out JSX1 in ASCII.
     */
    public static final int FILE_MAGIC = 0x4A535831;

    /**
     * Version of the segment file layout.
     */
    public static final int FORMAT_VERSION = 1;

    public static final String SCHEMA_FILE = "schema.json";
    public static final String MANIFEST_FILE = "manifest.json";
    public static final String WRITE_LOCK_FILE = "write.lock";
    public static final String TEMP_SUFFIX = ".tmp";
    public static final String SEGMENT_PREFIX = "seg_";

    public static final String TERMS_FILE = "terms.dat";
    public static final String POSTINGS_FILE = "postings.dat";
    public static final String NORMS_FILE = "norms.dat";
    public static final String COLUMNS_FILE = "columns.dat";
    public static final String STORE_FILE = "store.dat";
    public static final String TOMBSTONES_PREFIX = "tombstones_";
    public static final String TOMBSTONES_SUFFIX = ".del";

    private IndexConstants() {
        // Prevent instantiation
    }

    /**
     * Directory name of the segment with the given id, e.g. {@code seg_00000007}.
     */
    public static String segmentName(long id) {
        return String.format("%s%08d", SEGMENT_PREFIX, id);
    }

    /**
     * File name holding the given tombstone generation of a segment.
     */
    public static String tombstonesFileName(long generation) {
        return TOMBSTONES_PREFIX + generation + TOMBSTONES_SUFFIX;
    }
}

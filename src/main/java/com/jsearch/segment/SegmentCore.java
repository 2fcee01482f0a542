package com.jsearch.segment;

import com.jsearch.common.io.AtomicFiles;
import com.jsearch.common.schema.Schema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collections;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * The open, immutable files of one segment, shared by every reader of that
 * segment whatever its tombstone generation.
 *
 * Reference counted: the index holds one reference while the segment is in
 * the current segment set and every {@link SegmentReader} holds one more.
 * When the last reference goes the files are closed, and if the segment was
 * marked obsolete its directory is deleted.
 */
public final class SegmentCore {
    private static final Logger logger = LoggerFactory.getLogger(SegmentCore.class);

    private final String name;
    private final Path directory;
    private final Schema schema;
    private final int maxDoc;
    private final TermsReader terms;
    private final Map<Integer, int[]> norms;
    private final Map<Integer, NumericColumn> columns;
    private final StoredFieldsReader storedFields;
    private final AtomicInteger refCount = new AtomicInteger(1);
    private volatile boolean obsolete;

    private SegmentCore(String name, Path directory, Schema schema, int maxDoc, TermsReader terms,
                        Map<Integer, int[]> norms, Map<Integer, NumericColumn> columns,
                        StoredFieldsReader storedFields) {
        this.name = name;
        this.directory = directory;
        this.schema = schema;
        this.maxDoc = maxDoc;
        this.terms = terms;
        this.norms = Collections.unmodifiableMap(norms);
        this.columns = Collections.unmodifiableMap(columns);
        this.storedFields = storedFields;
    }

    /**
     * Opens and verifies every file of the segment. The caller owns the
     * initial reference.
     *
     * @throws com.jsearch.common.errors.CorruptIndexException If any file fails verification
     */
    public static SegmentCore open(Path indexDirectory, String name, int maxDoc, Schema schema) throws IOException {
        Path directory = indexDirectory.resolve(name);
        Map<Integer, int[]> norms = NormsFile.read(directory, maxDoc);
        Map<Integer, NumericColumn> columns = ColumnsFile.read(directory, maxDoc);
        TermsReader terms = new TermsReader(directory);
        StoredFieldsReader storedFields;
        try {
            storedFields = new StoredFieldsReader(directory, maxDoc);
        } catch (IOException e) {
            terms.close();
            throw e;
        }
        logger.debug("Opened segment {} with {} docs", name, maxDoc);
        return new SegmentCore(name, directory, schema, maxDoc, terms, norms, columns, storedFields);
    }

    public String getName() {
        return name;
    }

    public Path getDirectory() {
        return directory;
    }

    public Schema getSchema() {
        return schema;
    }

    public int getMaxDoc() {
        return maxDoc;
    }

    TermsReader terms() {
        return terms;
    }

    Map<Integer, int[]> norms() {
        return norms;
    }

    Map<Integer, NumericColumn> columns() {
        return columns;
    }

    StoredFieldsReader storedFields() {
        return storedFields;
    }

    public int getRefCount() {
        return refCount.get();
    }

    public boolean isObsolete() {
        return obsolete;
    }

    public void incRef() {
        while (true) {
            int current = refCount.get();
            if (current <= 0) {
                throw new IllegalStateException("Segment " + name + " is already closed");
            }
            if (refCount.compareAndSet(current, current + 1)) {
                return;
            }
        }
    }

    /**
     * Drops one reference; the last one closes the files and removes the
     * directory of an obsolete segment.
     */
    public void decRef() throws IOException {
        int remaining = refCount.decrementAndGet();
        if (remaining > 0) {
            return;
        }
        if (remaining < 0) {
            throw new IllegalStateException("Segment " + name + " released too many times");
        }
        try {
            try {
                terms.close();
            } finally {
                storedFields.close();
            }
        } finally {
            if (obsolete) {
                AtomicFiles.deleteRecursively(directory);
                logger.info("Deleted obsolete segment {}", name);
            }
        }
    }

    /**
     * Marks the segment as no longer part of any future segment set.
     */
    public void markObsolete() {
        obsolete = true;
    }

    @Override
    public String toString() {
        return name + "(maxDoc=" + maxDoc + ", refs=" + refCount.get() + ")";
    }
}

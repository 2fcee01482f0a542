package com.jsearch.index;

import com.jsearch.segment.SegmentReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A published segment set as seen by readers. Immutable and reference
 * counted: the index holds one reference while the snapshot is current,
 * every search holds another while it runs.
 */
public final class IndexSnapshot implements Closeable {
    private static final Logger logger = LoggerFactory.getLogger(IndexSnapshot.class);

    private final Manifest manifest;
    private final List<SegmentReader> readers;
    private final int[] docBases;
    private final long numDocs;
    private final long maxDoc;
    private final AtomicInteger refCount = new AtomicInteger(1);

    /**
     * Takes ownership of {@code readers}; they are closed with the snapshot.
     */
    IndexSnapshot(Manifest manifest, List<SegmentReader> readers) {
        this.manifest = manifest;
        this.readers = Collections.unmodifiableList(new ArrayList<>(readers));
        this.docBases = new int[readers.size()];
        long live = 0;
        int base = 0;
        for (int i = 0; i < readers.size(); i++) {
            docBases[i] = base;
            base += readers.get(i).maxDoc();
            live += readers.get(i).numDocs();
        }
        this.numDocs = live;
        this.maxDoc = base;
    }

    public Manifest getManifest() {
        return manifest;
    }

    public List<SegmentReader> getReaders() {
        return readers;
    }

    /**
     * Global id of the first doc of the segment at {@code index}.
     */
    public int docBase(int index) {
        return docBases[index];
    }

    /**
     * Live documents across all segments.
     */
    public long numDocs() {
        return numDocs;
    }

    /**
     * Documents physically present, tombstoned ones included.
     */
    public long maxDoc() {
        return maxDoc;
    }

    public long getCommitSequence() {
        return manifest.getCommitSequence();
    }

    /**
     * @return The reader named {@code name}, or null if not in this snapshot
     */
    public SegmentReader reader(String name) {
        for (SegmentReader reader : readers) {
            if (reader.getName().equals(name)) {
                return reader;
            }
        }
        return null;
    }

    /**
     * Acquires a reference if the snapshot is still alive.
     */
    boolean tryIncRef() {
        while (true) {
            int current = refCount.get();
            if (current <= 0) {
                return false;
            }
            if (refCount.compareAndSet(current, current + 1)) {
                return true;
            }
        }
    }

    /**
     * Releases a reference; the last one closes the segment readers.
     */
    public void decRef() throws IOException {
        int remaining = refCount.decrementAndGet();
        if (remaining > 0) {
            return;
        }
        if (remaining < 0) {
            throw new IllegalStateException("Snapshot released too many times");
        }
        IOException failure = null;
        for (SegmentReader reader : readers) {
            try {
                reader.close();
            } catch (IOException e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        logger.debug("Released snapshot generation {}", manifest.getGeneration());
        if (failure != null) {
            throw failure;
        }
    }

    @Override
    public void close() throws IOException {
        decRef();
    }
}

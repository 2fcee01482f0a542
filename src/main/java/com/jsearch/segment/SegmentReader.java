package com.jsearch.segment;

import com.jsearch.common.schema.Schema;
import com.jsearch.document.StoredDocumentCodec;

import java.io.Closeable;
import java.io.IOException;
import java.util.BitSet;
import java.util.List;
import java.util.Map;

/**
 * View of one segment at one tombstone generation. Holds a reference on the
 * shared {@link SegmentCore} until closed.
 */
public final class SegmentReader implements Closeable {
    private final SegmentCore core;
    private final SegmentInfo info;
    private final BitSet deleted;
    private final int numDocs;
    private boolean closed;

    /**
     * @param deleted tombstones in effect; not copied, must not change afterwards
     */
    public SegmentReader(SegmentCore core, SegmentInfo info, BitSet deleted) {
        if (!core.getName().equals(info.getName()) || core.getMaxDoc() != info.getMaxDoc()) {
            throw new IllegalArgumentException("Segment info " + info + " does not describe " + core);
        }
        core.incRef();
        this.core = core;
        this.info = info;
        this.deleted = deleted;
        this.numDocs = info.getMaxDoc() - deleted.cardinality();
    }

    public SegmentCore getCore() {
        return core;
    }

    public SegmentInfo getInfo() {
        return info;
    }

    public String getName() {
        return info.getName();
    }

    public Schema getSchema() {
        return core.getSchema();
    }

    public int maxDoc() {
        return info.getMaxDoc();
    }

    public int numDocs() {
        return numDocs;
    }

    public boolean isDeleted(int doc) {
        return deleted.get(doc);
    }

    /**
     * Copy of the tombstones in effect.
     */
    public BitSet deletedDocs() {
        return (BitSet) deleted.clone();
    }

    /**
     * @return The field's term dictionary, or null if the field has no postings here
     */
    public TermDictionary terms(int fieldOrdinal) {
        return core.terms().dictionary(fieldOrdinal);
    }

    public Postings postings(TermDictionary dictionary, int termIndex) throws IOException {
        return core.terms().postings(dictionary, termIndex);
    }

    /**
     * Token counts per doc, or null if the field has no norms.
     */
    public int[] norms(int fieldOrdinal) {
        return core.norms().get(fieldOrdinal);
    }

    /**
     * @return The numeric column of the field, or null if it has none
     */
    public NumericColumn column(int fieldOrdinal) {
        return core.columns().get(fieldOrdinal);
    }

    public byte[] storedPayload(int doc) throws IOException {
        return core.storedFields().document(doc);
    }

    public Map<String, List<Object>> document(int doc) throws IOException {
        return StoredDocumentCodec.decode(core.getSchema(), storedPayload(doc), core.getDirectory());
    }

    @Override
    public synchronized void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        core.decRef();
    }

    @Override
    public String toString() {
        return info.toString();
    }
}

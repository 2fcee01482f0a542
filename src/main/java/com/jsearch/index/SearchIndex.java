package com.jsearch.index;

import com.jsearch.common.IndexConstants;
import com.jsearch.common.errors.CommitFailedException;
import com.jsearch.common.errors.IndexAlreadyExistsException;
import com.jsearch.common.errors.IndexNotFoundException;
import com.jsearch.common.io.AtomicFiles;
import com.jsearch.common.schema.Schema;
import com.jsearch.common.schema.SchemaParser;
import com.jsearch.document.Document;
import com.jsearch.document.DocumentEncoder;
import com.jsearch.document.DocumentParser;
import com.jsearch.merge.ConcurrentMergeScheduler;
import com.jsearch.merge.LogDocMergePolicy;
import com.jsearch.merge.MergePolicy;
import com.jsearch.merge.MergeResult;
import com.jsearch.merge.MergeScheduler;
import com.jsearch.merge.MergeSource;
import com.jsearch.merge.OneMerge;
import com.jsearch.merge.SegmentMerger;
import com.jsearch.merge.SerialMergeScheduler;
import com.jsearch.query.IndexSearcher;
import com.jsearch.query.QueryParser;
import com.jsearch.query.SearchRequest;
import com.jsearch.query.SearchResults;
import com.jsearch.segment.DeleteTerm;
import com.jsearch.segment.SegmentCore;
import com.jsearch.segment.SegmentInfo;
import com.jsearch.segment.SegmentReader;
import com.jsearch.segment.SegmentWriter;
import com.jsearch.segment.Tombstones;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * An on-disk full-text index: accepts documents and deletes, publishes them
 * durably on commit, keeps the segment count bounded through merges, and
 * answers queries against the last published state.
 *
 * Writers ({@link #addDocument}, {@link #deleteDocuments}, {@link #commit})
 * are serialized by one lock. Readers ({@link #search}, {@link #numDocs})
 * never wait: they work on a reference-counted snapshot of the published
 * segment set. Publications, from commits and merges alike, are serialized by
 * a second lock that is always taken after the writer lock.
 */
public class SearchIndex implements Closeable, MergeSource {
    private static final Logger logger = LoggerFactory.getLogger(SearchIndex.class);
    static final int MAX_MERGE_FAILURES = 32;

    private final Path directory;
    private final Schema schema;
    private final IndexConfig config;
    private final WriteLock writeLock;
    private final DocumentParser documentParser;
    private final DocumentEncoder documentEncoder;
    private final QueryParser queryParser;
    private final SegmentWriter buffer;
    private final SegmentMerger merger;
    private final MergePolicy mergePolicy;
    private final MergeScheduler mergeScheduler;

    private final ReentrantLock writerLock = new ReentrantLock();
    private final ReentrantLock publishLock = new ReentrantLock();
    private final ReentrantLock mergeLock = new ReentrantLock();

    private final AtomicReference<IndexSnapshot> current = new AtomicReference<>();
    private final AtomicLong nextSegmentId;
    // open segments owned by the index: published and pending; guarded by publishLock
    private final Map<String, SegmentCore> cores = new HashMap<>();
    // guarded by writerLock
    private final List<SegmentInfo> pendingSegments = new ArrayList<>();
    private final List<PendingDelete> pendingDeletes = new ArrayList<>();
    private final List<IOException> mergeFailures = new CopyOnWriteArrayList<>();

    private volatile WriterState state = WriterState.OPEN;
    private volatile boolean closed;

    private SearchIndex(Path directory, Schema schema, Manifest manifest, IndexConfig config, WriteLock writeLock)
            throws IOException {
        this.directory = directory;
        this.schema = schema;
        this.config = config;
        this.writeLock = writeLock;
        this.documentParser = new DocumentParser(schema, config.isStrictDocuments());
        this.documentEncoder = new DocumentEncoder(schema);
        this.queryParser = new QueryParser(schema, config.getDefaultLimit());
        this.buffer = new SegmentWriter(schema);
        this.merger = new SegmentMerger(schema, config.getCompressionCodec(), config.getStoreBlockSize());
        this.mergePolicy = new LogDocMergePolicy(config.getMaxSegmentCount(), config.getMergeFactor());
        this.mergeScheduler = config.isBackgroundMerges() ? new ConcurrentMergeScheduler() : new SerialMergeScheduler();
        this.nextSegmentId = new AtomicLong(manifest.getNextSegmentId());
        this.current.set(loadSnapshot(manifest));
    }

    /**
     * Creates a new, empty index.
     *
     * @param directory Where to create it; created if missing
     * @throws IndexAlreadyExistsException If an index already exists there
     * @throws IOException If the directory or its files cannot be written
     */
    public static SearchIndex create(Path directory, Schema schema, IndexConfig config) throws IOException {
        if (ManifestStore.exists(directory)) {
            throw new IndexAlreadyExistsException(directory);
        }
        Files.createDirectories(directory);
        WriteLock lock = WriteLock.obtain(directory);
        try {
            if (ManifestStore.exists(directory)) {
                throw new IndexAlreadyExistsException(directory);
            }
            ManifestStore.writeSchema(directory, schema);
            Manifest manifest = Manifest.empty();
            ManifestStore.writeManifest(directory, manifest);
            logger.info("Created index at {} with {} fields", directory, schema.size());
            return new SearchIndex(directory, schema, manifest, config, lock);
        } catch (IOException | RuntimeException e) {
            closeAfterFailure(lock, e);
            throw e;
        }
    }

    /**
     * Creates an index from the JSON form of a schema.
     *
     * @throws com.jsearch.common.errors.SchemaException If the schema is invalid
     */
    public static SearchIndex create(Path directory, String schemaJson, IndexConfig config) throws IOException {
        return create(directory, SchemaParser.parse(schemaJson), config);
    }

    /**
     * Opens an existing index and removes files a crash may have left behind.
     *
     * @throws IndexNotFoundException If there is no index at {@code directory}
     * @throws com.jsearch.common.errors.CorruptIndexException If the manifest,
     *         schema or any live segment fails verification
     */
    public static SearchIndex open(Path directory, IndexConfig config) throws IOException {
        if (!Files.isDirectory(directory)) {
            throw new IndexNotFoundException("No index directory at " + directory);
        }
        if (!ManifestStore.exists(directory)) {
            throw new IndexNotFoundException("No manifest in " + directory);
        }
        WriteLock lock = WriteLock.obtain(directory);
        try {
            Manifest manifest = ManifestStore.readManifest(directory);
            Schema schema = ManifestStore.readSchema(directory);
            removeUnreferencedFiles(directory, manifest);
            SearchIndex index = new SearchIndex(directory, schema, manifest, config, lock);
            logger.info("Opened index at {}: {} segments, {} docs, commit {}", directory,
                manifest.getSegments().size(), manifest.getNumDocs(), manifest.getCommitSequence());
            return index;
        } catch (IOException | RuntimeException e) {
            closeAfterFailure(lock, e);
            throw e;
        }
    }

    public static SearchIndex open(Path directory) throws IOException {
        return open(directory, IndexConfig.defaults());
    }

    private static void closeAfterFailure(Closeable closeable, Exception primary) {
        try {
            closeable.close();
        } catch (IOException e) {
            primary.addSuppressed(e);
        }
    }

    /**
     * Removes temp entries, segment directories the manifest does not list and
     * superseded tombstone generations.
     */
    private static void removeUnreferencedFiles(Path directory, Manifest manifest) throws IOException {
        Map<String, SegmentInfo> live = new HashMap<>();
        for (SegmentInfo segment : manifest.getSegments()) {
            live.put(segment.getName(), segment);
        }
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(directory)) {
            for (Path entry : entries) {
                String name = entry.getFileName().toString();
                if (name.endsWith(IndexConstants.TEMP_SUFFIX)) {
                    logger.info("Removing leftover temp entry {}", entry);
                    AtomicFiles.deleteRecursively(entry);
                } else if (name.startsWith(IndexConstants.SEGMENT_PREFIX) && Files.isDirectory(entry)) {
                    SegmentInfo segment = live.get(name);
                    if (segment == null) {
                        logger.info("Removing unreferenced segment {}", entry);
                        AtomicFiles.deleteRecursively(entry);
                    } else {
                        removeStaleTombstones(entry, segment);
                    }
                }
            }
        }
    }

    private static void removeStaleTombstones(Path segmentDirectory, SegmentInfo segment) throws IOException {
        String current = IndexConstants.tombstonesFileName(segment.getDelGen());
        try (DirectoryStream<Path> files = Files.newDirectoryStream(segmentDirectory,
                IndexConstants.TOMBSTONES_PREFIX + "*")) {
            for (Path file : files) {
                String name = file.getFileName().toString();
                if (!segment.hasDeletions() || !name.equals(current)) {
                    logger.debug("Removing stale tombstones {}", file);
                    Files.deleteIfExists(file);
                }
            }
        }
    }

    private IndexSnapshot loadSnapshot(Manifest manifest) throws IOException {
        List<SegmentReader> readers = new ArrayList<>();
        try {
            for (SegmentInfo info : manifest.getSegments()) {
                SegmentCore core = SegmentCore.open(directory, info.getName(), info.getMaxDoc(), schema);
                cores.put(info.getName(), core);
                BitSet deleted = Tombstones.read(core.getDirectory(), info.getDelGen(), info.getMaxDoc(),
                    info.getDelCount());
                readers.add(new SegmentReader(core, info, deleted));
            }
        } catch (IOException | RuntimeException e) {
            for (SegmentReader reader : readers) {
                closeAfterFailure(reader, e);
            }
            for (SegmentCore core : cores.values()) {
                try {
                    core.decRef();
                } catch (IOException closeFailure) {
                    e.addSuppressed(closeFailure);
                }
            }
            cores.clear();
            throw e;
        }
        return new IndexSnapshot(manifest, readers);
    }

    public Path getDirectory() {
        return directory;
    }

    public Schema getSchema() {
        return schema;
    }

    public IndexConfig getConfig() {
        return config;
    }

    public WriterState getState() {
        return state;
    }

    private void checkOpen() {
        if (closed) {
            throw new IllegalStateException("Index is closed: " + directory);
        }
    }

    /**
     * Adds a document given as JSON. It becomes searchable with the next commit.
     *
     * @throws com.jsearch.common.errors.DocumentException If the document does not fit the schema
     * @throws IOException If an automatic flush fails; the document is buffered regardless
     */
    public void addDocument(String json) throws IOException {
        addParsed(documentParser.parse(json));
    }

    public void addDocument(Document document) throws IOException {
        documentParser.validate(document);
        addParsed(document);
    }

    private void addParsed(Document document) throws IOException {
        writerLock.lock();
        try {
            checkOpen();
            buffer.addDocument(documentEncoder.encode(document));
            state = WriterState.PENDING;
            if (buffer.numBufferedDocs() >= config.getMaxBufferedDocs()) {
                flushBuffer();
            }
        } finally {
            writerLock.unlock();
        }
    }

    /**
     * Deletes every document holding the exact term (text and string fields)
     * or value (numeric fields), including documents added but not yet
     * committed. Takes effect with the next commit; documents added after
     * this call are not affected.
     *
     * @throws com.jsearch.common.errors.QueryException If the field or value is unusable
     */
    public void deleteDocuments(String field, Object value) {
        DeleteTerm term = DeleteTerm.of(schema, field, value);
        writerLock.lock();
        try {
            checkOpen();
            int buffered = buffer.deleteDocuments(term);
            pendingDeletes.add(new PendingDelete(term, pendingSegments.size()));
            state = WriterState.PENDING;
            logger.debug("Delete {} queued, {} buffered docs dropped", term, buffered);
        } finally {
            writerLock.unlock();
        }
    }

    private void flushBuffer() throws IOException {
        if (buffer.isEmpty()) {
            return;
        }
        String name = IndexConstants.segmentName(nextSegmentId.getAndIncrement());
        SegmentInfo info = buffer.flush(directory, name, config.getCompressionCodec(), config.getStoreBlockSize());
        if (info != null) {
            SegmentCore core;
            try {
                core = SegmentCore.open(directory, name, info.getMaxDoc(), schema);
            } catch (IOException e) {
                try {
                    AtomicFiles.deleteRecursively(directory.resolve(name));
                } catch (IOException cleanup) {
                    e.addSuppressed(cleanup);
                }
                throw e;
            }
            publishLock.lock();
            try {
                cores.put(name, core);
            } finally {
                publishLock.unlock();
            }
            pendingSegments.add(info);
        }
        buffer.reset();
    }

    /**
     * Makes every buffered document and pending delete durable and visible.
     * Does nothing, and writes nothing, when there is nothing to publish.
     *
     * @return The number of live documents after the commit
     * @throws CommitFailedException If the manifest cannot be written; the
     *         previous state stays current and the commit can be retried
     * @throws IOException If flushing buffered documents fails
     */
    public long commit() throws IOException {
        long numDocs;
        writerLock.lock();
        try {
            checkOpen();
            flushBuffer();
            numDocs = publishCommit();
        } finally {
            writerLock.unlock();
        }
        maybeMerge();
        return numDocs;
    }

    private long publishCommit() throws IOException {
        publishLock.lock();
        try {
            IndexSnapshot snapshot = current.get();
            Manifest manifest = snapshot.getManifest();

            Map<String, BitSet> changedDeletes = new HashMap<>();
            for (SegmentReader reader : snapshot.getReaders()) {
                BitSet deleted = applyDeletes(reader, reader.deletedDocs(), null);
                if (deleted.cardinality() != reader.getInfo().getDelCount()) {
                    changedDeletes.put(reader.getName(), deleted);
                }
            }
            List<BitSet> pendingDeleted = new ArrayList<>();
            for (int i = 0; i < pendingSegments.size(); i++) {
                SegmentInfo info = pendingSegments.get(i);
                try (SegmentReader reader = new SegmentReader(cores.get(info.getName()), info, new BitSet())) {
                    pendingDeleted.add(applyDeletes(reader, new BitSet(info.getMaxDoc()), i));
                }
            }

            if (pendingSegments.isEmpty() && changedDeletes.isEmpty()) {
                pendingDeletes.clear();
                state = WriterState.OPEN;
                logger.debug("Nothing to commit, commit sequence stays {}", manifest.getCommitSequence());
                return snapshot.numDocs();
            }

            List<SegmentInfo> segments = new ArrayList<>();
            Map<String, BitSet> deletesByName = new HashMap<>();
            List<String> dropped = new ArrayList<>();
            for (SegmentReader reader : snapshot.getReaders()) {
                SegmentInfo info = reader.getInfo();
                BitSet deleted = changedDeletes.get(info.getName());
                if (deleted == null) {
                    segments.add(info);
                    deletesByName.put(info.getName(), reader.deletedDocs());
                } else if (deleted.cardinality() == info.getMaxDoc()) {
                    dropped.add(info.getName());
                } else {
                    long generation = info.getDelGen() + 1;
                    Tombstones.write(reader.getCore().getDirectory(), generation, deleted, info.getMaxDoc());
                    segments.add(info.withDeletes(generation, deleted.cardinality()));
                    deletesByName.put(info.getName(), deleted);
                }
            }
            for (int i = 0; i < pendingSegments.size(); i++) {
                SegmentInfo info = pendingSegments.get(i);
                BitSet deleted = pendingDeleted.get(i);
                if (deleted.cardinality() == info.getMaxDoc()) {
                    dropped.add(info.getName());
                    continue;
                }
                if (!deleted.isEmpty()) {
                    Tombstones.write(cores.get(info.getName()).getDirectory(), 1, deleted, info.getMaxDoc());
                    info = info.withDeletes(1, deleted.cardinality());
                }
                segments.add(info);
                deletesByName.put(info.getName(), deleted);
            }

            Manifest next = manifest.nextCommit(segments, nextSegmentId.get());
            state = WriterState.COMMITTING;
            try {
                ManifestStore.writeManifest(directory, next);
            } catch (IOException e) {
                state = WriterState.PENDING;
                logger.error("Commit {} failed, previous commit {} stays current", next.getCommitSequence(),
                    manifest.getCommitSequence(), e);
                throw new CommitFailedException("Failed to write manifest for commit " + next.getCommitSequence(), e);
            }

            swapSnapshot(next, deletesByName, dropped);
            for (SegmentReader reader : snapshot.getReaders()) {
                if (changedDeletes.containsKey(reader.getName()) && reader.getInfo().hasDeletions()) {
                    deleteTombstones(reader.getCore(), reader.getInfo().getDelGen());
                }
            }
            pendingSegments.clear();
            pendingDeletes.clear();
            state = WriterState.OPEN;
            logger.info("Committed {}: {} segments, {} docs", next.getCommitSequence(), segments.size(),
                next.getNumDocs());
            return next.getNumDocs();
        } finally {
            publishLock.unlock();
        }
    }

    /**
     * @param pendingIndex index of a pending segment, or null for a published one
     */
    private BitSet applyDeletes(SegmentReader reader, BitSet deleted, Integer pendingIndex) throws IOException {
        for (PendingDelete delete : pendingDeletes) {
            if (pendingIndex == null || delete.appliesToPending(pendingIndex)) {
                deleted.or(delete.getTerm().matchingDocs(reader));
            }
        }
        return deleted;
    }

    /**
     * Makes {@code manifest} current. Must hold the publish lock and the
     * manifest must already be durable.
     */
    private void swapSnapshot(Manifest manifest, Map<String, BitSet> deletesByName, List<String> dropped)
            throws IOException {
        List<SegmentReader> readers = new ArrayList<>();
        for (SegmentInfo info : manifest.getSegments()) {
            readers.add(new SegmentReader(cores.get(info.getName()), info, deletesByName.get(info.getName())));
        }
        IndexSnapshot previous = current.getAndSet(new IndexSnapshot(manifest, readers));
        for (String name : dropped) {
            SegmentCore core = cores.remove(name);
            core.markObsolete();
            core.decRef();
        }
        previous.decRef();
    }

    private void deleteTombstones(SegmentCore core, long generation) {
        try {
            Tombstones.delete(core.getDirectory(), generation);
        } catch (IOException e) {
            logger.warn("Could not delete tombstones generation {} of {}; removed on next open", generation,
                core.getName(), e);
        }
    }

    private void maybeMerge() {
        if (!closed) {
            mergeScheduler.merge(this);
        }
    }

    @Override
    public OneMerge getNextMerge() {
        if (closed) {
            return null;
        }
        return mergePolicy.findMerge(current.get().getManifest().getSegments());
    }

    /**
     * Merges segments until at most {@code maxSegmentCount} remain.
     *
     * @throws IOException If a merge fails; segments merged so far stay merged
     */
    public void forceMerge(int maxSegmentCount) throws IOException {
        checkOpen();
        if (maxSegmentCount < 1) {
            throw new IllegalArgumentException("maxSegmentCount must be at least 1, got " + maxSegmentCount);
        }
        OneMerge merge;
        while ((merge = mergePolicy.findForcedMerge(current.get().getManifest().getSegments(), maxSegmentCount))
                != null) {
            merge(merge);
        }
    }

    /**
     * Runs one merge against the current snapshot and publishes the result.
     * Deletes committed while the merge ran are carried over to the merged
     * segment.
     */
    @Override
    public void merge(OneMerge merge) throws IOException {
        mergeLock.lock();
        try {
            if (closed) {
                logger.debug("Index closed, skipping {}", merge);
                return;
            }
            IndexSnapshot snapshot = incRefCurrent();
            try {
                runMerge(merge, snapshot);
            } finally {
                snapshot.decRef();
            }
        } finally {
            mergeLock.unlock();
        }
    }

    private void runMerge(OneMerge merge, IndexSnapshot snapshot) throws IOException {
        List<SegmentReader> inputs = new ArrayList<>();
        for (SegmentInfo info : merge.getSegments()) {
            SegmentReader reader = snapshot.reader(info.getName());
            if (reader == null) {
                logger.debug("Skipping {}: segment {} is gone", merge, info.getName());
                return;
            }
            inputs.add(reader);
        }
        String name = IndexConstants.segmentName(nextSegmentId.getAndIncrement());
        logger.info("Merging {} into {}", merge, name);
        MergeResult result = merger.merge(directory, name, inputs);
        SegmentCore mergedCore = null;
        if (result.getSegment() != null) {
            try {
                mergedCore = SegmentCore.open(directory, name, result.getSegment().getMaxDoc(), schema);
            } catch (IOException e) {
                try {
                    AtomicFiles.deleteRecursively(directory.resolve(name));
                } catch (IOException cleanup) {
                    e.addSuppressed(cleanup);
                }
                throw e;
            }
        }
        publishMerge(inputs, result, mergedCore);
    }

    private void publishMerge(List<SegmentReader> inputs, MergeResult result, SegmentCore mergedCore)
            throws IOException {
        publishLock.lock();
        try {
            IndexSnapshot latest = current.get();
            Set<String> inputNames = new HashSet<>();
            for (SegmentReader input : inputs) {
                inputNames.add(input.getName());
            }

            SegmentInfo mergedInfo = result.getSegment();
            BitSet carried = new BitSet();
            for (int i = 0; i < inputs.size(); i++) {
                SegmentReader before = inputs.get(i);
                SegmentReader now = latest.reader(before.getName());
                if (now == null) {
                    logger.info("Discarding merge result: {} was removed while merging", before.getName());
                    discard(mergedCore);
                    return;
                }
                BitSet newlyDeleted = now.deletedDocs();
                newlyDeleted.andNot(before.deletedDocs());
                int[] docMap = result.getDocMap(i);
                for (int doc = newlyDeleted.nextSetBit(0); doc >= 0; doc = newlyDeleted.nextSetBit(doc + 1)) {
                    carried.set(docMap[doc]);
                }
            }
            boolean dropMerged = mergedInfo == null || carried.cardinality() == mergedInfo.getMaxDoc();
            if (mergedInfo != null && !dropMerged && !carried.isEmpty()) {
                Tombstones.write(mergedCore.getDirectory(), 1, carried, mergedInfo.getMaxDoc());
                mergedInfo = mergedInfo.withDeletes(1, carried.cardinality());
                logger.debug("Carried {} deletes onto {}", carried.cardinality(), mergedInfo.getName());
            }

            List<SegmentInfo> segments = new ArrayList<>();
            Map<String, BitSet> deletesByName = new HashMap<>();
            boolean placed = false;
            for (SegmentReader reader : latest.getReaders()) {
                if (inputNames.contains(reader.getName())) {
                    if (!placed && !dropMerged) {
                        segments.add(mergedInfo);
                        deletesByName.put(mergedInfo.getName(), carried);
                    }
                    placed = true;
                    continue;
                }
                segments.add(reader.getInfo());
                deletesByName.put(reader.getName(), reader.deletedDocs());
            }
            Manifest next = latest.getManifest().nextMerge(segments, nextSegmentId.get());
            try {
                ManifestStore.writeManifest(directory, next);
            } catch (IOException e) {
                discard(mergedCore);
                throw e;
            }
            if (mergedCore != null && !dropMerged) {
                cores.put(mergedInfo.getName(), mergedCore);
            } else {
                discard(mergedCore);
            }
            swapSnapshot(next, deletesByName, new ArrayList<>(inputNames));
            logger.info("Published merge generation {}: {} segments", next.getGeneration(), segments.size());
        } finally {
            publishLock.unlock();
        }
    }

    private static void discard(SegmentCore core) throws IOException {
        if (core != null) {
            core.markObsolete();
            core.decRef();
        }
    }

    @Override
    public void onMergeFailure(OneMerge merge, IOException failure) {
        synchronized (mergeFailures) {
            mergeFailures.add(failure);
            while (mergeFailures.size() > MAX_MERGE_FAILURES) {
                mergeFailures.remove(0);
            }
        }
    }

    /**
     * The most recent failures of merges that ran automatically after a
     * commit, oldest first. At most {@value #MAX_MERGE_FAILURES} are kept.
     */
    public List<IOException> mergeFailures() {
        return Collections.unmodifiableList(new ArrayList<>(mergeFailures));
    }

    /**
     * Waits for background merges requested so far. A no-op when merges run
     * in the committing thread.
     */
    public void waitForMerges() throws IOException {
        checkOpen();
        if (mergeScheduler instanceof ConcurrentMergeScheduler) {
            ((ConcurrentMergeScheduler) mergeScheduler).sync();
        }
    }

    /**
     * Takes a reference on the current snapshot. Release it with
     * {@link IndexSnapshot#close()}.
     */
    public IndexSnapshot acquireSnapshot() {
        checkOpen();
        return incRefCurrent();
    }

    private IndexSnapshot incRefCurrent() {
        while (true) {
            IndexSnapshot snapshot = current.get();
            if (snapshot.tryIncRef()) {
                return snapshot;
            }
            // only close() drops the last reference; swaps install the next snapshot first
            checkOpen();
        }
    }

    /**
     * Live documents in the last published state.
     */
    public long numDocs() {
        checkOpen();
        return current.get().numDocs();
    }

    public long commitSequence() {
        checkOpen();
        return current.get().getCommitSequence();
    }

    public int segmentCount() {
        checkOpen();
        return current.get().getReaders().size();
    }

    /**
     * Runs a query written in the JSON DSL.
     *
     * @return The result page as JSON
     * @throws com.jsearch.common.errors.QueryException If the query is malformed
     */
    public String search(String queryJson) throws IOException {
        return search(queryParser.parse(queryJson)).toJson();
    }

    public SearchResults search(SearchRequest request) throws IOException {
        try (IndexSnapshot snapshot = acquireSnapshot()) {
            return new IndexSearcher(snapshot).search(request);
        }
    }

    public QueryParser getQueryParser() {
        return queryParser;
    }

    /**
     * Stops merges, releases the published snapshot and the write lock.
     * Uncommitted documents, segments and deletes are discarded. Snapshots
     * still held by readers stay usable until released.
     */
    @Override
    public void close() throws IOException {
        writerLock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            try {
                mergeScheduler.close();
            } finally {
                publishLock.lock();
                try {
                    if (!buffer.isEmpty() || !pendingSegments.isEmpty() || !pendingDeletes.isEmpty()) {
                        logger.warn("Closing {} with uncommitted changes: {} buffered docs, {} pending segments, "
                            + "{} pending deletes", directory, buffer.numBufferedDocs(), pendingSegments.size(),
                            pendingDeletes.size());
                    }
                    buffer.reset();
                    Set<String> published = new HashSet<>();
                    for (SegmentInfo info : current.get().getManifest().getSegments()) {
                        published.add(info.getName());
                    }
                    current.get().decRef();
                    for (SegmentCore core : cores.values()) {
                        if (!published.contains(core.getName())) {
                            core.markObsolete();
                        }
                        core.decRef();
                    }
                    cores.clear();
                    pendingSegments.clear();
                    pendingDeletes.clear();
                } finally {
                    publishLock.unlock();
                    writeLock.close();
                }
            }
            logger.info("Closed index at {}", directory);
        } finally {
            writerLock.unlock();
        }
    }
}

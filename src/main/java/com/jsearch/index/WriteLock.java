package com.jsearch.index;

import com.jsearch.common.IndexConstants;
import com.jsearch.common.errors.LockObtainFailedException;

import java.io.Closeable;
import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Exclusive OS-level lock on {@code write.lock}, held for as long as an index
 * is open. The file itself is never deleted.
 */
final class WriteLock implements Closeable {
    private final Path path;
    private final FileChannel channel;
    private final FileLock lock;

    private WriteLock(Path path, FileChannel channel, FileLock lock) {
        this.path = path;
        this.channel = channel;
        this.lock = lock;
    }

    static WriteLock obtain(Path indexDirectory) throws IOException {
        Path path = indexDirectory.resolve(IndexConstants.WRITE_LOCK_FILE);
        FileChannel channel = FileChannel.open(path, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
        FileLock lock;
        try {
            lock = channel.tryLock();
        } catch (OverlappingFileLockException e) {
            channel.close();
            throw new LockObtainFailedException("Index is already open in this process: " + indexDirectory, e);
        } catch (IOException e) {
            channel.close();
            throw e;
        }
        if (lock == null) {
            channel.close();
            throw new LockObtainFailedException("Index is locked by another process: " + indexDirectory);
        }
        return new WriteLock(path, channel, lock);
    }

    @Override
    public void close() throws IOException {
        try {
            lock.release();
        } finally {
            channel.close();
        }
    }

    @Override
    public String toString() {
        return "WriteLock(" + path + ")";
    }
}

package com.jsearch.common.io;

import com.jsearch.common.IndexConstants;
import com.jsearch.common.errors.CorruptIndexException;

import java.io.IOException;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.zip.CRC32;

/**
 * Reader over a byte buffer written by {@link IndexOutput}.
 */
public class IndexInput {
    private static final int FOOTER_LENGTH = 12;
    private static final int VERIFY_CHUNK = 64 * 1024;

    private final Path path;
    private final ByteBuffer buffer;

    public IndexInput(Path path, ByteBuffer buffer) {
        this.path = path;
        this.buffer = buffer;
    }

    /**
     * Reads a whole file into memory, verifies header and checksum, and returns
     * an input positioned right after the header. The footer is excluded.
     *
     * @param path The file to read
     * @param fileType The file type the header must name
     * @return The verified input
     * @throws IOException If the file cannot be read
     * @throws CorruptIndexException If header, footer or checksum do not match
     */
    public static IndexInput openVerified(Path path, String fileType) throws IOException {
        try (FileChannel channel = FileChannel.open(path, StandardOpenOption.READ)) {
            long size = channel.size();
            if (size > Integer.MAX_VALUE) {
                throw new CorruptIndexException("File too large to load: " + size, path);
            }
            ByteBuffer all = ByteBuffer.allocate((int) size);
            readFully(channel, all, 0);
            all.flip();
            verifyChecksum(path, all);
            ByteBuffer body = all.duplicate();
            body.limit((int) size - FOOTER_LENGTH);
            IndexInput input = new IndexInput(path, body);
            input.checkHeader(fileType);
            return input;
        }
    }

    /**
     * Streams an open file once to check its header and checksum without loading it.
     *
     * @return The offset right after the header
     */
    public static long verifyChannel(Path path, FileChannel channel, String fileType) throws IOException {
        long size = channel.size();
        if (size < FOOTER_LENGTH + 8) {
            throw new CorruptIndexException("File truncated: " + size + " bytes", path);
        }
        CRC32 crc = new CRC32();
        ByteBuffer chunk = ByteBuffer.allocate(VERIFY_CHUNK);
        long checkedLength = size - 8;
        long offset = 0;
        while (offset < checkedLength) {
            chunk.clear();
            chunk.limit((int) Math.min(VERIFY_CHUNK, checkedLength - offset));
            readFully(channel, chunk, offset);
            chunk.flip();
            crc.update(chunk);
            offset += chunk.limit();
        }
        ByteBuffer tail = ByteBuffer.allocate(FOOTER_LENGTH);
        readFully(channel, tail, size - FOOTER_LENGTH);
        tail.flip();
        if (tail.getInt() != IndexConstants.FILE_MAGIC) {
            throw new CorruptIndexException("Invalid footer magic number", path);
        }
        if (tail.getLong() != crc.getValue()) {
            throw new CorruptIndexException("Checksum mismatch", path);
        }
        ByteBuffer head = ByteBuffer.allocate((int) Math.min(size, 256));
        readFully(channel, head, 0);
        head.flip();
        IndexInput header = new IndexInput(path, head);
        header.checkHeader(fileType);
        return header.position();
    }

    /**
     * Reads {@code length} bytes at {@code offset} of an open file.
     */
    public static IndexInput slice(Path path, FileChannel channel, long offset, int length) throws IOException {
        ByteBuffer slice = ByteBuffer.allocate(length);
        readFully(channel, slice, offset);
        slice.flip();
        return new IndexInput(path, slice);
    }

    private static void verifyChecksum(Path path, ByteBuffer all) throws CorruptIndexException {
        int size = all.limit();
        if (size < FOOTER_LENGTH + 8) {
            throw new CorruptIndexException("File truncated: " + size + " bytes", path);
        }
        CRC32 crc = new CRC32();
        ByteBuffer checked = all.duplicate();
        checked.limit(size - 8);
        crc.update(checked);
        if (all.getInt(size - FOOTER_LENGTH) != IndexConstants.FILE_MAGIC) {
            throw new CorruptIndexException("Invalid footer magic number", path);
        }
        if (all.getLong(size - 8) != crc.getValue()) {
            throw new CorruptIndexException("Checksum mismatch", path);
        }
    }

    private static void readFully(FileChannel channel, ByteBuffer target, long offset) throws IOException {
        long position = offset;
        while (target.hasRemaining()) {
            int read = channel.read(target, position);
            if (read < 0) {
                throw new IOException("Unexpected end of file at offset " + position);
            }
            position += read;
        }
    }

    private void checkHeader(String fileType) throws IOException {
        if (readInt() != IndexConstants.FILE_MAGIC) {
            throw new CorruptIndexException("Invalid header magic number", path);
        }
        String actualType = readString();
        if (!actualType.equals(fileType)) {
            throw new CorruptIndexException("Expected file type " + fileType + " but found " + actualType, path);
        }
        int version = readInt();
        if (version != IndexConstants.FORMAT_VERSION) {
            throw new CorruptIndexException("Unsupported format version " + version, path);
        }
    }

    public byte readByte() throws IOException {
        try {
            return buffer.get();
        } catch (BufferUnderflowException e) {
            throw new CorruptIndexException("Read past end of data", path, e);
        }
    }

    public void readBytes(byte[] target) throws IOException {
        try {
            buffer.get(target);
        } catch (BufferUnderflowException e) {
            throw new CorruptIndexException("Read past end of data", path, e);
        }
    }

    public int readInt() throws IOException {
        try {
            return buffer.getInt();
        } catch (BufferUnderflowException e) {
            throw new CorruptIndexException("Read past end of data", path, e);
        }
    }

    public long readLong() throws IOException {
        try {
            return buffer.getLong();
        } catch (BufferUnderflowException e) {
            throw new CorruptIndexException("Read past end of data", path, e);
        }
    }

    public int readVInt() throws IOException {
        int value = 0;
        for (int shift = 0; shift < 32; shift += 7) {
            byte b = readByte();
            value |= (b & 0x7F) << shift;
            if ((b & 0x80) == 0) {
                return value;
            }
        }
        throw new CorruptIndexException("Invalid vint", path);
    }

    public long readVLong() throws IOException {
        long value = 0;
        for (int shift = 0; shift < 64; shift += 7) {
            byte b = readByte();
            value |= (long) (b & 0x7F) << shift;
            if ((b & 0x80) == 0) {
                return value;
            }
        }
        throw new CorruptIndexException("Invalid vlong", path);
    }

    public String readString() throws IOException {
        int length = readVInt();
        if (length > buffer.remaining()) {
            throw new CorruptIndexException("String length " + length + " exceeds remaining data", path);
        }
        byte[] bytes = new byte[length];
        readBytes(bytes);
        return new String(bytes, StandardCharsets.UTF_8);
    }

    public int position() {
        return buffer.position();
    }

    public void seek(int position) {
        buffer.position(position);
    }

    public boolean hasRemaining() {
        return buffer.hasRemaining();
    }

    public Path getPath() {
        return path;
    }
}

package com.jsearch.common.io;

import com.jsearch.common.IndexConstants;

import java.io.BufferedOutputStream;
import java.io.Closeable;
import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.zip.CRC32;
import java.util.zip.CheckedOutputStream;

/**
 * Sequential writer for one segment file.
 *
 * Every file starts with a header (magic, file type, format version) and ends
 * with a footer (magic, CRC32 of everything before the checksum itself), so
 * that truncated or damaged files are detected when they are opened.
 * Integers are big-endian; the variable-length encodings use 7 bits per byte
 * with the high bit as continuation flag.
 */
public class IndexOutput implements Closeable {
    private static final int BUFFER_SIZE = 64 * 1024;

    private final Path path;
    private final FileChannel channel;
    private final CRC32 crc = new CRC32();
    private final DataOutputStream out;
    private long position;
    private boolean closed;

    private IndexOutput(Path path, FileChannel channel) {
        this.path = path;
        this.channel = channel;
        this.out = new DataOutputStream(new CheckedOutputStream(
            new BufferedOutputStream(Channels.newOutputStream(channel), BUFFER_SIZE), crc));
    }

    /**
     * Creates a new file; fails if it already exists.
     *
     * @param path The file to create
     * @return An output positioned at offset 0
     * @throws IOException If the file cannot be created
     */
    public static IndexOutput create(Path path) throws IOException {
        FileChannel channel = FileChannel.open(path, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
        return new IndexOutput(path, channel);
    }

    public void writeHeader(String fileType) throws IOException {
        if (position != 0) {
            throw new IllegalStateException("Header must be the first thing written to " + path);
        }
        writeInt(IndexConstants.FILE_MAGIC);
        writeString(fileType);
        writeInt(IndexConstants.FORMAT_VERSION);
    }

    /**
     * Writes the footer magic and the checksum. Nothing may be written after it.
     */
    public void writeFooter() throws IOException {
        writeInt(IndexConstants.FILE_MAGIC);
        long checksum = crc.getValue();
        writeLong(checksum);
    }

    public void writeByte(byte b) throws IOException {
        out.writeByte(b);
        position++;
    }

    public void writeBytes(byte[] bytes) throws IOException {
        writeBytes(bytes, 0, bytes.length);
    }

    public void writeBytes(byte[] bytes, int offset, int length) throws IOException {
        out.write(bytes, offset, length);
        position += length;
    }

    public void writeInt(int value) throws IOException {
        out.writeInt(value);
        position += 4;
    }

    public void writeLong(long value) throws IOException {
        out.writeLong(value);
        position += 8;
    }

    public void writeVInt(int value) throws IOException {
        if (value < 0) {
            throw new IllegalArgumentException("Negative vint: " + value);
        }
        while ((value & ~0x7F) != 0) {
            writeByte((byte) ((value & 0x7F) | 0x80));
            value >>>= 7;
        }
        writeByte((byte) value);
    }

    public void writeVLong(long value) throws IOException {
        if (value < 0) {
            throw new IllegalArgumentException("Negative vlong: " + value);
        }
        while ((value & ~0x7FL) != 0L) {
            writeByte((byte) ((value & 0x7FL) | 0x80L));
            value >>>= 7;
        }
        writeByte((byte) value);
    }

    public void writeString(String value) throws IOException {
        byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
        writeVInt(bytes.length);
        writeBytes(bytes);
    }

    public long getFilePointer() {
        return position;
    }

    public Path getPath() {
        return path;
    }

    /**
     * Flushes buffered bytes and forces them to the storage device.
     */
    public void sync() throws IOException {
        out.flush();
        channel.force(true);
    }

    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        try {
            out.flush();
        } finally {
            channel.close();
        }
    }
}

package com.jsearch.common.io;

import com.jsearch.common.errors.CorruptIndexException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.*;

class IndexFilesTest {
    @TempDir
    Path tempDir;

    private Path writeSample(String fileType) throws IOException {
        Path file = tempDir.resolve("sample.dat");
        try (IndexOutput out = IndexOutput.create(file)) {
            out.writeHeader(fileType);
            out.writeVInt(300);
            out.writeVLong(1L << 40);
            out.writeString("knight");
            out.writeInt(-7);
            out.writeLong(Long.MIN_VALUE);
            out.writeFooter();
            out.sync();
        }
        return file;
    }

    @Test
    void shouldReadBackWhatWasWritten() throws IOException {
        Path file = writeSample("sample");

        IndexInput in = IndexInput.openVerified(file, "sample");

        assertThat(in.readVInt()).isEqualTo(300);
        assertThat(in.readVLong()).isEqualTo(1L << 40);
        assertThat(in.readString()).isEqualTo("knight");
        assertThat(in.readInt()).isEqualTo(-7);
        assertThat(in.readLong()).isEqualTo(Long.MIN_VALUE);
        assertThat(in.hasRemaining()).isFalse();
    }

    @Test
    void shouldDetectFlippedByte() throws IOException {
        Path file = writeSample("sample");
        byte[] bytes = Files.readAllBytes(file);
        bytes[bytes.length / 2] ^= 0x10;
        Files.write(file, bytes);

        assertThatThrownBy(() -> IndexInput.openVerified(file, "sample"))
            .isInstanceOf(CorruptIndexException.class)
            .hasMessageContaining("Checksum mismatch");
        try (FileChannel channel = FileChannel.open(file, StandardOpenOption.READ)) {
            assertThatThrownBy(() -> IndexInput.verifyChannel(file, channel, "sample"))
                .isInstanceOf(CorruptIndexException.class);
        }
    }

    @Test
    void shouldDetectTruncatedFile() throws IOException {
        Path file = writeSample("sample");
        byte[] bytes = Files.readAllBytes(file);
        Files.write(file, Arrays.copyOf(bytes, bytes.length - 3));

        assertThatThrownBy(() -> IndexInput.openVerified(file, "sample"))
            .isInstanceOf(CorruptIndexException.class);
    }

    @Test
    void shouldRejectWrongFileType() throws IOException {
        Path file = writeSample("norms");

        assertThatThrownBy(() -> IndexInput.openVerified(file, "terms"))
            .isInstanceOf(CorruptIndexException.class)
            .hasMessageContaining("Expected file type terms");
    }

    @Test
    void shouldRefuseToOverwriteExistingFile() throws IOException {
        Path file = writeSample("sample");

        assertThatThrownBy(() -> IndexOutput.create(file)).isInstanceOf(IOException.class);
    }

    @Test
    void shouldReplaceFileAtomically() throws IOException {
        Path target = tempDir.resolve("manifest.json");
        AtomicFiles.write(target, "first".getBytes(StandardCharsets.UTF_8));

        AtomicFiles.write(target, "second".getBytes(StandardCharsets.UTF_8));

        assertThat(Files.readString(target)).isEqualTo("second");
        assertThat(tempDir.resolve("manifest.json.tmp")).doesNotExist();
    }

    @Test
    void shouldDeleteDirectoryTrees() throws IOException {
        Path tree = Files.createDirectories(tempDir.resolve("seg_00000001/nested"));
        Files.writeString(tree.resolve("file.dat"), "x");

        AtomicFiles.deleteRecursively(tempDir.resolve("seg_00000001"));
        AtomicFiles.deleteRecursively(tempDir.resolve("never-existed"));

        assertThat(tempDir.resolve("seg_00000001")).doesNotExist();
    }
}

package com.jsearch.segment;

import com.jsearch.common.compression.CompressionCodec;
import com.jsearch.common.errors.CorruptIndexException;
import com.jsearch.document.DocumentEncoder;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.BitSet;

import static com.jsearch.segment.SegmentTestSupport.MOVIES;
import static com.jsearch.segment.SegmentTestSupport.movie;
import static com.jsearch.segment.SegmentTestSupport.writeSegment;
import static org.assertj.core.api.Assertions.*;

class SegmentWriterTest {
    @TempDir
    Path tempDir;

    @Test
    void shouldWriteReadableSegment() throws IOException {
        // Arrange / Act
        try (SegmentReader reader = writeSegment(tempDir, "seg_00000001",
                movie("tt0468569", "The Dark Knight", 2008, 9.0),
                movie("tt0068646", "The Godfather", 1972, 9.2),
                movie("tt0133093", "The Matrix", 1999, 8.7))) {

            // Assert
            assertThat(reader.maxDoc()).isEqualTo(3);
            assertThat(reader.numDocs()).isEqualTo(3);

            TermDictionary titles = reader.terms(1);
            assertThat(titles.size()).isEqualTo(5);
            assertThat(titles.term(0)).isEqualTo("dark");
            assertThat(titles.getDocCount()).isEqualTo(3);
            assertThat(titles.getSumTotalTermFreq()).isEqualTo(7);

            int the = titles.find("the");
            assertThat(titles.docFreq(the)).isEqualTo(3);
            Postings postings = reader.postings(titles, the);
            assertThat(postings.doc(2)).isEqualTo(2);
            assertThat(postings.positions(0)).containsExactly(0);
            assertThat(titles.find("knights")).isNegative();

            assertThat(reader.norms(1)).containsExactly(3, 2, 2);
            assertThat(reader.norms(0)).isNull();
            assertThat(reader.column(2).longValue(1)).isEqualTo(1972L);
            assertThat(reader.column(3).doubleValue(2)).isEqualTo(8.7);

            assertThat(reader.document(0).get("title")).containsExactly("The Dark Knight");
            assertThat(reader.document(2).get("id")).containsExactly("tt0133093");
        }
    }

    @Test
    void shouldWriteOnlyCompleteSegmentDirectory() throws IOException {
        try (SegmentReader reader = writeSegment(tempDir, "seg_00000001", movie("tt1", "Heat", 1995, 8.3))) {
            assertThat(tempDir.resolve("seg_00000001")).isDirectory();
            assertThat(tempDir.resolve("seg_00000001.tmp")).doesNotExist();
            assertThat(reader.getCore().getDirectory()).isEqualTo(tempDir.resolve("seg_00000001"));
        }
    }

    @Test
    void shouldDropBufferedDocumentsMatchingDelete() throws IOException {
        // Arrange
        SegmentWriter writer = new SegmentWriter(MOVIES);
        DocumentEncoder encoder = new DocumentEncoder(MOVIES);
        writer.addDocument(encoder.encode(movie("a", "Fight Club", 1999, 8.8)));
        writer.addDocument(encoder.encode(movie("b", "Forrest Gump", 1994, 8.8)));
        writer.addDocument(encoder.encode(movie("c", "The Matrix", 1999, 8.7)));

        // Act
        int byTerm = writer.deleteDocuments(DeleteTerm.of(MOVIES, "id", "b"));
        int byValue = writer.deleteDocuments(DeleteTerm.of(MOVIES, "year", 1999L));
        SegmentInfo info = writer.flush(tempDir, "seg_00000001", CompressionCodec.UNCOMPRESSED, 1024);

        // Assert
        assertThat(byTerm).isEqualTo(1);
        assertThat(byValue).isEqualTo(2);
        assertThat(writer.numLiveDocs()).isZero();
        assertThat(info).isNull();
        assertThat(tempDir.resolve("seg_00000001")).doesNotExist();
    }

    @Test
    void shouldCompactDeletedBufferedDocuments() throws IOException {
        SegmentWriter writer = new SegmentWriter(MOVIES);
        DocumentEncoder encoder = new DocumentEncoder(MOVIES);
        writer.addDocument(encoder.encode(movie("a", "Fight Club", 1999, 8.8)));
        writer.addDocument(encoder.encode(movie("b", "Forrest Gump", 1994, 8.8)));
        writer.addDocument(encoder.encode(movie("c", "The Matrix", 1999, 8.7)));
        writer.deleteDocuments(DeleteTerm.of(MOVIES, "id", "b"));

        SegmentInfo info = writer.flush(tempDir, "seg_00000001", CompressionCodec.ZSTD, 16);

        assertThat(info.getMaxDoc()).isEqualTo(2);
        try (SegmentReader reader = SegmentTestSupport.open(tempDir, info, new BitSet())) {
            assertThat(reader.document(1).get("id")).containsExactly("c");
            assertThat(reader.terms(1).find("gump")).isNegative();
            assertThat(reader.column(2).longValue(1)).isEqualTo(1999L);
        }
    }

    @Test
    void shouldMatchDeleteTermsAgainstSegment() throws IOException {
        try (SegmentReader reader = writeSegment(tempDir, "seg_00000001",
                movie("a", "Fight Club", 1999, 8.8),
                movie("b", "Forrest Gump", 1994, -0.0),
                movie("c", "The Matrix", 1999, 8.7))) {

            assertThat(DeleteTerm.of(MOVIES, "year", 1999L).matchingDocs(reader).stream()).containsExactly(0, 2);
            assertThat(DeleteTerm.of(MOVIES, "rating", 0.0).matchingDocs(reader).stream()).containsExactly(1);
            assertThat(DeleteTerm.of(MOVIES, "title", "club").matchingDocs(reader).stream()).containsExactly(0);
            assertThat(DeleteTerm.of(MOVIES, "title", "Club").matchingDocs(reader).isEmpty()).isTrue();
        }
    }

    @Test
    void shouldPersistTombstoneGenerations() throws IOException {
        try (SegmentReader reader = writeSegment(tempDir, "seg_00000001",
                movie("a", "Fight Club", 1999, 8.8), movie("b", "Heat", 1995, 8.3))) {
            Path directory = reader.getCore().getDirectory();
            BitSet deleted = new BitSet();
            deleted.set(1);

            Tombstones.write(directory, 1, deleted, 2);

            assertThat(Tombstones.read(directory, 1, 2, 1)).isEqualTo(deleted);
            assertThat(Tombstones.read(directory, 0, 2, 0).isEmpty()).isTrue();
            assertThatThrownBy(() -> Tombstones.read(directory, 1, 2, 2))
                .isInstanceOf(CorruptIndexException.class);
            Tombstones.delete(directory, 1);
            assertThat(Files.exists(directory.resolve("tombstones_1.del"))).isFalse();
        }
    }

    @Test
    void shouldRejectCorruptSegmentOnOpen() throws IOException {
        SegmentInfo info;
        try (SegmentReader reader = writeSegment(tempDir, "seg_00000001", movie("a", "Fight Club", 1999, 8.8))) {
            info = reader.getInfo();
        }
        Path store = tempDir.resolve("seg_00000001").resolve("store.dat");
        byte[] bytes = Files.readAllBytes(store);
        bytes[bytes.length - 20] ^= 0x01;
        Files.write(store, bytes);

        assertThatThrownBy(() -> SegmentTestSupport.open(tempDir, info, new BitSet()))
            .isInstanceOf(CorruptIndexException.class);
    }

    @Test
    void shouldRejectDeleteTermsThatCannotMatch() {
        assertThatThrownBy(() -> DeleteTerm.of(MOVIES, "director", "Nolan"))
            .hasMessageContaining("Unknown field");
        assertThatThrownBy(() -> DeleteTerm.of(MOVIES, "year", "1999"))
            .hasMessageContaining("numeric value");
        assertThatThrownBy(() -> DeleteTerm.of(MOVIES, "title", 1999))
            .hasMessageContaining("string term");
    }
}

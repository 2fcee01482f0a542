package com.jsearch.merge;

import com.jsearch.common.compression.CompressionCodec;
import com.jsearch.segment.Postings;
import com.jsearch.segment.SegmentInfo;
import com.jsearch.segment.SegmentReader;
import com.jsearch.segment.SegmentTestSupport;
import com.jsearch.segment.TermDictionary;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.BitSet;
import java.util.List;

import static com.jsearch.segment.SegmentTestSupport.MOVIES;
import static com.jsearch.segment.SegmentTestSupport.movie;
import static com.jsearch.segment.SegmentTestSupport.writeSegment;
import static org.assertj.core.api.Assertions.*;

class SegmentMergerTest {
    @TempDir
    Path tempDir;

    private final SegmentMerger merger = new SegmentMerger(MOVIES, CompressionCodec.GZIP, 128);

    @Test
    void shouldMergeSegmentsInOrderDroppingDeletedDocs() throws IOException {
        // Arrange
        SegmentInfo first;
        SegmentInfo second;
        try (SegmentReader a = writeSegment(tempDir, "seg_00000001",
                movie("a", "The Dark Knight", 2008, 9.0), movie("b", "The Godfather", 1972, 9.2));
             SegmentReader b = writeSegment(tempDir, "seg_00000002",
                movie("c", "The Dark Knight Rises", 2012, 8.4), movie("d", "Heat", 1995, 8.3))) {
            first = a.getInfo();
            second = b.getInfo();
        }
        BitSet deletedInFirst = new BitSet();
        deletedInFirst.set(1);

        MergeResult result;
        try (SegmentReader a = SegmentTestSupport.open(tempDir, first.withDeletes(1, 1), deletedInFirst);
             SegmentReader b = SegmentTestSupport.open(tempDir, second, new BitSet())) {

            // Act
            result = merger.merge(tempDir, "seg_00000003", List.of(a, b));
        }

        // Assert
        assertThat(result.getSegment().getMaxDoc()).isEqualTo(3);
        assertThat(result.getDocMap(0)).containsExactly(0, -1);
        assertThat(result.getDocMap(1)).containsExactly(1, 2);
        try (SegmentReader merged = SegmentTestSupport.open(tempDir, result.getSegment(), new BitSet())) {
            TermDictionary titles = merged.terms(1);
            assertThat(titles.find("godfather")).isNegative();
            int dark = titles.find("dark");
            assertThat(titles.docFreq(dark)).isEqualTo(2);
            Postings postings = merged.postings(titles, dark);
            assertThat(postings.doc(0)).isZero();
            assertThat(postings.doc(1)).isEqualTo(1);
            assertThat(postings.positions(1)).containsExactly(1);

            assertThat(titles.getSumTotalTermFreq()).isEqualTo(3 + 4 + 1);
            assertThat(merged.norms(1)).containsExactly(3, 4, 1);
            assertThat(merged.column(2).longValue(1)).isEqualTo(2012L);
            assertThat(merged.document(2).get("title")).containsExactly("Heat");
        }
    }

    @Test
    void shouldWriteNothingWhenNoDocumentSurvives() throws IOException {
        BitSet all = new BitSet();
        all.set(0);
        SegmentInfo info;
        try (SegmentReader a = writeSegment(tempDir, "seg_00000001", movie("a", "Heat", 1995, 8.3))) {
            info = a.getInfo();
        }

        MergeResult result;
        try (SegmentReader a = SegmentTestSupport.open(tempDir, info.withDeletes(1, 1), all);
             SegmentReader b = SegmentTestSupport.open(tempDir, info.withDeletes(1, 1), all)) {
            result = merger.merge(tempDir, "seg_00000002", List.of(a, b));
        }

        assertThat(result.getSegment()).isNull();
        assertThat(result.getDocMap(0)).containsExactly(-1);
        assertThat(tempDir.resolve("seg_00000002")).doesNotExist();
    }
}

package com.jsearch.index;

import com.jsearch.common.errors.CommitFailedException;
import com.jsearch.common.io.AtomicFiles;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.*;

class CommitFailureTest {
    @TempDir
    Path tempDir;

    private Path indexDir;
    private SearchIndex index;

    @BeforeEach
    void setUp() throws IOException {
        indexDir = tempDir.resolve("index");
        index = SearchIndex.create(indexDir, SearchIndexTest.SCHEMA, IndexConfig.defaults());
        index.addDocument("{\"id\": \"a\", \"title\": \"Heat\", \"year\": 1995}");
        index.commit();
    }

    @AfterEach
    void tearDown() throws IOException {
        index.close();
    }

    @Test
    void shouldKeepPreviousCommitWhenManifestWriteFails() throws IOException {
        // Arrange: a non-empty directory where the manifest temp file goes
        Path blocker = Files.createDirectories(indexDir.resolve("manifest.json.tmp"));
        Files.writeString(blocker.resolve("keep"), "x");
        index.addDocument("{\"id\": \"b\", \"title\": \"Fight Club\", \"year\": 1999}");
        index.deleteDocuments("id", "a");

        // Act / Assert
        assertThatThrownBy(() -> index.commit()).isInstanceOf(CommitFailedException.class);
        assertThat(index.getState()).isEqualTo(WriterState.PENDING);
        assertThat(index.numDocs()).isEqualTo(1);
        assertThat(index.commitSequence()).isEqualTo(1);
        assertThat(index.search("{\"type\": \"text\", \"query\": \"heat\"}")).contains("\"count\":1");

        AtomicFiles.deleteRecursively(blocker);
        assertThat(index.commit()).isEqualTo(1);
        assertThat(index.commitSequence()).isEqualTo(2);
        assertThat(index.search("{\"type\": \"text\", \"query\": \"heat\"}")).contains("\"count\":0");
        assertThat(index.search("{\"type\": \"text\", \"query\": \"club\"}")).contains("\"count\":1");
    }

    @Test
    void shouldSurviveReopenAfterFailedCommit() throws IOException {
        Path blocker = Files.createDirectories(indexDir.resolve("manifest.json.tmp"));
        Files.writeString(blocker.resolve("keep"), "x");
        index.addDocument("{\"id\": \"b\", \"title\": \"Fight Club\", \"year\": 1999}");
        assertThatThrownBy(() -> index.commit()).isInstanceOf(CommitFailedException.class);
        index.close();

        index = SearchIndex.open(indexDir);

        assertThat(index.numDocs()).isEqualTo(1);
        assertThat(blocker).doesNotExist();
        try (Stream<Path> entries = Files.list(indexDir)) {
            assertThat(entries.map(p -> p.getFileName().toString()).filter(n -> n.startsWith("seg_")))
                .containsExactly("seg_00000001");
        }
    }

    @Test
    void shouldRetryFailedFlush() throws IOException {
        // Arrange: a regular file where the next segment's temp directory goes
        Files.writeString(indexDir.resolve("seg_00000002.tmp"), "in the way");
        index.addDocument("{\"id\": \"b\", \"title\": \"Fight Club\", \"year\": 1999}");

        // Act / Assert
        assertThatThrownBy(() -> index.commit()).isInstanceOf(IOException.class);
        assertThat(index.numDocs()).isEqualTo(1);
        assertThat(index.getState()).isEqualTo(WriterState.PENDING);

        assertThat(index.commit()).isEqualTo(2);
        assertThat(index.search("{\"type\": \"text\", \"query\": \"club\"}")).contains("\"count\":1");
    }
}

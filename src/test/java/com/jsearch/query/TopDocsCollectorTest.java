package com.jsearch.query;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class TopDocsCollectorTest {
    @Test
    void shouldKeepBestHitsWithDocIdTieBreak() {
        TopDocsCollector collector = new TopDocsCollector(0, 3);

        collector.collect(5, 1.0);
        collector.collect(2, 3.0);
        collector.collect(9, 1.0);
        collector.collect(1, 1.0);
        collector.collect(7, 0.5);

        assertThat(collector.getTotalHits()).isEqualTo(5);
        assertThat(collector.topDocs()).extracting(ScoreDoc::getDoc).containsExactly(2, 1, 5);
    }

    @Test
    void shouldSkipOffset() {
        TopDocsCollector collector = new TopDocsCollector(2, 2);
        for (int doc = 0; doc < 10; doc++) {
            collector.collect(doc, 10 - doc);
        }

        assertThat(collector.topDocs()).extracting(ScoreDoc::getDoc).containsExactly(2, 3);
        assertThat(new TopDocsCollector(20, 5).topDocs()).isEmpty();
    }
}

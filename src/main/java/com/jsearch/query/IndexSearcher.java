package com.jsearch.query;

import com.jsearch.index.IndexSnapshot;
import com.jsearch.segment.SegmentReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs queries against one snapshot. The caller keeps the snapshot
 * referenced for as long as the searcher is used.
 */
public class IndexSearcher {
    private static final Logger logger = LoggerFactory.getLogger(IndexSearcher.class);

    private final IndexSnapshot snapshot;
    private final SearchStats stats;

    public IndexSearcher(IndexSnapshot snapshot) {
        this.snapshot = snapshot;
        this.stats = new SearchStats(snapshot.getReaders());
    }

    public SearchStats getStats() {
        return stats;
    }

    public SearchResults search(SearchRequest request) throws IOException {
        TopDocsCollector collector = new TopDocsCollector(request.getOffset(), request.getLimit());
        List<SegmentReader> readers = snapshot.getReaders();
        for (int i = 0; i < readers.size(); i++) {
            SegmentReader reader = readers.get(i);
            DocScores matches = request.getQuery().execute(new LeafContext(reader, stats));
            int docBase = snapshot.docBase(i);
            for (int m = 0; m < matches.size(); m++) {
                int doc = matches.doc(m);
                if (!reader.isDeleted(doc)) {
                    collector.collect(docBase + doc, matches.score(m));
                }
            }
        }
        List<SearchHit> hits = new ArrayList<>();
        for (ScoreDoc scoreDoc : collector.topDocs()) {
            int segment = segmentOf(scoreDoc.getDoc());
            SegmentReader reader = readers.get(segment);
            int localDoc = scoreDoc.getDoc() - snapshot.docBase(segment);
            hits.add(new SearchHit(scoreDoc.getDoc(), scoreDoc.getScore(), reader.document(localDoc)));
        }
        logger.debug("Query {} matched {} docs, returning {}", request, collector.getTotalHits(), hits.size());
        return new SearchResults(hits, collector.getTotalHits(), request.getLimit(), request.getOffset());
    }

    private int segmentOf(int globalDoc) {
        List<SegmentReader> readers = snapshot.getReaders();
        int low = 0;
        int high = readers.size() - 1;
        while (low < high) {
            int mid = (low + high + 1) >>> 1;
            if (snapshot.docBase(mid) <= globalDoc) {
                low = mid;
            } else {
                high = mid - 1;
            }
        }
        return low;
    }
}

package com.jsearch.query;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.PriorityQueue;

/**
 * Keeps the best {@code offset + limit} hits in a bounded priority queue
 * and counts every hit it sees.
 */
public class TopDocsCollector {
    private final int offset;
    private final int limit;
    private final int capacity;
    private final PriorityQueue<ScoreDoc> queue;
    private long totalHits;

    public TopDocsCollector(int offset, int limit) {
        this.offset = offset;
        this.limit = limit;
        this.capacity = (int) Math.min((long) offset + limit, Integer.MAX_VALUE - 8);
        // head is the worst hit kept so far
        this.queue = new PriorityQueue<>(Math.min(capacity, 1024), (a, b) -> ScoreDoc.compareRank(b, a));
    }

    public void collect(int doc, double score) {
        totalHits++;
        if (queue.size() < capacity) {
            queue.add(new ScoreDoc(doc, score));
            return;
        }
        ScoreDoc candidate = new ScoreDoc(doc, score);
        if (ScoreDoc.compareRank(candidate, queue.peek()) < 0) {
            queue.poll();
            queue.add(candidate);
        }
    }

    public long getTotalHits() {
        return totalHits;
    }

    /**
     * @return The hits of the requested page, best first
     */
    public List<ScoreDoc> topDocs() {
        List<ScoreDoc> all = new ArrayList<>(queue);
        all.sort(ScoreDoc::compareRank);
        if (offset >= all.size()) {
            return Collections.emptyList();
        }
        return all.subList(offset, Math.min(all.size(), offset + limit));
    }
}

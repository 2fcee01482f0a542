package com.jsearch.query;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * One result: global doc id, score and stored fields.
 */
public final class SearchHit {
    private final int docId;
    private final double score;
    private final Map<String, List<Object>> fields;

    public SearchHit(int docId, double score, Map<String, List<Object>> fields) {
        this.docId = docId;
        this.score = score;
        this.fields = Collections.unmodifiableMap(fields);
    }

    public int getDocId() {
        return docId;
    }

    public double getScore() {
        return score;
    }

    public Map<String, List<Object>> getFields() {
        return fields;
    }

    public Object getFirst(String field) {
        List<Object> values = fields.get(field);
        return values == null || values.isEmpty() ? null : values.get(0);
    }
}

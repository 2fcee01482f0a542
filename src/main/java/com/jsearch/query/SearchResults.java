package com.jsearch.query;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * A page of hits plus the total number of matches.
 *
 * JSON form:
 * <pre>
 * {"results": [{"title": "...", "_score": 1.3, "_doc_id": 4}],
 *  "count": 1, "total_count": 7, "limit": 1, "offset": 0}
 * </pre>
 * Single-valued fields are written as scalars, multi-valued ones as arrays.
 */
public final class SearchResults {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final List<SearchHit> hits;
    private final long totalCount;
    private final int limit;
    private final int offset;

    public SearchResults(List<SearchHit> hits, long totalCount, int limit, int offset) {
        this.hits = Collections.unmodifiableList(hits);
        this.totalCount = totalCount;
        this.limit = limit;
        this.offset = offset;
    }

    public List<SearchHit> getHits() {
        return hits;
    }

    public int getCount() {
        return hits.size();
    }

    public long getTotalCount() {
        return totalCount;
    }

    public int getLimit() {
        return limit;
    }

    public int getOffset() {
        return offset;
    }

    public ObjectNode toJsonNode() {
        ObjectNode root = MAPPER.createObjectNode();
        ArrayNode results = root.putArray("results");
        for (SearchHit hit : hits) {
            ObjectNode node = results.addObject();
            for (Map.Entry<String, List<Object>> field : hit.getFields().entrySet()) {
                List<Object> values = field.getValue();
                if (values.size() == 1) {
                    node.set(field.getKey(), MAPPER.valueToTree(values.get(0)));
                } else {
                    node.set(field.getKey(), MAPPER.valueToTree(values));
                }
            }
            node.put("_score", hit.getScore());
            node.put("_doc_id", hit.getDocId());
        }
        root.put("count", getCount());
        root.put("total_count", totalCount);
        root.put("limit", limit);
        root.put("offset", offset);
        return root;
    }

    public String toJson() {
        try {
            return MAPPER.writeValueAsString(toJsonNode());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize search results", e);
        }
    }

    @Override
    public String toString() {
        return toJson();
    }
}

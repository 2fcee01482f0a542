package com.jsearch.query;

import java.util.Objects;

/**
 * A parsed top-level query with its page window.
 */
public final class SearchRequest {
    private final Query query;
    private final int limit;
    private final int offset;

    public SearchRequest(Query query, int limit, int offset) {
        this.query = Objects.requireNonNull(query, "query cannot be null");
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be positive: " + limit);
        }
        if (offset < 0) {
            throw new IllegalArgumentException("offset cannot be negative: " + offset);
        }
        this.limit = limit;
        this.offset = offset;
    }

    public Query getQuery() {
        return query;
    }

    public int getLimit() {
        return limit;
    }

    public int getOffset() {
        return offset;
    }

    @Override
    public String toString() {
        return query + " [offset=" + offset + ", limit=" + limit + "]";
    }
}

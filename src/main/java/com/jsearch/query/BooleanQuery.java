package com.jsearch.query;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Combines clauses. A doc matches when it matches every {@code must}
 * clause, at least one {@code should} clause if there are no {@code must}
 * clauses, and no {@code mustNot} clause. Its score is the sum of the
 * scores of the {@code must} and {@code should} clauses it matches. A query
 * with neither {@code must} nor {@code should} clauses matches nothing.
 */
public class BooleanQuery extends Query {
    private final List<Query> must;
    private final List<Query> should;
    private final List<Query> mustNot;

    private BooleanQuery(Builder builder) {
        this.must = Collections.unmodifiableList(new ArrayList<>(builder.must));
        this.should = Collections.unmodifiableList(new ArrayList<>(builder.should));
        this.mustNot = Collections.unmodifiableList(new ArrayList<>(builder.mustNot));
    }

    @Override
    public DocScores execute(LeafContext leaf) throws IOException {
        DocScores result;
        if (!must.isEmpty()) {
            result = must.get(0).execute(leaf);
            for (int i = 1; i < must.size() && !result.isEmpty(); i++) {
                result = result.intersect(must.get(i).execute(leaf));
            }
            for (Query clause : should) {
                if (result.isEmpty()) {
                    break;
                }
                result = result.boost(clause.execute(leaf));
            }
        } else if (!should.isEmpty()) {
            result = DocScores.empty();
            for (Query clause : should) {
                result = result.union(clause.execute(leaf));
            }
        } else {
            return DocScores.empty();
        }
        for (Query clause : mustNot) {
            if (result.isEmpty()) {
                break;
            }
            result = result.exclude(clause.execute(leaf));
        }
        return result;
    }

    public List<Query> getMust() {
        return must;
    }

    public List<Query> getShould() {
        return should;
    }

    public List<Query> getMustNot() {
        return mustNot;
    }

    @Override
    public String toString() {
        return "bool(must=" + must + ", should=" + should + ", must_not=" + mustNot + ")";
    }

    public static class Builder {
        private final List<Query> must = new ArrayList<>();
        private final List<Query> should = new ArrayList<>();
        private final List<Query> mustNot = new ArrayList<>();

        public Builder addMust(Query query) {
            must.add(query);
            return this;
        }

        public Builder addShould(Query query) {
            should.add(query);
            return this;
        }

        public Builder addMustNot(Query query) {
            mustNot.add(query);
            return this;
        }

        public BooleanQuery build() {
            return new BooleanQuery(this);
        }
    }
}

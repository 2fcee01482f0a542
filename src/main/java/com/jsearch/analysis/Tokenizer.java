package com.jsearch.analysis;

import java.util.List;

/**
 * Turns a field value into index terms. Indexing and query parsing use the
 * same tokenizer for a field, so both sides agree on term boundaries.
 */
public interface Tokenizer {
    /**
     * Tokenizes the text; positions start at {@code firstPosition} and
     * increase by one per emitted token.
     *
     * @param text The text to analyze; an empty string yields no tokens
     * @param firstPosition Position of the first emitted token
     * @return The tokens in order of appearance
     */
    List<Token> tokenize(String text, int firstPosition);

    default List<Token> tokenize(String text) {
        return tokenize(text, 0);
    }
}

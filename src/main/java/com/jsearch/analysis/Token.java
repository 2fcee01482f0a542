package com.jsearch.analysis;

import java.util.Objects;

/**
 * One normalized term and its position within the analyzed field value.
 */
public final class Token {
    private final String text;
    private final int position;

    public Token(String text, int position) {
        this.text = Objects.requireNonNull(text, "text cannot be null");
        this.position = position;
    }

    public String getText() {
        return text;
    }

    public int getPosition() {
        return position;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Token token = (Token) o;
        return position == token.position && text.equals(token.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(text, position);
    }

    @Override
    public String toString() {
        return text + "@" + position;
    }
}

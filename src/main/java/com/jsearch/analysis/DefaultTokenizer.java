package com.jsearch.analysis;

import java.nio.charset.StandardCharsets;
import java.text.BreakIterator;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Splits on Unicode word boundaries, keeps only words containing a letter or
 * digit, lowercases them and drops tokens of {@value #MAX_TOKEN_BYTES} UTF-8
 * bytes or more.
 */
public class DefaultTokenizer implements Tokenizer {
    public static final int MAX_TOKEN_BYTES = 40;

    @Override
    public List<Token> tokenize(String text, int firstPosition) {
        List<Token> tokens = new ArrayList<>();
        if (text.isEmpty()) {
            return tokens;
        }
        BreakIterator words = BreakIterator.getWordInstance(Locale.ROOT);
        words.setText(text);
        int position = firstPosition;
        int start = words.first();
        for (int end = words.next(); end != BreakIterator.DONE; start = end, end = words.next()) {
            String word = text.substring(start, end);
            if (!isWord(word)) {
                continue;
            }
            String normalized = normalize(word.toLowerCase(Locale.ROOT));
            if (normalized.isEmpty() || normalized.getBytes(StandardCharsets.UTF_8).length >= MAX_TOKEN_BYTES) {
                continue;
            }
            tokens.add(new Token(normalized, position++));
        }
        return tokens;
    }

    /**
     * Hook applied to every lowercased word before length filtering.
     */
    protected String normalize(String lowercased) {
        return lowercased;
    }

    private static boolean isWord(String segment) {
        for (int i = 0; i < segment.length(); ) {
            int codePoint = segment.codePointAt(i);
            if (Character.isLetterOrDigit(codePoint)) {
                return true;
            }
            i += Character.charCount(codePoint);
        }
        return false;
    }
}

package com.jsearch.analysis;

import java.util.Collections;
import java.util.List;

/**
 * Emits the whole value as a single token, unchanged.
 */
public class RawTokenizer implements Tokenizer {
    @Override
    public List<Token> tokenize(String text, int firstPosition) {
        if (text.isEmpty()) {
            return Collections.emptyList();
        }
        return Collections.singletonList(new Token(text, firstPosition));
    }
}

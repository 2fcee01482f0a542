package com.jsearch.analysis;

import java.util.Map;

/**
 * Named tokenizers a schema field can refer to.
 */
public final class TokenizerRegistry {
    public static final String DEFAULT = "default";
    public static final String RAW = "raw";
    public static final String EN_STEM = "en_stem";

    private static final Map<String, Tokenizer> TOKENIZERS = Map.of(
        DEFAULT, new DefaultTokenizer(),
        RAW, new RawTokenizer(),
        EN_STEM, new EnglishStemTokenizer()
    );

    private TokenizerRegistry() {
    }

    public static boolean isKnown(String name) {
        return name != null && TOKENIZERS.containsKey(name);
    }

    public static Tokenizer get(String name) {
        Tokenizer tokenizer = TOKENIZERS.get(name);
        if (tokenizer == null) {
            throw new IllegalArgumentException("Unknown tokenizer: " + name);
        }
        return tokenizer;
    }
}

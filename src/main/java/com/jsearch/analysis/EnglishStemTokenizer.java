package com.jsearch.analysis;

import org.tartarus.snowball.ext.EnglishStemmer;

/**
 * {@link DefaultTokenizer} followed by the Snowball English stemmer.
 */
public class EnglishStemTokenizer extends DefaultTokenizer {
    // the Snowball stemmer keeps per-word state
    private static final ThreadLocal<EnglishStemmer> STEMMER = ThreadLocal.withInitial(EnglishStemmer::new);

    @Override
    protected String normalize(String lowercased) {
        EnglishStemmer stemmer = STEMMER.get();
        stemmer.setCurrent(lowercased);
        stemmer.stem();
        return stemmer.getCurrent();
    }
}

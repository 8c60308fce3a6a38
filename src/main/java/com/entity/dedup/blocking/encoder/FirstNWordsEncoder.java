package com.entity.dedup.blocking.encoder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * First {@code n} words of the value, optionally sorted before truncation.
 */
public class FirstNWordsEncoder implements KeyEncoder {

    private final int n;
    private final boolean sortWords;

    public FirstNWordsEncoder(int n) {
        this(n, false);
    }

    public FirstNWordsEncoder(int n, boolean sortWords) {
        if (n <= 0) {
            throw new IllegalArgumentException("n must be > 0");
        }
        this.n = n;
        this.sortWords = sortWords;
    }

    @Override
    public String encode(String value) {
        List<String> words = new ArrayList<>(Tokens.lowerCaseWords(value));
        if (sortWords) {
            Collections.sort(words);
        }
        return String.join("", words.subList(0, Math.min(n, words.size())));
    }

    @Override
    public String getName() {
        return "first" + n + "words" + (sortWords ? ":sorted" : "");
    }
}

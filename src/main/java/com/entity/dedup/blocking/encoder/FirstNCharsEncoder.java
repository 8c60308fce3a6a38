package com.entity.dedup.blocking.encoder;

import java.util.List;

/**
 * First {@code n} characters of every word, sorted and concatenated.
 */
public class FirstNCharsEncoder implements KeyEncoder {

    private final int n;

    public FirstNCharsEncoder(int n) {
        if (n <= 0) {
            throw new IllegalArgumentException("n must be > 0");
        }
        this.n = n;
    }

    @Override
    public String encode(String value) {
        List<String> heads = Tokens.lowerCaseWords(value).stream()
                .map(token -> Tokens.head(token, n))
                .sorted()
                .toList();
        return String.join("", heads);
    }

    @Override
    public String getName() {
        return "first" + n + "chars";
    }
}

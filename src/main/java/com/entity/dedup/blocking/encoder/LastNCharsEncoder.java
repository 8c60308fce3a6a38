package com.entity.dedup.blocking.encoder;

import java.util.List;

/**
 * Last {@code n} characters of every word, sorted and concatenated.
 * Useful for values whose prefix is noisy, such as titles or honorifics.
 */
public class LastNCharsEncoder implements KeyEncoder {

    private final int n;

    public LastNCharsEncoder(int n) {
        if (n <= 0) {
            throw new IllegalArgumentException("n must be > 0");
        }
        this.n = n;
    }

    @Override
    public String encode(String value) {
        List<String> tails = Tokens.lowerCaseWords(value).stream()
                .map(token -> Tokens.tail(token, n))
                .sorted()
                .toList();
        return String.join("", tails);
    }

    @Override
    public String getName() {
        return "last" + n + "chars";
    }
}

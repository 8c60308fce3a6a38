package com.entity.dedup.blocking.encoder;

import java.util.List;

/**
 * N-letter abbreviation: the initial letter of each word, sorted, first {@code n} kept.
 * "International Business Machines" and "Business Machines International" both give "bim".
 */
public class AbbreviationEncoder implements KeyEncoder {

    private final int letters;

    public AbbreviationEncoder(int letters) {
        if (letters <= 0) {
            throw new IllegalArgumentException("letters must be > 0");
        }
        this.letters = letters;
    }

    @Override
    public String encode(String value) {
        List<String> initials = Tokens.lowerCaseWords(value).stream()
                .map(token -> token.substring(0, 1))
                .sorted()
                .limit(letters)
                .toList();
        return String.join("", initials);
    }

    @Override
    public String getName() {
        return "abbrev" + letters;
    }
}

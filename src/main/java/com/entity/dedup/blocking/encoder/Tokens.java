package com.entity.dedup.blocking.encoder;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Whitespace tokenization shared by the token-based encoders.
 */
final class Tokens {

    private Tokens() {
    }

    /**
     * Lower-cases the value and splits it on runs of whitespace.
     */
    static List<String> lowerCaseWords(String value) {
        if (value == null) {
            return List.of();
        }
        String cleaned = value.toLowerCase(Locale.ROOT).trim();
        if (cleaned.isEmpty()) {
            return List.of();
        }
        return Arrays.asList(cleaned.split("\\s+"));
    }

    static String head(String token, int n) {
        return token.length() <= n ? token : token.substring(0, n);
    }

    static String tail(String token, int n) {
        return token.length() <= n ? token : token.substring(token.length() - n);
    }
}

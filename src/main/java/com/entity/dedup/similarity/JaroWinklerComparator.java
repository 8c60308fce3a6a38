package com.entity.dedup.similarity;

/**
 * Jaro-Winkler similarity, favouring strings that share a prefix.
 */
public class JaroWinklerComparator extends TextComparator {

    private static final double DEFAULT_PREFIX_SCALE = 0.1;
    private static final int MAX_PREFIX = 4;

    private final double prefixScale;

    public JaroWinklerComparator() {
        this(DEFAULT_PREFIX_SCALE);
    }

    public JaroWinklerComparator(double prefixScale) {
        if (prefixScale < 0 || prefixScale > 0.25) {
            throw new IllegalArgumentException("prefixScale must be between 0 and 0.25");
        }
        this.prefixScale = prefixScale;
    }

    @Override
    protected double compareText(String s1, String s2) {
        double jaro = jaro(s1, s2);
        int limit = Math.min(MAX_PREFIX, Math.min(s1.length(), s2.length()));
        int prefix = 0;
        while (prefix < limit && s1.charAt(prefix) == s2.charAt(prefix)) {
            prefix++;
        }
        return jaro + prefix * prefixScale * (1.0 - jaro);
    }

    @Override
    public String getName() {
        return "jaro-winkler";
    }

    static double jaro(String s1, String s2) {
        int window = Math.max(0, Math.max(s1.length(), s2.length()) / 2 - 1);
        boolean[] taken = new boolean[s2.length()];
        char[] matched1 = new char[s1.length()];
        int matches = 0;

        for (int i = 0; i < s1.length(); i++) {
            int from = Math.max(0, i - window);
            int to = Math.min(s2.length() - 1, i + window);
            for (int j = from; j <= to; j++) {
                if (!taken[j] && s1.charAt(i) == s2.charAt(j)) {
                    taken[j] = true;
                    matched1[matches++] = s1.charAt(i);
                    break;
                }
            }
        }
        if (matches == 0) {
            return 0.0;
        }

        int halfTranspositions = 0;
        int k = 0;
        for (int j = 0; j < s2.length(); j++) {
            if (taken[j]) {
                if (s2.charAt(j) != matched1[k]) {
                    halfTranspositions++;
                }
                k++;
            }
        }
        double m = matches;
        return (m / s1.length() + m / s2.length() + (m - halfTranspositions / 2.0) / m) / 3.0;
    }
}

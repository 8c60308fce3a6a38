package com.entity.dedup.similarity;

/**
 * Normalised edit-distance similarity: 1 - distance / max(length).
 */
public class LevenshteinComparator extends TextComparator {

    @Override
    protected double compareText(String s1, String s2) {
        return 1.0 - (double) distance(s1, s2) / Math.max(s1.length(), s2.length());
    }

    @Override
    public String getName() {
        return "levenshtein";
    }

    /**
     * Edit distance with a single row of the dynamic-programming table.
     */
    static int distance(String source, String target) {
        if (source.length() < target.length()) {
            String swap = source;
            source = target;
            target = swap;
        }
        int[] row = new int[target.length() + 1];
        for (int j = 0; j < row.length; j++) {
            row[j] = j;
        }
        for (int i = 1; i <= source.length(); i++) {
            int diagonal = row[0];
            row[0] = i;
            char sc = source.charAt(i - 1);
            for (int j = 1; j <= target.length(); j++) {
                int above = row[j];
                int substitution = diagonal + (sc == target.charAt(j - 1) ? 0 : 1);
                row[j] = Math.min(substitution, Math.min(above, row[j - 1]) + 1);
                diagonal = above;
            }
        }
        return row[target.length()];
    }
}

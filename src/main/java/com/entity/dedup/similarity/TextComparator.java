package com.entity.dedup.similarity;

/**
 * Base class for comparators working on the text form of values.
 * Handles the common cases (identical, empty) before delegating to {@link #compareText}.
 */
public abstract class TextComparator implements AttributeComparator {

    @Override
    public final double score(Object a, Object b) {
        if (a == null || b == null) {
            return 0.0;
        }
        String s1 = a.toString();
        String s2 = b.toString();
        if (s1.equals(s2)) {
            return 1.0;
        }
        if (s1.isEmpty() || s2.isEmpty()) {
            return 0.0;
        }
        return compareText(s1, s2);
    }

    /**
     * Scores two distinct, non-empty strings.
     */
    protected abstract double compareText(String s1, String s2);

    /**
     * Name used in logs.
     */
    public abstract String getName();
}

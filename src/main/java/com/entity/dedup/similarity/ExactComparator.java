package com.entity.dedup.similarity;

import java.util.Locale;

/**
 * 1.0 when the values are equal, 0.0 otherwise. Optionally ignores case and
 * surrounding whitespace.
 */
public class ExactComparator implements AttributeComparator {

    private final boolean ignoreCase;

    public ExactComparator() {
        this(false);
    }

    public ExactComparator(boolean ignoreCase) {
        this.ignoreCase = ignoreCase;
    }

    @Override
    public double score(Object a, Object b) {
        if (a == null || b == null) {
            return 0.0;
        }
        if (a.equals(b)) {
            return 1.0;
        }
        String s1 = a.toString().trim();
        String s2 = b.toString().trim();
        if (ignoreCase) {
            s1 = s1.toLowerCase(Locale.ROOT);
            s2 = s2.toLowerCase(Locale.ROOT);
        }
        return s1.equals(s2) ? 1.0 : 0.0;
    }
}

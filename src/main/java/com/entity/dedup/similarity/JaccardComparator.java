package com.entity.dedup.similarity;

import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Token-set overlap: |A ∩ B| / |A ∪ B| over lower-cased tokens.
 */
public class JaccardComparator extends TextComparator {

    private final Pattern separator;

    public JaccardComparator() {
        this("[\\s,;]+");
    }

    public JaccardComparator(String separatorRegex) {
        this.separator = Pattern.compile(separatorRegex);
    }

    @Override
    protected double compareText(String s1, String s2) {
        Set<String> left = tokens(s1);
        Set<String> right = tokens(s2);
        if (left.isEmpty() || right.isEmpty()) {
            return left.isEmpty() && right.isEmpty() ? 1.0 : 0.0;
        }
        long shared = left.stream().filter(right::contains).count();
        return (double) shared / (left.size() + right.size() - shared);
    }

    @Override
    public String getName() {
        return "jaccard";
    }

    private Set<String> tokens(String value) {
        return Arrays.stream(separator.split(value.toLowerCase(Locale.ROOT)))
                .filter(token -> !token.isEmpty())
                .collect(Collectors.toSet());
    }
}

package com.entity.dedup.similarity;

import java.util.List;
import java.util.Locale;

/**
 * Lenient name comparator: the best score of several string measures on the lower-cased
 * values. Taking the maximum lets typos (edit distance), shared prefixes (Jaro-Winkler)
 * and reordered words (Jaccard) each count as a match.
 */
public class NameSimilarityComparator extends TextComparator {

    private final List<TextComparator> measures;

    public NameSimilarityComparator() {
        this(List.of(new LevenshteinComparator(), new JaroWinklerComparator(), new JaccardComparator()));
    }

    public NameSimilarityComparator(List<TextComparator> measures) {
        if (measures == null || measures.isEmpty()) {
            throw new IllegalArgumentException("at least one measure is required");
        }
        this.measures = List.copyOf(measures);
    }

    @Override
    protected double compareText(String s1, String s2) {
        String a = s1.toLowerCase(Locale.ROOT).trim();
        String b = s2.toLowerCase(Locale.ROOT).trim();
        double best = 0.0;
        for (TextComparator measure : measures) {
            best = Math.max(best, measure.score(a, b));
        }
        return best;
    }

    @Override
    public String getName() {
        return "name";
    }
}

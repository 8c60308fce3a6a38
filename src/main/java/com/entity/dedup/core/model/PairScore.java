package com.entity.dedup.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Per-attribute similarity scores for one unordered pair of records in the same block.
 * Positions refer to the records' positions within the block, {@code first < second}.
 *
 * @param first           block position of the first record
 * @param second          block position of the second record
 * @param attributeScores similarity in [0,1] per configured attribute, in comparator order
 */
public record PairScore(int first, int second, Map<String, Double> attributeScores) {

    public PairScore {
        if (first >= second) {
            throw new IllegalArgumentException("first must be < second, got " + first + "," + second);
        }
        Objects.requireNonNull(attributeScores, "attributeScores is required");
        attributeScores = Collections.unmodifiableMap(new LinkedHashMap<>(attributeScores));
    }
}

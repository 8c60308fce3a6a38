package com.entity.dedup.core.model;

/**
 * Scalar similarity for one pair of records after aggregation.
 *
 * @param first  block position of the first record
 * @param second block position of the second record
 * @param score  aggregated similarity in [0,1]
 */
public record AggregatedScore(int first, int second, double score) {

    public AggregatedScore {
        if (score < 0.0 || score > 1.0 || Double.isNaN(score)) {
            throw new IllegalArgumentException("Score must be between 0.0 and 1.0, got " + score);
        }
    }

    /**
     * Distance used for clustering.
     */
    public double distance() {
        return 1.0 - score;
    }
}

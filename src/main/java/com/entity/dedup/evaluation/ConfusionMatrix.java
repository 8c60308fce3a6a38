package com.entity.dedup.evaluation;

/**
 * Pair-level confusion matrix of a clustering against ground truth.
 * Each unordered record pair is counted exactly once.
 *
 * @param truePositives  pairs clustered together that belong together
 * @param falsePositives pairs clustered together that do not belong together
 * @param falseNegatives pairs that belong together but were separated
 * @param trueNegatives  pairs correctly kept apart
 */
public record ConfusionMatrix(long truePositives, long falsePositives, long falseNegatives, long trueNegatives) {

    public long total() {
        return truePositives + falsePositives + falseNegatives + trueNegatives;
    }
}

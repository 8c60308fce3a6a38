package com.entity.dedup.evaluation;

import com.entity.dedup.core.model.DuplicateCluster;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Pairwise quality measures of a clustering against ground-truth labels, and the cost
 * measures of a blocking. Precision, recall, F1 and reduction ratio are percentages.
 *
 * <p>Labels are aligned to record index: records sharing a label belong to the same
 * cluster. Noise must be given distinct labels, see {@link #labelsOf}.</p>
 */
public final class ClusterEvaluator {

    private static final double F1_TOLERANCE = 1e-6;

    private ClusterEvaluator() {
    }

    /**
     * Share of predicted co-clustered pairs that are true pairs; 100 when nothing was predicted.
     */
    public static double precision(int[] trueLabels, int[] predictedLabels) {
        checkAligned(trueLabels, predictedLabels);
        long predicted = pairsWithin(predictedLabels);
        if (predicted == 0) {
            return 100.0;
        }
        return 100.0 * pairsWithinBoth(trueLabels, predictedLabels) / predicted;
    }

    /**
     * Share of true pairs that were clustered together; 100 when there are no true pairs.
     */
    public static double recall(int[] trueLabels, int[] predictedLabels) {
        return precision(predictedLabels, trueLabels);
    }

    public static double f1(int[] trueLabels, int[] predictedLabels) {
        double p = precision(trueLabels, predictedLabels);
        double r = recall(trueLabels, predictedLabels);
        return 2 * p * r / (p + r + F1_TOLERANCE);
    }

    public static ConfusionMatrix confusionMatrix(int[] trueLabels, int[] predictedLabels) {
        checkAligned(trueLabels, predictedLabels);
        long tp = pairsWithinBoth(trueLabels, predictedLabels);
        long predicted = pairsWithin(predictedLabels);
        long actual = pairsWithin(trueLabels);
        long fp = predicted - tp;
        long fn = actual - tp;
        long tn = choose2(trueLabels.length) - tp - fp - fn;
        return new ConfusionMatrix(tp, fp, fn, tn);
    }

    /**
     * Number of comparisons an all-pairs run over {@code records} records would make.
     */
    public static long maxPossibleComparisons(int records) {
        return choose2(records);
    }

    /**
     * Percentage of comparisons avoided: {@code (1 - after / before) * 100}, 0 when
     * {@code before} is 0.
     */
    public static double reductionRatio(long comparisonsBefore, long comparisonsAfter) {
        if (comparisonsBefore == 0) {
            return 0.0;
        }
        return (1.0 - (double) comparisonsAfter / comparisonsBefore) * 100.0;
    }

    /**
     * Speed-up factor of a blocking, {@code before / after}; infinite when nothing was compared.
     */
    public static double comparisonEfficiency(long comparisonsBefore, long comparisonsAfter) {
        if (comparisonsAfter == 0) {
            return Double.POSITIVE_INFINITY;
        }
        return (double) comparisonsBefore / comparisonsAfter;
    }

    /**
     * Converts clusters into a label array over {@code 0..recordCount-1}. Records in no
     * cluster get a label of their own.
     */
    public static int[] labelsOf(List<DuplicateCluster> clusters, int recordCount) {
        Objects.requireNonNull(clusters, "clusters is required");
        int[] labels = new int[recordCount];
        Arrays.fill(labels, -1);
        int next = 0;
        for (DuplicateCluster cluster : clusters) {
            for (int index : cluster.indices()) {
                if (index >= recordCount) {
                    throw new IllegalArgumentException("Record index " + index + " outside 0.." + (recordCount - 1));
                }
                if (labels[index] != -1) {
                    throw new IllegalArgumentException("Record " + index + " appears in more than one cluster");
                }
                labels[index] = next;
            }
            next++;
        }
        for (int i = 0; i < recordCount; i++) {
            if (labels[i] == -1) {
                labels[i] = next++;
            }
        }
        return labels;
    }

    private static long pairsWithin(int[] labels) {
        Map<Integer, Long> sizes = new HashMap<>();
        for (int label : labels) {
            sizes.merge(label, 1L, Long::sum);
        }
        return sizes.values().stream().mapToLong(ClusterEvaluator::choose2).sum();
    }

    private static long pairsWithinBoth(int[] first, int[] second) {
        Map<Long, Long> sizes = new HashMap<>();
        for (int i = 0; i < first.length; i++) {
            long key = ((long) first[i] << 32) | (second[i] & 0xFFFFFFFFL);
            sizes.merge(key, 1L, Long::sum);
        }
        return sizes.values().stream().mapToLong(ClusterEvaluator::choose2).sum();
    }

    private static long choose2(long n) {
        return n * (n - 1) / 2;
    }

    private static void checkAligned(int[] trueLabels, int[] predictedLabels) {
        Objects.requireNonNull(trueLabels, "trueLabels is required");
        Objects.requireNonNull(predictedLabels, "predictedLabels is required");
        if (trueLabels.length != predictedLabels.length) {
            throw new IllegalArgumentException("Label arrays differ in length: "
                    + trueLabels.length + " vs " + predictedLabels.length);
        }
    }
}

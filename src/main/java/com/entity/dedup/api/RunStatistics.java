package com.entity.dedup.api;

import com.entity.dedup.evaluation.ClusterEvaluator;

import java.time.Duration;

/**
 * Counters collected during one deduplication run.
 *
 * @param runId              run identifier, also present in the logging MDC
 * @param records            input records
 * @param blocks             blocks produced by the blocking rule
 * @param subBlocks          sub-blocks after splitting, including skipped ones
 * @param skippedSubBlocks   sub-blocks rejected by the block filter
 * @param comparisons        record pairs scored
 * @param comparatorFailures comparator invocations that failed and scored 0
 * @param oracleFailures     sub-blocks whose clustering failed
 * @param clusters           clusters emitted
 * @param duration           wall-clock time of the computation
 */
public record RunStatistics(
        String runId,
        int records,
        int blocks,
        int subBlocks,
        int skippedSubBlocks,
        long comparisons,
        long comparatorFailures,
        long oracleFailures,
        int clusters,
        Duration duration
) {

    /**
     * Percentage of the all-pairs comparisons avoided by blocking.
     */
    public double reductionRatio() {
        return ClusterEvaluator.reductionRatio(ClusterEvaluator.maxPossibleComparisons(records), comparisons);
    }

    @Override
    public String toString() {
        return "RunStatistics{runId=" + runId +
                ", records=" + records +
                ", blocks=" + blocks +
                ", subBlocks=" + subBlocks +
                ", skipped=" + skippedSubBlocks +
                ", comparisons=" + comparisons +
                ", comparatorFailures=" + comparatorFailures +
                ", oracleFailures=" + oracleFailures +
                ", clusters=" + clusters +
                ", duration=" + duration.toMillis() + "ms}";
    }
}

package com.entity.dedup.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code dedup.run.duration}: Timer</li>
 *   <li>{@code dedup.records}: Counter</li>
 *   <li>{@code dedup.block.size}: DistributionSummary (per sub-block)</li>
 *   <li>{@code dedup.comparisons}: Counter</li>
 *   <li>{@code dedup.comparator.failures}: Counter</li>
 *   <li>{@code dedup.oracle.failures}: Counter</li>
 *   <li>{@code dedup.cluster.size}: DistributionSummary (emitted clusters)</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final Timer runTimer;
    private final Counter recordCounter;
    private final DistributionSummary blockSizeSummary;
    private final Counter comparisonCounter;
    private final Counter comparatorFailureCounter;
    private final Counter oracleFailureCounter;
    private final DistributionSummary clusterSizeSummary;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.runTimer = Timer.builder("dedup.run.duration")
                .description("Duration of a full deduplication run")
                .register(registry);
        this.recordCounter = Counter.builder("dedup.records")
                .description("Number of records submitted for deduplication")
                .register(registry);
        this.blockSizeSummary = DistributionSummary.builder("dedup.block.size")
                .description("Distribution of sub-block sizes after splitting")
                .register(registry);
        this.comparisonCounter = Counter.builder("dedup.comparisons")
                .description("Number of record pairs compared")
                .register(registry);
        this.comparatorFailureCounter = Counter.builder("dedup.comparator.failures")
                .description("Number of comparator invocations that failed and scored 0")
                .register(registry);
        this.oracleFailureCounter = Counter.builder("dedup.oracle.failures")
                .description("Number of sub-blocks whose clustering failed")
                .register(registry);
        this.clusterSizeSummary = DistributionSummary.builder("dedup.cluster.size")
                .description("Distribution of emitted cluster sizes")
                .register(registry);
    }

    @Override
    public void recordRunDuration(Duration duration) {
        runTimer.record(duration);
    }

    @Override
    public void incrementRecords(long count) {
        recordCounter.increment(count);
    }

    @Override
    public void recordBlockSize(int size) {
        blockSizeSummary.record(size);
    }

    @Override
    public void incrementComparisons(long count) {
        comparisonCounter.increment(count);
    }

    @Override
    public void incrementComparatorFailures(long count) {
        comparatorFailureCounter.increment(count);
    }

    @Override
    public void incrementOracleFailures() {
        oracleFailureCounter.increment();
    }

    @Override
    public void recordClusterSize(int size) {
        clusterSizeSummary.record(size);
    }
}

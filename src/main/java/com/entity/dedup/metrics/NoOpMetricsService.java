package com.entity.dedup.metrics;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordRunDuration(Duration duration) {
    }

    @Override
    public void incrementRecords(long count) {
    }

    @Override
    public void recordBlockSize(int size) {
    }

    @Override
    public void incrementComparisons(long count) {
    }

    @Override
    public void incrementComparatorFailures(long count) {
    }

    @Override
    public void incrementOracleFailures() {
    }

    @Override
    public void recordClusterSize(int size) {
    }
}

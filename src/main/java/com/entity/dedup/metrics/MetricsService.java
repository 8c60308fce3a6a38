package com.entity.dedup.metrics;

import java.time.Duration;

/**
 * Interface for recording deduplication pipeline metrics.
 * The default {@link NoOpMetricsService} does nothing, so the pipeline runs without any
 * metrics registry configured.
 */
public interface MetricsService {

    void recordRunDuration(Duration duration);

    void incrementRecords(long count);

    void recordBlockSize(int size);

    void incrementComparisons(long count);

    void incrementComparatorFailures(long count);

    void incrementOracleFailures();

    void recordClusterSize(int size);
}

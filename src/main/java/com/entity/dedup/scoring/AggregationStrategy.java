package com.entity.dedup.scoring;

import com.entity.dedup.api.ConfigurationException;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Named strategies for combining per-attribute scores into one similarity.
 */
public enum AggregationStrategy {
    /** Arithmetic mean of the attribute scores. */
    MEAN("mean"),
    /** Median of the attribute scores. */
    MEDIAN("median"),
    /** Conservative: the weakest attribute decides. */
    MIN("min"),
    /** Liberal: the strongest attribute decides. */
    MAX("max"),
    /** Weighted mean with caller-supplied weights, normalised internally. */
    WEIGHTED_MEAN("weighted_mean");

    private final String configName;

    AggregationStrategy(String configName) {
        this.configName = configName;
    }

    public String configName() {
        return configName;
    }

    /**
     * Resolves a strategy by its configuration name (case-insensitive).
     *
     * @throws ConfigurationException for unknown names
     */
    public static AggregationStrategy fromName(String name) {
        if (name != null) {
            String normalized = name.trim().toLowerCase(Locale.ROOT);
            for (AggregationStrategy strategy : values()) {
                if (strategy.configName.equals(normalized)) {
                    return strategy;
                }
            }
        }
        throw new ConfigurationException("Unknown aggregation strategy '" + name + "', expected one of "
                + Arrays.stream(values()).map(AggregationStrategy::configName).collect(Collectors.joining(", ")));
    }
}

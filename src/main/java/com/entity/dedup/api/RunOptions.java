package com.entity.dedup.api;

/**
 * Per-call overrides for a deduplication run.
 */
public class RunOptions {

    private static final double DEFAULT_SIMILARITY_THRESHOLD = 0.0;

    private final double similarityThreshold;
    private final Boolean includeSingletons;

    private RunOptions(Builder builder) {
        this.similarityThreshold = builder.similarityThreshold;
        this.includeSingletons = builder.includeSingletons;
    }

    /**
     * Pairs whose aggregated similarity is below this value are treated as unrelated
     * before clustering, independently of the clustering radius.
     */
    public double getSimilarityThreshold() {
        return similarityThreshold;
    }

    /**
     * Override of the configured singleton policy, or {@code null} to use the configuration.
     */
    public Boolean getIncludeSingletons() {
        return includeSingletons;
    }

    public static RunOptions defaults() {
        return builder().build();
    }

    public static RunOptions withThreshold(double similarityThreshold) {
        return builder().similarityThreshold(similarityThreshold).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private double similarityThreshold = DEFAULT_SIMILARITY_THRESHOLD;
        private Boolean includeSingletons;

        public Builder similarityThreshold(double similarityThreshold) {
            if (!(similarityThreshold >= 0.0 && similarityThreshold <= 1.0)) {
                throw new ConfigurationException("similarityThreshold must be between 0.0 and 1.0");
            }
            this.similarityThreshold = similarityThreshold;
            return this;
        }

        public Builder includeSingletons(Boolean includeSingletons) {
            this.includeSingletons = includeSingletons;
            return this;
        }

        public RunOptions build() {
            return new RunOptions(this);
        }
    }
}

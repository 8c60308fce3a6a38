package com.entity.dedup.api;

import com.entity.dedup.blocking.BlockFilter;
import com.entity.dedup.blocking.BlockSplitter;
import com.entity.dedup.blocking.BlockingRule;
import com.entity.dedup.blocking.BlockingRules;
import com.entity.dedup.blocking.IdentityBlockSplitter;
import com.entity.dedup.clustering.ClusteringOptions;
import com.entity.dedup.clustering.ClusteringOracle;
import com.entity.dedup.clustering.DbscanClusteringOracle;
import com.entity.dedup.metrics.MetricsService;
import com.entity.dedup.metrics.NoOpMetricsService;
import com.entity.dedup.scoring.AggregationStrategy;
import com.entity.dedup.scoring.Aggregator;
import com.entity.dedup.similarity.AttributeComparator;
import com.entity.dedup.similarity.ComparatorRegistry;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Validated configuration of a {@link Deduplicator}.
 * All configuration errors surface from {@link Builder#build()} as
 * {@link ConfigurationException}s, before any record is seen.
 */
public class DeduplicatorConfig {

    private static final String DEFAULT_AGGREGATION = "mean";

    private final ComparatorRegistry comparators;
    private final Aggregator aggregator;
    private final List<String> blockingAttributes;
    private final BlockingRule blockingRule;
    private final BlockSplitter blockSplitter;
    private final BlockFilter blockFilter;
    private final ClusteringOptions clusteringOptions;
    private final ClusteringOracle clusteringOracle;
    private final long maxComparisonsPerBlock;
    private final int numThreads;
    private final boolean includeSingletons;
    private final Set<String> schema;
    private final MetricsService metricsService;

    private DeduplicatorConfig(Builder builder, ComparatorRegistry comparators, Aggregator aggregator,
                               BlockingRule effectiveRule, ClusteringOptions clusteringOptions) {
        this.comparators = comparators;
        this.aggregator = aggregator;
        this.blockingAttributes = List.copyOf(builder.blockingAttributes);
        this.blockingRule = effectiveRule;
        this.blockSplitter = builder.blockSplitter;
        this.blockFilter = builder.blockFilter;
        this.clusteringOptions = clusteringOptions;
        this.clusteringOracle = builder.clusteringOracle;
        this.maxComparisonsPerBlock = builder.maxComparisonsPerBlock;
        this.numThreads = builder.numThreads;
        this.includeSingletons = builder.includeSingletons;
        this.schema = builder.schema == null ? null : Set.copyOf(builder.schema);
        this.metricsService = builder.metricsService;
    }

    public ComparatorRegistry getComparators() {
        return comparators;
    }

    public AggregationStrategy getAggregationStrategy() {
        return aggregator.getStrategy();
    }

    /**
     * Aggregator over the comparator attributes, in registration order.
     */
    public Aggregator getAggregator() {
        return aggregator;
    }

    public List<String> getBlockingAttributes() {
        return blockingAttributes;
    }

    /**
     * The rule in effect: the explicit rule, the exact-match conjunction of the blocking
     * attributes, or {@code null} when all records share one block.
     */
    public BlockingRule getBlockingRule() {
        return blockingRule;
    }

    public BlockSplitter getBlockSplitter() {
        return blockSplitter;
    }

    /**
     * Optional sub-block filter, {@code null} when none is configured.
     */
    public BlockFilter getBlockFilter() {
        return blockFilter;
    }

    public ClusteringOptions getClusteringOptions() {
        return clusteringOptions;
    }

    public ClusteringOracle getClusteringOracle() {
        return clusteringOracle;
    }

    public long getMaxComparisonsPerBlock() {
        return maxComparisonsPerBlock;
    }

    public int getNumThreads() {
        return numThreads;
    }

    public boolean isIncludeSingletons() {
        return includeSingletons;
    }

    /**
     * Declared attribute names, or {@code null} when no schema was declared.
     */
    public Set<String> getSchema() {
        return schema;
    }

    public MetricsService getMetricsService() {
        return metricsService;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Map<String, AttributeComparator> comparators = new LinkedHashMap<>();
        private String aggregationStrategy = DEFAULT_AGGREGATION;
        private final Map<String, Double> weights = new LinkedHashMap<>();
        private final List<String> blockingAttributes = new ArrayList<>();
        private BlockingRule blockingRule;
        private BlockSplitter blockSplitter = new IdentityBlockSplitter();
        private BlockFilter blockFilter;
        private Map<String, ?> clusteringKwargs = Map.of();
        private ClusteringOracle clusteringOracle = new DbscanClusteringOracle();
        private long maxComparisonsPerBlock = 0;
        private int numThreads = 1;
        private boolean includeSingletons = false;
        private Set<String> schema;
        private MetricsService metricsService = new NoOpMetricsService();

        /**
         * Adds an attribute comparator. Attributes contribute to similarity in the order added.
         */
        public Builder comparator(String attribute, AttributeComparator comparator) {
            if (attribute == null || attribute.isBlank()) {
                throw new ConfigurationException("comparator attribute is required");
            }
            if (comparator == null) {
                throw new ConfigurationException("comparator is required for attribute " + attribute);
            }
            if (comparators.putIfAbsent(attribute, comparator) != null) {
                throw new ConfigurationException("Duplicate comparator for attribute " + attribute);
            }
            return this;
        }

        public Builder comparators(ComparatorRegistry registry) {
            registry.entries().forEach(e -> comparator(e.getKey(), e.getValue()));
            return this;
        }

        /**
         * Aggregation strategy by name: mean, median, min, max or weighted_mean.
         */
        public Builder aggregationStrategy(String aggregationStrategy) {
            this.aggregationStrategy = aggregationStrategy;
            return this;
        }

        public Builder aggregationStrategy(AggregationStrategy aggregationStrategy) {
            this.aggregationStrategy = aggregationStrategy == null ? null : aggregationStrategy.configName();
            return this;
        }

        /**
         * Per-attribute weights for {@code weighted_mean}; they need not sum to 1.
         */
        public Builder weights(Map<String, Double> weights) {
            this.weights.clear();
            if (weights != null) {
                this.weights.putAll(weights);
            }
            return this;
        }

        /**
         * Exact-match blocking on all of these attributes (dot-paths allowed).
         * Cannot be combined with {@link #blockingRule}.
         */
        public Builder blockingAttributes(List<String> blockingAttributes) {
            this.blockingAttributes.clear();
            if (blockingAttributes != null) {
                this.blockingAttributes.addAll(blockingAttributes);
            }
            return this;
        }

        public Builder blockingAttributes(String... blockingAttributes) {
            return blockingAttributes(List.of(blockingAttributes));
        }

        public Builder blockingRule(BlockingRule blockingRule) {
            this.blockingRule = blockingRule;
            return this;
        }

        public Builder blockSplitter(BlockSplitter blockSplitter) {
            this.blockSplitter = blockSplitter;
            return this;
        }

        public Builder blockFilter(BlockFilter blockFilter) {
            this.blockFilter = blockFilter;
            return this;
        }

        /**
         * Clustering keyword arguments: {@code eps}, {@code min_samples}, {@code metric}.
         */
        public Builder clusteringKwargs(Map<String, ?> clusteringKwargs) {
            this.clusteringKwargs = clusteringKwargs == null ? Map.of() : new LinkedHashMap<>(clusteringKwargs);
            return this;
        }

        public Builder clusteringOracle(ClusteringOracle clusteringOracle) {
            this.clusteringOracle = clusteringOracle;
            return this;
        }

        /**
         * Caps the pairs compared per sub-block; 0 compares all pairs.
         */
        public Builder maxComparisonsPerBlock(long maxComparisonsPerBlock) {
            this.maxComparisonsPerBlock = maxComparisonsPerBlock;
            return this;
        }

        public Builder numThreads(int numThreads) {
            this.numThreads = numThreads;
            return this;
        }

        /**
         * Whether records without any cluster-mate are emitted as clusters of one.
         */
        public Builder includeSingletons(boolean includeSingletons) {
            this.includeSingletons = includeSingletons;
            return this;
        }

        /**
         * Declares the attribute names records may carry, so that comparator attributes
         * can be checked at construction time.
         */
        public Builder schema(Set<String> schema) {
            this.schema = schema == null ? null : new LinkedHashSet<>(schema);
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public DeduplicatorConfig build() {
            if (comparators.isEmpty()) {
                throw new ConfigurationException("At least one comparator is required");
            }
            AggregationStrategy strategy = AggregationStrategy.fromName(aggregationStrategy);
            if (!blockingAttributes.isEmpty() && blockingRule != null) {
                throw new ConfigurationException("Configure either blockingAttributes or blockingRule, not both");
            }
            for (String attribute : blockingAttributes) {
                if (attribute == null || attribute.isBlank()) {
                    throw new ConfigurationException("Blocking attributes must not be blank");
                }
            }
            if (blockSplitter == null) {
                throw new ConfigurationException("blockSplitter must not be null");
            }
            if (clusteringOracle == null) {
                throw new ConfigurationException("clusteringOracle must not be null");
            }
            if (metricsService == null) {
                throw new ConfigurationException("metricsService must not be null");
            }
            if (maxComparisonsPerBlock < 0) {
                throw new ConfigurationException("maxComparisonsPerBlock must be >= 0");
            }
            if (numThreads <= 0) {
                throw new ConfigurationException("numThreads must be > 0");
            }
            if (schema != null) {
                for (String attribute : comparators.keySet()) {
                    if (!schema.contains(attribute)) {
                        throw new ConfigurationException("Comparator attribute '" + attribute + "' is not in the declared schema " + schema);
                    }
                }
            }
            ClusteringOptions options = ClusteringOptions.fromKwargs(clusteringKwargs);
            BlockingRule effectiveRule = blockingRule != null
                    ? blockingRule
                    : blockingAttributes.isEmpty() ? null : BlockingRules.exactAll(blockingAttributes);
            ComparatorRegistry registry = ComparatorRegistry.of(comparators);
            Aggregator aggregator = new Aggregator(strategy, registry.attributes(), weights);
            return new DeduplicatorConfig(this, registry, aggregator, effectiveRule, options);
        }
    }
}

package com.entity.dedup.scoring;

import com.entity.dedup.api.ConfigurationException;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Combines a pair's attribute scores into a single similarity in [0,1].
 * Deterministic and stateless once constructed; safe to share between threads.
 */
public class Aggregator {

    private final AggregationStrategy strategy;
    private final List<String> attributes;
    private final double[] normalizedWeights;

    public Aggregator(AggregationStrategy strategy, List<String> attributes) {
        this(strategy, attributes, Map.of());
    }

    /**
     * @param strategy   aggregation strategy
     * @param attributes attribute names in comparator order
     * @param weights    per-attribute weights, required for and only for {@code WEIGHTED_MEAN}
     * @throws ConfigurationException if the weights do not fit the strategy or attributes
     */
    public Aggregator(AggregationStrategy strategy, List<String> attributes, Map<String, Double> weights) {
        if (strategy == null) {
            throw new ConfigurationException("aggregation strategy is required");
        }
        if (attributes == null || attributes.isEmpty()) {
            throw new ConfigurationException("at least one attribute is required for aggregation");
        }
        Map<String, Double> w = weights == null ? Map.of() : weights;
        this.strategy = strategy;
        this.attributes = List.copyOf(attributes);
        if (strategy == AggregationStrategy.WEIGHTED_MEAN) {
            this.normalizedWeights = normalize(this.attributes, w);
        } else {
            if (!w.isEmpty()) {
                throw new ConfigurationException("Weights are only used by the "
                        + AggregationStrategy.WEIGHTED_MEAN.configName() + " strategy, not " + strategy.configName());
            }
            this.normalizedWeights = null;
        }
    }

    /**
     * Aggregates a pair's scores. Attributes absent from the map count as 0.
     */
    public double aggregate(Map<String, Double> attributeScores) {
        double[] scores = new double[attributes.size()];
        for (int i = 0; i < scores.length; i++) {
            scores[i] = attributeScores.getOrDefault(attributes.get(i), 0.0);
        }
        return aggregate(scores);
    }

    /**
     * Aggregates scores given in attribute order.
     */
    public double aggregate(double[] scores) {
        if (scores.length != attributes.size()) {
            throw new IllegalArgumentException("Expected " + attributes.size() + " scores, got " + scores.length);
        }
        double result;
        switch (strategy) {
            case MEAN:
                result = Arrays.stream(scores).average().orElse(0.0);
                break;
            case MEDIAN:
                result = median(scores);
                break;
            case MIN:
                result = Arrays.stream(scores).min().orElse(0.0);
                break;
            case MAX:
                result = Arrays.stream(scores).max().orElse(0.0);
                break;
            case WEIGHTED_MEAN:
                result = 0.0;
                for (int i = 0; i < scores.length; i++) {
                    result += normalizedWeights[i] * scores[i];
                }
                break;
            default:
                throw new IllegalStateException("Unhandled strategy " + strategy);
        }
        return Math.max(0.0, Math.min(1.0, result));
    }

    public AggregationStrategy getStrategy() {
        return strategy;
    }

    public List<String> getAttributes() {
        return attributes;
    }

    /**
     * Normalised weights by attribute, or empty for unweighted strategies.
     */
    public Map<String, Double> getNormalizedWeights() {
        Map<String, Double> result = new LinkedHashMap<>();
        if (normalizedWeights != null) {
            for (int i = 0; i < attributes.size(); i++) {
                result.put(attributes.get(i), normalizedWeights[i]);
            }
        }
        return result;
    }

    private static double median(double[] scores) {
        double[] sorted = scores.clone();
        Arrays.sort(sorted);
        int mid = sorted.length / 2;
        return sorted.length % 2 == 1 ? sorted[mid] : (sorted[mid - 1] + sorted[mid]) / 2.0;
    }

    private static double[] normalize(List<String> attributes, Map<String, Double> weights) {
        for (String name : weights.keySet()) {
            if (!attributes.contains(name)) {
                throw new ConfigurationException("Weight given for attribute '" + name + "' which has no comparator");
            }
        }
        double[] result = new double[attributes.size()];
        double total = 0.0;
        for (int i = 0; i < attributes.size(); i++) {
            Double weight = weights.get(attributes.get(i));
            if (weight == null) {
                throw new ConfigurationException("Missing weight for attribute '" + attributes.get(i) + "'");
            }
            if (weight < 0 || weight.isNaN() || weight.isInfinite()) {
                throw new ConfigurationException("Weight for attribute '" + attributes.get(i) + "' must be a non-negative number");
            }
            result[i] = weight;
            total += weight;
        }
        if (total <= 0.0) {
            throw new ConfigurationException("At least one weight must be positive");
        }
        for (int i = 0; i < result.length; i++) {
            result[i] /= total;
        }
        return result;
    }
}

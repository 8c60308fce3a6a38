package com.entity.dedup.clustering;

import com.entity.dedup.api.ConfigurationException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Parameters forwarded to the clustering oracle.
 *
 * @param eps        neighbourhood radius on the distance scale, {@code > 0}
 * @param minSamples neighbourhood size (the record itself included) for a core record, {@code >= 1}
 * @param metric     distance metric; only {@code precomputed} is supported
 */
public record ClusteringOptions(double eps, int minSamples, String metric) {

    public static final String PRECOMPUTED = "precomputed";
    public static final double DEFAULT_EPS = 0.5;
    public static final int DEFAULT_MIN_SAMPLES = 2;

    private static final Set<String> KNOWN_KEYS = Set.of("eps", "min_samples", "metric");

    public ClusteringOptions {
        if (!(eps > 0.0) || Double.isInfinite(eps)) {
            throw new ConfigurationException("eps must be a positive number, got " + eps);
        }
        if (minSamples < 1) {
            throw new ConfigurationException("min_samples must be >= 1, got " + minSamples);
        }
        if (metric == null) {
            metric = PRECOMPUTED;
        }
        if (!PRECOMPUTED.equals(metric)) {
            throw new ConfigurationException("Only metric='" + PRECOMPUTED + "' is supported, got '" + metric + "'");
        }
    }

    public ClusteringOptions(double eps, int minSamples) {
        this(eps, minSamples, PRECOMPUTED);
    }

    public static ClusteringOptions defaults() {
        return new ClusteringOptions(DEFAULT_EPS, DEFAULT_MIN_SAMPLES, PRECOMPUTED);
    }

    /**
     * Parses clustering keyword arguments ({@code eps}, {@code min_samples}, {@code metric}).
     * Missing keys take their defaults.
     *
     * @throws ConfigurationException for unknown keys or values of the wrong type
     */
    public static ClusteringOptions fromKwargs(Map<String, ?> kwargs) {
        if (kwargs == null || kwargs.isEmpty()) {
            return defaults();
        }
        for (String key : kwargs.keySet()) {
            if (!KNOWN_KEYS.contains(key)) {
                throw new ConfigurationException("Unknown clustering option '" + key + "', expected one of " + KNOWN_KEYS);
            }
        }
        double eps = number(kwargs, "eps", DEFAULT_EPS).doubleValue();
        Number minSamples = number(kwargs, "min_samples", DEFAULT_MIN_SAMPLES);
        if (minSamples.doubleValue() != Math.rint(minSamples.doubleValue())) {
            throw new ConfigurationException("min_samples must be an integer, got " + minSamples);
        }
        Object metric = kwargs.get("metric");
        return new ClusteringOptions(eps, minSamples.intValue(), metric == null ? PRECOMPUTED : metric.toString());
    }

    /**
     * Keyword form of these options.
     */
    public Map<String, Object> toKwargs() {
        Map<String, Object> kwargs = new LinkedHashMap<>();
        kwargs.put("eps", eps);
        kwargs.put("min_samples", minSamples);
        kwargs.put("metric", metric);
        return kwargs;
    }

    private static Number number(Map<String, ?> kwargs, String key, Number fallback) {
        Object value = kwargs.get(key);
        if (value == null) {
            return fallback;
        }
        if (value instanceof Number n) {
            return n;
        }
        try {
            return Double.parseDouble(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Clustering option '" + key + "' must be numeric, got '" + value + "'", e);
        }
    }
}

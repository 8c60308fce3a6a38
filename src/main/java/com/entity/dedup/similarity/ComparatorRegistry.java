package com.entity.dedup.similarity;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Explicit, ordered mapping from attribute name to the comparator that scores it.
 * Each deduplicator owns its registry; there is no process-wide state.
 */
public final class ComparatorRegistry {

    private final Map<String, AttributeComparator> comparators;

    private ComparatorRegistry(Map<String, AttributeComparator> comparators) {
        this.comparators = Collections.unmodifiableMap(new LinkedHashMap<>(comparators));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a registry from an attribute to comparator map, preserving its iteration order.
     */
    public static ComparatorRegistry of(Map<String, ? extends AttributeComparator> comparators) {
        Builder builder = builder();
        comparators.forEach(builder::register);
        return builder.build();
    }

    public AttributeComparator get(String attribute) {
        return comparators.get(attribute);
    }

    public boolean contains(String attribute) {
        return comparators.containsKey(attribute);
    }

    /**
     * Attribute names in registration order.
     */
    public List<String> attributes() {
        return List.copyOf(comparators.keySet());
    }

    public Set<Map.Entry<String, AttributeComparator>> entries() {
        return comparators.entrySet();
    }

    public int size() {
        return comparators.size();
    }

    public boolean isEmpty() {
        return comparators.isEmpty();
    }

    public static class Builder {
        private final Map<String, AttributeComparator> comparators = new LinkedHashMap<>();

        /**
         * Registers a comparator for an attribute (dot-paths allowed).
         *
         * @throws IllegalArgumentException if the attribute is blank or already registered
         */
        public Builder register(String attribute, AttributeComparator comparator) {
            if (attribute == null || attribute.isBlank()) {
                throw new IllegalArgumentException("attribute is required");
            }
            if (comparator == null) {
                throw new IllegalArgumentException("comparator is required for attribute " + attribute);
            }
            if (comparators.putIfAbsent(attribute, comparator) != null) {
                throw new IllegalArgumentException("Duplicate comparator for attribute " + attribute);
            }
            return this;
        }

        public ComparatorRegistry build() {
            return new ComparatorRegistry(comparators);
        }
    }
}

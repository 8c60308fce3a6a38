package com.entity.dedup.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Opaque, hashable grouping key produced by a blocking rule.
 * A key is an ordered tuple of components; conjunction concatenates the tuples.
 */
public final class BlockKey {

    private final List<Object> components;

    private BlockKey(List<Object> components) {
        this.components = List.copyOf(components);
    }

    /**
     * Creates a leaf key tagged with the label of the rule that produced it.
     */
    public static BlockKey of(String ruleLabel, Object value) {
        Objects.requireNonNull(ruleLabel, "ruleLabel is required");
        Objects.requireNonNull(value, "value is required");
        return new BlockKey(List.of(ruleLabel + "=" + value));
    }

    /**
     * Key used for a record that no rule could place in a block.
     */
    public static BlockKey unblocked(int recordIndex) {
        return new BlockKey(List.of("unblocked:" + recordIndex));
    }

    /**
     * Returns the tuple (this, other).
     */
    public BlockKey concat(BlockKey other) {
        List<Object> joined = new ArrayList<>(components.size() + other.components.size());
        joined.addAll(components);
        joined.addAll(other.components);
        return new BlockKey(joined);
    }

    public List<Object> components() {
        return components;
    }

    public int arity() {
        return components.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BlockKey other)) return false;
        return components.equals(other.components);
    }

    @Override
    public int hashCode() {
        return components.hashCode();
    }

    @Override
    public String toString() {
        if (components.size() == 1) {
            return String.valueOf(components.get(0));
        }
        return components.stream().map(String::valueOf).collect(Collectors.joining("&", "(", ")"));
    }
}

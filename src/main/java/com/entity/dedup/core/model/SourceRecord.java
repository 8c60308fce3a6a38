package com.entity.dedup.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A single input record as seen by the deduplication pipeline.
 *
 * <p>The {@code index} is the record's position in the input sequence and serves as its
 * identifier for the whole run. Attributes may nest: a value that is itself a {@link Map}
 * can be reached with a dot-path such as {@code address.city}.</p>
 *
 * @param index      position in the input sequence (the record identifier)
 * @param attributes attribute values keyed by name, never modified by the pipeline
 */
public record SourceRecord(int index, Map<String, Object> attributes) {

    public SourceRecord {
        if (index < 0) {
            throw new IllegalArgumentException("index must be >= 0");
        }
        Objects.requireNonNull(attributes, "attributes is required");
        attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    /**
     * Looks up an attribute by name or dot-path.
     *
     * @param path attribute name, or segments joined by '.' for nested maps
     * @return the value, or {@code null} when any segment is missing
     */
    public Object get(String path) {
        if (path == null || path.isEmpty()) {
            return null;
        }
        if (attributes.containsKey(path)) {
            return attributes.get(path);
        }
        Object current = attributes;
        for (String segment : path.split("\\.")) {
            if (!(current instanceof Map<?, ?> map)) {
                return null;
            }
            current = map.get(segment);
            if (current == null) {
                return null;
            }
        }
        return current;
    }

    /**
     * Returns true if the attribute resolves to a non-null value.
     */
    public boolean has(String path) {
        return get(path) != null;
    }

    @Override
    public String toString() {
        return "SourceRecord{index=" + index + ", attributes=" + attributes + '}';
    }
}

package com.entity.dedup.blocking.encoder;

/**
 * Encodes an attribute value into a coarse blocking code.
 * Values that encode to the same code land in the same block.
 *
 * <p>Implementations must be pure and thread-safe. An empty result means the value
 * produced no usable code and the record does not match the rule.</p>
 */
@FunctionalInterface
public interface KeyEncoder {

    /**
     * Encodes a non-blank value.
     *
     * @param value the attribute value, already converted to text and trimmed
     * @return the blocking code (never null, empty if no code could be derived)
     */
    String encode(String value);

    /**
     * Returns a short name used in block keys and log messages.
     */
    default String getName() {
        return getClass().getSimpleName();
    }
}

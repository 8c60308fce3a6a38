package com.entity.dedup.similarity;

/**
 * Similarity function for one attribute.
 * Implementations should be pure and thread-safe, and must return a value in [0,1]
 * where 1 means identical.
 */
@FunctionalInterface
public interface AttributeComparator {

    /**
     * Scores two non-null attribute values.
     *
     * @param a first value
     * @param b second value
     * @return similarity between 0.0 and 1.0
     */
    double score(Object a, Object b);
}

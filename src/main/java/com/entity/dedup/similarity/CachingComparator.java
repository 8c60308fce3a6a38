package com.entity.dedup.similarity;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Memoises an expensive comparator with a bounded Caffeine cache.
 * The key is the unordered pair of values, so {@code score(a, b)} and {@code score(b, a)}
 * share an entry; the wrapped comparator must therefore be symmetric.
 *
 * <p>Exceptions from the delegate are not cached.</p>
 */
public class CachingComparator implements AttributeComparator {
    private static final Logger log = LoggerFactory.getLogger(CachingComparator.class);

    public static final int DEFAULT_MAX_SIZE = 10_000;

    private final AttributeComparator delegate;
    private final Cache<PairKey, Double> cache;

    public CachingComparator(AttributeComparator delegate) {
        this(delegate, DEFAULT_MAX_SIZE);
    }

    public CachingComparator(AttributeComparator delegate, int maxSize) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate is required");
        }
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
        this.delegate = delegate;
        this.cache = Caffeine.newBuilder()
                .maximumSize(maxSize)
                .recordStats()
                .build();
        log.debug("CachingComparator initialized: delegate={}, maxSize={}",
                delegate.getClass().getSimpleName(), maxSize);
    }

    @Override
    public double score(Object a, Object b) {
        return cache.get(PairKey.of(a, b), key -> delegate.score(a, b));
    }

    public CacheStats getStats() {
        return cache.stats();
    }

    public long estimatedSize() {
        return cache.estimatedSize();
    }

    /**
     * Unordered value pair.
     */
    record PairKey(Object low, Object high) {
        static PairKey of(Object a, Object b) {
            int ha = a.hashCode();
            int hb = b.hashCode();
            if (ha < hb || (ha == hb && a.toString().compareTo(b.toString()) <= 0)) {
                return new PairKey(a, b);
            }
            return new PairKey(b, a);
        }
    }
}

package com.entity.dedup.blocking;

import com.entity.dedup.core.model.Block;

/**
 * Rejects blocks whose size falls outside {@code [minBlockSize, maxBlockSize]}.
 * Very large blocks usually come from a non-selective key (an empty-ish or default value)
 * and would dominate the comparison cost.
 */
public class CardinalityBlockFilter implements BlockFilter {

    private final int minBlockSize;
    private final int maxBlockSize;

    public CardinalityBlockFilter(int minBlockSize, int maxBlockSize) {
        if (minBlockSize < 1) {
            throw new IllegalArgumentException("minBlockSize must be >= 1");
        }
        if (maxBlockSize < minBlockSize) {
            throw new IllegalArgumentException("maxBlockSize must be >= minBlockSize");
        }
        this.minBlockSize = minBlockSize;
        this.maxBlockSize = maxBlockSize;
    }

    /**
     * Only an upper bound; singleton blocks are kept.
     */
    public static CardinalityBlockFilter maxSize(int maxBlockSize) {
        return new CardinalityBlockFilter(1, maxBlockSize);
    }

    @Override
    public boolean reject(Block block) {
        return block.size() < minBlockSize || block.size() > maxBlockSize;
    }

    public int getMinBlockSize() {
        return minBlockSize;
    }

    public int getMaxBlockSize() {
        return maxBlockSize;
    }
}

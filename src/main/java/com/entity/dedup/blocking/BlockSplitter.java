package com.entity.dedup.blocking;

import com.entity.dedup.core.model.Block;

import java.util.List;

/**
 * Subdivides a block into smaller blocks to bound the quadratic comparison cost.
 * Implementations must be deterministic and must not drop records.
 */
@FunctionalInterface
public interface BlockSplitter {

    /**
     * Splits a block.
     *
     * @param block the block to split
     * @return one or more sub-blocks whose union is the input block
     */
    List<Block> split(Block block);
}

package com.entity.dedup.blocking;

import com.entity.dedup.core.model.Block;

/**
 * Decides whether a sub-block is skipped before scoring. Records of a skipped block are
 * not compared there but still appear in the output as singletons if nothing else links them.
 */
@FunctionalInterface
public interface BlockFilter {

    boolean reject(Block block);
}

package com.entity.dedup.blocking;

import com.entity.dedup.core.model.Block;

import java.util.List;

/**
 * Default splitter: leaves blocks unchanged. Suitable when the blocking keys are already
 * selective, as with phone-number blocking.
 */
public class IdentityBlockSplitter implements BlockSplitter {

    @Override
    public List<Block> split(Block block) {
        return List.of(block);
    }
}

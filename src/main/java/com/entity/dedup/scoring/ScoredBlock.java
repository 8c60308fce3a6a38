package com.entity.dedup.scoring;

import com.entity.dedup.core.model.AggregatedScore;
import com.entity.dedup.core.model.Block;

import java.util.List;

/**
 * Aggregated pair scores for one sub-block.
 *
 * @param block       the scored sub-block
 * @param scores      one entry per compared pair; pairs skipped by a comparison cap are absent
 * @param warnings    comparator failures recovered while scoring
 * @param comparisons number of pairs compared
 */
public record ScoredBlock(Block block, List<AggregatedScore> scores, List<ScoringWarning> warnings, long comparisons) {

    public ScoredBlock {
        scores = List.copyOf(scores);
        warnings = List.copyOf(warnings);
    }

    public long comparatorFailures() {
        return warnings.size();
    }
}

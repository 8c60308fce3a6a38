package com.entity.dedup.clustering;

import com.entity.dedup.core.model.Block;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Oracle labels for one sub-block, aligned with the block's records.
 *
 * @param block        the clustered sub-block
 * @param labels       one label per record, {@link ClusteringOracle#NOISE} for unclustered
 * @param oracleFailed true if the oracle failed and every record was marked noise
 */
public record LocalClustering(Block block, int[] labels, boolean oracleFailed) {

    public LocalClustering {
        if (labels.length != block.size()) {
            throw new IllegalArgumentException("Expected " + block.size() + " labels, got " + labels.length);
        }
        labels = labels.clone();
    }

    @Override
    public int[] labels() {
        return labels.clone();
    }

    /**
     * Input indices of the records in each non-noise local cluster.
     */
    public List<List<Integer>> clusters() {
        Map<Integer, List<Integer>> byLabel = new LinkedHashMap<>();
        for (int i = 0; i < labels.length; i++) {
            if (labels[i] != ClusteringOracle.NOISE) {
                byLabel.computeIfAbsent(labels[i], l -> new ArrayList<>()).add(block.get(i).index());
            }
        }
        return new ArrayList<>(byLabel.values());
    }

    public int noiseCount() {
        int count = 0;
        for (int label : labels) {
            if (label == ClusteringOracle.NOISE) {
                count++;
            }
        }
        return count;
    }
}

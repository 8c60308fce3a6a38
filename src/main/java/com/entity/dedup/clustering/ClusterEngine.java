package com.entity.dedup.clustering;

import com.entity.dedup.core.model.Block;
import com.entity.dedup.scoring.ScoredBlock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Turns scored sub-blocks into clusters.
 *
 * <p>{@link #clusterBlock} builds the distance matrix of one sub-block, applying the
 * similarity threshold, and asks the oracle for local labels. A failing oracle marks the
 * whole sub-block as noise. {@link #merge} then reconciles the block-local labels: two
 * records that share a non-noise label in any sub-block end up in the same global
 * cluster, transitively across blocks.</p>
 */
public class ClusterEngine {
    private static final Logger log = LoggerFactory.getLogger(ClusterEngine.class);

    private final ClusteringOracle oracle;
    private final ClusteringOptions options;

    public ClusterEngine(ClusteringOracle oracle, ClusteringOptions options) {
        this.oracle = Objects.requireNonNull(oracle, "oracle is required");
        this.options = Objects.requireNonNull(options, "options is required");
    }

    /**
     * Clusters one scored sub-block.
     *
     * @param scored              aggregated scores of the sub-block
     * @param similarityThreshold pairs scoring below this are pushed to maximal distance
     */
    public LocalClustering clusterBlock(ScoredBlock scored, double similarityThreshold) {
        Block block = scored.block();
        DistanceMatrix matrix = DistanceMatrix.fromScores(block.size(), scored.scores(), similarityThreshold);
        try {
            int[] labels = oracle.cluster(matrix, options);
            if (labels == null || labels.length != block.size()) {
                throw new IllegalStateException("oracle returned " + (labels == null ? "no labels" : labels.length + " labels")
                        + " for " + block.size() + " records");
            }
            return new LocalClustering(block, labels, false);
        } catch (RuntimeException e) {
            log.warn("clustering.oracle_failed blockId={} size={} error={}", block.id(), block.size(), e.toString());
            return allNoise(block);
        }
    }

    /**
     * Local clustering in which every record is noise.
     */
    public static LocalClustering allNoise(Block block) {
        int[] labels = new int[block.size()];
        Arrays.fill(labels, ClusteringOracle.NOISE);
        return new LocalClustering(block, labels, true);
    }

    /**
     * Reconciles local clusterings into a global partition of {@code 0..recordCount-1}.
     * The result does not depend on the order of {@code clusterings}.
     *
     * @return groups of input indices, each sorted, ordered by smallest index; records that
     *         were never clustered with another record form singleton groups
     */
    public static List<List<Integer>> merge(int recordCount, Collection<LocalClustering> clusterings) {
        DisjointSet sets = new DisjointSet(recordCount);
        int unions = 0;
        for (LocalClustering clustering : clusterings) {
            for (List<Integer> members : clustering.clusters()) {
                int anchor = members.get(0);
                for (int k = 1; k < members.size(); k++) {
                    if (sets.union(anchor, members.get(k))) {
                        unions++;
                    }
                }
            }
        }
        List<List<Integer>> groups = sets.groups();
        log.debug("clustering.merged records={} unions={} groups={}", recordCount, unions, groups.size());
        return groups;
    }

    public ClusteringOptions getOptions() {
        return options;
    }

    public ClusteringOracle getOracle() {
        return oracle;
    }
}

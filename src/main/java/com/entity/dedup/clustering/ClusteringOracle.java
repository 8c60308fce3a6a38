package com.entity.dedup.clustering;

/**
 * Density-based clustering over a precomputed distance matrix.
 */
@FunctionalInterface
public interface ClusteringOracle {

    /** Label of records that belong to no cluster. */
    int NOISE = -1;

    /**
     * Clusters the records of one sub-block.
     *
     * @param matrix  pairwise distances
     * @param options clustering parameters
     * @return one label per matrix row; equal non-negative labels share a cluster,
     *         {@link #NOISE} marks unclustered records
     */
    int[] cluster(DistanceMatrix matrix, ClusteringOptions options);
}

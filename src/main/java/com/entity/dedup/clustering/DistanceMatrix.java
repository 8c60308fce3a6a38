package com.entity.dedup.clustering;

import com.entity.dedup.core.model.AggregatedScore;

import java.util.Arrays;
import java.util.List;

/**
 * Symmetric pairwise distance matrix over the records of one sub-block, zero on the
 * diagonal. Every off-diagonal cell starts at {@link #MAX_DISTANCE}; only compared pairs
 * whose score reaches the similarity threshold get a smaller distance.
 */
public final class DistanceMatrix {

    public static final double MAX_DISTANCE = 1.0;

    private final int size;
    private final double[][] distances;

    private DistanceMatrix(int size) {
        this.size = size;
        this.distances = new double[size][size];
        for (int i = 0; i < size; i++) {
            Arrays.fill(distances[i], MAX_DISTANCE);
            distances[i][i] = 0.0;
        }
    }

    /**
     * Matrix with every pair at maximal distance.
     */
    public static DistanceMatrix unlinked(int size) {
        if (size < 0) {
            throw new IllegalArgumentException("size must be >= 0");
        }
        return new DistanceMatrix(size);
    }

    /**
     * Builds the matrix from aggregated scores: distance = 1 - score for pairs with
     * {@code score >= similarityThreshold}, maximal distance for all other pairs,
     * including pairs that were never compared.
     */
    public static DistanceMatrix fromScores(int size, List<AggregatedScore> scores, double similarityThreshold) {
        DistanceMatrix matrix = unlinked(size);
        for (AggregatedScore score : scores) {
            if (score.first() >= size || score.second() >= size) {
                throw new IllegalArgumentException("Score for pair (" + score.first() + "," + score.second()
                        + ") outside matrix of size " + size);
            }
            if (score.score() >= similarityThreshold) {
                matrix.set(score.first(), score.second(), score.distance());
            }
        }
        return matrix;
    }

    private void set(int i, int j, double distance) {
        distances[i][j] = distance;
        distances[j][i] = distance;
    }

    public double get(int i, int j) {
        return distances[i][j];
    }

    /**
     * True when the pair is at maximal distance (never compared, below threshold, or score 0).
     */
    public boolean isMaximal(int i, int j) {
        return i != j && distances[i][j] >= MAX_DISTANCE;
    }

    public int size() {
        return size;
    }

    /**
     * Defensive copy of the full matrix.
     */
    public double[][] toArray() {
        double[][] copy = new double[size][];
        for (int i = 0; i < size; i++) {
            copy[i] = distances[i].clone();
        }
        return copy;
    }
}

package com.entity.dedup.clustering;

import org.apache.commons.math3.ml.clustering.Cluster;
import org.apache.commons.math3.ml.clustering.Clusterable;
import org.apache.commons.math3.ml.clustering.DBSCANClusterer;
import org.apache.commons.math3.ml.distance.DistanceMeasure;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * DBSCAN over a precomputed distance matrix, backed by Commons Math.
 *
 * <p>Each record is represented by a point whose only coordinate is its matrix row, and the
 * distance measure reads the matrix. Pairs at maximal distance are reported as infinitely
 * far apart so they are never neighbours, whatever {@code eps} is.</p>
 *
 * <p>{@code min_samples} counts the record itself, whereas Commons Math counts only the
 * other records in the neighbourhood; the parameter is shifted by one accordingly.</p>
 */
public class DbscanClusteringOracle implements ClusteringOracle {

    @Override
    public int[] cluster(DistanceMatrix matrix, ClusteringOptions options) {
        int n = matrix.size();
        int[] labels = new int[n];
        Arrays.fill(labels, NOISE);
        if (n == 0) {
            return labels;
        }

        List<RowPoint> points = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            points.add(new RowPoint(i));
        }
        DistanceMeasure measure = (a, b) -> {
            int i = (int) a[0];
            int j = (int) b[0];
            return matrix.isMaximal(i, j) ? Double.POSITIVE_INFINITY : matrix.get(i, j);
        };
        DBSCANClusterer<RowPoint> dbscan = new DBSCANClusterer<>(options.eps(), options.minSamples() - 1, measure);

        List<Cluster<RowPoint>> clusters = dbscan.cluster(points);
        for (int label = 0; label < clusters.size(); label++) {
            for (RowPoint point : clusters.get(label).getPoints()) {
                labels[point.row] = label;
            }
        }
        return labels;
    }

    /**
     * Identity-compared point standing for one matrix row.
     */
    static final class RowPoint implements Clusterable {
        private final int row;
        private final double[] coordinates;

        RowPoint(int row) {
            this.row = row;
            this.coordinates = new double[]{row};
        }

        @Override
        public double[] getPoint() {
            return coordinates;
        }
    }
}

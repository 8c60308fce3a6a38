package com.entity.dedup.evaluation;

import com.entity.dedup.core.model.DuplicateCluster;
import com.entity.dedup.core.model.SourceRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ClusterEvaluatorTest {

    private static final int[] TRUTH = {0, 0, 0, 1, 1, 2};

    @Test
    @DisplayName("Perfect prediction scores 100")
    void perfectPrediction() {
        assertEquals(100.0, ClusterEvaluator.precision(TRUTH, TRUTH));
        assertEquals(100.0, ClusterEvaluator.recall(TRUTH, TRUTH));
        assertEquals(100.0, ClusterEvaluator.f1(TRUTH, TRUTH), 1e-3);
    }

    @Test
    @DisplayName("Pairwise precision and recall")
    void partialPrediction() {
        int[] predicted = {0, 0, 1, 1, 1, 2};

        // predicted pairs: (0,1) (2,3) (2,4) (3,4); true among them: (0,1) (3,4)
        assertEquals(50.0, ClusterEvaluator.precision(TRUTH, predicted), 1e-9);
        // true pairs: (0,1) (0,2) (1,2) (3,4); found: (0,1) (3,4)
        assertEquals(50.0, ClusterEvaluator.recall(TRUTH, predicted), 1e-9);
    }

    @Test
    @DisplayName("No predicted pairs gives precision 100")
    void noPredictedPairs() {
        int[] predicted = {0, 1, 2, 3, 4, 5};

        assertEquals(100.0, ClusterEvaluator.precision(TRUTH, predicted));
        assertEquals(0.0, ClusterEvaluator.recall(TRUTH, predicted));
    }

    @Test
    @DisplayName("Confusion matrix covers every pair once")
    void confusionMatrix() {
        ConfusionMatrix matrix = ClusterEvaluator.confusionMatrix(TRUTH, new int[]{0, 0, 1, 1, 1, 2});

        assertEquals(2, matrix.truePositives());
        assertEquals(2, matrix.falsePositives());
        assertEquals(2, matrix.falseNegatives());
        assertEquals(9, matrix.trueNegatives());
        assertEquals(15, matrix.total());
    }

    @Test
    @DisplayName("Reduction ratio and comparison efficiency")
    void blockingCost() {
        assertEquals(45, ClusterEvaluator.maxPossibleComparisons(10));
        assertEquals(80.0, ClusterEvaluator.reductionRatio(45, 9), 1e-9);
        assertEquals(5.0, ClusterEvaluator.comparisonEfficiency(45, 9), 1e-9);
        assertEquals(0.0, ClusterEvaluator.reductionRatio(0, 0));
        assertEquals(Double.POSITIVE_INFINITY, ClusterEvaluator.comparisonEfficiency(45, 0));
    }

    @Test
    @DisplayName("labelsOf gives unclustered records their own label")
    void labelsOf() {
        List<DuplicateCluster> clusters = List.of(
                new DuplicateCluster("a", List.of(new SourceRecord(0, Map.of()), new SourceRecord(2, Map.of()))));

        int[] labels = ClusterEvaluator.labelsOf(clusters, 4);

        assertEquals(labels[0], labels[2]);
        assertNotEquals(labels[0], labels[1]);
        assertNotEquals(labels[1], labels[3]);
        assertNotEquals(labels[0], labels[3]);
    }

    @Test
    @DisplayName("Label arrays must be aligned")
    void misalignedLabels() {
        assertThrows(IllegalArgumentException.class, () -> ClusterEvaluator.precision(TRUTH, new int[]{0}));
    }
}

package com.entity.dedup.clustering;

import com.entity.dedup.core.model.AggregatedScore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DistanceMatrixTest {

    @Test
    @DisplayName("Should be symmetric with a zero diagonal")
    void symmetricZeroDiagonal() {
        DistanceMatrix matrix = DistanceMatrix.fromScores(3, List.of(new AggregatedScore(0, 2, 0.8)), 0.0);

        for (int i = 0; i < 3; i++) {
            assertEquals(0.0, matrix.get(i, i));
            for (int j = 0; j < 3; j++) {
                assertEquals(matrix.get(i, j), matrix.get(j, i));
            }
        }
        assertEquals(0.2, matrix.get(0, 2), 1e-9);
    }

    @Test
    @DisplayName("Should leave uncompared and below-threshold pairs at maximal distance")
    void thresholdAndUncompared() {
        DistanceMatrix matrix = DistanceMatrix.fromScores(3, List.of(
                new AggregatedScore(0, 1, 0.6),
                new AggregatedScore(1, 2, 0.9)), 0.7);

        assertTrue(matrix.isMaximal(0, 1));
        assertTrue(matrix.isMaximal(0, 2));
        assertFalse(matrix.isMaximal(1, 2));
        assertEquals(DistanceMatrix.MAX_DISTANCE, matrix.get(0, 1));
    }

    @Test
    @DisplayName("Threshold is inclusive")
    void inclusiveThreshold() {
        DistanceMatrix matrix = DistanceMatrix.fromScores(2, List.of(new AggregatedScore(0, 1, 0.7)), 0.7);

        assertEquals(0.3, matrix.get(0, 1), 1e-9);
    }

    @Test
    @DisplayName("Should reject scores outside the matrix")
    void outOfRange() {
        assertThrows(IllegalArgumentException.class,
                () -> DistanceMatrix.fromScores(2, List.of(new AggregatedScore(0, 2, 0.5)), 0.0));
    }
}

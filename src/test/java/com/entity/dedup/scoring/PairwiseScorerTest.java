package com.entity.dedup.scoring;

import com.entity.dedup.core.model.AggregatedScore;
import com.entity.dedup.core.model.Block;
import com.entity.dedup.core.model.PairScore;
import com.entity.dedup.core.model.SourceRecord;
import com.entity.dedup.similarity.AttributeComparator;
import com.entity.dedup.similarity.ComparatorRegistry;
import com.entity.dedup.similarity.ExactComparator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PairwiseScorerTest {

    @Mock
    private AttributeComparator comparator;

    private static Block block(List<Map<String, Object>> attributes) {
        List<SourceRecord> records = new ArrayList<>();
        for (int i = 0; i < attributes.size(); i++) {
            records.add(new SourceRecord(i * 10, attributes.get(i)));
        }
        return new Block("test", records);
    }

    private static PairwiseScorer scorer(ComparatorRegistry registry, long cap) {
        return new PairwiseScorer(registry, new Aggregator(AggregationStrategy.MEAN, registry.attributes()), cap);
    }

    @Test
    @DisplayName("Should score every pair once in lexicographic order")
    void scoresAllPairs() {
        ComparatorRegistry registry = ComparatorRegistry.builder().register("name", new ExactComparator()).build();
        Block block = block(List.of(Map.of("name", "a"), Map.of("name", "a"), Map.of("name", "b")));

        ScoredBlock scored = scorer(registry, PairwiseScorer.UNLIMITED).score(block);

        assertEquals(3, scored.comparisons());
        List<AggregatedScore> scores = scored.scores();
        assertEquals(List.of(0, 0, 1), scores.stream().map(AggregatedScore::first).toList());
        assertEquals(List.of(1, 2, 2), scores.stream().map(AggregatedScore::second).toList());
        assertEquals(1.0, scores.get(0).score());
        assertEquals(0.0, scores.get(1).score());
        assertTrue(scored.warnings().isEmpty());
    }

    @Test
    @DisplayName("Should score a missing attribute as 0 without calling the comparator")
    void missingAttributeScoresZero() {
        ComparatorRegistry registry = ComparatorRegistry.builder()
                .register("name", new ExactComparator())
                .register("phone", comparator)
                .build();
        Block block = block(List.of(Map.of("name", "a", "phone", "1"), Map.of("name", "a")));

        ScoredBlock scored = scorer(registry, PairwiseScorer.UNLIMITED).score(block);

        assertEquals(0.5, scored.scores().get(0).score(), 1e-9);
        verifyNoInteractions(comparator);
    }

    @Test
    @DisplayName("Should recover from a failing comparator with score 0 and a warning")
    void failingComparatorRecovered() {
        when(comparator.score(any(), any())).thenThrow(new IllegalStateException("boom"));
        ComparatorRegistry registry = ComparatorRegistry.builder()
                .register("name", new ExactComparator())
                .register("phone", comparator)
                .build();
        Block block = block(List.of(Map.of("name", "a", "phone", "1"), Map.of("name", "a", "phone", "1")));

        ScoredBlock scored = scorer(registry, PairwiseScorer.UNLIMITED).score(block);

        assertEquals(0.5, scored.scores().get(0).score(), 1e-9);
        assertEquals(1, scored.comparatorFailures());
        ScoringWarning warning = scored.warnings().get(0);
        assertEquals("phone", warning.attribute());
        assertEquals(0, warning.firstIndex());
        assertEquals(10, warning.secondIndex());
        assertEquals("boom", warning.message());
    }

    @Test
    @DisplayName("Should treat NaN from a comparator as a failure")
    void nanIsFailure() {
        when(comparator.score(any(), any())).thenReturn(Double.NaN);
        ComparatorRegistry registry = ComparatorRegistry.builder().register("name", comparator).build();
        Block block = block(List.of(Map.of("name", "a"), Map.of("name", "b")));

        ScoredBlock scored = scorer(registry, PairwiseScorer.UNLIMITED).score(block);

        assertEquals(0.0, scored.scores().get(0).score());
        assertEquals(1, scored.comparatorFailures());
    }

    @Test
    @DisplayName("Should stop at the comparison cap")
    void comparisonCap() {
        ComparatorRegistry registry = ComparatorRegistry.builder().register("name", new ExactComparator()).build();
        Block block = block(List.of(Map.of("name", "a"), Map.of("name", "b"), Map.of("name", "c"), Map.of("name", "d")));

        ScoredBlock scored = scorer(registry, 4).score(block);

        assertEquals(4, scored.comparisons());
        assertEquals(6, block.pairCount());
        AggregatedScore last = scored.scores().get(3);
        assertEquals(1, last.first());
        assertEquals(2, last.second());
    }

    @Test
    @DisplayName("Should average element comparisons for collection values")
    void collectionValues() {
        ComparatorRegistry registry = ComparatorRegistry.builder().register("emails", new ExactComparator()).build();
        Block block = block(List.of(
                Map.of("emails", List.of("a@x", "b@x")),
                Map.of("emails", List.of("a@x"))));

        List<PairScore> pairs = scorer(registry, PairwiseScorer.UNLIMITED).scorePairs(block, new ArrayList<>());

        assertEquals(0.5, pairs.get(0).attributeScores().get("emails"), 1e-9);
    }

    @Test
    @DisplayName("Singleton block produces no pairs")
    void singletonBlock() {
        ComparatorRegistry registry = ComparatorRegistry.builder().register("name", new ExactComparator()).build();

        ScoredBlock scored = scorer(registry, PairwiseScorer.UNLIMITED).score(block(List.of(Map.of("name", "a"))));

        assertTrue(scored.scores().isEmpty());
        assertEquals(0, scored.comparisons());
    }

    @Test
    @DisplayName("Negative cap is rejected")
    void negativeCap() {
        ComparatorRegistry registry = ComparatorRegistry.builder().register("name", new ExactComparator()).build();

        assertThrows(IllegalArgumentException.class, () -> scorer(registry, -1));
    }
}

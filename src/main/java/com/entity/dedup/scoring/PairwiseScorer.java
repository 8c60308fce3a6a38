package com.entity.dedup.scoring;

import com.entity.dedup.core.model.AggregatedScore;
import com.entity.dedup.core.model.Block;
import com.entity.dedup.core.model.PairScore;
import com.entity.dedup.core.model.SourceRecord;
import com.entity.dedup.similarity.AttributeComparator;
import com.entity.dedup.similarity.ComparatorRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Scores record pairs inside a sub-block.
 *
 * <p>Pairs (i, j) with i &lt; j are visited in lexicographic order of block position; when
 * a comparison cap is set only the first {@code maxComparisonsPerBlock} pairs are scored.
 * An attribute missing on either record scores 0 without calling the comparator. A
 * comparator that throws also scores 0 and is reported as a {@link ScoringWarning}; it
 * never aborts the run.</p>
 *
 * <p>Collection-valued attributes are compared element by element and the scores averaged.</p>
 */
public class PairwiseScorer {
    private static final Logger log = LoggerFactory.getLogger(PairwiseScorer.class);

    public static final long UNLIMITED = 0;

    private final ComparatorRegistry comparators;
    private final Aggregator aggregator;
    private final long maxComparisonsPerBlock;

    public PairwiseScorer(ComparatorRegistry comparators, Aggregator aggregator) {
        this(comparators, aggregator, UNLIMITED);
    }

    public PairwiseScorer(ComparatorRegistry comparators, Aggregator aggregator, long maxComparisonsPerBlock) {
        this.comparators = Objects.requireNonNull(comparators, "comparators is required");
        this.aggregator = Objects.requireNonNull(aggregator, "aggregator is required");
        if (maxComparisonsPerBlock < 0) {
            throw new IllegalArgumentException("maxComparisonsPerBlock must be >= 0");
        }
        this.maxComparisonsPerBlock = maxComparisonsPerBlock;
    }

    /**
     * Scores and aggregates all (or the capped subset of) pairs of a sub-block.
     */
    public ScoredBlock score(Block block) {
        List<ScoringWarning> warnings = new ArrayList<>();
        List<PairScore> pairScores = scorePairs(block, warnings);
        List<AggregatedScore> aggregated = new ArrayList<>(pairScores.size());
        for (PairScore pair : pairScores) {
            aggregated.add(new AggregatedScore(pair.first(), pair.second(),
                    aggregator.aggregate(pair.attributeScores())));
        }
        if (pairScores.size() < block.pairCount()) {
            log.debug("scoring.capped blockId={} compared={} total={}",
                    block.id(), pairScores.size(), block.pairCount());
        }
        return new ScoredBlock(block, aggregated, warnings, pairScores.size());
    }

    /**
     * Per-attribute scores for the pairs of a sub-block.
     *
     * @param warnings receives one entry per failed comparator invocation
     */
    public List<PairScore> scorePairs(Block block, List<ScoringWarning> warnings) {
        long budget = maxComparisonsPerBlock == UNLIMITED ? Long.MAX_VALUE : maxComparisonsPerBlock;
        List<PairScore> result = new ArrayList<>((int) Math.min(block.pairCount(), Math.min(budget, 1 << 16)));
        int n = block.size();
        outer:
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                if (result.size() >= budget) {
                    break outer;
                }
                result.add(scorePair(block, i, j, warnings));
            }
        }
        return result;
    }

    private PairScore scorePair(Block block, int i, int j, List<ScoringWarning> warnings) {
        SourceRecord a = block.get(i);
        SourceRecord b = block.get(j);
        Map<String, Double> scores = new LinkedHashMap<>();
        for (Map.Entry<String, AttributeComparator> entry : comparators.entries()) {
            String attribute = entry.getKey();
            Object va = a.get(attribute);
            Object vb = b.get(attribute);
            if (va == null || vb == null) {
                scores.put(attribute, 0.0);
                continue;
            }
            try {
                scores.put(attribute, compare(entry.getValue(), va, vb));
            } catch (RuntimeException e) {
                scores.put(attribute, 0.0);
                warnings.add(new ScoringWarning(block.id(), a.index(), b.index(), attribute, String.valueOf(e.getMessage())));
                log.warn("scoring.comparator_failed blockId={} pair=({},{}) attribute={} error={}",
                        block.id(), a.index(), b.index(), attribute, e.toString());
            }
        }
        return new PairScore(i, j, scores);
    }

    static double compare(AttributeComparator comparator, Object a, Object b) {
        if (a instanceof Collection<?> || b instanceof Collection<?>) {
            List<Object> left = elements(a);
            List<Object> right = elements(b);
            if (left.isEmpty() || right.isEmpty()) {
                return 0.0;
            }
            if (left.equals(right)) {
                return 1.0;
            }
            double total = 0.0;
            for (Object x : left) {
                for (Object y : right) {
                    total += checked(comparator.score(x, y));
                }
            }
            return total / ((double) left.size() * right.size());
        }
        return checked(comparator.score(a, b));
    }

    private static double checked(double score) {
        if (Double.isNaN(score)) {
            throw new IllegalStateException("comparator returned NaN");
        }
        return Math.max(0.0, Math.min(1.0, score));
    }

    private static List<Object> elements(Object value) {
        List<Object> values = new ArrayList<>();
        if (value instanceof Collection<?> collection) {
            for (Object element : collection) {
                if (element != null && !element.toString().isBlank()) {
                    values.add(element);
                }
            }
        } else if (value != null && !value.toString().isBlank()) {
            values.add(value);
        }
        return values;
    }

    public long getMaxComparisonsPerBlock() {
        return maxComparisonsPerBlock;
    }
}

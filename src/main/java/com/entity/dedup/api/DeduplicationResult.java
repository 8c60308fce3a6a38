package com.entity.dedup.api;

import com.entity.dedup.core.model.DuplicateCluster;
import com.entity.dedup.scoring.ScoringWarning;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Single-pass iterator over the clusters of a finished run, ordered by each cluster's
 * smallest input index. All computation is done before the first cluster is available;
 * the iterator only walks the materialised result and cannot be restarted.
 */
public class DeduplicationResult implements Iterator<DuplicateCluster> {

    private final List<DuplicateCluster> clusters;
    private final RunStatistics statistics;
    private final List<ScoringWarning> warnings;
    private int position;

    DeduplicationResult(List<DuplicateCluster> clusters, RunStatistics statistics, List<ScoringWarning> warnings) {
        this.clusters = List.copyOf(clusters);
        this.statistics = statistics;
        this.warnings = List.copyOf(warnings);
    }

    @Override
    public boolean hasNext() {
        return position < clusters.size();
    }

    @Override
    public DuplicateCluster next() {
        if (!hasNext()) {
            throw new NoSuchElementException("All clusters have been consumed");
        }
        return clusters.get(position++);
    }

    /**
     * Drains the clusters not yet consumed into a list.
     */
    public List<DuplicateCluster> toList() {
        List<DuplicateCluster> rest = new ArrayList<>(clusters.size() - position);
        forEachRemaining(rest::add);
        return rest;
    }

    public RunStatistics statistics() {
        return statistics;
    }

    /**
     * Comparator failures recovered during the run.
     */
    public List<ScoringWarning> warnings() {
        return warnings;
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}

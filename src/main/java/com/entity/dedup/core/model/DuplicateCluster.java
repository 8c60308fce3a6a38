package com.entity.dedup.core.model;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * A final cluster of records judged to describe the same real-world entity.
 * Cluster ids are only meaningful within the run that produced them.
 *
 * @param clusterId identifier, unique within one run
 * @param members   member records ordered by ascending index
 */
public record DuplicateCluster(String clusterId, List<SourceRecord> members) {

    public DuplicateCluster {
        Objects.requireNonNull(clusterId, "clusterId is required");
        if (members == null || members.isEmpty()) {
            throw new IllegalArgumentException("members must not be empty");
        }
        List<SourceRecord> sorted = new ArrayList<>(members);
        sorted.sort(Comparator.comparingInt(SourceRecord::index));
        members = List.copyOf(sorted);
    }

    public int size() {
        return members.size();
    }

    public boolean isSingleton() {
        return members.size() == 1;
    }

    /**
     * Smallest input index among the members; clusters are emitted in this order.
     */
    public int minIndex() {
        return members.get(0).index();
    }

    public List<Integer> indices() {
        return members.stream().map(SourceRecord::index).toList();
    }
}

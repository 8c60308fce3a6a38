package com.entity.dedup.clustering;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Union-find over record indices {@code 0..size-1}, with path halving and union by size.
 * Not thread-safe; the pipeline merges into it from a single thread.
 */
public class DisjointSet {

    private final int[] parent;
    private final int[] size;

    public DisjointSet(int elements) {
        if (elements < 0) {
            throw new IllegalArgumentException("elements must be >= 0");
        }
        this.parent = new int[elements];
        this.size = new int[elements];
        for (int i = 0; i < elements; i++) {
            parent[i] = i;
            size[i] = 1;
        }
    }

    public int find(int x) {
        while (parent[x] != x) {
            parent[x] = parent[parent[x]];
            x = parent[x];
        }
        return x;
    }

    /**
     * Merges the sets containing {@code a} and {@code b}.
     *
     * @return true if two distinct sets were merged
     */
    public boolean union(int a, int b) {
        int rootA = find(a);
        int rootB = find(b);
        if (rootA == rootB) {
            return false;
        }
        if (size[rootA] < size[rootB]) {
            int swap = rootA;
            rootA = rootB;
            rootB = swap;
        }
        parent[rootB] = rootA;
        size[rootA] += size[rootB];
        return true;
    }

    public boolean connected(int a, int b) {
        return find(a) == find(b);
    }

    public int elements() {
        return parent.length;
    }

    /**
     * All sets, each sorted ascending, ordered by their smallest element.
     */
    public List<List<Integer>> groups() {
        Map<Integer, List<Integer>> byRoot = new LinkedHashMap<>();
        for (int i = 0; i < parent.length; i++) {
            byRoot.computeIfAbsent(find(i), r -> new ArrayList<>()).add(i);
        }
        List<List<Integer>> groups = new ArrayList<>(byRoot.values());
        groups.sort(Comparator.comparingInt(g -> g.get(0)));
        return groups;
    }
}

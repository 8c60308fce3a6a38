package com.entity.dedup.core.model;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A candidate group of records that will be compared pairwise.
 * Records are held in ascending index order and appear at most once.
 *
 * @param id      block identifier, derived from the blocking key and any split suffix
 * @param records member records, ordered by index
 */
public record Block(String id, List<SourceRecord> records) {

    public Block {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(records, "records is required");
        Map<Integer, SourceRecord> unique = new LinkedHashMap<>();
        for (SourceRecord r : records) {
            unique.putIfAbsent(r.index(), r);
        }
        List<SourceRecord> sorted = new ArrayList<>(unique.values());
        sorted.sort(Comparator.comparingInt(SourceRecord::index));
        records = List.copyOf(sorted);
    }

    public int size() {
        return records.size();
    }

    public boolean isSingleton() {
        return records.size() == 1;
    }

    public SourceRecord get(int position) {
        return records.get(position);
    }

    /**
     * Number of unordered pairs in this block.
     */
    public long pairCount() {
        long n = records.size();
        return n * (n - 1) / 2;
    }

    /**
     * Creates a sub-block of this block with the given records and suffix.
     */
    public Block subBlock(String suffix, List<SourceRecord> members) {
        return new Block(id + "/" + suffix, members);
    }
}

package com.entity.dedup.blocking;

import com.entity.dedup.core.model.Block;
import com.entity.dedup.core.model.SourceRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Sorted-neighbourhood splitting of oversized blocks.
 *
 * <p>A block no larger than {@code maxBlockSize} is returned unchanged. A larger block is
 * sorted by the configured field tuple and cut into windows of {@code maxBlockSize}
 * records. Consecutive windows share {@code overlap} records; with the default overlap of
 * zero the windows partition the sorted order, giving exactly ceil(n / maxBlockSize)
 * sub-blocks.</p>
 *
 * <p>Ordering of field values: missing values first, then numbers (numerically), then
 * booleans, then everything else by text, case-insensitively with a case-sensitive
 * tie-break. Records equal on every field keep index order.</p>
 */
public class SortedNeighbourhoodSplitter implements BlockSplitter {
    private static final Logger log = LoggerFactory.getLogger(SortedNeighbourhoodSplitter.class);

    public static final int DEFAULT_MAX_BLOCK_SIZE = 20;

    private final List<String> fields;
    private final int maxBlockSize;
    private final int overlap;
    private final Comparator<SourceRecord> ordering;

    public SortedNeighbourhoodSplitter(List<String> fields) {
        this(fields, DEFAULT_MAX_BLOCK_SIZE, 0);
    }

    public SortedNeighbourhoodSplitter(List<String> fields, int maxBlockSize) {
        this(fields, maxBlockSize, 0);
    }

    public SortedNeighbourhoodSplitter(List<String> fields, int maxBlockSize, int overlap) {
        if (fields == null || fields.isEmpty()) {
            throw new IllegalArgumentException("at least one sort field is required");
        }
        if (maxBlockSize < 2) {
            throw new IllegalArgumentException("maxBlockSize must be >= 2");
        }
        if (overlap < 0 || overlap >= maxBlockSize) {
            throw new IllegalArgumentException("overlap must be in [0, maxBlockSize)");
        }
        this.fields = List.copyOf(fields);
        this.maxBlockSize = maxBlockSize;
        this.overlap = overlap;
        this.ordering = buildOrdering(this.fields);
    }

    @Override
    public List<Block> split(Block block) {
        if (block.size() <= maxBlockSize) {
            return List.of(block);
        }
        List<SourceRecord> sorted = new ArrayList<>(block.records());
        sorted.sort(ordering);

        int step = maxBlockSize - overlap;
        List<Block> windows = new ArrayList<>();
        for (int start = 0; start < sorted.size(); start += step) {
            int end = Math.min(start + maxBlockSize, sorted.size());
            windows.add(block.subBlock("snw" + windows.size(), sorted.subList(start, end)));
            if (end == sorted.size()) {
                break;
            }
        }
        log.debug("splitter.sorted_neighbourhood blockId={} size={} windows={}",
                block.id(), block.size(), windows.size());
        return windows;
    }

    public List<String> getFields() {
        return fields;
    }

    public int getMaxBlockSize() {
        return maxBlockSize;
    }

    public int getOverlap() {
        return overlap;
    }

    private static Comparator<SourceRecord> buildOrdering(List<String> fields) {
        Comparator<SourceRecord> comparator = null;
        for (String field : fields) {
            Comparator<SourceRecord> byField = (a, b) -> compareValues(a.get(field), b.get(field));
            comparator = comparator == null ? byField : comparator.thenComparing(byField);
        }
        return comparator.thenComparingInt(SourceRecord::index);
    }

    static int compareValues(Object a, Object b) {
        int rankA = rank(a);
        int rankB = rank(b);
        if (rankA != rankB) {
            return Integer.compare(rankA, rankB);
        }
        switch (rankA) {
            case 0:
                return 0;
            case 1:
                return Double.compare(((Number) a).doubleValue(), ((Number) b).doubleValue());
            case 2:
                return Boolean.compare((Boolean) a, (Boolean) b);
            default:
                String textA = a.toString();
                String textB = b.toString();
                int folded = textA.toLowerCase(Locale.ROOT).compareTo(textB.toLowerCase(Locale.ROOT));
                return folded != 0 ? folded : textA.compareTo(textB);
        }
    }

    private static int rank(Object value) {
        if (value == null) {
            return 0;
        }
        if (value instanceof Number) {
            return 1;
        }
        if (value instanceof Boolean) {
            return 2;
        }
        return 3;
    }
}

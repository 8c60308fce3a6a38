package com.entity.dedup.blocking;

import com.entity.dedup.core.model.Block;
import com.entity.dedup.core.model.SourceRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SortedNeighbourhoodSplitterTest {

    private static Block block(int size) {
        List<SourceRecord> records = new ArrayList<>();
        for (int i = 0; i < size; i++) {
            records.add(new SourceRecord(i, Map.of("name", "name-" + (char) ('z' - (i % 26)) + i)));
        }
        return new Block("b", records);
    }

    @Test
    @DisplayName("Blocks within the limit pass through unchanged")
    void smallBlockUnchanged() {
        Block block = block(5);

        List<Block> result = new SortedNeighbourhoodSplitter(List.of("name"), 5).split(block);

        assertEquals(List.of(block), result);
    }

    @ParameterizedTest
    @DisplayName("Oversized block splits into ceil(n / w) windows covering each record once")
    @CsvSource({"45,20,3", "40,20,2", "21,20,2", "7,2,4"})
    void windowsPartitionRecords(int size, int window, int expectedWindows) {
        List<Block> windows = new SortedNeighbourhoodSplitter(List.of("name"), window).split(block(size));

        assertEquals(expectedWindows, windows.size());
        Set<Integer> seen = new HashSet<>();
        for (Block w : windows) {
            assertTrue(w.size() <= window);
            w.records().forEach(r -> assertTrue(seen.add(r.index()), "record " + r.index() + " repeated"));
        }
        assertEquals(size, seen.size());
    }

    @Test
    @DisplayName("Windows follow the sort order of the fields")
    void windowsAreSorted() {
        List<SourceRecord> records = List.of(
                new SourceRecord(0, Map.of("name", "delta")),
                new SourceRecord(1, Map.of("name", "Alpha")),
                new SourceRecord(2, Map.of("name", "charlie")),
                new SourceRecord(3, Map.of("name", "bravo")),
                new SourceRecord(4, Map.of()));

        List<Block> windows = new SortedNeighbourhoodSplitter(List.of("name"), 2).split(new Block("b", records));

        assertEquals(3, windows.size());
        assertEquals(List.of(1, 4), windows.get(0).records().stream().map(SourceRecord::index).toList());
        assertEquals(List.of(2, 3), windows.get(1).records().stream().map(SourceRecord::index).toList());
        assertEquals(List.of(0), windows.get(2).records().stream().map(SourceRecord::index).toList());
        assertEquals("b/snw0", windows.get(0).id());
    }

    @Test
    @DisplayName("Overlap shares records between consecutive windows")
    void overlappingWindows() {
        List<Block> windows = new SortedNeighbourhoodSplitter(List.of("name"), 4, 2).split(block(8));

        assertEquals(3, windows.size());
        Set<Integer> all = new HashSet<>();
        windows.forEach(w -> w.records().forEach(r -> all.add(r.index())));
        assertEquals(8, all.size());
    }

    @Test
    @DisplayName("Mixed value types order missing, numbers, booleans, then text")
    void mixedTypeOrdering() {
        assertTrue(SortedNeighbourhoodSplitter.compareValues(null, 1) < 0);
        assertTrue(SortedNeighbourhoodSplitter.compareValues(2, 10.5) < 0);
        assertTrue(SortedNeighbourhoodSplitter.compareValues(99, true) < 0);
        assertTrue(SortedNeighbourhoodSplitter.compareValues(false, "a") < 0);
        assertTrue(SortedNeighbourhoodSplitter.compareValues("apple", "Banana") < 0);
        assertEquals(0, SortedNeighbourhoodSplitter.compareValues("same", "same"));
    }

    @Test
    @DisplayName("Invalid parameters are rejected")
    void invalidParameters() {
        assertThrows(IllegalArgumentException.class, () -> new SortedNeighbourhoodSplitter(List.of(), 5));
        assertThrows(IllegalArgumentException.class, () -> new SortedNeighbourhoodSplitter(List.of("a"), 1));
        assertThrows(IllegalArgumentException.class, () -> new SortedNeighbourhoodSplitter(List.of("a"), 4, 4));
    }

    @Test
    @DisplayName("Identity splitter returns the block as is")
    void identitySplitter() {
        Block block = block(50);

        assertEquals(List.of(block), new IdentityBlockSplitter().split(block));
    }
}

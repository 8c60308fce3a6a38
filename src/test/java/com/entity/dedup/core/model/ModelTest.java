package com.entity.dedup.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ModelTest {

    @Test
    @DisplayName("SourceRecord resolves dot-paths and copies its attributes")
    void sourceRecordPaths() {
        Map<String, Object> attributes = new HashMap<>();
        attributes.put("address", Map.of("city", "Springfield", "geo", Map.of("zip", "12345")));
        attributes.put("name", "Jon");
        SourceRecord record = new SourceRecord(3, attributes);
        attributes.put("name", "changed");

        assertEquals("Jon", record.get("name"));
        assertEquals("Springfield", record.get("address.city"));
        assertEquals("12345", record.get("address.geo.zip"));
        assertNull(record.get("address.street"));
        assertNull(record.get("name.first"));
        assertFalse(record.has("phone"));
        assertThrows(UnsupportedOperationException.class, () -> record.attributes().put("x", 1));
    }

    @Test
    @DisplayName("SourceRecord prefers a literal dotted key")
    void literalDottedKey() {
        SourceRecord record = new SourceRecord(0, Map.of("address.city", "Literal"));

        assertEquals("Literal", record.get("address.city"));
    }

    @Test
    @DisplayName("BlockKey equality follows its components")
    void blockKeyEquality() {
        BlockKey a = BlockKey.of("exact:a", "1").concat(BlockKey.of("exact:b", "2"));
        BlockKey b = BlockKey.of("exact:a", "1").concat(BlockKey.of("exact:b", "2"));

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertEquals("(exact:a=1&exact:b=2)", a.toString());
        assertNotEquals(BlockKey.of("exact:a", "1"), BlockKey.of("exact:b", "1"));
    }

    @Test
    @DisplayName("Block removes duplicate records and orders by index")
    void blockNormalises() {
        SourceRecord r0 = new SourceRecord(0, Map.of());
        SourceRecord r5 = new SourceRecord(5, Map.of());

        Block block = new Block("b", List.of(r5, r0, r5));

        assertEquals(List.of(r0, r5), block.records());
        assertEquals(1, block.pairCount());
        assertEquals("b/w1", block.subBlock("w1", List.of(r0)).id());
    }

    @Test
    @DisplayName("Scores must be ordered pairs in range")
    void scoreValidation() {
        assertThrows(IllegalArgumentException.class, () -> new PairScore(1, 1, Map.of()));
        assertThrows(IllegalArgumentException.class, () -> new AggregatedScore(0, 1, 1.5));
        assertEquals(0.25, new AggregatedScore(0, 1, 0.75).distance(), 1e-9);
    }

    @Test
    @DisplayName("DuplicateCluster sorts its members")
    void clusterSortsMembers() {
        DuplicateCluster cluster = new DuplicateCluster("c",
                List.of(new SourceRecord(7, Map.of()), new SourceRecord(2, Map.of())));

        assertEquals(List.of(2, 7), cluster.indices());
        assertEquals(2, cluster.minIndex());
        assertThrows(IllegalArgumentException.class, () -> new DuplicateCluster("c", List.of()));
    }
}

package com.entity.dedup.similarity;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ComparatorRegistryTest {

    @Test
    @DisplayName("Should keep registration order")
    void registrationOrder() {
        ComparatorRegistry registry = ComparatorRegistry.builder()
                .register("name", new NameSimilarityComparator())
                .register("phone", new ExactComparator())
                .register("address.city", new LevenshteinComparator())
                .build();

        assertEquals(List.of("name", "phone", "address.city"), registry.attributes());
        assertEquals(3, registry.size());
        assertTrue(registry.contains("phone"));
        assertFalse(registry.contains("email"));
        assertNull(registry.get("email"));
    }

    @Test
    @DisplayName("Should reject duplicate and blank attributes")
    void rejectsInvalidRegistration() {
        ComparatorRegistry.Builder builder = ComparatorRegistry.builder().register("name", new ExactComparator());

        assertThrows(IllegalArgumentException.class, () -> builder.register("name", new ExactComparator()));
        assertThrows(IllegalArgumentException.class, () -> builder.register(" ", new ExactComparator()));
        assertThrows(IllegalArgumentException.class, () -> builder.register("phone", null));
    }

    @Test
    @DisplayName("Should build from an ordered map")
    void fromMap() {
        Map<String, AttributeComparator> map = new LinkedHashMap<>();
        map.put("b", new ExactComparator());
        map.put("a", new ExactComparator());

        ComparatorRegistry registry = ComparatorRegistry.of(map);

        assertEquals(List.of("b", "a"), registry.attributes());
        assertFalse(registry.isEmpty());
    }
}

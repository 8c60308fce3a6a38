package com.entity.dedup.similarity;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ComparatorTest {

    private final LevenshteinComparator levenshtein = new LevenshteinComparator();
    private final JaroWinklerComparator jaroWinkler = new JaroWinklerComparator();
    private final JaccardComparator jaccard = new JaccardComparator();

    // ============ Levenshtein ============

    @Test
    @DisplayName("Levenshtein: identical strings score 1.0")
    void levenshteinIdentical() {
        assertEquals(1.0, levenshtein.score("test", "test"));
    }

    @Test
    @DisplayName("Levenshtein: null or empty values score 0.0")
    void levenshteinNullEmpty() {
        assertEquals(0.0, levenshtein.score(null, "test"));
        assertEquals(0.0, levenshtein.score("test", null));
        assertEquals(0.0, levenshtein.score("", "test"));
    }

    @Test
    @DisplayName("Levenshtein: classic edit distance")
    void levenshteinDistance() {
        assertEquals(3, LevenshteinComparator.distance("kitten", "sitting"));
        assertEquals(1.0 - 3.0 / 7.0, levenshtein.score("kitten", "sitting"), 1e-9);
    }

    // ============ Jaro-Winkler ============

    @ParameterizedTest
    @DisplayName("Jaro-Winkler: reference values")
    @CsvSource({
            "MARTHA,MARHTA,0.961",
            "DWAYNE,DUANE,0.84",
            "DIXON,DICKSONX,0.813"
    })
    void jaroWinklerReference(String s1, String s2, double expected) {
        assertEquals(expected, jaroWinkler.score(s1, s2), 0.001);
    }

    @Test
    @DisplayName("Jaro-Winkler: unrelated strings score 0.0")
    void jaroWinklerUnrelated() {
        assertEquals(0.0, jaroWinkler.score("abc", "xyz"));
    }

    // ============ Jaccard ============

    @Test
    @DisplayName("Jaccard: token overlap ignores order")
    void jaccardOrder() {
        assertEquals(1.0, jaccard.score("john smith", "smith john"));
        assertEquals(1.0 / 3.0, jaccard.score("john smith", "john doe"), 1e-9);
    }

    // ============ Exact ============

    @Test
    @DisplayName("Exact: optional case folding")
    void exact() {
        assertEquals(1.0, new ExactComparator().score(42, 42));
        assertEquals(0.0, new ExactComparator().score("Acme", "ACME"));
        assertEquals(1.0, new ExactComparator(true).score("Acme ", "ACME"));
        assertEquals(0.0, new ExactComparator(true).score(null, "ACME"));
    }

    // ============ Name ============

    @Test
    @DisplayName("Name: best of the component measures")
    void nameSimilarity() {
        NameSimilarityComparator name = new NameSimilarityComparator();

        assertEquals(1.0, name.score("Smith John", "john smith"));
        assertTrue(name.score("Jon Smith", "John Smith") > 0.9);
        assertTrue(name.score("Amy Jones", "John Smith") < 0.6);
    }

    @Test
    @DisplayName("Name: requires at least one measure")
    void nameRequiresMeasures() {
        assertThrows(IllegalArgumentException.class, () -> new NameSimilarityComparator(List.of()));
    }
}

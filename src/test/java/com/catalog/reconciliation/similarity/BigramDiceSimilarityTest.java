package com.catalog.reconciliation.similarity;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BigramDiceSimilarityTest {

    private final BigramDiceSimilarity similarity = new BigramDiceSimilarity();

    @Test
    @DisplayName("Identical strings score 1.0")
    void testIdentical() {
        assertEquals(1.0, similarity.compute("battery", "battery"));
    }

    @Test
    @DisplayName("Empty or null input scores 0.0")
    void testEmpty() {
        assertEquals(0.0, similarity.compute("", "battery"));
        assertEquals(0.0, similarity.compute("battery", null));
    }

    @Test
    @DisplayName("Padded bigrams: 'quick battery' vs 'quik battery' is 24/27")
    void testTypo() {
        assertEquals(24.0 / 27.0, similarity.compute("quick battery", "quik battery"), 1e-9);
    }

    @Test
    @DisplayName("Plural suffix stays above 0.93")
    void testPlural() {
        double score = similarity.compute("advanced electrical component", "advanced electrical components");
        assertEquals(58.0 / 61.0, score, 1e-9);
        assertTrue(score >= 0.93);
    }

    @Test
    @DisplayName("Repeated bigrams intersect as a multiset")
    void testMultiset() {
        // " aa " -> " a","aa","a " ; " aaa " -> " a","aa","aa","a "
        assertEquals(6.0 / 7.0, similarity.compute("aa", "aaa"), 1e-9);
    }

    @Test
    @DisplayName("Score is symmetric")
    void testSymmetric() {
        assertEquals(similarity.compute("rusted gear", "rusty gears"),
                similarity.compute("rusty gears", "rusted gear"), 1e-12);
    }

    @Test
    void testName() {
        assertEquals("BigramDice", similarity.getName());
    }
}

package com.legal.extraction.similarity;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class LevenshteinSimilarityTest {

    private final LevenshteinSimilarity similarity = new LevenshteinSimilarity();

    @ParameterizedTest
    @DisplayName("Should compute edit distance")
    @CsvSource({
            "kitten, sitting, 3",
            "flaw, lawn, 2",
            "'', abc, 3",
            "same, same, 0",
            "federal law, federal lwa, 2"
    })
    void distance(String a, String b, int expected) {
        assertEquals(expected, LevenshteinSimilarity.distance(a, b));
        assertEquals(expected, LevenshteinSimilarity.distance(b, a));
    }

    @Test
    @DisplayName("Ratio is one minus distance over the longer length")
    void ratio() {
        assertEquals(1.0, similarity.compute("authority", "authority"));
        assertEquals(1.0 - 3.0 / 7.0, similarity.compute("kitten", "sitting"), 1e-9);
        assertEquals(1.0 - 1.0 / 27.0,
                similarity.compute("federal law no. (5) of 1985", "federal law no. (6) of 1985"), 1e-9);
    }

    @Test
    @DisplayName("Empty or missing input scores zero")
    void emptyInput() {
        assertEquals(0.0, similarity.compute("", "authority"));
        assertEquals(0.0, similarity.compute(null, "authority"));
        assertEquals("levenshtein", similarity.getName());
    }
}

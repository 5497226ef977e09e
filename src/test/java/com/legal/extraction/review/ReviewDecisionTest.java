package com.legal.extraction.review;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class ReviewDecisionTest {

    @ParameterizedTest
    @CsvSource({"accept, ACCEPT", "Accepted, ACCEPT", "' reject ', REJECT", "REJECTED, REJECT"})
    void parsesLeniently(String value, ReviewDecision expected) {
        assertEquals(expected, ReviewDecision.parse(value));
    }

    @Test
    void blankIsNoDecision() {
        assertNull(ReviewDecision.parse(null));
        assertNull(ReviewDecision.parse("  "));
    }

    @Test
    void unknownValuesAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> ReviewDecision.parse("maybe"));
    }
}

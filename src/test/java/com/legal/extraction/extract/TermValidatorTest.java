package com.legal.extraction.extract;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class TermValidatorTest {

    @ParameterizedTest
    @DisplayName("Noun phrases are accepted as terms")
    @ValueSource(strings = {"Authority", "Taxable Person", "Excise Goods", "Tax Registration Number", "UAE"})
    void validTerms(String term) {
        assertTrue(TermValidator.isValidTerm(term));
    }

    @ParameterizedTest
    @DisplayName("Sentence fragments are rejected as terms")
    @CsvSource(delimiter = '|', value = {
            "Whereas the parties|sentence starter",
            "Providing services|verb form",
            "The|lone determiner",
            "Any other|determiner and follower",
            "The Authority shall|modal",
            "taxable person|all lower case",
            "2017|digits",
            "(12)|parenthesized digits",
            "Rate of the|dangling last word",
            "Article|generic word",
            "Article 5|structure reference",
            "A|too short"
    })
    void invalidTerms(String term, String reason) {
        assertFalse(TermValidator.isValidTerm(term), reason);
    }

    @Test
    @DisplayName("Definitions must be real definition text")
    void definitions() {
        assertTrue(TermValidator.isValidDefinition("The Federal Tax Authority."));
        assertFalse(TermValidator.isValidDefinition(null));
        assertFalse(TermValidator.isValidDefinition("abc"));
        assertFalse(TermValidator.isValidDefinition("Having reviewed the Constitution"));
        assertFalse(TermValidator.isValidDefinition("Article 5 of this Law"));
        assertFalse(TermValidator.isValidDefinition("Federal Law No. 5 of 1985"));
        assertFalse(TermValidator.isValidDefinition("x".repeat(2001)));
    }

    @Test
    @DisplayName("A pair needs both halves valid")
    void pairs() {
        assertTrue(TermValidator.isValidPair("Authority", "The Federal Tax Authority."));
        assertFalse(TermValidator.isValidPair("Whereas", "The Federal Tax Authority."));
        assertFalse(TermValidator.isValidPair("Authority", "Article 5"));
    }
}

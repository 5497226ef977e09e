package com.legal.extraction.merge;

import com.legal.extraction.core.model.ExtractionMethod;
import com.legal.extraction.core.model.Provenance;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConfidenceAggregatorTest {

    private static Provenance evidence(String id, ExtractionMethod method, double confidence) {
        return new Provenance(id, "doc-1", 1, "text " + id, method, confidence);
    }

    @Test
    @DisplayName("No evidence means no confidence")
    void empty() {
        assertEquals(0.0, ConfidenceAggregator.aggregate(List.of()));
    }

    @Test
    @DisplayName("Independent methods combine by noisy-OR")
    void noisyOr() {
        double aggregated = ConfidenceAggregator.aggregate(List.of(
                evidence("a", ExtractionMethod.REGEX, 0.95),
                evidence("b", ExtractionMethod.AI_ENHANCEMENT, 0.7)));

        assertEquals(1.0 - 0.05 * 0.3, aggregated, 1e-9);
    }

    @Test
    @DisplayName("Only the best observation of each method counts")
    void bestPerMethod() {
        double aggregated = ConfidenceAggregator.aggregate(List.of(
                evidence("a", ExtractionMethod.REGEX, 0.6),
                evidence("b", ExtractionMethod.REGEX, 0.9),
                evidence("c", ExtractionMethod.REGEX, 0.7)));

        assertEquals(0.9, aggregated, 1e-9);
    }

    @Test
    @DisplayName("Adding evidence never lowers the result")
    void monotonic() {
        List<Provenance> evidence = new ArrayList<>();
        double previous = 0.0;
        ExtractionMethod[] methods = {ExtractionMethod.REGEX, ExtractionMethod.REGEX, ExtractionMethod.NER,
                ExtractionMethod.LAYOUT, ExtractionMethod.AI_ENHANCEMENT};
        double[] confidences = {0.4, 0.1, 0.0, 0.5, 0.3};
        for (int i = 0; i < methods.length; i++) {
            evidence.add(evidence("e" + i, methods[i], confidences[i]));
            double current = ConfidenceAggregator.aggregate(evidence);
            assertTrue(current >= previous, "confidence dropped at step " + i);
            assertTrue(current <= 1.0);
            previous = current;
        }
    }

    @Test
    @DisplayName("Out-of-range observations are clamped")
    void clamped() {
        assertEquals(1.0, ConfidenceAggregator.aggregate(List.of(evidence("a", ExtractionMethod.REGEX, 1.4))));
        assertEquals(0.0, ConfidenceAggregator.aggregate(List.of(evidence("a", ExtractionMethod.REGEX, -0.2))));
    }
}

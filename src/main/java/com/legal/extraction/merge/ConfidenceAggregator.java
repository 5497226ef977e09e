package com.legal.extraction.merge;

import com.legal.extraction.core.model.ExtractionMethod;
import com.legal.extraction.core.model.Provenance;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Noisy-OR over independent extraction methods: {@code 1 - prod(1 - c_m)}, where {@code c_m}
 * is the best confidence any piece of evidence from method {@code m} reached.
 *
 * <p>Several observations from the same method count once, so a pattern matching the same
 * citation on ten pages does not make it more certain than one clean match. Adding evidence
 * never lowers the result, and the result stays within [0, 1].</p>
 */
public final class ConfidenceAggregator {

    private ConfidenceAggregator() {
    }

    public static double aggregate(List<Provenance> evidence) {
        Map<ExtractionMethod, Double> bestPerMethod = new EnumMap<>(ExtractionMethod.class);
        for (Provenance p : evidence) {
            bestPerMethod.merge(p.extractionMethod(), clamp(p.confidence()), Math::max);
        }
        double disbelief = 1.0;
        for (double confidence : bestPerMethod.values()) {
            disbelief *= (1.0 - confidence);
        }
        return clamp(1.0 - disbelief);
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}

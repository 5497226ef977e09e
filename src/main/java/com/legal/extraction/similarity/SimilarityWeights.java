package com.legal.extraction.similarity;

/**
 * Weights for combining lexical and semantic similarity. Must sum to 1.0.
 */
public record SimilarityWeights(double lexicalWeight, double semanticWeight) {

    private static final double TOLERANCE = 0.001;

    public SimilarityWeights {
        if (lexicalWeight < 0 || semanticWeight < 0) {
            throw new IllegalArgumentException("Weights must be non-negative");
        }
        if (Math.abs(lexicalWeight + semanticWeight - 1.0) > TOLERANCE) {
            throw new IllegalArgumentException(
                    "Weights must sum to 1.0, got: " + (lexicalWeight + semanticWeight));
        }
    }

    public static SimilarityWeights defaults() {
        return new SimilarityWeights(0.5, 0.5);
    }

    public static SimilarityWeights lexicalOnly() {
        return new SimilarityWeights(1.0, 0.0);
    }
}

package com.legal.extraction.similarity;

/**
 * Combines the lexical ratio of two normalized texts with the cosine of their embeddings.
 * When either embedding is missing the lexical ratio is used on its own, so the score
 * never depends on whether an embedding source happened to be available for one side.
 */
public class CandidateSimilarityScorer {

    private final SimilarityAlgorithm lexical;
    private final SimilarityWeights weights;

    public CandidateSimilarityScorer() {
        this(new LevenshteinSimilarity(), SimilarityWeights.defaults());
    }

    public CandidateSimilarityScorer(SimilarityWeights weights) {
        this(new LevenshteinSimilarity(), weights);
    }

    public CandidateSimilarityScorer(SimilarityAlgorithm lexical, SimilarityWeights weights) {
        this.lexical = lexical;
        this.weights = weights;
    }

    public SimilarityWeights getWeights() {
        return weights;
    }

    public SimilarityBreakdown score(String text1, String text2, float[] embedding1, float[] embedding2) {
        double lexicalScore = lexical.compute(text1, text2);
        if (embedding1 == null || embedding2 == null || weights.semanticWeight() == 0.0) {
            return new SimilarityBreakdown(lexicalScore, null, lexicalScore);
        }
        double semanticScore = CosineSimilarity.compute(embedding1, embedding2);
        double combined = weights.lexicalWeight() * lexicalScore + weights.semanticWeight() * semanticScore;
        return new SimilarityBreakdown(lexicalScore, semanticScore, Math.min(1.0, combined));
    }

    public SimilarityBreakdown score(String text1, String text2) {
        return score(text1, text2, null, null);
    }

    /**
     * Per-signal scores of one comparison.
     *
     * @param lexicalScore  edit-distance ratio
     * @param semanticScore embedding cosine, null when embeddings were unavailable
     * @param combined      the score compared against the fuzzy-match threshold
     */
    public record SimilarityBreakdown(double lexicalScore, Double semanticScore, double combined) {

        public boolean usedEmbeddings() {
            return semanticScore != null;
        }
    }
}

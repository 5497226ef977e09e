package com.legal.extraction.similarity;

/**
 * Cosine similarity of embedding vectors, rescaled from [-1, 1] to [0, 1].
 */
public final class CosineSimilarity {

    private CosineSimilarity() {
    }

    public static double compute(float[] a, float[] b) {
        if (a == null || b == null || a.length == 0 || a.length != b.length) {
            return 0.0;
        }
        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += (double) a[i] * b[i];
            normA += (double) a[i] * a[i];
            normB += (double) b[i] * b[i];
        }
        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }
        double cosine = dot / (Math.sqrt(normA) * Math.sqrt(normB));
        return Math.max(0.0, Math.min(1.0, (cosine + 1.0) / 2.0));
    }
}

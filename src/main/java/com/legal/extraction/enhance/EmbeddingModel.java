package com.legal.extraction.enhance;

/**
 * Produces a dense vector for a text. Used as the semantic signal in approximate matching.
 */
public interface EmbeddingModel {

    /**
     * @throws EnhancementException if the model cannot produce an embedding
     */
    float[] embed(String text);

    String getName();

    default boolean isAvailable() {
        return true;
    }
}

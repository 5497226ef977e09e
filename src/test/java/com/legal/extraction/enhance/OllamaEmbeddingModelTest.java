package com.legal.extraction.enhance;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class OllamaEmbeddingModelTest {

    @Test
    @DisplayName("Name carries the model")
    void name() {
        assertEquals("ollama-embed/nomic-embed-text",
                new OllamaEmbeddingModel("http://localhost:11434", "nomic-embed-text", null).getName());
    }

    @Test
    @DisplayName("An unreachable server is reported as unavailable")
    void unreachableServer() {
        OllamaEmbeddingModel model = new OllamaEmbeddingModel("http://localhost:1", "nomic-embed-text",
                Duration.ofSeconds(1));

        EnhancementException e = assertThrows(EnhancementException.class, () -> model.embed("Authority"));
        assertEquals("ollama-embed/nomic-embed-text", e.getAdapterName());
    }
}

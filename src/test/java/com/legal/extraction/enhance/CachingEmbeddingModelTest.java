package com.legal.extraction.enhance;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CachingEmbeddingModelTest {

    @Mock
    private EmbeddingModel delegate;

    @Test
    @DisplayName("Repeated texts are embedded once")
    void memoizes() {
        float[] vector = {0.1f, 0.2f};
        when(delegate.embed("Federal Law No. (5) of 1985")).thenReturn(vector);
        CachingEmbeddingModel model = new CachingEmbeddingModel(delegate);

        assertArrayEquals(vector, model.embed("Federal Law No. (5) of 1985"));
        assertArrayEquals(vector, model.embed("Federal Law No. (5) of 1985"));

        verify(delegate, times(1)).embed("Federal Law No. (5) of 1985");
        assertEquals(1, model.stats().hitCount());
        assertEquals(1, model.size());
    }

    @Test
    @DisplayName("Failures are not cached")
    void failuresNotCached() {
        float[] vector = {1f};
        when(delegate.embed("text"))
                .thenThrow(new EnhancementException("ollama-embed", "HTTP 500"))
                .thenReturn(vector);
        CachingEmbeddingModel model = new CachingEmbeddingModel(delegate);

        assertThrows(EnhancementException.class, () -> model.embed("text"));
        assertArrayEquals(vector, model.embed("text"));

        verify(delegate, times(2)).embed("text");
    }

    @Test
    @DisplayName("Name and availability are the delegate's")
    void delegatesIdentity() {
        when(delegate.getName()).thenReturn("nomic-embed-text");
        when(delegate.isAvailable()).thenReturn(true);
        CachingEmbeddingModel model = new CachingEmbeddingModel(delegate);

        assertEquals("nomic-embed-text", model.getName());
        assertTrue(model.isAvailable());
    }
}

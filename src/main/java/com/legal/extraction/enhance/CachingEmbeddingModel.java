package com.legal.extraction.enhance;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Caffeine-backed memo of an {@link EmbeddingModel}. Repeated excerpts within and across
 * documents are embedded once. Failures are not cached.
 */
public class CachingEmbeddingModel implements EmbeddingModel {
    private static final Logger log = LoggerFactory.getLogger(CachingEmbeddingModel.class);

    private final EmbeddingModel delegate;
    private final Cache<String, float[]> cache;

    public CachingEmbeddingModel(EmbeddingModel delegate, long maxSize, Duration ttl) {
        this.delegate = delegate;
        this.cache = Caffeine.newBuilder()
                .maximumSize(maxSize)
                .expireAfterAccess(ttl)
                .recordStats()
                .build();
        log.info("CachingEmbeddingModel initialized: model={}, maxSize={}, ttl={}s",
                delegate.getName(), maxSize, ttl.toSeconds());
    }

    public CachingEmbeddingModel(EmbeddingModel delegate) {
        this(delegate, 10_000, Duration.ofHours(1));
    }

    @Override
    public float[] embed(String text) {
        return cache.get(text, delegate::embed);
    }

    @Override
    public String getName() {
        return delegate.getName();
    }

    @Override
    public boolean isAvailable() {
        return delegate.isAvailable();
    }

    public CacheStats stats() {
        return cache.stats();
    }

    public long size() {
        return cache.estimatedSize();
    }
}

package com.legal.extraction.config;

import com.legal.extraction.merge.TieBreakPolicy;
import com.legal.extraction.similarity.SimilarityWeights;

import java.time.Duration;

/**
 * Immutable pipeline settings, passed to the merger, router and pipeline at construction.
 * Use {@link #defaults()} or the validating {@link Builder}.
 */
public class PipelineConfig {

    static final double DEFAULT_HIGH_CONFIDENCE_THRESHOLD = 0.70;
    static final double DEFAULT_FUZZY_MATCH_THRESHOLD = 0.85;
    static final long DEFAULT_ADAPTER_TIMEOUT_MS = 30_000;
    static final int DEFAULT_ADAPTER_RETRY_COUNT = 2;
    static final long DEFAULT_RETRY_BACKOFF_MS = 500;
    static final long DEFAULT_DOCUMENT_TIMEOUT_MS = 120_000;
    static final int DEFAULT_MAX_LOOKAHEAD_LINES = 2;
    static final int DEFAULT_MAX_CONCURRENT_DOCUMENTS = 4;

    private final double highConfidenceThreshold;
    private final double fuzzyMatchThreshold;
    private final long adapterTimeoutMs;
    private final int adapterRetryCount;
    private final long retryBackoffMs;
    private final long documentTimeoutMs;
    private final int maxLookaheadLines;
    private final SimilarityWeights similarityWeights;
    private final TieBreakPolicy tieBreakPolicy;
    private final int maxConcurrentDocuments;

    private PipelineConfig(Builder builder) {
        this.highConfidenceThreshold = builder.highConfidenceThreshold;
        this.fuzzyMatchThreshold = builder.fuzzyMatchThreshold;
        this.adapterTimeoutMs = builder.adapterTimeoutMs;
        this.adapterRetryCount = builder.adapterRetryCount;
        this.retryBackoffMs = builder.retryBackoffMs;
        this.documentTimeoutMs = builder.documentTimeoutMs;
        this.maxLookaheadLines = builder.maxLookaheadLines;
        this.similarityWeights = builder.similarityWeights;
        this.tieBreakPolicy = builder.tieBreakPolicy;
        this.maxConcurrentDocuments = builder.maxConcurrentDocuments;
    }

    public static PipelineConfig defaults() {
        return builder().build();
    }

    /**
     * Records at or above this aggregated confidence are accepted without review.
     */
    public double getHighConfidenceThreshold() {
        return highConfidenceThreshold;
    }

    /**
     * Minimum combined similarity for attaching an unparsable candidate to an existing record.
     */
    public double getFuzzyMatchThreshold() {
        return fuzzyMatchThreshold;
    }

    public long getAdapterTimeoutMs() {
        return adapterTimeoutMs;
    }

    public Duration getAdapterTimeout() {
        return Duration.ofMillis(adapterTimeoutMs);
    }

    public int getAdapterRetryCount() {
        return adapterRetryCount;
    }

    public long getRetryBackoffMs() {
        return retryBackoffMs;
    }

    public long getDocumentTimeoutMs() {
        return documentTimeoutMs;
    }

    public int getMaxLookaheadLines() {
        return maxLookaheadLines;
    }

    public SimilarityWeights getSimilarityWeights() {
        return similarityWeights;
    }

    public TieBreakPolicy getTieBreakPolicy() {
        return tieBreakPolicy;
    }

    public int getMaxConcurrentDocuments() {
        return maxConcurrentDocuments;
    }

    public Builder toBuilder() {
        return builder()
                .highConfidenceThreshold(highConfidenceThreshold)
                .fuzzyMatchThreshold(fuzzyMatchThreshold)
                .adapterTimeoutMs(adapterTimeoutMs)
                .adapterRetryCount(adapterRetryCount)
                .retryBackoffMs(retryBackoffMs)
                .documentTimeoutMs(documentTimeoutMs)
                .maxLookaheadLines(maxLookaheadLines)
                .similarityWeights(similarityWeights)
                .tieBreakPolicy(tieBreakPolicy)
                .maxConcurrentDocuments(maxConcurrentDocuments);
    }

    @Override
    public String toString() {
        return "PipelineConfig{" +
                "highConfidenceThreshold=" + highConfidenceThreshold +
                ", fuzzyMatchThreshold=" + fuzzyMatchThreshold +
                ", adapterTimeoutMs=" + adapterTimeoutMs +
                ", adapterRetryCount=" + adapterRetryCount +
                ", retryBackoffMs=" + retryBackoffMs +
                ", documentTimeoutMs=" + documentTimeoutMs +
                ", maxLookaheadLines=" + maxLookaheadLines +
                ", similarityWeights=" + similarityWeights +
                ", tieBreakPolicy=" + tieBreakPolicy +
                ", maxConcurrentDocuments=" + maxConcurrentDocuments +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private double highConfidenceThreshold = DEFAULT_HIGH_CONFIDENCE_THRESHOLD;
        private double fuzzyMatchThreshold = DEFAULT_FUZZY_MATCH_THRESHOLD;
        private long adapterTimeoutMs = DEFAULT_ADAPTER_TIMEOUT_MS;
        private int adapterRetryCount = DEFAULT_ADAPTER_RETRY_COUNT;
        private long retryBackoffMs = DEFAULT_RETRY_BACKOFF_MS;
        private long documentTimeoutMs = DEFAULT_DOCUMENT_TIMEOUT_MS;
        private int maxLookaheadLines = DEFAULT_MAX_LOOKAHEAD_LINES;
        private SimilarityWeights similarityWeights = SimilarityWeights.defaults();
        private TieBreakPolicy tieBreakPolicy = TieBreakPolicy.MORE_EVIDENCE;
        private int maxConcurrentDocuments = DEFAULT_MAX_CONCURRENT_DOCUMENTS;

        public Builder highConfidenceThreshold(double threshold) {
            requireUnitInterval("highConfidenceThreshold", threshold);
            this.highConfidenceThreshold = threshold;
            return this;
        }

        public Builder fuzzyMatchThreshold(double threshold) {
            requireUnitInterval("fuzzyMatchThreshold", threshold);
            this.fuzzyMatchThreshold = threshold;
            return this;
        }

        public Builder adapterTimeoutMs(long timeoutMs) {
            if (timeoutMs <= 0) {
                throw new IllegalArgumentException("adapterTimeoutMs must be > 0");
            }
            this.adapterTimeoutMs = timeoutMs;
            return this;
        }

        public Builder adapterRetryCount(int retryCount) {
            if (retryCount < 0) {
                throw new IllegalArgumentException("adapterRetryCount must be >= 0");
            }
            this.adapterRetryCount = retryCount;
            return this;
        }

        public Builder retryBackoffMs(long backoffMs) {
            if (backoffMs < 0) {
                throw new IllegalArgumentException("retryBackoffMs must be >= 0");
            }
            this.retryBackoffMs = backoffMs;
            return this;
        }

        public Builder documentTimeoutMs(long timeoutMs) {
            if (timeoutMs <= 0) {
                throw new IllegalArgumentException("documentTimeoutMs must be > 0");
            }
            this.documentTimeoutMs = timeoutMs;
            return this;
        }

        public Builder maxLookaheadLines(int lines) {
            if (lines < 0) {
                throw new IllegalArgumentException("maxLookaheadLines must be >= 0");
            }
            this.maxLookaheadLines = lines;
            return this;
        }

        public Builder similarityWeights(SimilarityWeights weights) {
            if (weights == null) {
                throw new IllegalArgumentException("similarityWeights must not be null");
            }
            this.similarityWeights = weights;
            return this;
        }

        public Builder tieBreakPolicy(TieBreakPolicy policy) {
            if (policy == null) {
                throw new IllegalArgumentException("tieBreakPolicy must not be null");
            }
            this.tieBreakPolicy = policy;
            return this;
        }

        public Builder maxConcurrentDocuments(int max) {
            if (max <= 0) {
                throw new IllegalArgumentException("maxConcurrentDocuments must be > 0");
            }
            this.maxConcurrentDocuments = max;
            return this;
        }

        public PipelineConfig build() {
            return new PipelineConfig(this);
        }

        private static void requireUnitInterval(String name, double value) {
            if (value < 0.0 || value > 1.0) {
                throw new IllegalArgumentException(name + " must be between 0.0 and 1.0");
            }
        }
    }
}

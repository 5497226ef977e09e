package com.legal.extraction.config;

import com.legal.extraction.merge.TieBreakPolicy;
import com.legal.extraction.similarity.SimilarityWeights;
import org.eclipse.microprofile.config.Config;
import org.eclipse.microprofile.config.ConfigProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Builds a {@link PipelineConfig} from MicroProfile Config.
 *
 * <p>Keys (all optional, defaults in {@code META-INF/microprofile-config.properties}):</p>
 * <pre>
 * legal-extraction.high-confidence-threshold
 * legal-extraction.fuzzy-match-threshold
 * legal-extraction.adapter.timeout-ms
 * legal-extraction.adapter.retry-count
 * legal-extraction.adapter.retry-backoff-ms
 * legal-extraction.document.timeout-ms
 * legal-extraction.extractor.max-lookahead-lines
 * legal-extraction.similarity.lexical-weight
 * legal-extraction.similarity.semantic-weight
 * legal-extraction.merge.tie-break-policy
 * legal-extraction.max-concurrent-documents
 * </pre>
 * Environment variables override properties in the usual MicroProfile way,
 * e.g. {@code LEGAL_EXTRACTION_HIGH_CONFIDENCE_THRESHOLD}.
 */
public final class PipelineConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(PipelineConfigLoader.class);

    static final String PREFIX = "legal-extraction.";

    private PipelineConfigLoader() {
    }

    public static PipelineConfig load() {
        return load(ConfigProvider.getConfig());
    }

    /**
     * @throws IllegalArgumentException if a value is out of range or cannot be converted
     */
    public static PipelineConfig load(Config config) {
        PipelineConfig.Builder builder = PipelineConfig.builder();

        config.getOptionalValue(PREFIX + "high-confidence-threshold", Double.class)
                .ifPresent(builder::highConfidenceThreshold);
        config.getOptionalValue(PREFIX + "fuzzy-match-threshold", Double.class)
                .ifPresent(builder::fuzzyMatchThreshold);
        config.getOptionalValue(PREFIX + "adapter.timeout-ms", Long.class)
                .ifPresent(builder::adapterTimeoutMs);
        config.getOptionalValue(PREFIX + "adapter.retry-count", Integer.class)
                .ifPresent(builder::adapterRetryCount);
        config.getOptionalValue(PREFIX + "adapter.retry-backoff-ms", Long.class)
                .ifPresent(builder::retryBackoffMs);
        config.getOptionalValue(PREFIX + "document.timeout-ms", Long.class)
                .ifPresent(builder::documentTimeoutMs);
        config.getOptionalValue(PREFIX + "extractor.max-lookahead-lines", Integer.class)
                .ifPresent(builder::maxLookaheadLines);
        config.getOptionalValue(PREFIX + "max-concurrent-documents", Integer.class)
                .ifPresent(builder::maxConcurrentDocuments);
        config.getOptionalValue(PREFIX + "merge.tie-break-policy", String.class)
                .map(value -> TieBreakPolicy.valueOf(value.trim().toUpperCase(Locale.ROOT).replace('-', '_')))
                .ifPresent(builder::tieBreakPolicy);

        double lexical = config.getOptionalValue(PREFIX + "similarity.lexical-weight", Double.class)
                .orElse(SimilarityWeights.defaults().lexicalWeight());
        double semantic = config.getOptionalValue(PREFIX + "similarity.semantic-weight", Double.class)
                .orElse(SimilarityWeights.defaults().semanticWeight());
        builder.similarityWeights(new SimilarityWeights(lexical, semantic));

        PipelineConfig loaded = builder.build();
        log.info("config.loaded {}", loaded);
        return loaded;
    }
}

package com.legal.extraction.core.model;

/**
 * Closed set of extraction methods that can produce a {@link Candidate}.
 * Confidence aggregation treats each method as an independent source of evidence.
 */
public enum ExtractionMethod {
    REGEX("regex", true),
    COLON_PATTERN("colon_pattern", true),
    NEWLINE_COLON_PATTERN("newline_colon_pattern", true),
    MEANS_PATTERN("means_pattern", true),
    LAYOUT("layout", true),
    AI_ENHANCEMENT("ai_enhancement", false),
    NER("ner", false),
    EMBEDDING("embedding", false),
    MANUAL("manual", false);

    private final String tag;
    private final boolean deterministic;

    ExtractionMethod(String tag, boolean deterministic) {
        this.tag = tag;
        this.deterministic = deterministic;
    }

    /**
     * Stable lowercase identifier used in exports and logs.
     */
    public String tag() {
        return tag;
    }

    /**
     * Whether the method is rule-based rather than model-backed.
     */
    public boolean isDeterministic() {
        return deterministic;
    }

    public static ExtractionMethod fromTag(String tag) {
        for (ExtractionMethod method : values()) {
            if (method.tag.equalsIgnoreCase(tag) || method.name().equalsIgnoreCase(tag)) {
                return method;
            }
        }
        throw new IllegalArgumentException("Unknown extraction method: " + tag);
    }
}

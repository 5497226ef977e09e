package com.legal.extraction.canonical;

import com.legal.extraction.core.model.CanonicalKey;

/**
 * Result of canonicalizing one candidate.
 *
 * @param key            identity of the candidate
 * @param displayText    human-readable form (citation in standard form, or the cleaned term)
 * @param definitionText cleaned definition body, null for citations
 * @param matchText      normalized text used for approximate matching
 */
public record CanonicalForm(CanonicalKey key, String displayText, String definitionText, String matchText) {

    public boolean isFallback() {
        return key.fallback();
    }
}

package com.legal.extraction.enhance;

import com.legal.extraction.core.model.Candidate;
import com.legal.extraction.core.model.ExtractionMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Stand-in used when no enhancement source is configured.
 */
public class NoOpEnhancementAdapter implements EnhancementAdapter {
    private static final Logger log = LoggerFactory.getLogger(NoOpEnhancementAdapter.class);

    @Override
    public List<Candidate> enrich(EnhancementDocument document) {
        log.debug("enhance.noop documentId={}", document.documentId());
        return List.of();
    }

    @Override
    public String getName() {
        return "noop";
    }

    @Override
    public ExtractionMethod getExtractionMethod() {
        return ExtractionMethod.AI_ENHANCEMENT;
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}

package com.legal.extraction.enhance;

import com.legal.extraction.core.model.Candidate;
import com.legal.extraction.core.model.ExtractionMethod;

import java.util.List;

/**
 * A pluggable source of additional candidates beyond the deterministic extractor.
 * New sources are added by implementing this interface.
 *
 * <p>Implementations may block and may fail; callers bound each call with a timeout and
 * treat any {@link EnhancementException} as "no candidates from this source".</p>
 */
public interface EnhancementAdapter {

    /**
     * Produces candidates for the document. Every returned candidate must carry
     * {@link #getExtractionMethod()} and the document's id.
     *
     * @throws EnhancementException if the source fails
     */
    List<Candidate> enrich(EnhancementDocument document);

    String getName();

    ExtractionMethod getExtractionMethod();

    /**
     * Readiness check, run by the invoker under the call timeout. An adapter that answers false is
     * skipped without being called; one that throws or does not answer is degraded.
     */
    boolean isAvailable();
}

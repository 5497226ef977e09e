package com.legal.extraction.core.model;

import java.util.Objects;

/**
 * One piece of evidence supporting a merged record.
 *
 * @param candidateId      id of the candidate this evidence came from
 * @param documentId       source document
 * @param page             page number within the document
 * @param excerpt          raw text as observed
 * @param extractionMethod method that produced the observation
 * @param confidence       confidence of that single observation
 */
public record Provenance(
        String candidateId,
        String documentId,
        int page,
        String excerpt,
        ExtractionMethod extractionMethod,
        double confidence
) {
    public Provenance {
        Objects.requireNonNull(candidateId, "candidateId is required");
        Objects.requireNonNull(extractionMethod, "extractionMethod is required");
    }

    public static Provenance of(Candidate candidate) {
        return new Provenance(
                candidate.getCandidateId(),
                candidate.getSourceDocumentId(),
                candidate.getPage(),
                candidate.getRawText(),
                candidate.getExtractionMethod(),
                candidate.getConfidence());
    }
}

package com.legal.extraction.merge;

import com.legal.extraction.core.model.Candidate;

/**
 * Contract checks applied to every candidate before it is merged.
 */
public final class CandidateValidator {

    private CandidateValidator() {
    }

    /**
     * @throws MalformedCandidateException naming the first violated rule
     */
    public static void validate(Candidate candidate, String documentId) {
        String id = candidate.getCandidateId();
        if (candidate.getSourceDocumentId() == null || candidate.getSourceDocumentId().isBlank()) {
            throw new MalformedCandidateException(id, "missing_document");
        }
        if (documentId != null && !documentId.equals(candidate.getSourceDocumentId())) {
            throw new MalformedCandidateException(id, "foreign_document");
        }
        double confidence = candidate.getConfidence();
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new MalformedCandidateException(id, "confidence_out_of_range");
        }
        if (candidate.getPage() < 1) {
            throw new MalformedCandidateException(id, "invalid_page");
        }
        if (candidate.isCitation() && isBlank(candidate.getRawText())) {
            throw new MalformedCandidateException(id, "missing_text");
        }
        if (candidate.isDefinition() && isBlank(candidate.getRawText()) && isBlank(candidate.getTerm())) {
            throw new MalformedCandidateException(id, "missing_text");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}

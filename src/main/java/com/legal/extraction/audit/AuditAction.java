package com.legal.extraction.audit;

/**
 * Auditable events in a record's life.
 */
public enum AuditAction {
    RECORD_CREATED,
    EVIDENCE_MERGED,
    FUZZY_MATCHED,
    CANDIDATE_DROPPED,
    ADAPTER_DEGRADED,
    RECORD_AUTO_ACCEPTED,
    RECORD_FLAGGED_FOR_REVIEW,
    REVIEW_ACCEPTED,
    REVIEW_CORRECTED,
    REVIEW_REJECTED,
    REVIEW_CONFLICT,
    REVIEW_MISMATCH
}

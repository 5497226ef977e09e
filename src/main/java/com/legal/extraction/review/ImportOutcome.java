package com.legal.extraction.review;

import com.legal.extraction.core.model.ReviewStatus;

/**
 * Result of importing one correction. Failures are reported here rather than thrown so that
 * one bad row never affects the others.
 *
 * @param recordId        record the correction targeted
 * @param status          what happened
 * @param resultingStatus record status after the import, null when the record is unknown
 * @param message         human readable detail
 */
public record ImportOutcome(String recordId, Status status, ReviewStatus resultingStatus, String message) {

    public enum Status {
        /** The record left PENDING. */
        APPLIED,
        /** The record already carried exactly this decision. */
        UNCHANGED,
        /** The record was already finalized with a different decision. */
        CONFLICT,
        /** No record with this id is known. */
        REVIEW_IMPORT_MISMATCH
    }

    public boolean isApplied() {
        return status == Status.APPLIED;
    }

    static ImportOutcome applied(String recordId, ReviewStatus resulting) {
        return new ImportOutcome(recordId, Status.APPLIED, resulting, "moved to " + resulting);
    }

    static ImportOutcome unchanged(String recordId, ReviewStatus current) {
        return new ImportOutcome(recordId, Status.UNCHANGED, current, "already " + current);
    }

    static ImportOutcome conflict(String recordId, ReviewStatus current, ReviewStatus requested) {
        return new ImportOutcome(recordId, Status.CONFLICT, current,
                "record is " + current + ", correction asks for " + requested);
    }

    static ImportOutcome mismatch(String recordId, String reason) {
        return new ImportOutcome(recordId, Status.REVIEW_IMPORT_MISMATCH, null, reason);
    }
}

package com.legal.extraction.review;

import com.legal.extraction.audit.AuditEntry;
import com.legal.extraction.core.model.ReviewStatus;

import java.util.Objects;

/**
 * A reviewer's decision on one record, as imported from an exchange file.
 *
 * @param decision      accept or reject
 * @param correctedText replacement text; only meaningful with {@link ReviewDecision#ACCEPT}
 * @param reviewedBy    who decided; {@value AuditEntry#SYSTEM_ACTOR} when absent
 * @param notes         free text, may be null
 */
public record Correction(ReviewDecision decision, String correctedText, String reviewedBy, String notes) {

    public Correction {
        Objects.requireNonNull(decision, "decision is required");
        reviewedBy = reviewedBy == null || reviewedBy.isBlank() ? AuditEntry.SYSTEM_ACTOR : reviewedBy.strip();
        correctedText = correctedText == null || correctedText.isBlank() ? null : correctedText.strip();
    }

    public static Correction accept(String reviewedBy) {
        return new Correction(ReviewDecision.ACCEPT, null, reviewedBy, null);
    }

    public static Correction correct(String correctedText, String reviewedBy) {
        return new Correction(ReviewDecision.ACCEPT, correctedText, reviewedBy, null);
    }

    public static Correction reject(String reviewedBy) {
        return new Correction(ReviewDecision.REJECT, null, reviewedBy, null);
    }

    /**
     * Status the record ends in when this correction is applied.
     */
    public ReviewStatus targetStatus() {
        if (decision == ReviewDecision.REJECT) {
            return ReviewStatus.REJECTED;
        }
        return correctedText != null ? ReviewStatus.CORRECTED : ReviewStatus.ACCEPTED;
    }
}

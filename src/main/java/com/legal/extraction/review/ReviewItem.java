package com.legal.extraction.review;

import com.legal.extraction.core.model.CandidateKind;
import com.legal.extraction.core.model.ExtractionMethod;
import com.legal.extraction.core.model.MergedRecord;
import com.legal.extraction.core.model.Provenance;
import com.legal.extraction.core.model.ReviewStatus;

import java.time.Instant;
import java.util.Comparator;
import java.util.Objects;

/**
 * A low-confidence record waiting for a human decision.
 * There is at most one item per record; its id is the record id.
 */
public class ReviewItem {

    private final String recordId;
    private final String documentId;
    private final CandidateKind kind;
    private final String text;
    private final String definition;
    private final int page;
    private final double confidence;
    private final ExtractionMethod extractionMethod;
    private final String reason;
    private final Instant submittedAt;
    private ReviewStatus status;
    private Instant reviewedAt;
    private String reviewedBy;
    private String notes;

    private ReviewItem(Builder builder) {
        this.recordId = Objects.requireNonNull(builder.recordId, "recordId is required");
        this.documentId = Objects.requireNonNull(builder.documentId, "documentId is required");
        this.kind = Objects.requireNonNull(builder.kind, "kind is required");
        this.text = builder.text;
        this.definition = builder.definition;
        this.page = builder.page;
        this.confidence = builder.confidence;
        this.extractionMethod = builder.extractionMethod;
        this.reason = builder.reason;
        this.submittedAt = builder.submittedAt != null ? builder.submittedAt : Instant.now();
        this.status = ReviewStatus.PENDING;
    }

    /**
     * Snapshot of a record at routing time. Page and method come from the strongest piece of evidence.
     */
    public static ReviewItem fromRecord(MergedRecord record, String reason) {
        Provenance strongest = record.getProvenance().stream()
                .max(Comparator.comparingDouble(Provenance::confidence))
                .orElse(null);
        return builder()
                .recordId(record.getRecordId())
                .documentId(record.getDocumentId())
                .kind(record.getKind())
                .text(record.getBestText())
                .definition(record.getDefinitionText())
                .page(strongest != null ? strongest.page() : 0)
                .extractionMethod(strongest != null ? strongest.extractionMethod() : null)
                .confidence(record.getConfidence())
                .reason(reason)
                .build();
    }

    public String getRecordId() {
        return recordId;
    }

    public String getDocumentId() {
        return documentId;
    }

    public CandidateKind getKind() {
        return kind;
    }

    public String getText() {
        return text;
    }

    public String getDefinition() {
        return definition;
    }

    public int getPage() {
        return page;
    }

    public double getConfidence() {
        return confidence;
    }

    public ExtractionMethod getExtractionMethod() {
        return extractionMethod;
    }

    public String getReason() {
        return reason;
    }

    public Instant getSubmittedAt() {
        return submittedAt;
    }

    public ReviewStatus getStatus() {
        return status;
    }

    public Instant getReviewedAt() {
        return reviewedAt;
    }

    public String getReviewedBy() {
        return reviewedBy;
    }

    public String getNotes() {
        return notes;
    }

    public boolean isPending() {
        return status == ReviewStatus.PENDING;
    }

    void markResolved(ReviewStatus outcome, String reviewer, String notes) {
        this.status = outcome;
        this.reviewedAt = Instant.now();
        this.reviewedBy = reviewer;
        this.notes = notes;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ReviewItem that = (ReviewItem) o;
        return recordId.equals(that.recordId);
    }

    @Override
    public int hashCode() {
        return recordId.hashCode();
    }

    @Override
    public String toString() {
        return "ReviewItem{" +
                "recordId='" + recordId + '\'' +
                ", kind=" + kind +
                ", confidence=" + confidence +
                ", status=" + status +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String recordId;
        private String documentId;
        private CandidateKind kind;
        private String text;
        private String definition;
        private int page;
        private double confidence;
        private ExtractionMethod extractionMethod;
        private String reason;
        private Instant submittedAt;

        public Builder recordId(String recordId) {
            this.recordId = recordId;
            return this;
        }

        public Builder documentId(String documentId) {
            this.documentId = documentId;
            return this;
        }

        public Builder kind(CandidateKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder text(String text) {
            this.text = text;
            return this;
        }

        public Builder definition(String definition) {
            this.definition = definition;
            return this;
        }

        public Builder page(int page) {
            this.page = page;
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder extractionMethod(ExtractionMethod extractionMethod) {
            this.extractionMethod = extractionMethod;
            return this;
        }

        public Builder reason(String reason) {
            this.reason = reason;
            return this;
        }

        public Builder submittedAt(Instant submittedAt) {
            this.submittedAt = submittedAt;
            return this;
        }

        public ReviewItem build() {
            return new ReviewItem(this);
        }
    }
}

package com.legal.extraction.core.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The reconciled, provenance-tracked output unit for one canonical key in one document.
 *
 * <p>Records are only ever grown: evidence is appended, confidence never decreases,
 * and the review status only leaves {@link ReviewStatus#PENDING}. A record is never
 * removed; rejection is a terminal status.</p>
 */
public class MergedRecord {

    private final String recordId;
    private final String documentId;
    private final CanonicalKey key;
    private final Instant createdAt;
    private final List<Provenance> provenance = new ArrayList<>();
    private String bestText;
    private double bestTextConfidence;
    private String definitionText;
    private double definitionConfidence;
    private double confidence;
    private ReviewStatus reviewStatus = ReviewStatus.PENDING;
    private boolean flaggedForReview;
    private String correctedText;
    private String reviewedBy;
    private Instant reviewedAt;

    public MergedRecord(String documentId, CanonicalKey key) {
        this.documentId = Objects.requireNonNull(documentId, "documentId is required");
        this.key = Objects.requireNonNull(key, "key is required");
        this.recordId = recordIdFor(documentId, key);
        this.createdAt = Instant.now();
    }

    /**
     * Stable identifier used to match exported review rows back to their record.
     */
    public static String recordIdFor(String documentId, CanonicalKey key) {
        return documentId + ":" + key.value();
    }

    public String getRecordId() {
        return recordId;
    }

    public String getDocumentId() {
        return documentId;
    }

    public CanonicalKey getKey() {
        return key;
    }

    public CandidateKind getKind() {
        return key.kind();
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public String getBestText() {
        return bestText;
    }

    public double getBestTextConfidence() {
        return bestTextConfidence;
    }

    public double getDefinitionConfidence() {
        return definitionConfidence;
    }

    public String getDefinitionText() {
        return definitionText;
    }

    public double getConfidence() {
        return confidence;
    }

    public List<Provenance> getProvenance() {
        return Collections.unmodifiableList(provenance);
    }

    public int evidenceCount() {
        return provenance.size();
    }

    public Set<String> candidateIds() {
        return provenance.stream().map(Provenance::candidateId).collect(Collectors.toSet());
    }

    public boolean containsCandidate(String candidateId) {
        for (Provenance p : provenance) {
            if (p.candidateId().equals(candidateId)) {
                return true;
            }
        }
        return false;
    }

    public ReviewStatus getReviewStatus() {
        return reviewStatus;
    }

    public boolean isFlaggedForReview() {
        return flaggedForReview;
    }

    public Optional<String> getCorrectedText() {
        return Optional.ofNullable(correctedText);
    }

    public Optional<String> getReviewedBy() {
        return Optional.ofNullable(reviewedBy);
    }

    public Instant getReviewedAt() {
        return reviewedAt;
    }

    /**
     * Text a consumer should display: the reviewer's correction when present.
     */
    public String effectiveText() {
        return correctedText != null ? correctedText : bestText;
    }

    public void appendEvidence(Provenance evidence) {
        provenance.add(Objects.requireNonNull(evidence, "evidence is required"));
    }

    /**
     * Replaces the best text when the offered text is strictly more confident.
     * On equal confidence the earlier text stays.
     */
    public boolean offerBestText(String text, double textConfidence) {
        if (text == null) {
            return false;
        }
        if (bestText == null || textConfidence > bestTextConfidence) {
            bestText = text;
            bestTextConfidence = textConfidence;
            return true;
        }
        return false;
    }

    /**
     * Same policy as {@link #offerBestText} for the definition body.
     */
    public boolean offerDefinitionText(String text, double textConfidence) {
        if (text == null || text.isBlank()) {
            return false;
        }
        if (definitionText == null || textConfidence > definitionConfidence) {
            definitionText = text;
            definitionConfidence = textConfidence;
            return true;
        }
        return false;
    }

    /**
     * Sets the aggregated confidence. Lower values are ignored.
     */
    public void raiseConfidence(double aggregated) {
        if (aggregated > confidence) {
            confidence = Math.min(1.0, aggregated);
        }
    }

    public void flagForReview() {
        this.flaggedForReview = true;
    }

    /**
     * Moves the record out of PENDING.
     *
     * @throws IllegalStateException if the record already has a terminal status
     */
    public void transitionTo(ReviewStatus target, String reviewer, String corrected) {
        if (!reviewStatus.canTransitionTo(target)) {
            throw new IllegalStateException("Illegal review transition " + reviewStatus + " -> " + target
                    + " for record " + recordId);
        }
        this.reviewStatus = target;
        this.reviewedBy = reviewer;
        this.reviewedAt = Instant.now();
        if (target == ReviewStatus.CORRECTED) {
            this.correctedText = corrected;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        MergedRecord that = (MergedRecord) o;
        return recordId.equals(that.recordId);
    }

    @Override
    public int hashCode() {
        return recordId.hashCode();
    }

    @Override
    public String toString() {
        return "MergedRecord{" +
                "recordId='" + recordId + '\'' +
                ", bestText='" + bestText + '\'' +
                ", confidence=" + confidence +
                ", evidence=" + provenance.size() +
                ", status=" + reviewStatus +
                '}';
    }
}

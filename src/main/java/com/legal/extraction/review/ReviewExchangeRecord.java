package com.legal.extraction.review;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.legal.extraction.core.model.MergedRecord;

import java.util.Locale;

/**
 * One row of a review batch as exchanged with reviewers. The first columns describe the
 * record; {@code reviewedBy}, {@code correctedText}, {@code decision} and {@code notes} are
 * filled in by the reviewer. Rows without {@code reviewedBy} were not reviewed.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.ALWAYS)
public record ReviewExchangeRecord(
        @JsonProperty("record_id") String recordId,
        @JsonProperty("entity_type") String kind,
        @JsonProperty("text") String rawText,
        @JsonProperty("definition") String definition,
        @JsonProperty("page") int page,
        @JsonProperty("confidence") double confidence,
        @JsonProperty("extraction_method") String extractionMethod,
        @JsonProperty("reason") String reason,
        @JsonProperty("reviewed_by") String reviewedBy,
        @JsonProperty("corrected_text") String correctedText,
        @JsonProperty("decision") String decision,
        @JsonProperty("notes") String notes
) {

    public static ReviewExchangeRecord forReview(ReviewItem item) {
        return new ReviewExchangeRecord(
                item.getRecordId(),
                item.getKind().name().toLowerCase(Locale.ROOT),
                item.getText(),
                item.getDefinition(),
                item.getPage(),
                item.getConfidence(),
                item.getExtractionMethod() != null ? item.getExtractionMethod().tag() : null,
                item.getReason(),
                null, null, null, null);
    }

    public static ReviewExchangeRecord forReview(MergedRecord record) {
        return forReview(ReviewItem.fromRecord(record, null));
    }

    @JsonIgnore
    public boolean isReviewed() {
        return reviewedBy != null && !reviewedBy.isBlank();
    }

    /**
     * The reviewer's decision. A reviewed row without an explicit decision counts as an accept.
     *
     * @throws IllegalStateException    if the row was not reviewed
     * @throws IllegalArgumentException if the decision column holds an unknown value
     */
    public Correction toCorrection() {
        if (!isReviewed()) {
            throw new IllegalStateException("Row for record " + recordId + " has no reviewer");
        }
        ReviewDecision parsed = ReviewDecision.parse(decision);
        return new Correction(parsed != null ? parsed : ReviewDecision.ACCEPT, correctedText, reviewedBy, notes);
    }

    public ReviewExchangeRecord withReview(String reviewer, String decision, String correctedText, String notes) {
        return new ReviewExchangeRecord(recordId, kind, rawText, definition, page, confidence, extractionMethod,
                reason, reviewer, correctedText, decision, notes);
    }
}

package com.legal.extraction.review;

import com.legal.extraction.core.model.CandidateKind;
import com.legal.extraction.core.model.ReviewStatus;

/**
 * Holds records whose aggregated confidence fell below the acceptance threshold
 * until a reviewer decides on them.
 */
public interface ReviewQueue {

    /**
     * Adds an item. Submitting a record that is already queued keeps the existing item.
     *
     * @return the item held by the queue for that record
     */
    ReviewItem submit(ReviewItem item);

    /**
     * Pending items, oldest submission first.
     */
    Page<ReviewItem> getPending(PageRequest page);

    Page<ReviewItem> getPendingByKind(CandidateKind kind, PageRequest page);

    /**
     * Pending items whose confidence lies in {@code [minConfidence, maxConfidence]}, lowest first.
     */
    Page<ReviewItem> getPendingByConfidenceRange(double minConfidence, double maxConfidence, PageRequest page);

    /**
     * Closes the item of a record with the decision taken on it.
     *
     * @throws IllegalArgumentException if the record has no item
     * @throws IllegalStateException    if the item is already closed
     */
    void resolve(String recordId, ReviewStatus outcome, String reviewer, String notes);

    /**
     * @return the item, or null if the record was never queued
     */
    ReviewItem get(String recordId);

    long countPending();

    /**
     * Counts and average confidence over the pending items.
     */
    ReviewSummary summary();
}

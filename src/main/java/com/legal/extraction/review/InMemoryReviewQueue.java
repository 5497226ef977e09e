package com.legal.extraction.review;

import com.legal.extraction.core.model.CandidateKind;
import com.legal.extraction.core.model.ReviewStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory implementation of {@link ReviewQueue}.
 * Safe to share between documents processed in parallel.
 */
public class InMemoryReviewQueue implements ReviewQueue {
    private static final Logger log = LoggerFactory.getLogger(InMemoryReviewQueue.class);

    private final ConcurrentMap<String, ReviewItem> items = new ConcurrentHashMap<>();

    @Override
    public ReviewItem submit(ReviewItem item) {
        ReviewItem existing = items.putIfAbsent(item.getRecordId(), item);
        if (existing != null) {
            log.debug("review.already_queued recordId={}", item.getRecordId());
            return existing;
        }
        log.debug("review.queued recordId={} kind={} confidence={} reason='{}'",
                item.getRecordId(), item.getKind(), item.getConfidence(), item.getReason());
        return item;
    }

    @Override
    public Page<ReviewItem> getPending(PageRequest page) {
        List<ReviewItem> pending = items.values().stream()
                .filter(ReviewItem::isPending)
                .sorted(Comparator.comparing(ReviewItem::getSubmittedAt).thenComparing(ReviewItem::getRecordId))
                .toList();
        return Page.slice(pending, page);
    }

    @Override
    public Page<ReviewItem> getPendingByKind(CandidateKind kind, PageRequest page) {
        List<ReviewItem> filtered = items.values().stream()
                .filter(ReviewItem::isPending)
                .filter(item -> item.getKind() == kind)
                .sorted(Comparator.comparing(ReviewItem::getSubmittedAt).thenComparing(ReviewItem::getRecordId))
                .toList();
        return Page.slice(filtered, page);
    }

    @Override
    public Page<ReviewItem> getPendingByConfidenceRange(double minConfidence, double maxConfidence, PageRequest page) {
        List<ReviewItem> filtered = items.values().stream()
                .filter(ReviewItem::isPending)
                .filter(item -> item.getConfidence() >= minConfidence && item.getConfidence() <= maxConfidence)
                .sorted(Comparator.comparingDouble(ReviewItem::getConfidence).thenComparing(ReviewItem::getRecordId))
                .toList();
        return Page.slice(filtered, page);
    }

    @Override
    public void resolve(String recordId, ReviewStatus outcome, String reviewer, String notes) {
        ReviewItem item = items.get(recordId);
        if (item == null) {
            throw new IllegalArgumentException("Review item not found: " + recordId);
        }
        if (!item.isPending()) {
            throw new IllegalStateException("Review item is not pending: " + recordId);
        }
        item.markResolved(outcome, reviewer, notes);
        log.info("review.resolved recordId={} outcome={} reviewer={}", recordId, outcome, reviewer);
    }

    @Override
    public ReviewItem get(String recordId) {
        return items.get(recordId);
    }

    @Override
    public long countPending() {
        return items.values().stream().filter(ReviewItem::isPending).count();
    }

    @Override
    public ReviewSummary summary() {
        return ReviewSummary.of(items.values().stream().filter(ReviewItem::isPending).toList());
    }
}

package com.legal.extraction.review;

import com.legal.extraction.audit.AuditAction;
import com.legal.extraction.audit.AuditTrail;
import com.legal.extraction.core.model.MergedRecord;
import com.legal.extraction.core.model.ReviewStatus;
import com.legal.extraction.logging.LogContext;
import com.legal.extraction.metrics.MetricsService;
import com.legal.extraction.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Applies reviewer decisions to merged records.
 *
 * <p>Records become known to the service through {@link #register}. A correction moves a
 * PENDING record to ACCEPTED, CORRECTED or REJECTED and closes its queue item. Importing the
 * same correction again is reported as {@link ImportOutcome.Status#UNCHANGED}; a different
 * decision on a finalized record is a {@link ImportOutcome.Status#CONFLICT} and leaves the
 * record as it is. An unknown record id is reported, never thrown.</p>
 */
public class ReviewService {
    private static final Logger log = LoggerFactory.getLogger(ReviewService.class);

    private final ReviewQueue reviewQueue;
    private final MetricsService metrics;
    private final AuditTrail auditTrail;
    private final ConcurrentMap<String, MergedRecord> records = new ConcurrentHashMap<>();

    public ReviewService(ReviewQueue reviewQueue) {
        this(reviewQueue, NoOpMetricsService.INSTANCE, new AuditTrail());
    }

    public ReviewService(ReviewQueue reviewQueue, MetricsService metrics, AuditTrail auditTrail) {
        this.reviewQueue = reviewQueue;
        this.metrics = metrics;
        this.auditTrail = auditTrail;
    }

    public void register(Collection<MergedRecord> merged) {
        for (MergedRecord record : merged) {
            records.putIfAbsent(record.getRecordId(), record);
        }
    }

    public Optional<MergedRecord> getRecord(String recordId) {
        return Optional.ofNullable(records.get(recordId));
    }

    public ImportOutcome importCorrection(String recordId, Correction correction) {
        MergedRecord record = records.get(recordId);
        if (record == null) {
            return mismatch(recordId, null, "unknown record");
        }

        ReviewStatus target = correction.targetStatus();
        ImportOutcome outcome;
        synchronized (record) {
            ReviewStatus current = record.getReviewStatus();
            if (current == ReviewStatus.PENDING) {
                record.transitionTo(target, correction.reviewedBy(), correction.correctedText());
                closeQueueItem(record, target, correction);
                outcome = ImportOutcome.applied(recordId, target);
            } else if (current == target && sameCorrection(record, correction)) {
                outcome = ImportOutcome.unchanged(recordId, current);
            } else {
                outcome = ImportOutcome.conflict(recordId, current, target);
            }
        }

        metrics.incrementCorrectionImport(outcome.status().name().toLowerCase(Locale.ROOT));
        switch (outcome.status()) {
            case APPLIED -> {
                auditTrail.recordBy(correction.reviewedBy(), auditActionFor(target), record.getDocumentId(),
                        recordId, details(correction));
                log.info("review.applied recordId={} status={} reviewer={}", recordId, target, correction.reviewedBy());
            }
            case CONFLICT -> {
                auditTrail.recordBy(correction.reviewedBy(), AuditAction.REVIEW_CONFLICT, record.getDocumentId(),
                        recordId, details(correction));
                log.warn("review.conflict recordId={} current={} requested={} reviewer={}",
                        recordId, outcome.resultingStatus(), target, correction.reviewedBy());
            }
            default -> log.debug("review.unchanged recordId={} status={}", recordId, outcome.resultingStatus());
        }
        return outcome;
    }

    /**
     * Imports every reviewed row of a batch. Each row is handled on its own.
     */
    public List<ImportOutcome> importAll(List<ReviewExchangeRecord> rows) {
        List<ImportOutcome> outcomes = new ArrayList<>(rows.size());
        try (LogContext ctx = LogContext.forReviewImport(LogContext.generateCorrelationId())) {
            for (ReviewExchangeRecord row : rows) {
                if (!row.isReviewed()) {
                    continue;
                }
                Correction correction;
                try {
                    correction = row.toCorrection();
                } catch (IllegalArgumentException e) {
                    outcomes.add(mismatch(row.recordId(), row.reviewedBy(), e.getMessage()));
                    continue;
                }
                outcomes.add(importCorrection(row.recordId(), correction));
            }
            log.info("review.import.completed rows={} applied={}", outcomes.size(),
                    outcomes.stream().filter(ImportOutcome::isApplied).count());
        }
        return outcomes;
    }

    public List<ImportOutcome> importBatch(ReviewExchange exchange, Reader reader) throws IOException {
        return importAll(exchange.read(reader));
    }

    /**
     * Rows for every record still waiting for a decision, in queue order.
     */
    public List<ReviewExchangeRecord> exportPending() {
        List<ReviewExchangeRecord> rows = new ArrayList<>();
        int pageNumber = 0;
        Page<ReviewItem> page;
        do {
            page = reviewQueue.getPending(PageRequest.of(pageNumber++, 500));
            for (ReviewItem item : page.content()) {
                rows.add(ReviewExchangeRecord.forReview(item));
            }
        } while (page.hasNext());
        return rows;
    }

    public int exportPending(ReviewExchange exchange, Writer writer) throws IOException {
        return exchange.write(exportPending(), writer);
    }

    public ReviewQueue getReviewQueue() {
        return reviewQueue;
    }

    private ImportOutcome mismatch(String recordId, String reviewer, String reason) {
        metrics.incrementCorrectionImport("review_import_mismatch");
        auditTrail.recordBy(reviewer, AuditAction.REVIEW_MISMATCH, null, recordId, Map.of("reason", reason));
        log.warn("review.mismatch recordId={} reason={}", recordId, reason);
        return ImportOutcome.mismatch(recordId, reason);
    }

    private void closeQueueItem(MergedRecord record, ReviewStatus target, Correction correction) {
        ReviewItem item = reviewQueue.get(record.getRecordId());
        if (item != null && item.isPending()) {
            reviewQueue.resolve(record.getRecordId(), target, correction.reviewedBy(), correction.notes());
        }
    }

    private static boolean sameCorrection(MergedRecord record, Correction correction) {
        if (correction.targetStatus() != ReviewStatus.CORRECTED) {
            return true;
        }
        return record.getCorrectedText().map(text -> text.equals(correction.correctedText())).orElse(false);
    }

    private static AuditAction auditActionFor(ReviewStatus status) {
        return switch (status) {
            case ACCEPTED -> AuditAction.REVIEW_ACCEPTED;
            case CORRECTED -> AuditAction.REVIEW_CORRECTED;
            case REJECTED -> AuditAction.REVIEW_REJECTED;
            case PENDING -> throw new IllegalArgumentException("PENDING is not a review outcome");
        };
    }

    private static Map<String, Object> details(Correction correction) {
        Map<String, Object> details = new HashMap<>();
        details.put("decision", correction.decision().name());
        if (correction.correctedText() != null) {
            details.put("correctedText", correction.correctedText());
        }
        if (correction.notes() != null) {
            details.put("notes", correction.notes());
        }
        return details;
    }
}

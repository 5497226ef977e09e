package com.legal.extraction.review;

import com.legal.extraction.audit.AuditAction;
import com.legal.extraction.audit.AuditEntry;
import com.legal.extraction.audit.AuditTrail;
import com.legal.extraction.config.PipelineConfig;
import com.legal.extraction.core.model.MergedRecord;
import com.legal.extraction.core.model.ReviewStatus;
import com.legal.extraction.metrics.MetricsService;
import com.legal.extraction.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Map;

/**
 * Decides whether a merged record is accepted as is or goes to human review.
 *
 * <p>Records at or above the high-confidence threshold move to ACCEPTED. The others stay
 * PENDING, are flagged and get an item in the {@link ReviewQueue}. Routing is done once per
 * record; routing it again returns its current status untouched.</p>
 */
public class ConfidenceRouter {
    private static final Logger log = LoggerFactory.getLogger(ConfidenceRouter.class);

    private final double highConfidenceThreshold;
    private final ReviewQueue reviewQueue;
    private final MetricsService metrics;
    private final AuditTrail auditTrail;

    public ConfidenceRouter(PipelineConfig config, ReviewQueue reviewQueue) {
        this(config, reviewQueue, NoOpMetricsService.INSTANCE, new AuditTrail());
    }

    public ConfidenceRouter(PipelineConfig config, ReviewQueue reviewQueue, MetricsService metrics,
                            AuditTrail auditTrail) {
        this.highConfidenceThreshold = config.getHighConfidenceThreshold();
        this.reviewQueue = reviewQueue;
        this.metrics = metrics;
        this.auditTrail = auditTrail;
    }

    public ReviewStatus route(MergedRecord record) {
        synchronized (record) {
            if (record.getReviewStatus().isTerminal() || record.isFlaggedForReview()) {
                return record.getReviewStatus();
            }
            metrics.recordRecordConfidence(record.getConfidence());

            if (record.getConfidence() >= highConfidenceThreshold) {
                record.transitionTo(ReviewStatus.ACCEPTED, AuditEntry.SYSTEM_ACTOR, null);
                metrics.incrementRouted(ReviewStatus.ACCEPTED);
                auditTrail.record(AuditAction.RECORD_AUTO_ACCEPTED, record.getDocumentId(), record.getRecordId(),
                        Map.of("confidence", record.getConfidence()));
                log.debug("route.accepted recordId={} confidence={}", record.getRecordId(), record.getConfidence());
                return ReviewStatus.ACCEPTED;
            }

            String reason = String.format(Locale.ROOT, "Low confidence (%.2f)", record.getConfidence());
            record.flagForReview();
            reviewQueue.submit(ReviewItem.fromRecord(record, reason));
            metrics.incrementRouted(ReviewStatus.PENDING);
            auditTrail.record(AuditAction.RECORD_FLAGGED_FOR_REVIEW, record.getDocumentId(), record.getRecordId(),
                    Map.of("confidence", record.getConfidence(), "reason", reason));
            log.debug("route.flagged recordId={} confidence={}", record.getRecordId(), record.getConfidence());
            return ReviewStatus.PENDING;
        }
    }

    public double getHighConfidenceThreshold() {
        return highConfidenceThreshold;
    }
}

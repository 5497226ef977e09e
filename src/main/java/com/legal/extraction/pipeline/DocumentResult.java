package com.legal.extraction.pipeline;

import com.legal.extraction.core.model.MergedRecord;
import com.legal.extraction.core.model.ReviewStatus;
import com.legal.extraction.merge.MergeStats;

import java.time.Duration;
import java.util.List;

/**
 * Outcome of processing one document.
 *
 * <p>The status views read the records' current status, so they reflect review decisions
 * imported after processing.</p>
 *
 * @param documentId       the document
 * @param records          every merged record, in creation order
 * @param mergeStats       merge counters, null for a failed document
 * @param degradedAdapters adapters whose contribution was dropped (failure, timeout)
 * @param error            failure message, null on success
 * @param duration         wall-clock processing time
 */
public record DocumentResult(
        String documentId,
        List<MergedRecord> records,
        MergeStats mergeStats,
        List<String> degradedAdapters,
        String error,
        Duration duration
) {
    public DocumentResult {
        records = records != null ? List.copyOf(records) : List.of();
        degradedAdapters = degradedAdapters != null ? List.copyOf(degradedAdapters) : List.of();
    }

    public static DocumentResult completed(String documentId, List<MergedRecord> records, MergeStats stats,
                                           List<String> degradedAdapters, Duration duration) {
        return new DocumentResult(documentId, records, stats, degradedAdapters, null, duration);
    }

    public static DocumentResult failed(String documentId, String error, Duration duration) {
        return new DocumentResult(documentId, List.of(), null, List.of(), error, duration);
    }

    public boolean isSuccess() {
        return error == null;
    }

    public List<MergedRecord> withStatus(ReviewStatus status) {
        return records.stream().filter(r -> r.getReviewStatus() == status).toList();
    }

    public List<MergedRecord> accepted() {
        return withStatus(ReviewStatus.ACCEPTED);
    }

    public List<MergedRecord> pending() {
        return withStatus(ReviewStatus.PENDING);
    }

    public List<MergedRecord> corrected() {
        return withStatus(ReviewStatus.CORRECTED);
    }

    public List<MergedRecord> rejected() {
        return withStatus(ReviewStatus.REJECTED);
    }

    @Override
    public String toString() {
        return "DocumentResult{" +
                "documentId='" + documentId + '\'' +
                ", records=" + records.size() +
                ", degraded=" + degradedAdapters +
                (error != null ? ", error='" + error + '\'' : "") +
                '}';
    }
}

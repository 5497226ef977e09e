package com.legal.extraction.review;

import com.legal.extraction.core.model.CandidateKind;

import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Overview of the review backlog.
 *
 * @param total             number of items
 * @param byKind            item count per candidate kind
 * @param byReason          item count per routing reason
 * @param averageConfidence mean confidence, 0 when empty
 */
public record ReviewSummary(long total, Map<CandidateKind, Long> byKind, Map<String, Long> byReason,
                            double averageConfidence) {

    public ReviewSummary {
        byKind = Map.copyOf(byKind);
        byReason = Map.copyOf(byReason);
    }

    public static ReviewSummary of(Collection<ReviewItem> items) {
        Map<CandidateKind, Long> byKind = new EnumMap<>(CandidateKind.class);
        Map<String, Long> byReason = new TreeMap<>();
        double sum = 0.0;
        for (ReviewItem item : items) {
            byKind.merge(item.getKind(), 1L, Long::sum);
            if (item.getReason() != null) {
                byReason.merge(item.getReason(), 1L, Long::sum);
            }
            sum += item.getConfidence();
        }
        double average = items.isEmpty() ? 0.0 : sum / items.size();
        return new ReviewSummary(items.size(), byKind, byReason, average);
    }

    public long count(CandidateKind kind) {
        return byKind.getOrDefault(kind, 0L);
    }
}

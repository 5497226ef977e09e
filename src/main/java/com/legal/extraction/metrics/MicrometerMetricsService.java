package com.legal.extraction.metrics;

import com.legal.extraction.core.model.CandidateKind;
import com.legal.extraction.core.model.ExtractionMethod;
import com.legal.extraction.core.model.ReviewStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer implementation of {@link MetricsService}.
 *
 * <p>Meters:</p>
 * <ul>
 *   <li>{@code extraction.document.duration} Timer (tag: outcome)</li>
 *   <li>{@code extraction.candidates} Counter (tag: method)</li>
 *   <li>{@code extraction.adapter.duration} Timer (tags: adapter, outcome)</li>
 *   <li>{@code extraction.records.created} Counter (tag: kind)</li>
 *   <li>{@code extraction.evidence.merged} Counter (tag: kind)</li>
 *   <li>{@code extraction.fuzzy.matched} Counter (tag: kind)</li>
 *   <li>{@code extraction.candidates.dropped} Counter (tag: reason)</li>
 *   <li>{@code extraction.record.confidence} DistributionSummary</li>
 *   <li>{@code extraction.routed} Counter (tag: status)</li>
 *   <li>{@code extraction.review.imports} Counter (tag: outcome)</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timers = new ConcurrentHashMap<>();
    private final Map<String, Counter> counters = new ConcurrentHashMap<>();
    private final DistributionSummary confidenceSummary;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.confidenceSummary = DistributionSummary.builder("extraction.record.confidence")
                .description("Aggregated confidence of merged records")
                .register(registry);
    }

    @Override
    public void recordDocumentDuration(String outcome, Duration duration) {
        timer("extraction.document.duration", "Time to process one document", "outcome", outcome)
                .record(duration);
    }

    @Override
    public void recordCandidates(ExtractionMethod method, int count) {
        counter("extraction.candidates", "Candidates produced", "method", method.tag()).increment(count);
    }

    @Override
    public void recordAdapterCall(String adapterName, String outcome, Duration duration) {
        String key = "extraction.adapter.duration:" + adapterName + ":" + outcome;
        timers.computeIfAbsent(key, k -> Timer.builder("extraction.adapter.duration")
                        .description("Enhancement adapter call time")
                        .tag("adapter", adapterName)
                        .tag("outcome", outcome)
                        .register(registry))
                .record(duration);
    }

    @Override
    public void incrementRecordCreated(CandidateKind kind) {
        counter("extraction.records.created", "Merged records created", "kind", kind.name()).increment();
    }

    @Override
    public void incrementEvidenceMerged(CandidateKind kind) {
        counter("extraction.evidence.merged", "Candidates merged into an existing record", "kind", kind.name())
                .increment();
    }

    @Override
    public void incrementFuzzyMatched(CandidateKind kind) {
        counter("extraction.fuzzy.matched", "Fallback-key candidates attached by similarity", "kind", kind.name())
                .increment();
    }

    @Override
    public void incrementCandidateDropped(String reason) {
        counter("extraction.candidates.dropped", "Malformed candidates dropped", "reason", reason).increment();
    }

    @Override
    public void recordRecordConfidence(double confidence) {
        confidenceSummary.record(confidence);
    }

    @Override
    public void incrementRouted(ReviewStatus status) {
        counter("extraction.routed", "Records routed by confidence", "status", status.name()).increment();
    }

    @Override
    public void incrementCorrectionImport(String outcome) {
        counter("extraction.review.imports", "Review corrections imported", "outcome", outcome).increment();
    }

    private Counter counter(String name, String description, String tagKey, String tagValue) {
        return counters.computeIfAbsent(name + ":" + tagValue, k -> Counter.builder(name)
                .description(description)
                .tag(tagKey, tagValue)
                .register(registry));
    }

    private Timer timer(String name, String description, String tagKey, String tagValue) {
        return timers.computeIfAbsent(name + ":" + tagValue, k -> Timer.builder(name)
                .description(description)
                .tag(tagKey, tagValue)
                .register(registry));
    }
}

package com.legal.extraction.metrics;

import com.legal.extraction.core.model.CandidateKind;
import com.legal.extraction.core.model.ExtractionMethod;
import com.legal.extraction.core.model.ReviewStatus;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerMetricsServiceTest {

    private SimpleMeterRegistry registry;
    private MicrometerMetricsService metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new MicrometerMetricsService(registry);
    }

    @Test
    @DisplayName("Document and adapter timers are tagged by outcome")
    void timers() {
        metrics.recordDocumentDuration("success", Duration.ofMillis(120));
        metrics.recordDocumentDuration("success", Duration.ofMillis(80));
        metrics.recordAdapterCall("ollama/llama3.2", "timeout", Duration.ofSeconds(30));

        Timer documents = registry.get("extraction.document.duration").tag("outcome", "success").timer();
        assertEquals(2, documents.count());
        assertEquals(200, documents.totalTime(TimeUnit.MILLISECONDS), 0.001);
        assertEquals(1, registry.get("extraction.adapter.duration")
                .tags("adapter", "ollama/llama3.2", "outcome", "timeout").timer().count());
    }

    @Test
    @DisplayName("Candidate counters use the method tag")
    void candidates() {
        metrics.recordCandidates(ExtractionMethod.REGEX, 3);
        metrics.recordCandidates(ExtractionMethod.REGEX, 2);
        metrics.recordCandidates(ExtractionMethod.COLON_PATTERN, 1);

        assertEquals(5.0, registry.get("extraction.candidates").tag("method", "regex").counter().count());
        assertEquals(1.0, registry.get("extraction.candidates").tag("method", "colon_pattern").counter().count());
    }

    @Test
    @DisplayName("Merge counters are tagged by kind and reason")
    void mergeCounters() {
        metrics.incrementRecordCreated(CandidateKind.CITATION);
        metrics.incrementEvidenceMerged(CandidateKind.DEFINITION);
        metrics.incrementFuzzyMatched(CandidateKind.CITATION);
        metrics.incrementCandidateDropped("missing_text");
        metrics.incrementCandidateDropped("missing_text");

        assertEquals(1.0, registry.get("extraction.records.created").tag("kind", "CITATION").counter().count());
        assertEquals(1.0, registry.get("extraction.evidence.merged").tag("kind", "DEFINITION").counter().count());
        assertEquals(1.0, registry.get("extraction.fuzzy.matched").tag("kind", "CITATION").counter().count());
        assertEquals(2.0, registry.get("extraction.candidates.dropped").tag("reason", "missing_text")
                .counter().count());
    }

    @Test
    @DisplayName("Routing, imports and confidence distribution")
    void reviewMeters() {
        metrics.incrementRouted(ReviewStatus.ACCEPTED);
        metrics.incrementRouted(ReviewStatus.PENDING);
        metrics.incrementCorrectionImport("applied");
        metrics.recordRecordConfidence(0.95);
        metrics.recordRecordConfidence(0.45);

        assertEquals(1.0, registry.get("extraction.routed").tag("status", "ACCEPTED").counter().count());
        assertEquals(1.0, registry.get("extraction.routed").tag("status", "PENDING").counter().count());
        assertEquals(1.0, registry.get("extraction.review.imports").tag("outcome", "applied").counter().count());
        DistributionSummary confidence = registry.get("extraction.record.confidence").summary();
        assertEquals(2, confidence.count());
        assertEquals(0.95, confidence.max(), 1e-9);
    }
}

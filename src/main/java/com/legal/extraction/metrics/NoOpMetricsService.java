package com.legal.extraction.metrics;

import com.legal.extraction.core.model.CandidateKind;
import com.legal.extraction.core.model.ExtractionMethod;
import com.legal.extraction.core.model.ReviewStatus;

import java.time.Duration;

/**
 * Discards every measurement.
 */
public class NoOpMetricsService implements MetricsService {

    public static final NoOpMetricsService INSTANCE = new NoOpMetricsService();

    @Override
    public void recordDocumentDuration(String outcome, Duration duration) {
    }

    @Override
    public void recordCandidates(ExtractionMethod method, int count) {
    }

    @Override
    public void recordAdapterCall(String adapterName, String outcome, Duration duration) {
    }

    @Override
    public void incrementRecordCreated(CandidateKind kind) {
    }

    @Override
    public void incrementEvidenceMerged(CandidateKind kind) {
    }

    @Override
    public void incrementFuzzyMatched(CandidateKind kind) {
    }

    @Override
    public void incrementCandidateDropped(String reason) {
    }

    @Override
    public void recordRecordConfidence(double confidence) {
    }

    @Override
    public void incrementRouted(ReviewStatus status) {
    }

    @Override
    public void incrementCorrectionImport(String outcome) {
    }
}

package com.legal.extraction.metrics;

import com.legal.extraction.core.model.CandidateKind;
import com.legal.extraction.core.model.ExtractionMethod;
import com.legal.extraction.core.model.ReviewStatus;

import java.time.Duration;

/**
 * Pipeline metrics sink. {@link NoOpMetricsService} is the default so that the pipeline
 * runs without a metrics backend.
 */
public interface MetricsService {

    void recordDocumentDuration(String outcome, Duration duration);

    void recordCandidates(ExtractionMethod method, int count);

    void recordAdapterCall(String adapterName, String outcome, Duration duration);

    void incrementRecordCreated(CandidateKind kind);

    void incrementEvidenceMerged(CandidateKind kind);

    void incrementFuzzyMatched(CandidateKind kind);

    void incrementCandidateDropped(String reason);

    void recordRecordConfidence(double confidence);

    void incrementRouted(ReviewStatus status);

    void incrementCorrectionImport(String outcome);
}

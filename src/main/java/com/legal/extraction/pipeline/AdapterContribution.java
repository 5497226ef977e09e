package com.legal.extraction.pipeline;

import com.legal.extraction.core.model.Candidate;

import java.util.List;

/**
 * What one enhancement adapter added to a document. A degraded contribution is always empty.
 *
 * @param failureReason why the adapter contributed nothing, null when it succeeded
 */
public record AdapterContribution(String adapterName, List<Candidate> candidates, int attempts, String failureReason) {

    public AdapterContribution {
        candidates = candidates != null ? List.copyOf(candidates) : List.of();
    }

    static AdapterContribution succeeded(String adapterName, List<Candidate> candidates, int attempts) {
        return new AdapterContribution(adapterName, candidates, attempts, null);
    }

    static AdapterContribution skipped(String adapterName) {
        return new AdapterContribution(adapterName, List.of(), 0, null);
    }

    static AdapterContribution degraded(String adapterName, int attempts, String reason) {
        return new AdapterContribution(adapterName, List.of(), attempts, reason);
    }

    public boolean isDegraded() {
        return failureReason != null;
    }
}

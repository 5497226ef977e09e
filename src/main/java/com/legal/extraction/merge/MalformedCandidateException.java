package com.legal.extraction.merge;

/**
 * A candidate violates the data contract and cannot be merged.
 * The merger catches it, drops the candidate and carries on with the rest.
 */
public class MalformedCandidateException extends RuntimeException {

    private final String candidateId;
    private final String reason;

    public MalformedCandidateException(String candidateId, String reason) {
        super("Malformed candidate " + candidateId + ": " + reason);
        this.candidateId = candidateId;
        this.reason = reason;
    }

    public String getCandidateId() {
        return candidateId;
    }

    public String getReason() {
        return reason;
    }
}

package com.legal.extraction.core.model;

/**
 * Review lifecycle of a {@link MergedRecord}.
 * The only legal moves are out of {@link #PENDING}; the other states are terminal.
 */
public enum ReviewStatus {
    PENDING,
    ACCEPTED,
    CORRECTED,
    REJECTED;

    public boolean isTerminal() {
        return this != PENDING;
    }

    public boolean canTransitionTo(ReviewStatus target) {
        return this == PENDING && target != PENDING;
    }
}

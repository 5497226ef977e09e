package com.legal.extraction.review;

import java.util.Locale;

/**
 * What a reviewer decided on a queued record.
 */
public enum ReviewDecision {
    ACCEPT,
    REJECT;

    /**
     * Lenient parse of exchanged values: {@code accept}, {@code accepted}, {@code reject}, {@code rejected}.
     *
     * @return null for blank input
     * @throws IllegalArgumentException for anything else
     */
    public static ReviewDecision parse(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.strip().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "accept", "accepted" -> ACCEPT;
            case "reject", "rejected" -> REJECT;
            default -> throw new IllegalArgumentException("Unknown review decision: " + value);
        };
    }
}

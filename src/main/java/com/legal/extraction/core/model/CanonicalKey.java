package com.legal.extraction.core.model;

import java.util.Objects;

/**
 * Identity used to decide whether two candidates denote the same citation or definition.
 * Two keys are equal exactly when kind and value are equal.
 *
 * @param kind     what the key identifies
 * @param value    canonical id slug for citations, normalized term for definitions,
 *                 or a hash-derived value when parsing failed
 * @param type     instrument type of a parsed citation, otherwise null
 * @param number   instrument number of a parsed citation, otherwise null
 * @param year     instrument year of a parsed citation, otherwise null
 * @param fallback true when the key was derived from a hash of the raw text
 */
public record CanonicalKey(
        CandidateKind kind,
        String value,
        InstrumentType type,
        String number,
        Integer year,
        boolean fallback
) {
    public CanonicalKey {
        Objects.requireNonNull(kind, "kind is required");
        Objects.requireNonNull(value, "value is required");
        if (value.isBlank()) {
            throw new IllegalArgumentException("value must not be blank");
        }
    }

    public static CanonicalKey citation(InstrumentType type, String number, int year) {
        Objects.requireNonNull(type, "type is required");
        Objects.requireNonNull(number, "number is required");
        String id = type.slug() + "_" + number + "_" + year;
        return new CanonicalKey(CandidateKind.CITATION, id, type, number, year, false);
    }

    public static CanonicalKey definition(String normalizedTerm) {
        return new CanonicalKey(CandidateKind.DEFINITION, normalizedTerm, null, null, null, false);
    }

    /**
     * Key for text that could not be parsed. The hash makes it stable across runs
     * while keeping unrelated unparsable texts apart.
     */
    public static CanonicalKey fallback(CandidateKind kind, String normalizedText) {
        String prefix = kind == CandidateKind.CITATION ? "unresolved_" : "term_unresolved_";
        return new CanonicalKey(kind, prefix + Fingerprint.of(12, normalizedText), null, null, null, true);
    }

    /**
     * The {@code type_number_year} slug of a parsed citation, or the key value otherwise.
     */
    public String canonicalId() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CanonicalKey that)) return false;
        return kind == that.kind && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, value);
    }

    @Override
    public String toString() {
        return kind.name().toLowerCase() + ":" + value;
    }
}

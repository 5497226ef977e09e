package com.legal.extraction.core.model;

import java.util.Objects;

/**
 * One unreconciled extraction observation from a single source and method.
 * Candidates are immutable; the merger decides which of them denote the same entity.
 *
 * <p>The builder only enforces the fields every producer knows (kind and method).
 * Range and presence checks for the remaining fields happen when candidates enter
 * the merger, so a faulty enhancement source cannot abort extraction.</p>
 */
public final class Candidate {

    private final String candidateId;
    private final CandidateKind kind;
    private final String rawText;
    private final String term;
    private final String definitionText;
    private final int page;
    private final int position;
    private final String sourceDocumentId;
    private final ExtractionMethod extractionMethod;
    private final double confidence;
    private final boolean possiblyTruncated;

    private Candidate(Builder builder) {
        this.kind = Objects.requireNonNull(builder.kind, "kind is required");
        this.extractionMethod = Objects.requireNonNull(builder.extractionMethod, "extractionMethod is required");
        this.rawText = builder.rawText;
        this.term = builder.term;
        this.definitionText = builder.definitionText;
        this.page = builder.page;
        this.position = builder.position;
        this.sourceDocumentId = builder.sourceDocumentId;
        this.confidence = builder.confidence;
        this.possiblyTruncated = builder.possiblyTruncated;
        this.candidateId = builder.candidateId != null ? builder.candidateId
                : Fingerprint.of(16, sourceDocumentId, page, extractionMethod.tag(), position, rawText);
    }

    public String getCandidateId() {
        return candidateId;
    }

    public CandidateKind getKind() {
        return kind;
    }

    public String getRawText() {
        return rawText;
    }

    public String getTerm() {
        return term;
    }

    public String getDefinitionText() {
        return definitionText;
    }

    public int getPage() {
        return page;
    }

    /**
     * Character offset of the observation within its page, or -1 when the source cannot tell.
     */
    public int getPosition() {
        return position;
    }

    public String getSourceDocumentId() {
        return sourceDocumentId;
    }

    public ExtractionMethod getExtractionMethod() {
        return extractionMethod;
    }

    public double getConfidence() {
        return confidence;
    }

    public boolean isPossiblyTruncated() {
        return possiblyTruncated;
    }

    public boolean isCitation() {
        return kind == CandidateKind.CITATION;
    }

    public boolean isDefinition() {
        return kind == CandidateKind.DEFINITION;
    }

    public Builder toBuilder() {
        return new Builder()
                .kind(kind)
                .rawText(rawText)
                .term(term)
                .definitionText(definitionText)
                .page(page)
                .position(position)
                .sourceDocumentId(sourceDocumentId)
                .extractionMethod(extractionMethod)
                .confidence(confidence)
                .possiblyTruncated(possiblyTruncated);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Candidate that = (Candidate) o;
        return Objects.equals(candidateId, that.candidateId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(candidateId);
    }

    @Override
    public String toString() {
        return "Candidate{" +
                "id='" + candidateId + '\'' +
                ", kind=" + kind +
                ", method=" + extractionMethod +
                ", page=" + page +
                ", confidence=" + confidence +
                ", text='" + rawText + '\'' +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder citation(String rawText) {
        return new Builder().kind(CandidateKind.CITATION).rawText(rawText);
    }

    public static Builder definition(String term, String definitionText) {
        return new Builder().kind(CandidateKind.DEFINITION).term(term).definitionText(definitionText);
    }

    public static class Builder {
        private String candidateId;
        private CandidateKind kind;
        private String rawText;
        private String term;
        private String definitionText;
        private int page = 1;
        private int position = -1;
        private String sourceDocumentId;
        private ExtractionMethod extractionMethod;
        private double confidence;
        private boolean possiblyTruncated;

        public Builder candidateId(String candidateId) {
            this.candidateId = candidateId;
            return this;
        }

        public Builder kind(CandidateKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder rawText(String rawText) {
            this.rawText = rawText;
            return this;
        }

        public Builder term(String term) {
            this.term = term;
            return this;
        }

        public Builder definitionText(String definitionText) {
            this.definitionText = definitionText;
            return this;
        }

        public Builder page(int page) {
            this.page = page;
            return this;
        }

        public Builder position(int position) {
            this.position = position;
            return this;
        }

        public Builder sourceDocumentId(String sourceDocumentId) {
            this.sourceDocumentId = sourceDocumentId;
            return this;
        }

        public Builder extractionMethod(ExtractionMethod extractionMethod) {
            this.extractionMethod = extractionMethod;
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder possiblyTruncated(boolean possiblyTruncated) {
            this.possiblyTruncated = possiblyTruncated;
            return this;
        }

        public Candidate build() {
            if (rawText == null && kind == CandidateKind.DEFINITION && term != null) {
                rawText = definitionText != null ? term + ": " + definitionText : term;
            }
            return new Candidate(this);
        }
    }
}

package com.legal.extraction.canonical;

import com.legal.extraction.core.model.Candidate;
import com.legal.extraction.core.model.CandidateKind;
import com.legal.extraction.core.model.CanonicalKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Maps a candidate to its {@link CanonicalKey} and display form.
 *
 * <p>Canonicalization is pure and deterministic. It never fails: text that cannot be parsed
 * gets a hash-derived fallback key so that it still produces a record, which the merger may
 * later attach to an existing record by approximate matching.</p>
 */
public class Canonicalizer {
    private static final Logger log = LoggerFactory.getLogger(Canonicalizer.class);

    private static final int MIN_SENTENCE_LENGTH = 20;

    private final NormalizationEngine engine;
    private final CitationParser citationParser;

    public Canonicalizer() {
        this(NormalizationEngine.withDefaults());
    }

    public Canonicalizer(NormalizationEngine engine) {
        this.engine = engine;
        this.citationParser = new CitationParser();
    }

    public CanonicalForm canonicalize(Candidate candidate) {
        return candidate.isCitation() ? canonicalizeCitation(candidate) : canonicalizeDefinition(candidate);
    }

    /**
     * Normalized lower-case term, e.g. {@code "The Tax-Registration\nNumber"} becomes
     * {@code "tax registration number"}.
     */
    public String normalizeTerm(String term) {
        return engine.normalize(term, CandidateKind.DEFINITION);
    }

    public String normalizeCitation(String text) {
        return engine.normalize(text, CandidateKind.CITATION);
    }

    /**
     * Collapses whitespace, joins hyphenated line breaks and closes a full sentence with a period.
     */
    public String normalizeDefinition(String definition) {
        if (definition == null || definition.isBlank()) {
            return null;
        }
        String cleaned = definition
                .replaceAll("(\\p{L})-\\s*\\n\\s*(\\p{L})", "$1$2")
                .replaceAll("\\s+", " ")
                .trim();
        if (cleaned.length() > MIN_SENTENCE_LENGTH && !cleaned.matches(".*[.;:!?]$")) {
            cleaned = cleaned + ".";
        }
        return cleaned;
    }

    private CanonicalForm canonicalizeCitation(Candidate candidate) {
        String raw = candidate.getRawText() != null ? candidate.getRawText() : "";
        String normalized = normalizeCitation(raw);

        Optional<CitationParser.CitationParts> parts = citationParser.parse(raw);
        if (parts.isPresent()) {
            CitationParser.CitationParts p = parts.get();
            CanonicalKey key = CanonicalKey.citation(p.type(), p.number(), p.year());
            String display = p.type().displayName() + " No. (" + p.number() + ") of " + p.year();
            return new CanonicalForm(key, display, null, normalized);
        }

        CanonicalKey fallback = CanonicalKey.fallback(CandidateKind.CITATION, normalized);
        log.debug("canonicalize.fallback kind=CITATION key={} text='{}'", fallback.value(), raw);
        return new CanonicalForm(fallback, collapse(raw), null, normalized);
    }

    private CanonicalForm canonicalizeDefinition(Candidate candidate) {
        String term = candidate.getTerm();
        String body = candidate.getDefinitionText();

        if (term == null || term.isBlank()) {
            Optional<TermSplitter.Split> split = TermSplitter.split(candidate.getRawText());
            if (split.isPresent()) {
                term = split.get().term();
                if (body == null || body.isBlank()) {
                    body = split.get().body();
                }
            }
        }

        String definition = normalizeDefinition(body);
        String normalizedTerm = term != null ? normalizeTerm(term) : "";
        if (!normalizedTerm.isEmpty()) {
            return new CanonicalForm(CanonicalKey.definition(normalizedTerm), displayTerm(term),
                    definition, normalizedTerm);
        }

        String raw = candidate.getRawText() != null ? candidate.getRawText() : "";
        String normalizedRaw = normalizeTerm(raw);
        CanonicalKey fallback = CanonicalKey.fallback(CandidateKind.DEFINITION, normalizedRaw);
        log.debug("canonicalize.fallback kind=DEFINITION key={} text='{}'", fallback.value(), raw);
        return new CanonicalForm(fallback, collapse(raw), definition, normalizedRaw);
    }

    private static String displayTerm(String term) {
        return collapse(term.replaceAll("(\\p{L})-\\s*\\n\\s*(\\p{L})", "$1$2")
                .replaceAll("[\"\\u201C\\u201D]", ""));
    }

    private static String collapse(String text) {
        return text.replaceAll("\\s+", " ").trim();
    }
}

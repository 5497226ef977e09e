package com.legal.extraction.enhance;

import com.legal.extraction.core.model.Candidate;
import com.legal.extraction.core.model.ExtractionMethod;
import com.legal.extraction.extract.PageText;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Turns named-entity spans into citation candidates.
 * {@code LAW} spans are taken as-is; {@code ORG} spans only when they mention a legal instrument,
 * since models commonly label "Cabinet Resolution No. 37" as an organization.
 */
public class EntityRecognitionAdapter implements EnhancementAdapter {
    private static final Logger log = LoggerFactory.getLogger(EntityRecognitionAdapter.class);

    static final double NER_CONFIDENCE = 0.8;
    private static final int MIN_SPAN_LENGTH = 10;
    private static final Set<String> INSTRUMENT_WORDS = Set.of("law", "decree", "resolution", "cabinet");

    private final EntityRecognizer recognizer;

    public EntityRecognitionAdapter(EntityRecognizer recognizer) {
        this.recognizer = Objects.requireNonNull(recognizer, "recognizer is required");
    }

    @Override
    public List<Candidate> enrich(EnhancementDocument document) {
        List<Candidate> candidates = new ArrayList<>();
        for (PageText page : document.pages()) {
            for (EntityRecognizer.RecognizedEntity entity : recognizer.recognize(page.text())) {
                if (isCitationSpan(entity)) {
                    candidates.add(Candidate.citation(entity.text().strip())
                            .page(page.pageNumber())
                            .position(entity.start())
                            .sourceDocumentId(document.documentId())
                            .extractionMethod(ExtractionMethod.NER)
                            .confidence(NER_CONFIDENCE)
                            .build());
                }
            }
        }
        log.debug("enhance.completed adapter={} documentId={} candidates={}",
                getName(), document.documentId(), candidates.size());
        return candidates;
    }

    boolean isCitationSpan(EntityRecognizer.RecognizedEntity entity) {
        if (entity.text() == null || entity.text().strip().length() < MIN_SPAN_LENGTH) {
            return false;
        }
        String label = entity.label() != null ? entity.label().toUpperCase(Locale.ROOT) : "";
        if (label.equals("LAW")) {
            return true;
        }
        if (label.equals("ORG")) {
            String lower = entity.text().toLowerCase(Locale.ROOT);
            return INSTRUMENT_WORDS.stream().anyMatch(lower::contains);
        }
        return false;
    }

    @Override
    public String getName() {
        return "ner/" + recognizer.getModelName();
    }

    @Override
    public ExtractionMethod getExtractionMethod() {
        return ExtractionMethod.NER;
    }

    @Override
    public boolean isAvailable() {
        return recognizer.isReady();
    }
}

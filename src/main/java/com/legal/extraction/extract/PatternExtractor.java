package com.legal.extraction.extract;

import com.legal.extraction.core.model.Candidate;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Deterministic, rule-based extractor of citations and definitions from page text.
 *
 * <p>Citations are produced lazily as the page is scanned; definitions follow once the
 * citation scan is exhausted. The extractor holds no mutable state and can be shared
 * across threads.</p>
 */
public class PatternExtractor {

    public static final int DEFAULT_MAX_LOOKAHEAD_LINES = 2;

    private final int maxLookaheadLines;

    public PatternExtractor() {
        this(DEFAULT_MAX_LOOKAHEAD_LINES);
    }

    public PatternExtractor(int maxLookaheadLines) {
        if (maxLookaheadLines < 0) {
            throw new IllegalArgumentException("maxLookaheadLines must be >= 0");
        }
        this.maxLookaheadLines = maxLookaheadLines;
    }

    public int getMaxLookaheadLines() {
        return maxLookaheadLines;
    }

    public CandidateSequence extract(PageText page) {
        if (page.text().isBlank() && page.layoutHints().isEmpty()) {
            return CandidateSequence.empty();
        }
        return new CandidateSequence(() -> new PageIterator(page));
    }

    private final class PageIterator implements Iterator<Candidate> {
        private final PageText page;
        private final String cleaned;
        private final CitationScanner citations;
        private Iterator<Candidate> definitions;

        PageIterator(PageText page) {
            this.page = page;
            this.cleaned = PageCleaner.clean(page.text());
            this.citations = new CitationScanner(page.documentId(), page.pageNumber(), cleaned, maxLookaheadLines);
        }

        @Override
        public boolean hasNext() {
            if (citations.hasNext()) {
                return true;
            }
            if (definitions == null) {
                definitions = new DefinitionGrammar(page.documentId(), page.pageNumber())
                        .extract(cleaned, page.layoutHints())
                        .iterator();
            }
            return definitions.hasNext();
        }

        @Override
        public Candidate next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return citations.hasNext() ? citations.next() : definitions.next();
        }
    }
}

package com.legal.extraction.extract;

import java.util.List;
import java.util.Objects;

/**
 * Text of one page as delivered by the ingestion layer.
 *
 * @param documentId  document the page belongs to
 * @param pageNumber  1-based page number
 * @param text        plain page text, line breaks preserved
 * @param layoutHints bold-term pairings found by the layout reader, may be empty
 */
public record PageText(String documentId, int pageNumber, String text, List<LayoutHint> layoutHints) {

    public PageText {
        Objects.requireNonNull(documentId, "documentId is required");
        if (pageNumber < 1) {
            throw new IllegalArgumentException("pageNumber must be >= 1");
        }
        text = text != null ? text : "";
        layoutHints = layoutHints != null ? List.copyOf(layoutHints) : List.of();
    }

    public PageText(String documentId, int pageNumber, String text) {
        this(documentId, pageNumber, text, List.of());
    }
}

package com.legal.extraction.enhance;

import com.legal.extraction.extract.PageText;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * The document view handed to enhancement sources.
 */
public record EnhancementDocument(String documentId, List<PageText> pages) {

    public EnhancementDocument {
        Objects.requireNonNull(documentId, "documentId is required");
        pages = pages != null ? List.copyOf(pages) : List.of();
    }

    public String fullText() {
        return pages.stream().map(PageText::text).collect(Collectors.joining("\n"));
    }

    public int pageCount() {
        return pages.size();
    }
}

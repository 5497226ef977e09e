package com.legal.extraction.pipeline;

import com.legal.extraction.extract.PageText;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One document to process: its id and its pages in order.
 */
public record DocumentInput(String documentId, List<PageText> pages) {

    public DocumentInput {
        Objects.requireNonNull(documentId, "documentId is required");
        pages = pages != null ? List.copyOf(pages) : List.of();
        for (PageText page : pages) {
            if (!documentId.equals(page.documentId())) {
                throw new IllegalArgumentException("Page " + page.pageNumber() + " belongs to document "
                        + page.documentId() + ", not " + documentId);
            }
        }
    }

    /**
     * Plain-text pages numbered from 1.
     */
    public static DocumentInput of(String documentId, String... pageTexts) {
        List<PageText> pages = new ArrayList<>(pageTexts.length);
        for (int i = 0; i < pageTexts.length; i++) {
            pages.add(new PageText(documentId, i + 1, pageTexts[i]));
        }
        return new DocumentInput(documentId, pages);
    }
}

package com.legal.extraction.extract;

import java.util.Objects;

/**
 * A term/definition pairing derived from page layout (a bold term followed by its body).
 *
 * @param term       the visually emphasized term
 * @param definition the text that follows it
 * @param quality    how cleanly the layout reader separated the two, in [0, 1]
 */
public record LayoutHint(String term, String definition, double quality) {

    public LayoutHint {
        Objects.requireNonNull(term, "term is required");
        if (quality < 0.0 || quality > 1.0) {
            throw new IllegalArgumentException("quality must be between 0.0 and 1.0");
        }
    }
}

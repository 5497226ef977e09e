package com.legal.extraction.enhance;

import java.util.List;

/**
 * A named-entity recognition model. Only its output contract matters here.
 */
public interface EntityRecognizer {

    List<RecognizedEntity> recognize(String text);

    String getModelName();

    default boolean isReady() {
        return true;
    }

    /**
     * One recognized span.
     *
     * @param text  the span text
     * @param label entity label, e.g. {@code LAW} or {@code ORG}
     * @param start start offset in the input
     * @param end   end offset in the input
     */
    record RecognizedEntity(String text, String label, int start, int end) {
    }
}

package com.legal.extraction.enhance;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits long text into overlapping windows for model prompts, preferring to cut at a line break.
 */
public final class TextChunker {

    public static final int DEFAULT_CHUNK_SIZE = 3500;
    public static final int DEFAULT_OVERLAP = 200;

    private TextChunker() {
    }

    public static List<String> chunk(String text, int chunkSize, int overlap) {
        if (chunkSize <= 0 || overlap < 0 || overlap >= chunkSize) {
            throw new IllegalArgumentException("Need chunkSize > overlap >= 0");
        }
        if (text == null || text.isBlank()) {
            return List.of();
        }
        if (text.length() <= chunkSize) {
            return List.of(text);
        }
        List<String> chunks = new ArrayList<>();
        int start = 0;
        while (start < text.length()) {
            int end = Math.min(start + chunkSize, text.length());
            if (end < text.length()) {
                int lineBreak = text.lastIndexOf('\n', end);
                if (lineBreak > start + overlap) {
                    end = lineBreak;
                }
            }
            chunks.add(text.substring(start, end));
            if (end == text.length()) {
                break;
            }
            start = end - overlap;
        }
        return chunks;
    }
}

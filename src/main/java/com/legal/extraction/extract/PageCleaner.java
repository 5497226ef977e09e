package com.legal.extraction.extract;

import java.util.Arrays;
import java.util.List;

/**
 * Strips running headers and footers from a page before pattern matching.
 * Only pages with at least {@value #MIN_LINES} lines are touched; shorter text is
 * usually a fragment and has no furniture to remove.
 */
public final class PageCleaner {

    static final int MIN_LINES = 10;
    private static final int MAX_HEADER_LINES = 3;
    private static final int MAX_FOOTER_LINES = 3;
    private static final int HEADER_MAX_LENGTH = 80;
    private static final int FOOTER_MAX_LENGTH = 10;

    private PageCleaner() {
    }

    public static String clean(String text) {
        if (text == null) {
            return "";
        }
        List<String> lines = Arrays.asList(text.split("\n", -1));
        if (lines.size() < MIN_LINES) {
            return text;
        }

        int start = 0;
        for (int i = 0; i < MAX_HEADER_LINES; i++) {
            String line = lines.get(i).strip();
            if (line.length() < HEADER_MAX_LENGTH && !line.matches(".*[.;:]$")) {
                start = i + 1;
            } else {
                break;
            }
        }

        int end = lines.size();
        for (int i = lines.size() - 1; i >= Math.max(lines.size() - MAX_FOOTER_LINES, start); i--) {
            String line = lines.get(i).strip();
            if (line.matches("\\d+") || line.length() < FOOTER_MAX_LENGTH) {
                end = i;
            } else {
                break;
            }
        }

        return String.join("\n", lines.subList(start, end));
    }
}

package com.legal.extraction.canonical;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits "Term: body" or "Term means body" text into its two halves.
 */
public final class TermSplitter {

    private static final Pattern COLON = Pattern.compile(
            "^\\s*[\"\\u201C]?([^:\\n\\u2013\\u2014]{1,80}?)[\"\\u201D]?\\s*[:\\u2013\\u2014]\\s*(.+)$",
            Pattern.DOTALL);
    private static final Pattern VERB = Pattern.compile(
            "^\\s*[\"\\u201C]?(.{1,80}?)[\"\\u201D]?\\s+(?:means|shall\\s+mean|refers\\s+to|is\\s+defined\\s+as|denotes)\\s+(.+)$",
            Pattern.DOTALL | Pattern.CASE_INSENSITIVE);

    public record Split(String term, String body) {
    }

    private TermSplitter() {
    }

    public static Optional<Split> split(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        Split byVerb = null;
        Matcher verb = VERB.matcher(text);
        if (verb.matches()) {
            byVerb = new Split(verb.group(1).trim(), verb.group(2).trim());
        }
        Split byColon = null;
        Matcher colon = COLON.matcher(text);
        if (colon.matches()) {
            byColon = new Split(colon.group(1).trim(), colon.group(2).trim());
        }
        // the earlier separator wins
        if (byVerb != null && byColon != null) {
            return Optional.of(byColon.term().length() <= byVerb.term().length() ? byColon : byVerb);
        }
        if (byVerb != null) {
            return Optional.of(byVerb);
        }
        if (byColon != null) {
            return Optional.of(byColon);
        }
        return Optional.empty();
    }
}

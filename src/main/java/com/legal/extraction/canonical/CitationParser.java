package com.legal.extraction.canonical;

import com.legal.extraction.core.model.InstrumentType;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls (type, number, year) out of a citation text.
 * Understands "No. (7) of 2017", "No 7 of 2017", "(7) of 2017", "7 of 2017" and "7/2017".
 * Only the text between the opening keyword and the next instrument keyword is read.
 */
public class CitationParser {

    private static final Pattern NUMBER_AFTER_KEYWORD = Pattern.compile(
            "^[\\s,]*(?:No\\.?|Number)?\\s*\\(?\\s*(\\d+)\\s*\\)?(?:\\s*/\\s*(\\d{4})\\b)?",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern NUMBER_MARKER = Pattern.compile(
            "\\bNo\\.?\\s*\\(?\\s*(\\d+)\\s*\\)?", Pattern.CASE_INSENSITIVE);
    private static final Pattern SLASH_FORM = Pattern.compile("\\b(\\d+)\\s*/\\s*(\\d{4})\\b");
    private static final Pattern YEAR = Pattern.compile(
            "\\bof\\s+(?:the\\s+year\\s+)?(\\d{4})\\b", Pattern.CASE_INSENSITIVE);

    public record CitationParts(InstrumentType type, String number, int year) {
    }

    public Optional<CitationParts> parse(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        Optional<InstrumentType.KeywordMatch> located = InstrumentType.locate(text);
        if (located.isEmpty()) {
            return Optional.empty();
        }
        InstrumentType type = located.get().type();
        String tail = text.substring(located.get().end());
        Optional<InstrumentType.KeywordMatch> next = InstrumentType.locate(tail);
        if (next.isPresent()) {
            tail = tail.substring(0, next.get().start());
        }

        String number = null;
        String year = null;

        Matcher direct = NUMBER_AFTER_KEYWORD.matcher(tail);
        if (direct.lookingAt()) {
            number = direct.group(1);
            year = direct.group(2);
        } else {
            Matcher marker = NUMBER_MARKER.matcher(tail);
            if (marker.find()) {
                number = marker.group(1);
            } else {
                Matcher slash = SLASH_FORM.matcher(tail);
                if (slash.find()) {
                    number = slash.group(1);
                    year = slash.group(2);
                }
            }
        }

        if (year == null) {
            Matcher yearMatcher = YEAR.matcher(tail);
            if (yearMatcher.find()) {
                year = yearMatcher.group(1);
            }
        }

        if (number == null || year == null) {
            return Optional.empty();
        }
        return Optional.of(new CitationParts(type, stripLeadingZeros(number), Integer.parseInt(year)));
    }

    private static String stripLeadingZeros(String number) {
        String stripped = number.replaceFirst("^0+(?=\\d)", "");
        return stripped.isEmpty() ? "0" : stripped;
    }
}

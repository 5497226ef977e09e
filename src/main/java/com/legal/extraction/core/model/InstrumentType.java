package com.legal.extraction.core.model;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fixed enumeration of legal instrument types a citation can refer to.
 * The keyword that opens a citation decides its type; declaration order, most specific first,
 * breaks ties so that "Federal Decree-Law" is never mistaken for "Federal Decree".
 */
public enum InstrumentType {
    FEDERAL_DECREE_LAW("federal_decree_law", "Federal Decree-Law",
            "Federal\\s+Decree[\\s-]*(?:by\\s+)?Law", "Decree[\\s-]*Law"),
    FEDERAL_LAW("federal_law", "Federal Law", "Federal\\s+Law"),
    CABINET_RESOLUTION("cabinet_resolution", "Cabinet Resolution", "Cabinet\\s+(?:Resolution|Decision)"),
    MINISTERIAL_RESOLUTION("ministerial_resolution", "Ministerial Resolution",
            "Ministerial\\s+(?:Resolution|Decision)"),
    FEDERAL_DECREE("federal_decree", "Federal Decree", "Federal\\s+Decree");

    private final String slug;
    private final String displayName;
    private final List<Pattern> patterns;

    InstrumentType(String slug, String displayName, String... regexes) {
        this.slug = slug;
        this.displayName = displayName;
        this.patterns = Arrays.stream(regexes)
                .map(r -> Pattern.compile(r, Pattern.CASE_INSENSITIVE))
                .toList();
    }

    public String slug() {
        return slug;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * A keyword occurrence: the type it names and where it sits in the text.
     */
    public record KeywordMatch(InstrumentType type, int start, int end) {
    }

    /**
     * Finds the type whose keyword starts earliest in the text. When two keywords start at the
     * same offset, the type declared first (the more specific one) wins.
     */
    public static Optional<KeywordMatch> locate(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        KeywordMatch earliest = null;
        for (InstrumentType type : values()) {
            for (Pattern pattern : type.patterns) {
                Matcher matcher = pattern.matcher(text);
                if (matcher.find() && (earliest == null || matcher.start() < earliest.start())) {
                    earliest = new KeywordMatch(type, matcher.start(), matcher.end());
                }
            }
        }
        return Optional.ofNullable(earliest);
    }

    /**
     * The type of the instrument named first in the text.
     */
    public static Optional<InstrumentType> detect(String text) {
        return locate(text).map(KeywordMatch::type);
    }

    /**
     * End offset of this type's first keyword in the text, or -1 when it does not occur.
     */
    public int keywordEnd(String text) {
        int start = Integer.MAX_VALUE;
        int end = -1;
        for (Pattern pattern : patterns) {
            Matcher matcher = pattern.matcher(text);
            if (matcher.find() && matcher.start() < start) {
                start = matcher.start();
                end = matcher.end();
            }
        }
        return end;
    }

    public static InstrumentType fromSlug(String slug) {
        for (InstrumentType type : values()) {
            if (type.slug.equals(slug)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown instrument type: " + slug);
    }
}

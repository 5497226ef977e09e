package com.legal.extraction.extract;

import com.legal.extraction.core.model.Candidate;
import com.legal.extraction.core.model.CandidateKind;
import com.legal.extraction.core.model.ExtractionMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognizes term definitions on a cleaned page.
 *
 * <ul>
 *   <li>{@code Term: body} on one line, the body continuing until the next entry ({@value #COLON_CONFIDENCE})</li>
 *   <li>a term alone on its line and the body on the next line starting with a colon ({@value #NEWLINE_CONFIDENCE})</li>
 *   <li>{@code Term means body.} and its variants ({@value #MEANS_CONFIDENCE})</li>
 *   <li>layout pairings supplied with the page, scored {@code 0.6 + 0.3 * quality}</li>
 * </ul>
 */
class DefinitionGrammar {
    private static final Logger log = LoggerFactory.getLogger(DefinitionGrammar.class);

    static final double COLON_CONFIDENCE = 0.95;
    static final double NEWLINE_CONFIDENCE = 0.88;
    static final double MEANS_CONFIDENCE = 0.82;
    static final double LAYOUT_BASE_CONFIDENCE = 0.6;
    static final double LAYOUT_QUALITY_WEIGHT = 0.3;
    static final double TRUNCATION_PENALTY = 0.25;

    private static final Pattern COLON_ENTRY = Pattern.compile(
            "^\\s*(?:[\\u2212\\u2013\\u2014\\u2022*-]\\s*)?[\"\\u201C]?([A-Z][^:\"\\u201D\\n]{0,79}?)[\"\\u201D]?"
                    + "\\s*[:\\u2013\\u2014]\\s*(\\S.*)$");
    private static final Pattern TERM_ONLY = Pattern.compile(
            "^\\s*(?:[\\u2212\\u2013\\u2014\\u2022*-]\\s*)?[\"\\u201C]?([A-Z][^:.;\"\\u201D\\n]{0,79}?)[\"\\u201D]?\\s*$");
    private static final Pattern COLON_CONTINUATION = Pattern.compile("^\\s*[:\\u2013\\u2014]\\s*(.*)$");
    private static final Pattern STRUCTURE_LINE = Pattern.compile(
            "^\\s*(?:Article|Chapter|Section|Part)\\s*\\(?\\s*\\w+", Pattern.CASE_INSENSITIVE);
    private static final Pattern MEANS = Pattern.compile(
            "(?:^|(?<=[.;:]\\s))[ \\t]*[\"\\u201C]?([A-Z][\\w&()'\\- ]{0,79}?)[\"\\u201D]?\\s+"
                    + "(?:means|shall\\s+mean|refers\\s+to|is\\s+defined\\s+as|denotes)\\s+",
            Pattern.MULTILINE);
    private static final Pattern SENTENCE_STOP = Pattern.compile("[.;](?=\\s|$)|\\n\\s*\\n");
    private static final Pattern TERMINATED = Pattern.compile("(?s).*[.;:!?)]$");

    private final String documentId;
    private final int pageNumber;

    DefinitionGrammar(String documentId, int pageNumber) {
        this.documentId = documentId;
        this.pageNumber = pageNumber;
    }

    List<Candidate> extract(String text, List<LayoutHint> layoutHints) {
        List<Candidate> candidates = new ArrayList<>();
        extractLineEntries(text, candidates);
        extractMeansSentences(text, candidates);
        for (LayoutHint hint : layoutHints) {
            fromLayout(text, hint, candidates);
        }
        return candidates;
    }

    private void extractLineEntries(String text, List<Candidate> out) {
        String[] lines = text.split("\n", -1);
        int[] offsets = lineOffsets(lines);

        int i = 0;
        while (i < lines.length) {
            Matcher colon = COLON_ENTRY.matcher(lines[i]);
            if (colon.matches() && TermValidator.isValidTerm(colon.group(1).strip())) {
                int end = continuationEnd(lines, i + 1);
                String body = joinBody(colon.group(2), lines, i + 1, end);
                emitEntry(out, colon.group(1), body, ExtractionMethod.COLON_PATTERN, COLON_CONFIDENCE,
                        offsets[i], end == lines.length);
                i = end;
                continue;
            }

            Matcher termOnly = TERM_ONLY.matcher(lines[i]);
            if (termOnly.matches() && i + 1 < lines.length) {
                Matcher next = COLON_CONTINUATION.matcher(lines[i + 1]);
                if (next.matches() && TermValidator.isValidTerm(termOnly.group(1).strip())) {
                    int end = continuationEnd(lines, i + 2);
                    String body = joinBody(next.group(1), lines, i + 2, end);
                    emitEntry(out, termOnly.group(1), body, ExtractionMethod.NEWLINE_COLON_PATTERN,
                            NEWLINE_CONFIDENCE, offsets[i], end == lines.length);
                    i = end;
                    continue;
                }
            }
            i++;
        }
    }

    private void extractMeansSentences(String text, List<Candidate> out) {
        Matcher means = MEANS.matcher(text);
        while (means.find()) {
            String term = means.group(1).strip();
            int bodyStart = means.end();
            Matcher stop = SENTENCE_STOP.matcher(text);
            boolean reachedEnd;
            int bodyEnd;
            if (stop.find(bodyStart)) {
                bodyEnd = text.charAt(stop.start()) == '\n' ? stop.start() : stop.end();
                reachedEnd = false;
            } else {
                bodyEnd = text.length();
                reachedEnd = true;
            }
            String body = text.substring(bodyStart, bodyEnd).replaceAll("\\s+", " ").strip();
            if (!TermValidator.isValidPair(term, body)) {
                log.trace("definition.skipped method=means term='{}'", term);
                continue;
            }
            boolean truncated = reachedEnd && !TERMINATED.matcher(body).matches();
            String raw = text.substring(means.start(), bodyEnd).replaceAll("\\s+", " ").strip();
            out.add(candidate(term, body, raw, ExtractionMethod.MEANS_PATTERN, MEANS_CONFIDENCE,
                    means.start(1), truncated));
        }
    }

    private void fromLayout(String text, LayoutHint hint, List<Candidate> out) {
        String term = hint.term().strip();
        String body = hint.definition() != null ? hint.definition().replaceAll("\\s+", " ").strip() : null;
        if (!TermValidator.isValidPair(term, body)) {
            log.trace("definition.skipped method=layout term='{}'", term);
            return;
        }
        double confidence = LAYOUT_BASE_CONFIDENCE + LAYOUT_QUALITY_WEIGHT * hint.quality();
        out.add(candidate(term, body, term + ": " + body, ExtractionMethod.LAYOUT, confidence,
                text.indexOf(term), false));
    }

    private void emitEntry(List<Candidate> out, String rawTerm, String body, ExtractionMethod method,
                           double confidence, int position, boolean reachedEnd) {
        String term = rawTerm.strip();
        if (!TermValidator.isValidDefinition(body)) {
            log.trace("definition.skipped method={} term='{}'", method.tag(), term);
            return;
        }
        boolean truncated = reachedEnd && !TERMINATED.matcher(body).matches();
        out.add(candidate(term, body, term + ": " + body, method, confidence, position, truncated));
    }

    private Candidate candidate(String term, String body, String raw, ExtractionMethod method,
                                double confidence, int position, boolean truncated) {
        return Candidate.builder()
                .kind(CandidateKind.DEFINITION)
                .term(term)
                .definitionText(body)
                .rawText(raw)
                .page(pageNumber)
                .position(position)
                .sourceDocumentId(documentId)
                .extractionMethod(method)
                .confidence(truncated ? Math.max(0.0, confidence - TRUNCATION_PENALTY) : confidence)
                .possiblyTruncated(truncated)
                .build();
    }

    /**
     * Index of the first line after {@code from} that no longer continues the current body.
     */
    private int continuationEnd(String[] lines, int from) {
        int j = from;
        while (j < lines.length) {
            String line = lines[j];
            if (line.isBlank() || STRUCTURE_LINE.matcher(line).lookingAt() || startsEntry(lines, j)) {
                break;
            }
            j++;
        }
        return j;
    }

    private boolean startsEntry(String[] lines, int j) {
        Matcher colon = COLON_ENTRY.matcher(lines[j]);
        if (colon.matches() && TermValidator.isValidTerm(colon.group(1).strip())) {
            return true;
        }
        if (j + 1 < lines.length && TERM_ONLY.matcher(lines[j]).matches()
                && COLON_CONTINUATION.matcher(lines[j + 1]).matches()) {
            return true;
        }
        Matcher means = MEANS.matcher(lines[j]);
        return means.lookingAt();
    }

    private static String joinBody(String first, String[] lines, int from, int to) {
        StringBuilder body = new StringBuilder(first.strip());
        for (int k = from; k < to; k++) {
            String line = lines[k].strip();
            if (body.length() > 0 && body.charAt(body.length() - 1) == '-') {
                body.setLength(body.length() - 1);
                body.append(line);
            } else {
                body.append(' ').append(line);
            }
        }
        return body.toString()
                .replaceFirst("(?i);\\s*and\\s*$", "")
                .replaceFirst(";\\s*$", "")
                .strip();
    }

    private static int[] lineOffsets(String[] lines) {
        int[] offsets = new int[lines.length];
        int offset = 0;
        for (int k = 0; k < lines.length; k++) {
            offsets[k] = offset;
            offset += lines[k].length() + 1;
        }
        return offsets;
    }
}

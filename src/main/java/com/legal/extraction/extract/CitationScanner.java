package com.legal.extraction.extract;

import com.legal.extraction.core.model.Candidate;
import com.legal.extraction.core.model.CandidateKind;
import com.legal.extraction.core.model.ExtractionMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lazily scans a cleaned page for citations of other legal instruments.
 *
 * <p>Each citation is recognized by a small state machine:
 * {@code IDLE -> SAW_TYPE_KEYWORD -> SAW_NUMBER -> SAW_YEAR -> CLOSING}. Once a type keyword
 * is found, the number, year and closing clause must all lie within the keyword's line plus
 * {@code maxLookaheadLines} further lines, after which whatever was recognized is emitted.
 * When the page itself ends before the citation is complete, the candidate is emitted
 * with {@code possiblyTruncated} set and a lower confidence.</p>
 *
 * <p>Instances are single-use iterators; {@link PatternExtractor} creates a fresh one per scan.</p>
 */
class CitationScanner implements Iterator<Candidate> {
    private static final Logger log = LoggerFactory.getLogger(CitationScanner.class);

    static final double BASE_CONFIDENCE = 0.85;
    static final double PARENTHESIZED_NUMBER_BONUS = 0.05;
    static final double YEAR_BONUS = 0.05;
    static final double TITLE_CLAUSE_BONUS = 0.05;
    static final double MISSING_YEAR_PENALTY = 0.20;
    static final double TRUNCATION_PENALTY = 0.25;
    static final int MIN_LENGTH = 20;
    static final int MAX_LENGTH = 200;

    private static final Pattern KEYWORD = Pattern.compile(
            "(?:[\\u2212\\u2013\\u2014\\u2022]\\s*)?"
                    + "(?:Federal\\s+Decree[\\s-]*(?:by\\s+)?Law|Decree[\\s-]*Law|Federal\\s+Law"
                    + "|Cabinet\\s+(?:Resolution|Decision)|Ministerial\\s+(?:Resolution|Decision)|Federal\\s+Decree)",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern PARENTHESIZED_NUMBER = Pattern.compile(
            "\\s*(?:(?:No\\.?|Number)\\s*)?\\(\\s*\\d+\\s*\\)", Pattern.CASE_INSENSITIVE);
    private static final Pattern PLAIN_NUMBER = Pattern.compile(
            "\\s*(?:(?:No\\.?|Number)\\s*\\d+|\\d+(?=\\s*(?:/\\s*\\d{4}|of\\b)))", Pattern.CASE_INSENSITIVE);
    private static final Pattern YEAR = Pattern.compile(
            "\\s*(?:of\\s+(?:the\\s+year\\s+)?|/\\s*)\\d{4}\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern AMENDED = Pattern.compile(
            ",?\\s+as\\s+amended\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern TITLE_CLAUSE = Pattern.compile(
            ",?\\s+(?:on|regarding|concerning|issuing|promulgating|in\\s+respect\\s+of)\\b",
            Pattern.CASE_INSENSITIVE);
    // a dangling prefix of a number or year token at the very end of the page
    private static final Pattern PARTIAL_TOKEN = Pattern.compile(
            "\\s*(?:No\\.?|Number|of|/)?\\s*\\(?\\s*\\d*\\s*",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern DANGLING_CLAUSE = Pattern.compile(
            "(?is).*(?:\\b(?:of|and|the|on|for|to|in|regarding|concerning|issuing)|,)$");
    private static final Pattern CLAUSE_STOP = Pattern.compile("[.;]");

    private final String documentId;
    private final int pageNumber;
    private final String text;
    private final int maxLookaheadLines;
    private final Matcher keywordMatcher;

    private int searchFrom;
    private Candidate next;

    CitationScanner(String documentId, int pageNumber, String cleanedText, int maxLookaheadLines) {
        this.documentId = documentId;
        this.pageNumber = pageNumber;
        this.text = cleanedText;
        this.maxLookaheadLines = maxLookaheadLines;
        this.keywordMatcher = KEYWORD.matcher(cleanedText);
    }

    @Override
    public boolean hasNext() {
        if (next == null) {
            next = advance();
        }
        return next != null;
    }

    @Override
    public Candidate next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        Candidate result = next;
        next = null;
        return result;
    }

    private Candidate advance() {
        while (searchFrom < text.length() && keywordMatcher.find(searchFrom)) {
            int start = keywordMatcher.start();
            Candidate candidate = scanFrom(start, keywordMatcher.end());
            if (candidate != null) {
                return candidate;
            }
        }
        return null;
    }

    /**
     * Runs the state machine from one keyword occurrence and positions {@link #searchFrom}
     * after whatever was consumed.
     */
    private Candidate scanFrom(int start, int keywordEnd) {
        int windowEnd = windowEnd(start);
        boolean windowReachesEnd = windowEnd == text.length();

        ScanState state = ScanState.SAW_TYPE_KEYWORD;
        int pos = keywordEnd;
        boolean parenthesized = false;
        boolean hasYear = false;
        boolean titleClause = false;
        boolean truncated = false;

        scan:
        while (true) {
            switch (state) {
                case SAW_TYPE_KEYWORD -> {
                    Matcher paren = region(PARENTHESIZED_NUMBER, pos, windowEnd);
                    Matcher plain = region(PLAIN_NUMBER, pos, windowEnd);
                    if (paren.lookingAt()) {
                        parenthesized = true;
                        pos = paren.end();
                        state = ScanState.SAW_NUMBER;
                    } else if (plain.lookingAt()) {
                        pos = plain.end();
                        state = ScanState.SAW_NUMBER;
                    } else {
                        if (windowReachesEnd && danglesAtEnd(pos)) {
                            truncated = true;
                            pos = text.length();
                            break scan;
                        }
                        // a keyword without a number is a mention, not a citation
                        searchFrom = keywordEnd;
                        return null;
                    }
                }
                case SAW_NUMBER -> {
                    Matcher year = region(YEAR, pos, windowEnd);
                    if (year.lookingAt()) {
                        hasYear = true;
                        pos = year.end();
                        state = ScanState.SAW_YEAR;
                    } else if (windowReachesEnd && danglesAtEnd(pos)) {
                        truncated = true;
                        pos = text.length();
                        break scan;
                    } else {
                        state = ScanState.CLOSING;
                    }
                }
                case SAW_YEAR -> {
                    Matcher amended = region(AMENDED, pos, windowEnd);
                    if (amended.lookingAt()) {
                        pos = amended.end();
                    }
                    state = ScanState.CLOSING;
                }
                case CLOSING -> {
                    Matcher clause = region(TITLE_CLAUSE, pos, windowEnd);
                    if (clause.lookingAt()) {
                        titleClause = true;
                        int clauseEnd = clauseEnd(clause.end(), windowEnd);
                        if (clauseEnd == text.length()
                                && DANGLING_CLAUSE.matcher(text.substring(pos, clauseEnd).strip()).matches()) {
                            truncated = true;
                        }
                        pos = clauseEnd;
                    }
                    break scan;
                }
                default -> throw new IllegalStateException("Unexpected scan state " + state);
            }
        }

        searchFrom = Math.max(pos, keywordEnd);
        String rawText = clean(text.substring(start, pos));
        if (rawText.length() < MIN_LENGTH || rawText.length() > MAX_LENGTH) {
            log.trace("citation.skipped reason=length length={} text='{}'", rawText.length(), rawText);
            return null;
        }

        double confidence = BASE_CONFIDENCE;
        if (parenthesized) {
            confidence += PARENTHESIZED_NUMBER_BONUS;
        }
        if (hasYear) {
            confidence += YEAR_BONUS;
        } else {
            confidence -= MISSING_YEAR_PENALTY;
        }
        if (titleClause) {
            confidence += TITLE_CLAUSE_BONUS;
        }
        if (truncated) {
            confidence -= TRUNCATION_PENALTY;
        }

        return Candidate.builder()
                .kind(CandidateKind.CITATION)
                .rawText(rawText)
                .page(pageNumber)
                .position(start)
                .sourceDocumentId(documentId)
                .extractionMethod(ExtractionMethod.REGEX)
                .confidence(Math.max(0.0, Math.min(1.0, confidence)))
                .possiblyTruncated(truncated)
                .build();
    }

    /**
     * End of the line holding {@code start} plus {@code maxLookaheadLines} more lines.
     */
    private int windowEnd(int start) {
        int end = start;
        for (int line = 0; line <= maxLookaheadLines; line++) {
            int newline = text.indexOf('\n', end);
            if (newline < 0) {
                return text.length();
            }
            end = newline + 1;
        }
        return end - 1;
    }

    /**
     * A title clause runs to the first sentence stop, the next cited instrument or the window end.
     */
    private int clauseEnd(int from, int windowEnd) {
        int end = windowEnd;
        Matcher stop = region(CLAUSE_STOP, from, windowEnd);
        if (stop.find()) {
            end = stop.start();
        }
        Matcher nextKeyword = region(KEYWORD, from, end);
        if (nextKeyword.find()) {
            end = nextKeyword.start();
            // drop a joining "and" or comma before the next instrument
            String head = text.substring(from, end).replaceFirst("(?i)[\\s,]*(?:and)?\\s*$", "");
            end = from + head.length();
        }
        return end;
    }

    private boolean danglesAtEnd(int pos) {
        Matcher partial = region(PARTIAL_TOKEN, pos, text.length());
        return partial.matches();
    }

    private Matcher region(Pattern pattern, int from, int to) {
        Matcher matcher = pattern.matcher(text);
        matcher.region(from, Math.max(from, to));
        return matcher;
    }

    static String clean(String citation) {
        return citation
                .replaceAll("\\s+", " ")
                .replaceFirst("^[\\u2212\\u2013\\u2014\\u2022]\\s*", "")
                .replaceFirst("(?i);\\s*and\\s*$", "")
                .replaceFirst("[;,]\\s*$", "")
                .replaceAll("(?i)No\\.\\s*\\(", "No. (")
                .replaceAll("\\)\\s*of\\s*", ") of ")
                .trim();
    }
}

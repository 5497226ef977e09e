package com.legal.extraction.extract;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Structural checks that separate defined terms from sentence fragments picked up by the
 * definition patterns. A term has to read as a noun phrase; a definition must not be
 * preamble text, a bare cross-reference or a citation.
 */
public final class TermValidator {

    static final int MIN_TERM_LENGTH = 2;
    static final int MAX_TERM_LENGTH = 60;
    static final int MIN_DEFINITION_LENGTH = 5;
    static final int MAX_DEFINITION_LENGTH = 2000;

    private static final Set<String> SENTENCE_STARTERS = Set.of(
            "whereas", "therefore", "however", "moreover", "furthermore", "nevertheless",
            "accordingly", "consequently", "hence", "thus", "when", "where", "while", "although",
            "though", "unless", "if", "because", "since", "as", "after", "before", "until");
    private static final Set<String> VERB_FORMS = Set.of(
            "notifying", "providing", "submitting", "issuing", "establishing", "creating", "forming",
            "making", "taking", "giving", "receiving", "sending", "filing", "requesting", "requiring",
            "ensuring", "determining", "calculating", "processing", "reviewing", "approving");
    private static final Set<String> DETERMINERS = Set.of("the", "any", "all", "each", "every", "some");
    private static final Set<String> DETERMINER_FOLLOWERS = Set.of(
            "other", "following", "such", "said", "aforementioned");
    private static final Set<String> GENERIC_WORDS = Set.of(
            "article", "chapter", "section", "part", "clause", "paragraph", "procedures",
            "regulations", "resolution", "decree", "law", "cabinet", "constitution");
    private static final Set<String> DANGLING_LAST_WORDS = Set.of(
            "the", "a", "an", "this", "that", "these", "those", "of", "to", "for", "in", "on", "at",
            "by", "with", "from", "and", "or");
    private static final List<String> PREPOSITION_CHAINS = List.of(
            "of the", "to the", "by the", "for the", "in the", "on the", "at the");
    private static final List<String> MODALS = List.of(
            " shall ", " must ", " may ", " should ", " would ", " could ", " will ");
    private static final List<String> SENTENCE_ENDINGS = List.of(
            "as follows", "otherwise", "the following", "shall be", "as amended");

    private static final Pattern STRUCTURE_REFERENCE = Pattern.compile(
            "\\b(?:article|chapter|section|part|clause|paragraph)\\s*\\(?\\d+\\)?");
    private static final Pattern PREAMBLE = Pattern.compile(
            "^(?:Having reviewed|And based on|Hereby resolves|The Cabinet|Upon the proposal)",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern CROSS_REFERENCE = Pattern.compile(
            "^(?:Article|Chapter|Section)\\s+\\(?\\d+", Pattern.CASE_INSENSITIVE);
    private static final Pattern CITATION_ONLY = Pattern.compile(
            "^(?:Cabinet Resolution|Federal Decree|Federal Law)", Pattern.CASE_INSENSITIVE);

    private TermValidator() {
    }

    public static boolean isValidPair(String term, String definition) {
        return isValidTerm(term) && isValidDefinition(definition);
    }

    public static boolean isValidTerm(String term) {
        if (term == null) {
            return false;
        }
        String trimmed = term.strip();
        if (trimmed.length() < MIN_TERM_LENGTH || trimmed.length() > MAX_TERM_LENGTH) {
            return false;
        }
        String lower = trimmed.toLowerCase(Locale.ROOT);
        String[] words = trimmed.split("\\s+");
        String first = words[0].toLowerCase(Locale.ROOT);

        if (SENTENCE_STARTERS.contains(first) || VERB_FORMS.contains(first)) {
            return false;
        }
        if (words.length == 1 && DETERMINERS.contains(first)) {
            return false;
        }
        if (words.length == 2 && DETERMINERS.contains(first)
                && DETERMINER_FOLLOWERS.contains(words[1].toLowerCase(Locale.ROOT))) {
            return false;
        }
        if (PREPOSITION_CHAINS.stream().filter(lower::contains).count() >= 2) {
            return false;
        }
        String padded = " " + lower + " ";
        if (MODALS.stream().anyMatch(padded::contains)) {
            return false;
        }
        if (lower.contains(";and") || lower.contains("; and")) {
            return false;
        }
        if (SENTENCE_ENDINGS.stream().anyMatch(lower::endsWith)) {
            return false;
        }
        if (STRUCTURE_REFERENCE.matcher(lower).find() || GENERIC_WORDS.contains(lower)) {
            return false;
        }
        if (lower.equals(trimmed) && trimmed.chars().anyMatch(Character::isLetter)) {
            // all-lowercase text is a broken-word fragment, not a defined term
            return false;
        }
        if (trimmed.replaceAll("[\\s()]", "").matches("\\d+")) {
            return false;
        }
        if (words.length > 1 && DANGLING_LAST_WORDS.contains(words[words.length - 1].toLowerCase(Locale.ROOT))) {
            return false;
        }
        return true;
    }

    public static boolean isValidDefinition(String definition) {
        if (definition == null) {
            return false;
        }
        String trimmed = definition.strip();
        if (trimmed.length() < MIN_DEFINITION_LENGTH || trimmed.length() > MAX_DEFINITION_LENGTH) {
            return false;
        }
        return !PREAMBLE.matcher(trimmed).find()
                && !CROSS_REFERENCE.matcher(trimmed).find()
                && !CITATION_ONLY.matcher(trimmed).find();
    }
}

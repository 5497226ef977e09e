package com.legal.extraction.canonical;

import com.legal.extraction.core.model.CandidateKind;

import java.util.ArrayList;
import java.util.List;

/**
 * Built-in rules for legal citation and defined-term normalization.
 */
public final class DefaultNormalizationRules {

    private DefaultNormalizationRules() {
    }

    public static List<NormalizationRule> all() {
        List<NormalizationRule> rules = new ArrayList<>();
        rules.addAll(shared());
        rules.addAll(termRules());
        rules.addAll(citationRules());
        return rules;
    }

    /**
     * Layout artifacts that appear in both kinds of text.
     */
    public static List<NormalizationRule> shared() {
        return List.of(
                NormalizationRule.builder()
                        .name("join-hyphenated-line-break")
                        .pattern("(\\p{L})-\\s*\\n\\s*(\\p{L})")
                        .replacement("$1$2")
                        .priority(10)
                        .build(),
                NormalizationRule.builder()
                        .name("combining-marks")
                        .pattern("\\p{M}+")
                        .replacement("")
                        .priority(20)
                        .build(),
                NormalizationRule.builder()
                        .name("leading-bullet")
                        .pattern("^\\s*[\\u2212\\u2013\\u2014\\u2022*\\-]+\\s*")
                        .replacement("")
                        .priority(30)
                        .build()
        );
    }

    public static List<NormalizationRule> termRules() {
        return List.of(
                NormalizationRule.builder()
                        .name("quotes")
                        .pattern("[\"'\\u201C\\u201D\\u2018\\u2019\\u00AB\\u00BB]")
                        .replacement("")
                        .kinds(CandidateKind.DEFINITION)
                        .priority(40)
                        .build(),
                NormalizationRule.builder()
                        .name("punctuation")
                        .pattern("[^\\p{L}\\p{N}\\s]")
                        .replacement(" ")
                        .kinds(CandidateKind.DEFINITION)
                        .priority(50)
                        .build(),
                NormalizationRule.builder()
                        .name("leading-article")
                        .pattern("^\\s*(?:the|a|an)\\s+")
                        .replacement("")
                        .kinds(CandidateKind.DEFINITION)
                        .priority(60)
                        .build()
        );
    }

    public static List<NormalizationRule> citationRules() {
        return List.of(
                NormalizationRule.builder()
                        .name("number-spacing")
                        .pattern("No\\.?\\s*\\(\\s*(\\d+)\\s*\\)\\s*of\\s*")
                        .replacement("No. ($1) of ")
                        .kinds(CandidateKind.CITATION)
                        .priority(40)
                        .build(),
                NormalizationRule.builder()
                        .name("amendment-suffix")
                        .pattern(",?\\s+as\\s+amended\\s*$")
                        .replacement("")
                        .kinds(CandidateKind.CITATION)
                        .priority(50)
                        .build(),
                NormalizationRule.builder()
                        .name("trailing-punctuation")
                        .pattern("(?:\\s*(?:;\\s*and|[.;,:]))+\\s*$")
                        .replacement("")
                        .kinds(CandidateKind.CITATION)
                        .priority(60)
                        .build()
        );
    }
}

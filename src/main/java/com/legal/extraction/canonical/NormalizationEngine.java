package com.legal.extraction.canonical;

import com.legal.extraction.core.model.CandidateKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Applies {@link NormalizationRule}s in priority order (lower number first).
 * Input is NFD-decomposed before the rules run so that a rule can drop combining marks;
 * output is always lower-cased, trimmed and whitespace-collapsed.
 *
 * <p>The rule list is fixed at construction, which keeps normalization a pure function.</p>
 */
public class NormalizationEngine {
    private static final Logger log = LoggerFactory.getLogger(NormalizationEngine.class);

    private final List<NormalizationRule> rules;

    public NormalizationEngine(List<NormalizationRule> rules) {
        List<NormalizationRule> sorted = new ArrayList<>(rules);
        sorted.sort(Comparator.comparingInt(NormalizationRule::getPriority));
        this.rules = List.copyOf(sorted);
    }

    public static NormalizationEngine withDefaults() {
        return new NormalizationEngine(DefaultNormalizationRules.all());
    }

    public List<NormalizationRule> getRules() {
        return rules;
    }

    public String normalize(String text, CandidateKind kind) {
        if (text == null || text.isBlank()) {
            return "";
        }

        String result = Normalizer.normalize(text, Normalizer.Form.NFD);
        for (NormalizationRule rule : rules) {
            if (!rule.appliesTo(kind)) {
                continue;
            }
            String before = result;
            result = rule.apply(result);
            if (log.isTraceEnabled() && !before.equals(result)) {
                log.trace("normalize.rule name={} before='{}' after='{}'", rule.getName(), before, result);
            }
        }

        return Normalizer.normalize(result, Normalizer.Form.NFC)
                .toLowerCase(Locale.ROOT)
                .replaceAll("\\s+", " ")
                .trim();
    }

    public boolean areEquivalent(String a, String b, CandidateKind kind) {
        return normalize(a, kind).equals(normalize(b, kind));
    }
}

package com.hotel.reconciliation.rules;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Applies normalization rules to hotel names.
 * Names are case and diacritic folded first, then rules run in priority order
 * (lower priority number = earlier), then whitespace is collapsed.
 * Instances are immutable and safe to share between worker threads.
 */
public class NormalizationEngine {
    private static final Logger log = LoggerFactory.getLogger(NormalizationEngine.class);
    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final List<NormalizationRule> rules;

    public NormalizationEngine(List<NormalizationRule> rules) {
        List<NormalizationRule> sorted = new ArrayList<>(rules);
        sorted.sort(Comparator.comparingInt(NormalizationRule::priority));
        this.rules = List.copyOf(sorted);
    }

    /**
     * Returns a new engine with the given rule added.
     */
    public NormalizationEngine withRule(NormalizationRule rule) {
        List<NormalizationRule> extended = new ArrayList<>(rules);
        extended.add(rule);
        return new NormalizationEngine(extended);
    }

    /**
     * Gets all rules in application order.
     */
    public List<NormalizationRule> getRules() {
        return rules;
    }

    /**
     * Normalizes a name. Null or blank input yields the empty string.
     */
    public String normalize(String name) {
        if (name == null || name.isBlank()) {
            return "";
        }

        String result = fold(name);
        for (NormalizationRule rule : rules) {
            String before = result;
            result = rule.apply(result);
            if (log.isTraceEnabled() && !before.equals(result)) {
                log.trace("Rule '{}' transformed '{}' -> '{}'", rule.name(), before, result);
            }
        }
        return collapse(result);
    }

    /**
     * Lowercases and strips diacritics ("Hôtel Éden" becomes "hotel eden").
     */
    public static String fold(String value) {
        String decomposed = Normalizer.normalize(value, Normalizer.Form.NFD);
        return COMBINING_MARKS.matcher(decomposed).replaceAll("").toLowerCase(Locale.ROOT);
    }

    private static String collapse(String value) {
        return WHITESPACE.matcher(value.trim()).replaceAll(" ");
    }
}

package com.hotel.reconciliation.rules;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Built-in rules for hotel names.
 * Punctuation is handled before noise tokens so that "Hotel-Spa" splits into two tokens
 * that are then removed individually.
 */
public final class HotelNameRules {

    /**
     * Generic category words that platforms add or drop freely.
     */
    public static final List<String> DEFAULT_NOISE_TOKENS = List.of(
            "hotel", "resort", "spa", "suites", "apartments", "inn",
            "boutique", "luxury", "grand", "the");

    private HotelNameRules() {
        // Utility class
    }

    /**
     * Creates the full cleaning engine: punctuation rules plus removal of the given noise tokens.
     */
    public static NormalizationEngine createEngine(Collection<String> noiseTokens) {
        List<NormalizationRule> rules = new ArrayList<>(getPunctuationRules());
        if (noiseTokens != null && noiseTokens.stream().anyMatch(t -> t != null && !t.isBlank())) {
            rules.add(noiseTokenRule(noiseTokens));
        }
        return new NormalizationEngine(rules);
    }

    /**
     * Creates an engine that folds and strips punctuation but keeps every word.
     * Used when noise removal would leave a name empty.
     */
    public static NormalizationEngine createFoldingEngine() {
        return new NormalizationEngine(getPunctuationRules());
    }

    /**
     * Gets punctuation rules.
     */
    public static List<NormalizationRule> getPunctuationRules() {
        return List.of(
                // Joiners merge the surrounding word: "Bob's" -> "bobs"
                NormalizationRule.builder()
                        .name("punctuation-apostrophe")
                        .pattern("['’`´]")
                        .replacement("")
                        .priority(10)
                        .build(),

                // Everything else that is not a letter or digit separates tokens
                NormalizationRule.builder()
                        .name("punctuation-separators")
                        .pattern("[^\\p{L}\\p{Nd}\\s]+")
                        .replacement(" ")
                        .priority(20)
                        .build()
        );
    }

    /**
     * Builds the rule removing whole-token occurrences of the given words.
     * Tokens go through the same folding and punctuation rules as names, so "Hôtel" or
     * "B&B" in configuration match what the engine sees.
     */
    public static NormalizationRule noiseTokenRule(Collection<String> noiseTokens) {
        NormalizationEngine folding = createFoldingEngine();
        Set<String> folded = new LinkedHashSet<>();
        for (String token : noiseTokens) {
            String normalized = folding.normalize(token);
            if (!normalized.isEmpty()) {
                folded.add(normalized);
            }
        }
        if (folded.isEmpty()) {
            throw new IllegalArgumentException("noise token list has no usable token");
        }
        String alternation = folded.stream()
                .map(Pattern::quote)
                .collect(Collectors.joining("|"));
        return NormalizationRule.builder()
                .name("noise-tokens")
                .pattern("(?<!\\S)(?:" + alternation + ")(?!\\S)")
                .replacement(" ")
                .priority(50)
                .build();
    }
}

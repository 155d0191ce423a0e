package com.hotel.reconciliation.similarity;

import java.util.Arrays;

/**
 * Edit-distance similarity over alphabetically sorted tokens.
 * Word order differs across platforms ("Lisboa Plaza" vs "Plaza Lisboa"); sorting the
 * tokens first makes those names identical while still penalizing spelling differences.
 */
public class TokenSortSimilarity implements SimilarityAlgorithm {

    public static final String NAME = "token-sort";

    private final LevenshteinSimilarity levenshtein = new LevenshteinSimilarity();

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        return levenshtein.compute(sortTokens(s1), sortTokens(s2));
    }

    @Override
    public String getName() {
        return NAME;
    }

    static String sortTokens(String s) {
        String trimmed = s.trim();
        if (trimmed.isEmpty()) {
            return "";
        }
        String[] tokens = trimmed.split("\\s+");
        Arrays.sort(tokens);
        return String.join(" ", tokens);
    }
}

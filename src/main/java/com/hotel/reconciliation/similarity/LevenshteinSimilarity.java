package com.hotel.reconciliation.similarity;

/**
 * Normalized edit-distance similarity: {@code 1 - distance / maxLength}.
 * Two empty names are identical; an empty name against a non-empty one scores 0.
 */
public class LevenshteinSimilarity implements SimilarityAlgorithm {

    public static final String NAME = "levenshtein";

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        if (s1.equals(s2)) {
            return 1.0;
        }
        int maxLength = Math.max(s1.length(), s2.length());
        return 1.0 - ((double) distance(s1, s2) / maxLength);
    }

    @Override
    public String getName() {
        return NAME;
    }

    /**
     * Levenshtein edit distance (insertions, deletions, substitutions of one char each).
     * Two-row Wagner-Fischer, O(min(m,n)) memory.
     */
    public static int distance(String s1, String s2) {
        String shorter = s1.length() <= s2.length() ? s1 : s2;
        String longer = shorter == s1 ? s2 : s1;

        int[] previous = new int[shorter.length() + 1];
        int[] current = new int[shorter.length() + 1];
        for (int i = 0; i <= shorter.length(); i++) {
            previous[i] = i;
        }

        for (int j = 1; j <= longer.length(); j++) {
            current[0] = j;
            char c = longer.charAt(j - 1);
            for (int i = 1; i <= shorter.length(); i++) {
                int substitution = previous[i - 1] + (shorter.charAt(i - 1) == c ? 0 : 1);
                current[i] = Math.min(substitution, Math.min(current[i - 1], previous[i]) + 1);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[shorter.length()];
    }
}

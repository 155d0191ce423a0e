package com.hotel.reconciliation.similarity;

/**
 * Jaro-Winkler similarity. Rewards names sharing a prefix, which suits chains
 * ("ibis budget centro" vs "ibis centro").
 */
public class JaroWinklerSimilarity implements SimilarityAlgorithm {

    public static final String NAME = "jaro-winkler";

    private static final double DEFAULT_SCALING_FACTOR = 0.1;
    private static final int MAX_PREFIX_LENGTH = 4;

    private final double scalingFactor;

    public JaroWinklerSimilarity() {
        this(DEFAULT_SCALING_FACTOR);
    }

    public JaroWinklerSimilarity(double scalingFactor) {
        if (scalingFactor < 0 || scalingFactor > 0.25) {
            throw new IllegalArgumentException("Scaling factor must be between 0 and 0.25");
        }
        this.scalingFactor = scalingFactor;
    }

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        if (s1.equals(s2)) {
            return 1.0;
        }
        if (s1.isEmpty() || s2.isEmpty()) {
            return 0.0;
        }

        double jaro = jaro(s1, s2);
        int limit = Math.min(MAX_PREFIX_LENGTH, Math.min(s1.length(), s2.length()));
        int prefix = 0;
        while (prefix < limit && s1.charAt(prefix) == s2.charAt(prefix)) {
            prefix++;
        }
        return jaro + prefix * scalingFactor * (1.0 - jaro);
    }

    @Override
    public String getName() {
        return NAME;
    }

    private static double jaro(String s1, String s2) {
        int window = Math.max(0, Math.max(s1.length(), s2.length()) / 2 - 1);
        boolean[] matched1 = new boolean[s1.length()];
        boolean[] matched2 = new boolean[s2.length()];

        int matches = 0;
        for (int i = 0; i < s1.length(); i++) {
            int end = Math.min(i + window + 1, s2.length());
            for (int j = Math.max(0, i - window); j < end; j++) {
                if (!matched2[j] && s1.charAt(i) == s2.charAt(j)) {
                    matched1[i] = true;
                    matched2[j] = true;
                    matches++;
                    break;
                }
            }
        }
        if (matches == 0) {
            return 0.0;
        }

        int halfTranspositions = 0;
        int k = 0;
        for (int i = 0; i < s1.length(); i++) {
            if (!matched1[i]) {
                continue;
            }
            while (!matched2[k]) {
                k++;
            }
            if (s1.charAt(i) != s2.charAt(k)) {
                halfTranspositions++;
            }
            k++;
        }

        double m = matches;
        return (m / s1.length() + m / s2.length() + (m - halfTranspositions / 2.0) / m) / 3.0;
    }
}

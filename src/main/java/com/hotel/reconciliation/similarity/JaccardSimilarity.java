package com.hotel.reconciliation.similarity;

import java.util.HashSet;
import java.util.Set;

/**
 * Token overlap: |shared tokens| / |all distinct tokens|.
 * Insensitive to word order and spelling-blind; used as one component of the composite score.
 */
public class JaccardSimilarity implements SimilarityAlgorithm {

    public static final String NAME = "jaccard";

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        Set<String> tokens1 = tokenize(s1);
        Set<String> tokens2 = tokenize(s2);
        if (tokens1.isEmpty() && tokens2.isEmpty()) {
            return 1.0;
        }
        if (tokens1.isEmpty() || tokens2.isEmpty()) {
            return 0.0;
        }

        int shared = 0;
        for (String token : tokens1) {
            if (tokens2.contains(token)) {
                shared++;
            }
        }
        return (double) shared / (tokens1.size() + tokens2.size() - shared);
    }

    @Override
    public String getName() {
        return NAME;
    }

    private static Set<String> tokenize(String s) {
        Set<String> tokens = new HashSet<>();
        for (String token : s.trim().split("\\s+")) {
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        return tokens;
    }
}

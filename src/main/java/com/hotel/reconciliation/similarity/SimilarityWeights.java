package com.hotel.reconciliation.similarity;

import com.hotel.reconciliation.config.ConfigurationException;

/**
 * Weights of the composite name score. Must be non-negative and sum to 1.
 */
public record SimilarityWeights(
        double levenshteinWeight,
        double tokenSortWeight,
        double jaccardWeight
) {
    public SimilarityWeights {
        if (levenshteinWeight < 0 || tokenSortWeight < 0 || jaccardWeight < 0) {
            throw new ConfigurationException("Similarity weights must be non-negative");
        }
        double sum = levenshteinWeight + tokenSortWeight + jaccardWeight;
        if (Math.abs(sum - 1.0) > 0.001) {
            throw new ConfigurationException("Similarity weights must sum to 1.0, got " + sum);
        }
    }

    /**
     * Default weights, leaning on word-order-insensitive edit distance.
     */
    public static SimilarityWeights defaultWeights() {
        return new SimilarityWeights(0.2, 0.5, 0.3);
    }
}

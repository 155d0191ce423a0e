package com.hotel.reconciliation.similarity;

import com.hotel.reconciliation.config.ConfigurationException;

import java.util.List;
import java.util.Locale;

/**
 * Resolves a configured algorithm name to an instance.
 */
public final class SimilarityAlgorithms {

    public static final List<String> NAMES = List.of(
            LevenshteinSimilarity.NAME, TokenSortSimilarity.NAME,
            JaroWinklerSimilarity.NAME, JaccardSimilarity.NAME, CompositeSimilarityScorer.NAME);

    private SimilarityAlgorithms() {
        // Utility class
    }

    /**
     * Creates the algorithm for {@code name}; composite uses the given weights.
     *
     * @throws ConfigurationException when the name is unknown
     */
    public static SimilarityAlgorithm forName(String name, SimilarityWeights weights) {
        String key = name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
        return switch (key) {
            case LevenshteinSimilarity.NAME -> new LevenshteinSimilarity();
            case TokenSortSimilarity.NAME -> new TokenSortSimilarity();
            case JaroWinklerSimilarity.NAME -> new JaroWinklerSimilarity();
            case JaccardSimilarity.NAME -> new JaccardSimilarity();
            case CompositeSimilarityScorer.NAME -> new CompositeSimilarityScorer(
                    weights != null ? weights : SimilarityWeights.defaultWeights());
            default -> throw new ConfigurationException(
                    "Unknown similarity algorithm '" + name + "', expected one of " + NAMES);
        };
    }
}

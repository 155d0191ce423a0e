package com.hotel.reconciliation.similarity;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Weighted combination of edit distance, token-sort edit distance and token overlap.
 * Formula: score = w1*levenshtein + w2*tokenSort + w3*jaccard
 */
public class CompositeSimilarityScorer implements SimilarityAlgorithm {
    private static final Logger log = LoggerFactory.getLogger(CompositeSimilarityScorer.class);

    public static final String NAME = "composite";

    private final LevenshteinSimilarity levenshtein = new LevenshteinSimilarity();
    private final TokenSortSimilarity tokenSort = new TokenSortSimilarity();
    private final JaccardSimilarity jaccard = new JaccardSimilarity();
    private final SimilarityWeights weights;

    public CompositeSimilarityScorer() {
        this(SimilarityWeights.defaultWeights());
    }

    public CompositeSimilarityScorer(SimilarityWeights weights) {
        this.weights = weights;
    }

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        if (s1.equals(s2)) {
            return 1.0;
        }

        double levScore = levenshtein.compute(s1, s2);
        double sortScore = tokenSort.compute(s1, s2);
        double jaccardScore = jaccard.compute(s1, s2);
        double composite = weights.levenshteinWeight() * levScore
                + weights.tokenSortWeight() * sortScore
                + weights.jaccardWeight() * jaccardScore;

        log.trace("Similarity '{}' vs '{}': levenshtein={}, tokenSort={}, jaccard={}, composite={}",
                s1, s2, levScore, sortScore, jaccardScore, composite);

        // Weights may sum to 1 +/- 0.001
        return Math.min(1.0, composite);
    }

    @Override
    public String getName() {
        return NAME;
    }

    public SimilarityWeights getWeights() {
        return weights;
    }
}

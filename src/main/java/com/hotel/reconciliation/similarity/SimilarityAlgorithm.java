package com.hotel.reconciliation.similarity;

/**
 * Scores how alike two cleaned hotel names are.
 * Implementations return 1.0 for identical names and 0.0 for maximally dissimilar ones,
 * and must be symmetric and thread-safe.
 */
public interface SimilarityAlgorithm {

    /**
     * Computes the similarity between two names.
     *
     * @param s1 first name
     * @param s2 second name
     * @return similarity score between 0.0 and 1.0
     */
    double compute(String s1, String s2);

    /**
     * Returns the configuration name of this algorithm.
     */
    String getName();
}

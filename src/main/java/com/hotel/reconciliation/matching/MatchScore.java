package com.hotel.reconciliation.matching;

/**
 * Raw comparison of two listings.
 *
 * @param similarity     name similarity in [0, 1]
 * @param distanceMeters great-circle distance, infinite when a coordinate is unknown
 */
public record MatchScore(double similarity, double distanceMeters) {

    public MatchScore {
        if (Double.isNaN(similarity) || similarity < 0.0 || similarity > 1.0) {
            throw new IllegalArgumentException("similarity must be between 0.0 and 1.0, got " + similarity);
        }
        if (Double.isNaN(distanceMeters) || distanceMeters < 0.0) {
            throw new IllegalArgumentException("distance must be >= 0, got " + distanceMeters);
        }
    }
}

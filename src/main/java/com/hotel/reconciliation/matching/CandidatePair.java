package com.hotel.reconciliation.matching;

import com.hotel.reconciliation.core.model.NormalizedListing;

import java.util.Objects;

/**
 * A scored cross-source pairing. Exists only while matching; the audit trail keeps its outcome.
 */
public record CandidatePair(NormalizedListing a, NormalizedListing b, MatchScore score) {

    public CandidatePair {
        Objects.requireNonNull(a, "a is required");
        Objects.requireNonNull(b, "b is required");
        Objects.requireNonNull(score, "score is required");
    }

    public int aIndex() {
        return a.index();
    }

    public int bIndex() {
        return b.index();
    }

    public double similarity() {
        return score.similarity();
    }

    public double distanceMeters() {
        return score.distanceMeters();
    }
}

package com.hotel.reconciliation.blocking;

/**
 * A proposed pairing of listing A[aIndex] with listing B[bIndex].
 */
public record CandidateIndexPair(int aIndex, int bIndex) {

    @Override
    public String toString() {
        return "(" + aIndex + "," + bIndex + ")";
    }
}

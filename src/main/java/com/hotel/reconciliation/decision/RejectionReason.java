package com.hotel.reconciliation.decision;

/**
 * Why a candidate pair did not become a match.
 */
public enum RejectionReason {
    /** Name similarity below the threshold. */
    NAME("name"),

    /** Distance above the threshold (or unknown coordinates). */
    DISTANCE("distance"),

    /** Both thresholds failed. */
    NAME_AND_DISTANCE("name+distance"),

    /** Both thresholds passed, but the B listing was matched to another A listing. */
    SOURCE_B_CLAIMED("b-claimed"),

    /** Both thresholds passed, but the A listing was matched to a preferred B listing. */
    SOURCE_A_MATCHED("a-matched");

    private final String label;

    RejectionReason(String label) {
        this.label = label;
    }

    /**
     * Short lower-case label used in logs and audit exports.
     */
    public String label() {
        return label;
    }

    /**
     * True when the pair failed a threshold, as opposed to losing disambiguation.
     */
    public boolean isThresholdFailure() {
        return this == NAME || this == DISTANCE || this == NAME_AND_DISTANCE;
    }

    /**
     * Reason for a pair failing one or both thresholds.
     */
    public static RejectionReason forThresholds(boolean namePassed, boolean distancePassed) {
        if (namePassed && distancePassed) {
            throw new IllegalArgumentException("pair passed both thresholds");
        }
        if (!namePassed && !distancePassed) {
            return NAME_AND_DISTANCE;
        }
        return namePassed ? DISTANCE : NAME;
    }
}

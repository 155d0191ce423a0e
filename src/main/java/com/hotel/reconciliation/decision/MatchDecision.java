package com.hotel.reconciliation.decision;

import java.util.Objects;

/**
 * Immutable audit record of one evaluated candidate pair.
 * Every generated pair produces exactly one decision, accepted or not, together with the
 * thresholds it was judged against, so any outcome can be explained after the run.
 *
 * @param aIndex              index of the Source A listing
 * @param bIndex              index of the Source B listing
 * @param aName               cleaned name of the A listing
 * @param bName               cleaned name of the B listing
 * @param similarity          name similarity in [0, 1]
 * @param distanceMeters      great-circle distance, infinite when a coordinate is unknown
 * @param accepted            true when the pair is a final match
 * @param rejectionReason     null when accepted
 * @param nameThreshold       similarity threshold in force
 * @param distanceThresholdKm distance threshold in force
 */
public record MatchDecision(
        int aIndex,
        int bIndex,
        String aName,
        String bName,
        double similarity,
        double distanceMeters,
        boolean accepted,
        RejectionReason rejectionReason,
        double nameThreshold,
        double distanceThresholdKm
) {
    public MatchDecision {
        if (accepted && rejectionReason != null) {
            throw new IllegalArgumentException("an accepted decision has no rejection reason");
        }
        if (!accepted) {
            Objects.requireNonNull(rejectionReason, "a rejected decision needs a reason");
        }
    }

    public boolean isRejected() {
        return !accepted;
    }

    /**
     * Distance in kilometers, for display.
     */
    public double distanceKm() {
        return distanceMeters / 1000.0;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int aIndex;
        private int bIndex;
        private String aName;
        private String bName;
        private double similarity;
        private double distanceMeters;
        private boolean accepted;
        private RejectionReason rejectionReason;
        private double nameThreshold;
        private double distanceThresholdKm;

        private Builder() {}

        public Builder aIndex(int aIndex) { this.aIndex = aIndex; return this; }
        public Builder bIndex(int bIndex) { this.bIndex = bIndex; return this; }
        public Builder aName(String aName) { this.aName = aName; return this; }
        public Builder bName(String bName) { this.bName = bName; return this; }
        public Builder similarity(double similarity) { this.similarity = similarity; return this; }
        public Builder distanceMeters(double distanceMeters) { this.distanceMeters = distanceMeters; return this; }
        public Builder nameThreshold(double nameThreshold) { this.nameThreshold = nameThreshold; return this; }
        public Builder distanceThresholdKm(double distanceThresholdKm) { this.distanceThresholdKm = distanceThresholdKm; return this; }

        public Builder accepted() {
            this.accepted = true;
            this.rejectionReason = null;
            return this;
        }

        public Builder rejected(RejectionReason reason) {
            this.accepted = false;
            this.rejectionReason = reason;
            return this;
        }

        public MatchDecision build() {
            return new MatchDecision(aIndex, bIndex, aName, bName, similarity, distanceMeters,
                    accepted, rejectionReason, nameThreshold, distanceThresholdKm);
        }
    }
}

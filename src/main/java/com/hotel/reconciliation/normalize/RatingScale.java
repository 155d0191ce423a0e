package com.hotel.reconciliation.normalize;

import com.hotel.reconciliation.config.ConfigurationException;

/**
 * A platform's native rating range, mapped linearly onto the common 0-10 scale.
 *
 * @param min lowest rating the platform can display
 * @param max highest rating the platform can display
 */
public record RatingScale(double min, double max) {

    public static final double COMMON_MAX = 10.0;

    public RatingScale {
        if (!Double.isFinite(min) || !Double.isFinite(max) || max <= min) {
            throw new ConfigurationException("rating scale needs finite bounds with max > min, got ["
                    + min + ", " + max + "]");
        }
    }

    /**
     * The 0-5 star scale.
     */
    public static RatingScale fivePoint() {
        return new RatingScale(0.0, 5.0);
    }

    /**
     * The 0-10 review score scale (identity mapping).
     */
    public static RatingScale tenPoint() {
        return new RatingScale(0.0, COMMON_MAX);
    }

    public boolean contains(double rating) {
        return Double.isFinite(rating) && rating >= min && rating <= max;
    }

    /**
     * Maps a native rating onto 0-10. The caller checks {@link #contains(double)} first.
     */
    public double toCommonScale(double rating) {
        return (rating - min) / (max - min) * COMMON_MAX;
    }
}

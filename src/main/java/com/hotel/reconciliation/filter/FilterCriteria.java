package com.hotel.reconciliation.filter;

import com.hotel.reconciliation.config.ConfigurationException;

/**
 * Business thresholds applied to enriched hotels. Every criterion is optional (null);
 * present criteria are combined with AND.
 *
 * @param maxPrice      highest acceptable price, inclusive
 * @param maxDistanceKm highest acceptable distance to center in km, inclusive
 * @param minRating     lowest acceptable rating on the 0-10 scale, inclusive
 * @param minReviews    lowest acceptable review count, inclusive
 */
public record FilterCriteria(
        Double maxPrice,
        Double maxDistanceKm,
        Double minRating,
        Integer minReviews
) {
    private static final FilterCriteria NONE = new FilterCriteria(null, null, null, null);

    public FilterCriteria {
        requireNonNegative("maxPrice", maxPrice);
        requireNonNegative("maxDistanceKm", maxDistanceKm);
        requireNonNegative("minRating", minRating);
        if (minReviews != null && minReviews < 0) {
            throw new ConfigurationException("minReviews must be >= 0, got " + minReviews);
        }
    }

    /**
     * Criteria that keep every hotel.
     */
    public static FilterCriteria none() {
        return NONE;
    }

    public boolean isEmpty() {
        return maxPrice == null && maxDistanceKm == null && minRating == null && minReviews == null;
    }

    public static Builder builder() {
        return new Builder();
    }

    private static void requireNonNegative(String field, Double value) {
        if (value != null && (!Double.isFinite(value) || value < 0.0)) {
            throw new ConfigurationException(field + " must be a finite number >= 0, got " + value);
        }
    }

    public static final class Builder {
        private Double maxPrice;
        private Double maxDistanceKm;
        private Double minRating;
        private Integer minReviews;

        private Builder() {}

        public Builder maxPrice(Double maxPrice) {
            this.maxPrice = maxPrice;
            return this;
        }

        public Builder maxDistanceKm(Double maxDistanceKm) {
            this.maxDistanceKm = maxDistanceKm;
            return this;
        }

        public Builder minRating(Double minRating) {
            this.minRating = minRating;
            return this;
        }

        public Builder minReviews(Integer minReviews) {
            this.minReviews = minReviews;
            return this;
        }

        public FilterCriteria build() {
            return new FilterCriteria(maxPrice, maxDistanceKm, minRating, minReviews);
        }
    }
}

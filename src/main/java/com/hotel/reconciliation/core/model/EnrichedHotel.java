package com.hotel.reconciliation.core.model;

import java.util.Objects;

/**
 * A consolidated hotel with its derived metrics.
 *
 * @param hotel            the consolidated hotel
 * @param valueScore       rating / (price / city average price), or null when the hotel has no price
 * @param popularityTier   review-count tier
 * @param locationCategory distance-to-center category
 */
public record EnrichedHotel(
        ConsolidatedHotel hotel,
        Double valueScore,
        PopularityTier popularityTier,
        LocationCategory locationCategory
) {
    public EnrichedHotel {
        Objects.requireNonNull(hotel, "hotel is required");
        Objects.requireNonNull(popularityTier, "popularityTier is required");
        Objects.requireNonNull(locationCategory, "locationCategory is required");
    }

    public boolean hasValueScore() {
        return valueScore != null;
    }

    public String name() {
        return hotel.canonicalName();
    }

    public Double price() {
        return hotel.price();
    }

    public double rating() {
        return hotel.rating();
    }

    public int reviewCount() {
        return hotel.reviewCount();
    }

    public Double distanceToCenterKm() {
        return hotel.distanceToCenterKm();
    }
}

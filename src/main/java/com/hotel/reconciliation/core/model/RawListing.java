package com.hotel.reconciliation.core.model;

import java.util.Objects;

/**
 * A listing as captured from one source platform.
 * Numeric fields are nullable: platforms routinely omit prices, ratings or coordinates,
 * and nothing here is validated. {@code ListingNormalizer} is the only consumer that
 * interprets these values.
 *
 * @param source             the platform the listing came from
 * @param index              position of the listing within its source sequence
 * @param name               hotel name as displayed by the platform
 * @param price              price in the run's currency, or null
 * @param rating             rating on the platform's own scale, or null
 * @param reviewCount        number of reviews, or null
 * @param latitude           latitude in decimal degrees, or null
 * @param longitude          longitude in decimal degrees, or null
 * @param distanceToCenterKm distance from the city center reported by the platform, or null
 * @param url                detail page URL, or null
 * @param coordinateDecimals decimal places of the coordinates as the platform wrote them,
 *                           trailing zeros included, or null when only the parsed values are known
 */
public record RawListing(
        Source source,
        int index,
        String name,
        Double price,
        Double rating,
        Integer reviewCount,
        Double latitude,
        Double longitude,
        Double distanceToCenterKm,
        String url,
        Integer coordinateDecimals
) {
    public RawListing {
        Objects.requireNonNull(source, "source is required");
        if (index < 0) {
            throw new IllegalArgumentException("index must be >= 0");
        }
    }

    /**
     * Returns a copy positioned at the given index, or this listing if it already is.
     */
    public RawListing withIndex(int newIndex) {
        if (newIndex == index) {
            return this;
        }
        return new RawListing(source, newIndex, name, price, rating, reviewCount,
                latitude, longitude, distanceToCenterKm, url, coordinateDecimals);
    }

    public static Builder builder(Source source) {
        return new Builder(source);
    }

    public static class Builder {
        private final Source source;
        private int index;
        private String name;
        private Double price;
        private Double rating;
        private Integer reviewCount;
        private Double latitude;
        private Double longitude;
        private Double distanceToCenterKm;
        private String url;
        private Integer coordinateDecimals;

        private Builder(Source source) {
            this.source = source;
        }

        public Builder index(int index) {
            this.index = index;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder price(Double price) {
            this.price = price;
            return this;
        }

        public Builder rating(Double rating) {
            this.rating = rating;
            return this;
        }

        public Builder reviewCount(Integer reviewCount) {
            this.reviewCount = reviewCount;
            return this;
        }

        public Builder coordinates(Double latitude, Double longitude) {
            this.latitude = latitude;
            this.longitude = longitude;
            return this;
        }

        public Builder distanceToCenterKm(Double distanceToCenterKm) {
            this.distanceToCenterKm = distanceToCenterKm;
            return this;
        }

        public Builder url(String url) {
            this.url = url;
            return this;
        }

        public Builder coordinateDecimals(Integer coordinateDecimals) {
            this.coordinateDecimals = coordinateDecimals;
            return this;
        }

        public RawListing build() {
            return new RawListing(source, index, name, price, rating, reviewCount,
                    latitude, longitude, distanceToCenterKm, url, coordinateDecimals);
        }
    }
}

package com.hotel.reconciliation.bulk;

import com.hotel.reconciliation.core.model.RawListing;
import com.hotel.reconciliation.core.model.Source;
import com.hotel.reconciliation.geo.CoordinatePrecision;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Accepted column / property names per listing field, matched case-insensitively.
 * Covers the headers of the scraper exports (HOTEL_NAME, REVIEW_AMOUNT, ...).
 */
enum ListingFields {
    NAME("name", "hotel_name", "hotel"),
    PRICE("price"),
    RATING("rating", "score"),
    REVIEWS("reviews", "review_amount", "review_count", "reviews_amount"),
    LATITUDE("latitude", "lat"),
    LONGITUDE("longitude", "lon", "lng"),
    DISTANCE("distance", "distance_km", "distance_to_center"),
    URL("url", "link");

    private final List<String> aliases;

    ListingFields(String... aliases) {
        this.aliases = List.of(aliases);
    }

    /**
     * Resolves a header or property name, or null when it is not a listing field.
     */
    static ListingFields forName(String name) {
        if (name == null) {
            return null;
        }
        String key = name.trim().toLowerCase(Locale.ROOT);
        for (ListingFields field : values()) {
            if (field.aliases.contains(key)) {
                return field;
            }
        }
        return null;
    }

    /**
     * Builds a listing from textual values keyed by field.
     */
    static RawListing toListing(Source source, int index, Map<ListingFields, String> values) {
        return RawListing.builder(source)
                .index(index)
                .name(LooseValues.text(values.get(NAME)))
                .price(LooseValues.extractNumber(values.get(PRICE)))
                .rating(LooseValues.extractNumber(values.get(RATING)))
                .reviewCount(LooseValues.extractInteger(values.get(REVIEWS)))
                .coordinates(signedNumber(values.get(LATITUDE)), signedNumber(values.get(LONGITUDE)))
                .coordinateDecimals(reportedDecimals(values.get(LATITUDE), values.get(LONGITUDE)))
                .distanceToCenterKm(LooseValues.extractDistanceKm(values.get(DISTANCE)))
                .url(LooseValues.text(values.get(URL)))
                .build();
    }

    /**
     * Decimal places of the coordinate text as exported, the lower of the two.
     */
    private static Integer reportedDecimals(String latitude, String longitude) {
        Integer lat = CoordinatePrecision.decimalPlaces(LooseValues.text(latitude));
        Integer lon = CoordinatePrecision.decimalPlaces(LooseValues.text(longitude));
        if (lat == null || lon == null) {
            return null;
        }
        return Math.min(lat, lon);
    }

    /**
     * Coordinates keep their sign, unlike scraped amounts.
     */
    private static Double signedNumber(String value) {
        String text = LooseValues.text(value);
        if (text == null) {
            return null;
        }
        try {
            return Double.valueOf(text);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}

package com.hotel.reconciliation.geo;

import com.hotel.reconciliation.core.model.GeoPoint;
import com.hotel.reconciliation.core.model.NormalizedListing;

import java.math.BigDecimal;

/**
 * Measures how precisely a platform reported a coordinate, in decimal places.
 * {@code 38.7169} has 4, {@code 38.72} has 2, {@code 38.0} has 0.
 */
public final class CoordinatePrecision {

    private CoordinatePrecision() {
        // Utility class
    }

    /**
     * Decimal places of a listing's coordinates. The platform's own text is preferred
     * (it keeps trailing zeros such as {@code 38.7200}); the parsed point is measured otherwise.
     * Returns -1 when the listing has no valid coordinates.
     */
    public static int decimalPlaces(NormalizedListing listing) {
        if (listing.coordinates() == null) {
            return -1;
        }
        Integer reported = listing.raw().coordinateDecimals();
        return reported != null ? reported : decimalPlaces(listing.coordinates());
    }

    /**
     * Decimal places of a point: the lower of its latitude and longitude precision.
     * Returns -1 for a missing point so that any real coordinate outranks it.
     */
    public static int decimalPlaces(GeoPoint point) {
        if (point == null) {
            return -1;
        }
        return Math.min(decimalPlaces(point.latitude()), decimalPlaces(point.longitude()));
    }

    /**
     * Decimal places of the shortest decimal representation of {@code value}.
     */
    public static int decimalPlaces(double value) {
        if (!Double.isFinite(value)) {
            return -1;
        }
        int scale = BigDecimal.valueOf(value).stripTrailingZeros().scale();
        return Math.max(0, scale);
    }

    /**
     * Decimal places written in {@code text}, trailing zeros included, or null when it is not a number.
     */
    public static Integer decimalPlaces(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        try {
            return Math.max(0, new BigDecimal(text.trim()).scale());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}

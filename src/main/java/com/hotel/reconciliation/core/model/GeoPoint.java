package com.hotel.reconciliation.core.model;

/**
 * A latitude/longitude pair in decimal degrees.
 * Construction does not validate ranges; use {@link #isValid(double, double)} at boundaries.
 */
public record GeoPoint(double latitude, double longitude) {

    public static GeoPoint of(double latitude, double longitude) {
        return new GeoPoint(latitude, longitude);
    }

    /**
     * Checks that both values are finite and inside the WGS84 ranges.
     */
    public static boolean isValid(double latitude, double longitude) {
        return Double.isFinite(latitude) && Double.isFinite(longitude)
                && latitude >= -90.0 && latitude <= 90.0
                && longitude >= -180.0 && longitude <= 180.0;
    }
}

package com.hotel.reconciliation.geo;

import com.hotel.reconciliation.core.model.GeoPoint;

/**
 * Great-circle distance on a spherical Earth (haversine formula).
 */
public final class GeoDistance {

    /** Mean Earth radius in meters (IUGG). */
    public static final double EARTH_RADIUS_METERS = 6_371_008.8;

    private GeoDistance() {
        // Utility class
    }

    /**
     * Distance between two points in meters.
     * Returns {@link Double#POSITIVE_INFINITY} when either point is unknown, so a missing
     * coordinate can never satisfy a distance threshold.
     */
    public static double meters(GeoPoint from, GeoPoint to) {
        if (from == null || to == null) {
            return Double.POSITIVE_INFINITY;
        }
        double lat1 = Math.toRadians(from.latitude());
        double lat2 = Math.toRadians(to.latitude());
        double dLat = lat2 - lat1;
        double dLon = Math.toRadians(to.longitude() - from.longitude());

        double h = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(lat1) * Math.cos(lat2) * Math.sin(dLon / 2) * Math.sin(dLon / 2);
        // Clamp rounding noise before asin
        double c = 2 * Math.asin(Math.min(1.0, Math.sqrt(h)));
        return EARTH_RADIUS_METERS * c;
    }

    public static double kilometers(GeoPoint from, GeoPoint to) {
        return meters(from, to) / 1000.0;
    }
}

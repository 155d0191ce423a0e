package com.hotel.reconciliation.core.model;

/**
 * Ordinal classification of a hotel's distance to the city center, closest first.
 * {@link #UNKNOWN} sits outside the ordering and is used when no distance is known.
 */
public enum LocationCategory {
    CENTRAL,
    NEAR_CENTER,
    OUTER,
    REMOTE,
    UNKNOWN;

    /**
     * Number of ordered categories, excluding {@link #UNKNOWN}.
     */
    public static int orderedCount() {
        return values().length - 1;
    }
}

package com.hotel.reconciliation.core.model;

/**
 * Ordinal classification of a hotel's review count, lowest first.
 */
public enum PopularityTier {
    NICHE,
    ESTABLISHED,
    POPULAR,
    VERY_POPULAR
}

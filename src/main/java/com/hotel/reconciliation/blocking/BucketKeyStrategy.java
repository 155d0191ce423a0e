package com.hotel.reconciliation.blocking;

import com.hotel.reconciliation.core.model.GeoPoint;

/**
 * Strategy interface for deriving bucket keys from a normalized listing.
 * Bucket keys are used to narrow the candidate set before the expensive string
 * comparison; they never decide a match by themselves.
 */
public interface BucketKeyStrategy {

    /**
     * Derives the bucket key of a listing.
     *
     * @param cleanedName the cleaned name of the listing
     * @param coordinates validated coordinates, or null when the listing has none
     * @return the bucket key (never null)
     */
    BucketKey keyFor(String cleanedName, GeoPoint coordinates);
}

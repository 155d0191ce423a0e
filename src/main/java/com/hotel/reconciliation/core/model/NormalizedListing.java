package com.hotel.reconciliation.core.model;

import com.hotel.reconciliation.blocking.BucketKey;

import java.util.List;
import java.util.Objects;

/**
 * A listing in comparable form. Every downstream stage works on this type only.
 *
 * @param raw                the listing this was derived from (kept by value)
 * @param cleanedName        folded, noise-free name used for similarity scoring
 * @param price              validated price, or null when the listing has no usable price
 * @param rating             rating on the common 0-10 scale; 0 when {@code unrated}
 * @param unrated            true when the raw rating was missing or out of range
 * @param reviewCount        non-negative review count
 * @param coordinates        validated coordinates, or null when missing or invalid
 * @param distanceToCenterKm validated platform-reported distance to center, or null
 * @param bucketKey          candidate-search pruning key, never a matching criterion
 * @param warnings           data quality problems defaulted while normalizing
 */
public record NormalizedListing(
        RawListing raw,
        String cleanedName,
        Double price,
        double rating,
        boolean unrated,
        int reviewCount,
        GeoPoint coordinates,
        Double distanceToCenterKm,
        BucketKey bucketKey,
        List<DataQualityWarning> warnings
) {
    public NormalizedListing {
        Objects.requireNonNull(raw, "raw is required");
        Objects.requireNonNull(cleanedName, "cleanedName is required");
        Objects.requireNonNull(bucketKey, "bucketKey is required");
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }

    public Source source() {
        return raw.source();
    }

    public int index() {
        return raw.index();
    }

    public boolean hasPrice() {
        return price != null;
    }

    public boolean hasCoordinates() {
        return coordinates != null;
    }
}

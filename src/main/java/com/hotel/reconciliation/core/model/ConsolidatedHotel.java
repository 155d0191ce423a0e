package com.hotel.reconciliation.core.model;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * The unit of truth after merging: one physical hotel, built from one or two listings.
 *
 * @param canonicalName      display name
 * @param price              best-available price, or null
 * @param priceSource        source the price was taken from, or null without price
 * @param rating             rating on the 0-10 scale
 * @param unrated            true when no contributing source had a usable rating
 * @param ratingSource       source the rating was taken from
 * @param reviewCount        review count used for the rating decision
 * @param coordinates        chosen coordinates, or null
 * @param distanceToCenterKm distance to the city center, or null
 * @param lowestPrice        lowest valid price over the contributing listings, or null
 * @param lowestPriceSource  source of {@code lowestPrice}, or null
 * @param matchedSources     sources that contributed ({A}, {B} or {A,B})
 * @param sourceUrls         detail URL per contributing source (absent URLs omitted)
 * @param listingIndices     index of the contributing listing per source
 */
public record ConsolidatedHotel(
        String canonicalName,
        Double price,
        Source priceSource,
        double rating,
        boolean unrated,
        Source ratingSource,
        int reviewCount,
        GeoPoint coordinates,
        Double distanceToCenterKm,
        Double lowestPrice,
        Source lowestPriceSource,
        Set<Source> matchedSources,
        Map<Source, String> sourceUrls,
        Map<Source, Integer> listingIndices
) {
    public ConsolidatedHotel {
        Objects.requireNonNull(canonicalName, "canonicalName is required");
        Objects.requireNonNull(ratingSource, "ratingSource is required");
        if (matchedSources == null || matchedSources.isEmpty()) {
            throw new IllegalArgumentException("a consolidated hotel needs at least one source");
        }
        matchedSources = Set.copyOf(EnumSet.copyOf(matchedSources));
        sourceUrls = sourceUrls != null ? Map.copyOf(sourceUrls) : Map.of();
        listingIndices = listingIndices != null ? Map.copyOf(listingIndices) : Map.of();
        if (!listingIndices.keySet().equals(matchedSources)) {
            throw new IllegalArgumentException("listingIndices must cover exactly the matched sources");
        }
    }

    /**
     * True when the hotel was found on both platforms.
     */
    public boolean isMatched() {
        return matchedSources.size() > 1;
    }

    public boolean hasPrice() {
        return price != null;
    }

    public boolean hasDistance() {
        return distanceToCenterKm != null;
    }

    /**
     * Source URLs in source order, for stable rendering.
     */
    public Map<Source, String> orderedSourceUrls() {
        Map<Source, String> ordered = new EnumMap<>(Source.class);
        ordered.putAll(sourceUrls);
        return ordered;
    }
}

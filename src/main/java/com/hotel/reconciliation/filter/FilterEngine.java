package com.hotel.reconciliation.filter;

import com.hotel.reconciliation.core.model.EnrichedHotel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Applies business thresholds and ranks hotels by value.
 */
public class FilterEngine {
    private static final Logger log = LoggerFactory.getLogger(FilterEngine.class);

    /**
     * Value score descending; hotels without a value score last.
     */
    public static final Comparator<EnrichedHotel> BY_VALUE = Comparator.comparing(
            EnrichedHotel::valueScore, Comparator.nullsLast(Comparator.<Double>reverseOrder()));

    /**
     * Keeps the hotels satisfying every present criterion, in input order.
     * A hotel lacking the attribute a present criterion tests is dropped.
     */
    public List<EnrichedHotel> filter(List<EnrichedHotel> hotels, FilterCriteria criteria) {
        Objects.requireNonNull(criteria, "criteria is required");
        List<EnrichedHotel> kept = hotels.stream()
                .filter(hotel -> matches(hotel, criteria))
                .toList();
        log.debug("filter.applied criteria={} input={} kept={}", criteria, hotels.size(), kept.size());
        return kept;
    }

    /**
     * Stable sort by value, without truncation.
     */
    public List<EnrichedHotel> rank(List<EnrichedHotel> hotels) {
        return hotels.stream().sorted(BY_VALUE).toList();
    }

    /**
     * Stable sort by value, truncated to {@code topN}.
     */
    public List<EnrichedHotel> rank(List<EnrichedHotel> hotels, int topN) {
        if (topN < 1) {
            throw new IllegalArgumentException("topN must be >= 1, got " + topN);
        }
        return hotels.stream().sorted(BY_VALUE).limit(topN).toList();
    }

    /**
     * Filters then ranks; a null {@code topN} keeps every hotel that passes.
     */
    public List<EnrichedHotel> filterAndRank(List<EnrichedHotel> hotels, FilterCriteria criteria, Integer topN) {
        List<EnrichedHotel> kept = filter(hotels, criteria);
        return topN == null ? rank(kept) : rank(kept, topN);
    }

    public static boolean matches(EnrichedHotel hotel, FilterCriteria criteria) {
        if (criteria.maxPrice() != null
                && (hotel.price() == null || hotel.price() > criteria.maxPrice())) {
            return false;
        }
        if (criteria.maxDistanceKm() != null
                && (hotel.distanceToCenterKm() == null || hotel.distanceToCenterKm() > criteria.maxDistanceKm())) {
            return false;
        }
        if (criteria.minRating() != null
                && (hotel.hotel().unrated() || hotel.rating() < criteria.minRating())) {
            return false;
        }
        return criteria.minReviews() == null || hotel.reviewCount() >= criteria.minReviews();
    }
}

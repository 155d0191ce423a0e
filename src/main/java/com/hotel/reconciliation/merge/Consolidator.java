package com.hotel.reconciliation.merge;

import com.hotel.reconciliation.core.model.ConsolidatedHotel;
import com.hotel.reconciliation.core.model.GeoPoint;
import com.hotel.reconciliation.core.model.NormalizedListing;
import com.hotel.reconciliation.core.model.Source;
import com.hotel.reconciliation.decision.MatchDecision;
import com.hotel.reconciliation.geo.GeoDistance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Merges accepted matches into single hotels and passes unmatched listings through.
 *
 * <p>For a match, rating and price come from the listing with more reviews (falling back to
 * the other listing when that one has no usable value), coordinates come from the more precise
 * listing, and the name is the Source A display name. Output order is: matches by A index,
 * then unmatched A listings, then unmatched B listings, each by index.</p>
 */
public class Consolidator {
    private static final Logger log = LoggerFactory.getLogger(Consolidator.class);

    private final GeoPoint cityCenter;

    /**
     * Creates a consolidator that carries platform-reported distances.
     */
    public Consolidator() {
        this(null);
    }

    /**
     * @param cityCenter when non-null, distance to center is recomputed from the chosen coordinates
     */
    public Consolidator(GeoPoint cityCenter) {
        this.cityCenter = cityCenter;
    }

    /**
     * @throws IllegalArgumentException when an accepted decision references an unknown listing
     *                                  or a listing is accepted twice
     */
    public List<ConsolidatedHotel> consolidate(List<NormalizedListing> sourceA, List<NormalizedListing> sourceB,
                                               List<MatchDecision> decisions) {
        Map<Integer, NormalizedListing> aByIndex = byIndex(sourceA, Source.A);
        Map<Integer, NormalizedListing> bByIndex = byIndex(sourceB, Source.B);

        List<MatchDecision> accepted = decisions.stream()
                .filter(MatchDecision::accepted)
                .sorted(Comparator.comparingInt(MatchDecision::aIndex))
                .toList();

        Set<Integer> matchedA = new HashSet<>();
        Set<Integer> matchedB = new HashSet<>();
        List<ConsolidatedHotel> hotels = new ArrayList<>(sourceA.size() + sourceB.size());
        for (MatchDecision decision : accepted) {
            NormalizedListing a = aByIndex.get(decision.aIndex());
            NormalizedListing b = bByIndex.get(decision.bIndex());
            if (a == null || b == null) {
                throw new IllegalArgumentException("Accepted decision references unknown listing: A#"
                        + decision.aIndex() + " / B#" + decision.bIndex());
            }
            if (!matchedA.add(decision.aIndex())) {
                throw new IllegalArgumentException("A#" + decision.aIndex() + " is accepted more than once");
            }
            if (!matchedB.add(decision.bIndex())) {
                throw new IllegalArgumentException("B#" + decision.bIndex() + " is accepted more than once");
            }
            hotels.add(merge(a, b));
        }

        int onlyA = 0;
        for (NormalizedListing a : sourceA) {
            if (!matchedA.contains(a.index())) {
                hotels.add(single(a));
                onlyA++;
            }
        }
        int onlyB = 0;
        for (NormalizedListing b : sourceB) {
            if (!matchedB.contains(b.index())) {
                hotels.add(single(b));
                onlyB++;
            }
        }

        log.info("consolidation.completed matched={} onlyA={} onlyB={} total={}",
                accepted.size(), onlyA, onlyB, hotels.size());
        return hotels;
    }

    /**
     * Merges one accepted match.
     */
    public ConsolidatedHotel merge(NormalizedListing a, NormalizedListing b) {
        NormalizedListing trusted = MergePrecedence.byReviewCount(a, b);
        NormalizedListing other = trusted == a ? b : a;

        NormalizedListing ratingListing = trusted.unrated() && !other.unrated() ? other : trusted;
        NormalizedListing priceListing = !trusted.hasPrice() && other.hasPrice() ? other : trusted;
        NormalizedListing cheapest = MergePrecedence.byLowestPrice(a, b);
        GeoPoint coordinates = MergePrecedence.coordinates(a, b);

        Double carriedDistance = ratingListing.distanceToCenterKm() != null
                ? ratingListing.distanceToCenterKm()
                : (ratingListing == a ? b : a).distanceToCenterKm();

        Map<Source, String> urls = new EnumMap<>(Source.class);
        putUrl(urls, a);
        putUrl(urls, b);
        Map<Source, Integer> indices = new EnumMap<>(Source.class);
        indices.put(Source.A, a.index());
        indices.put(Source.B, b.index());

        return new ConsolidatedHotel(
                canonicalName(a, b),
                priceListing.price(),
                priceListing.hasPrice() ? priceListing.source() : null,
                ratingListing.rating(),
                ratingListing.unrated(),
                ratingListing.source(),
                Math.max(a.reviewCount(), b.reviewCount()),
                coordinates,
                distance(coordinates, carriedDistance),
                cheapest != null ? cheapest.price() : null,
                cheapest != null ? cheapest.source() : null,
                EnumSet.of(Source.A, Source.B),
                urls,
                indices);
    }

    /**
     * Passes an unmatched listing through as a single-source hotel.
     */
    public ConsolidatedHotel single(NormalizedListing listing) {
        Map<Source, String> urls = new EnumMap<>(Source.class);
        putUrl(urls, listing);
        return new ConsolidatedHotel(
                displayName(listing),
                listing.price(),
                listing.hasPrice() ? listing.source() : null,
                listing.rating(),
                listing.unrated(),
                listing.source(),
                listing.reviewCount(),
                listing.coordinates(),
                distance(listing.coordinates(), listing.distanceToCenterKm()),
                listing.price(),
                listing.hasPrice() ? listing.source() : null,
                EnumSet.of(listing.source()),
                urls,
                Map.of(listing.source(), listing.index()));
    }

    public GeoPoint getCityCenter() {
        return cityCenter;
    }

    private Double distance(GeoPoint coordinates, Double carried) {
        if (cityCenter != null && coordinates != null) {
            return GeoDistance.kilometers(cityCenter, coordinates);
        }
        return carried;
    }

    private static String canonicalName(NormalizedListing a, NormalizedListing b) {
        String name = displayName(a);
        return name.isEmpty() ? displayName(b) : name;
    }

    private static String displayName(NormalizedListing listing) {
        String name = listing.raw().name();
        return name == null ? "" : name.trim();
    }

    private static void putUrl(Map<Source, String> urls, NormalizedListing listing) {
        String url = listing.raw().url();
        if (url != null && !url.isBlank()) {
            urls.put(listing.source(), url.trim());
        }
    }

    private static Map<Integer, NormalizedListing> byIndex(List<NormalizedListing> listings, Source expected) {
        Map<Integer, NormalizedListing> byIndex = new HashMap<>();
        for (NormalizedListing listing : listings) {
            if (listing.source() != expected) {
                throw new IllegalArgumentException("Listing " + listing.source() + "#" + listing.index()
                        + " found in the Source " + expected + " sequence");
            }
            if (byIndex.put(listing.index(), listing) != null) {
                throw new IllegalArgumentException("Duplicate listing index " + expected + "#" + listing.index());
            }
        }
        return byIndex;
    }
}

package com.hotel.reconciliation.merge;

import com.hotel.reconciliation.blocking.GridBucketKeyStrategy;
import com.hotel.reconciliation.core.model.ConsolidatedHotel;
import com.hotel.reconciliation.core.model.GeoPoint;
import com.hotel.reconciliation.core.model.NormalizedListing;
import com.hotel.reconciliation.core.model.Source;
import com.hotel.reconciliation.decision.MatchDecision;
import com.hotel.reconciliation.decision.RejectionReason;
import com.hotel.reconciliation.normalize.ListingNormalizer;
import com.hotel.reconciliation.normalize.NameCleaner;
import com.hotel.reconciliation.normalize.RatingScale;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.hotel.reconciliation.core.model.ListingFixtures.listing;
import static com.hotel.reconciliation.core.model.ListingFixtures.normalized;
import static com.hotel.reconciliation.core.model.ListingFixtures.normalizedA;
import static com.hotel.reconciliation.core.model.ListingFixtures.normalizedB;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Consolidator Tests")
class ConsolidatorTest {

    private final Consolidator consolidator = new Consolidator();

    private static MatchDecision accept(int a, int b) {
        return MatchDecision.builder().aIndex(a).bIndex(b).similarity(1.0).distanceMeters(10).accepted().build();
    }

    private static MatchDecision reject(int a, int b) {
        return MatchDecision.builder().aIndex(a).bIndex(b).similarity(0.2).distanceMeters(10)
                .rejected(RejectionReason.NAME).build();
    }

    @Nested
    @DisplayName("Merging a match")
    class Merge {

        @Test
        @DisplayName("Rating and price come from the listing with more reviews")
        void mostReviewedWins() {
            ListingNormalizer normalizer = new ListingNormalizer(NameCleaner.withDefaultNoiseTokens(),
                    Map.of(Source.A, RatingScale.fivePoint()), new GridBucketKeyStrategy(0.01, true));
            NormalizedListing a = normalizer.normalize(listing(Source.A, 0, "Grand Plaza Hotel & Spa")
                    .price(120.0).rating(4.2).reviewCount(900).coordinates(38.7169, -9.1399).build());
            NormalizedListing b = normalizer.normalize(listing(Source.B, 0, "grand plaza hotel")
                    .price(115.0).rating(8.4).reviewCount(1500).coordinates(38.7170, -9.1400).build());

            ConsolidatedHotel hotel = consolidator.merge(a, b);

            assertEquals("Grand Plaza Hotel & Spa", hotel.canonicalName());
            assertEquals(115.0, hotel.price());
            assertEquals(Source.B, hotel.priceSource());
            assertEquals(8.4, hotel.rating(), 1e-9);
            assertEquals(Source.B, hotel.ratingSource());
            assertEquals(1500, hotel.reviewCount());
            assertEquals(115.0, hotel.lowestPrice());
            assertEquals(Set.of(Source.A, Source.B), hotel.matchedSources());
            assertTrue(hotel.isMatched());
            assertEquals(Map.of(Source.A, 0, Source.B, 0), hotel.listingIndices());
            assertEquals(2, hotel.sourceUrls().size());
        }

        @Test
        @DisplayName("Equal review counts favor Source A")
        void tiesFavorA() {
            NormalizedListing a = normalized(listing(Source.A, 0, "Casa").price(90.0).rating(7.0).build());
            NormalizedListing b = normalized(listing(Source.B, 0, "Casa").price(80.0).rating(9.0).build());

            ConsolidatedHotel hotel = consolidator.merge(a, b);

            assertEquals(90.0, hotel.price());
            assertEquals(7.0, hotel.rating());
            assertEquals(80.0, hotel.lowestPrice());
            assertEquals(Source.B, hotel.lowestPriceSource());
        }

        @Test
        @DisplayName("Missing price or rating falls back to the other listing")
        void fallbacks() {
            NormalizedListing a = normalized(listing(Source.A, 0, "Casa").price(95.0).rating(7.5).reviewCount(10).build());
            NormalizedListing b = normalized(listing(Source.B, 0, "Casa").price(null).rating(null).reviewCount(500).build());

            ConsolidatedHotel hotel = consolidator.merge(a, b);

            assertEquals(95.0, hotel.price());
            assertEquals(Source.A, hotel.priceSource());
            assertEquals(7.5, hotel.rating());
            assertFalse(hotel.unrated());
            assertEquals(500, hotel.reviewCount());
        }

        @Test
        @DisplayName("Coordinates come from the more precise listing")
        void precisionWins() {
            NormalizedListing a = normalized(listing(Source.A, 0, "Casa").coordinates(38.72, -9.14).build());
            NormalizedListing b = normalized(listing(Source.B, 0, "Casa").coordinates(38.71693, -9.13991).build());

            assertEquals(GeoPoint.of(38.71693, -9.13991), consolidator.merge(a, b).coordinates());
            assertEquals(b, MergePrecedence.byCoordinatePrecision(a, b));
        }

        @Test
        @DisplayName("Reported trailing zeros count toward coordinate precision")
        void reportedPrecisionWins() {
            NormalizedListing a = normalized(listing(Source.A, 0, "Casa").coordinates(38.72, -9.14)
                    .coordinateDecimals(4).build());
            NormalizedListing b = normalized(listing(Source.B, 0, "Casa").coordinates(38.717, -9.139).build());

            assertEquals(GeoPoint.of(38.72, -9.14), consolidator.merge(a, b).coordinates());
            assertEquals(a, MergePrecedence.byCoordinatePrecision(a, b));
        }

        @Test
        @DisplayName("Missing coordinates never win")
        void missingCoordinates() {
            NormalizedListing a = normalized(listing(Source.A, 0, "Casa").coordinates(null, null).build());
            NormalizedListing b = normalized(listing(Source.B, 0, "Casa").coordinates(38.7, -9.1).build());

            assertEquals(GeoPoint.of(38.7, -9.1), consolidator.merge(a, b).coordinates());
        }

        @Test
        @DisplayName("Distance is recomputed from the city center when one is configured")
        void cityCenterDistance() {
            Consolidator withCenter = new Consolidator(GeoPoint.of(38.7169, -9.1399));
            NormalizedListing a = normalized(listing(Source.A, 0, "Casa").coordinates(38.7169, -9.1399)
                    .distanceToCenterKm(4.0).build());
            NormalizedListing b = normalizedB(0, "Casa");

            assertEquals(0.0, withCenter.merge(a, b).distanceToCenterKm(), 1e-9);
            assertEquals(4.0, consolidator.merge(a, b).distanceToCenterKm());
        }
    }

    @Nested
    @DisplayName("Consolidating a run")
    class Run {

        @Test
        @DisplayName("Every listing appears exactly once")
        void completeness() {
            List<NormalizedListing> a = List.of(normalizedA(0, "Alpha"), normalizedA(1, "Beta"), normalizedA(2, "Gamma"));
            List<NormalizedListing> b = List.of(normalizedB(0, "Beta"), normalizedB(1, "Delta"));

            List<ConsolidatedHotel> hotels = consolidator.consolidate(a, b,
                    List.of(reject(0, 0), accept(1, 0), reject(2, 1)));

            assertEquals(4, hotels.size());
            assertEquals("Beta", hotels.get(0).canonicalName());
            assertTrue(hotels.get(0).isMatched());
            assertEquals(List.of("Alpha", "Gamma", "Delta"),
                    hotels.subList(1, 4).stream().map(ConsolidatedHotel::canonicalName).toList());
            int contributions = hotels.stream().mapToInt(h -> h.matchedSources().size()).sum();
            assertEquals(a.size() + b.size(), contributions);
        }

        @Test
        @DisplayName("A single-source hotel passes through with its own fields")
        void singleSource() {
            NormalizedListing only = normalized(listing(Source.A, 0, "  Solo Inn ").price(70.0).build());

            ConsolidatedHotel hotel = consolidator.consolidate(List.of(only), List.of(), List.of()).get(0);

            assertEquals("Solo Inn", hotel.canonicalName());
            assertEquals(70.0, hotel.price());
            assertEquals(Set.of(Source.A), hotel.matchedSources());
            assertFalse(hotel.isMatched());
        }

        @Test
        @DisplayName("Accepted decisions must reference known listings")
        void unknownIndex() {
            List<NormalizedListing> a = List.of(normalizedA(0, "Alpha"));
            List<NormalizedListing> b = List.of(normalizedB(0, "Alpha"));

            assertThrows(IllegalArgumentException.class, () -> consolidator.consolidate(a, b, List.of(accept(0, 5))));
        }

        @Test
        @DisplayName("A listing cannot be accepted twice")
        void acceptedTwice() {
            List<NormalizedListing> a = List.of(normalizedA(0, "Alpha"), normalizedA(1, "Alpha"));
            List<NormalizedListing> b = List.of(normalizedB(0, "Alpha"));

            assertThrows(IllegalArgumentException.class,
                    () -> consolidator.consolidate(a, b, List.of(accept(0, 0), accept(1, 0))));
        }

        @Test
        @DisplayName("Listings must sit in their own source sequence")
        void wrongSource() {
            List<NormalizedListing> a = List.of(normalizedB(0, "Alpha"));

            assertThrows(IllegalArgumentException.class, () -> consolidator.consolidate(a, List.of(), List.of()));
        }
    }
}

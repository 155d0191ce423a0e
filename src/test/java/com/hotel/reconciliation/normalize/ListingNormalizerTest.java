package com.hotel.reconciliation.normalize;

import com.hotel.reconciliation.blocking.GridBucketKeyStrategy;
import com.hotel.reconciliation.blocking.GridCell;
import com.hotel.reconciliation.concurrent.PartitionExecutor;
import com.hotel.reconciliation.config.ConfigurationException;
import com.hotel.reconciliation.core.model.DataQualityWarning;
import com.hotel.reconciliation.core.model.NormalizedListing;
import com.hotel.reconciliation.core.model.RawListing;
import com.hotel.reconciliation.core.model.Source;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.hotel.reconciliation.core.model.ListingFixtures.listing;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ListingNormalizer Tests")
class ListingNormalizerTest {

    private final ListingNormalizer normalizer = new ListingNormalizer(
            NameCleaner.withDefaultNoiseTokens(),
            Map.of(Source.A, RatingScale.fivePoint()),
            new GridBucketKeyStrategy(0.01, true));

    private static List<String> fields(NormalizedListing listing) {
        return listing.warnings().stream().map(DataQualityWarning::field).toList();
    }

    @Test
    @DisplayName("A complete listing normalizes without warnings")
    void completeListing() {
        RawListing raw = RawListing.builder(Source.B)
                .index(3)
                .name("Grand Plaza Hotel")
                .price(115.0)
                .rating(8.4)
                .reviewCount(1500)
                .coordinates(38.7170, -9.1400)
                .distanceToCenterKm(0.6)
                .url("https://b.example/3")
                .build();

        NormalizedListing listing = normalizer.normalize(raw);

        assertEquals("plaza", listing.cleanedName());
        assertEquals(115.0, listing.price());
        assertEquals(8.4, listing.rating(), 1e-9);
        assertFalse(listing.unrated());
        assertEquals(1500, listing.reviewCount());
        assertEquals(38.7170, listing.coordinates().latitude());
        assertEquals(0.6, listing.distanceToCenterKm());
        assertEquals("plaza", listing.bucketKey().nameToken());
        assertTrue(listing.warnings().isEmpty());
        assertSame(raw, listing.raw());
        assertEquals(Source.B, listing.source());
        assertEquals(3, listing.index());
    }

    @Test
    @DisplayName("Ratings are rescaled from the source's native scale to 0-10")
    void ratingRescaled() {
        NormalizedListing listing = normalizer.normalize(listing(Source.A, 0, "Grand Plaza Hotel & Spa")
                .rating(4.2).build());

        assertEquals(8.4, listing.rating(), 1e-9);
        assertFalse(listing.unrated());
    }

    @Nested
    @DisplayName("Malformed values are defaulted with a warning")
    class DataQuality {

        @Test
        @DisplayName("Missing and non-positive prices become absent")
        void badPrice() {
            NormalizedListing missing = normalizer.normalize(listing(Source.B, 0, "Casa").price(null).build());
            NormalizedListing negative = normalizer.normalize(listing(Source.B, 1, "Casa").price(-5.0).build());
            NormalizedListing zero = normalizer.normalize(listing(Source.B, 2, "Casa").price(0.0).build());
            NormalizedListing nan = normalizer.normalize(listing(Source.B, 3, "Casa").price(Double.NaN).build());

            for (NormalizedListing listing : List.of(missing, negative, zero, nan)) {
                assertNull(listing.price());
                assertFalse(listing.hasPrice());
                assertEquals(List.of("price"), fields(listing));
            }
        }

        @Test
        @DisplayName("Out-of-range and missing ratings mark the listing unrated")
        void badRating() {
            NormalizedListing outOfRange = normalizer.normalize(listing(Source.A, 0, "Casa").rating(7.5).build());
            NormalizedListing missing = normalizer.normalize(listing(Source.B, 0, "Casa").rating(null).build());

            assertTrue(outOfRange.unrated());
            assertEquals(0.0, outOfRange.rating());
            assertEquals(List.of("rating"), fields(outOfRange));
            assertTrue(missing.unrated());
            assertEquals(List.of("rating"), fields(missing));
        }

        @Test
        @DisplayName("Negative and missing review counts become 0")
        void badReviewCount() {
            NormalizedListing negative = normalizer.normalize(listing(Source.B, 0, "Casa").reviewCount(-3).build());
            NormalizedListing missing = normalizer.normalize(listing(Source.B, 1, "Casa").reviewCount(null).build());

            assertEquals(0, negative.reviewCount());
            assertEquals(List.of("reviewCount"), fields(negative));
            assertEquals(0, missing.reviewCount());
            assertEquals(List.of("reviewCount"), fields(missing));
        }

        @Test
        @DisplayName("Invalid coordinates become absent and land in the unlocated cell")
        void badCoordinates() {
            NormalizedListing outOfRange = normalizer.normalize(listing(Source.B, 0, "Casa")
                    .coordinates(95.0, 10.0).build());
            NormalizedListing partial = normalizer.normalize(listing(Source.B, 1, "Casa")
                    .coordinates(38.7, null).build());

            for (NormalizedListing listing : List.of(outOfRange, partial)) {
                assertNull(listing.coordinates());
                assertEquals(GridCell.UNLOCATED, listing.bucketKey().cell());
                assertEquals(List.of("coordinates"), fields(listing));
            }
        }

        @Test
        @DisplayName("Negative distance to center becomes absent")
        void badDistance() {
            NormalizedListing listing = normalizer.normalize(listing(Source.B, 0, "Casa")
                    .distanceToCenterKm(-1.0).build());

            assertNull(listing.distanceToCenterKm());
            assertEquals(List.of("distance"), fields(listing));
        }

        @Test
        @DisplayName("A name without letters or digits is kept empty with a warning")
        void emptyName() {
            NormalizedListing listing = normalizer.normalize(listing(Source.A, 4, "???").build());

            assertEquals("", listing.cleanedName());
            DataQualityWarning warning = listing.warnings().get(0);
            assertEquals(Source.A, warning.source());
            assertEquals(4, warning.index());
            assertEquals("name", warning.field());
        }
    }

    @Test
    @DisplayName("Normalizing the cleaned name again changes nothing")
    void cleanedNameIsFixedPoint() {
        NormalizedListing first = normalizer.normalize(listing(Source.A, 0, "The Grand Hotel").build());
        NormalizedListing second = normalizer.normalize(listing(Source.A, 0, first.cleanedName()).build());

        assertEquals(first.cleanedName(), second.cleanedName());
        assertEquals(first.bucketKey(), second.bucketKey());
    }

    @Test
    @DisplayName("normalizeAll preserves input order across worker threads")
    void normalizeAllPreservesOrder() {
        List<RawListing> raws = new ArrayList<>();
        for (int i = 0; i < 250; i++) {
            raws.add(listing(Source.B, i, "Hotel Number " + i).build());
        }

        List<NormalizedListing> normalized;
        try (PartitionExecutor executor = PartitionExecutor.create(4)) {
            normalized = normalizer.normalizeAll(raws, executor, 16);
        }

        assertEquals(250, normalized.size());
        for (int i = 0; i < normalized.size(); i++) {
            assertEquals(i, normalized.get(i).index());
            assertEquals("number " + i, normalized.get(i).cleanedName());
        }
    }

    @Nested
    @DisplayName("RatingScale")
    class RatingScales {

        @Test
        @DisplayName("Invalid bounds are a configuration error")
        void invalidBounds() {
            assertThrows(ConfigurationException.class, () -> new RatingScale(5.0, 5.0));
            assertThrows(ConfigurationException.class, () -> new RatingScale(0.0, Double.NaN));
        }

        @Test
        @DisplayName("Non-zero minimum maps linearly")
        void offsetScale() {
            RatingScale scale = new RatingScale(1.0, 5.0);

            assertEquals(0.0, scale.toCommonScale(1.0));
            assertEquals(10.0, scale.toCommonScale(5.0));
            assertEquals(5.0, scale.toCommonScale(3.0));
            assertFalse(scale.contains(0.5));
        }
    }
}

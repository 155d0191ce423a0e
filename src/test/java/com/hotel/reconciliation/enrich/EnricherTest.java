package com.hotel.reconciliation.enrich;

import com.hotel.reconciliation.concurrent.PartitionExecutor;
import com.hotel.reconciliation.config.ConfigurationException;
import com.hotel.reconciliation.core.model.ConsolidatedHotel;
import com.hotel.reconciliation.core.model.EnrichedHotel;
import com.hotel.reconciliation.core.model.LocationCategory;
import com.hotel.reconciliation.core.model.PopularityTier;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.ArrayList;
import java.util.List;

import static com.hotel.reconciliation.core.model.HotelFixtures.hotel;
import static com.hotel.reconciliation.core.model.HotelFixtures.unratedHotel;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Enricher Tests")
class EnricherTest {

    private final Enricher enricher = new Enricher();

    @Nested
    @DisplayName("Value score")
    class ValueScore {

        @Test
        @DisplayName("Average price covers every priced hotel, single-source included")
        void averageOverAllPricedHotels() {
            List<ConsolidatedHotel> hotels = List.of(
                    hotel("Matched", 100.0, 8.0, 500, 1.0),
                    hotel("Only A", 200.0, 9.0, 20, 2.0),
                    hotel("No price", null, 7.0, 10, 2.0));

            List<EnrichedHotel> enriched = enricher.enrich(hotels);

            // average 150
            assertEquals(12.0, enriched.get(0).valueScore(), 1e-9);
            assertEquals(6.75, enriched.get(1).valueScore(), 1e-9);
            assertNull(enriched.get(2).valueScore());
            assertEquals(PopularityTier.NICHE, enriched.get(2).popularityTier());
        }

        @Test
        @DisplayName("At equal price the higher rating has the higher value score")
        void orderedByRatingAtEqualPrice() {
            List<EnrichedHotel> enriched = enricher.enrich(List.of(
                    hotel("Better", 120.0, 9.1, 100, 1.0),
                    hotel("Worse", 120.0, 7.3, 100, 1.0)));

            assertTrue(enriched.get(0).valueScore() > enriched.get(1).valueScore());
        }

        @Test
        @DisplayName("Hotels without any price fail enrichment")
        void allPricesMissing() {
            List<ConsolidatedHotel> hotels = List.of(unratedHotel("One", null), hotel("Two", null, 8.0, 10, 1.0));

            InsufficientDataException e = assertThrows(InsufficientDataException.class, () -> enricher.enrich(hotels));
            assertTrue(e.getMessage().contains("price"));
        }

        @Test
        @DisplayName("Chunked averaging matches a single pass")
        void chunkedAverage() {
            List<ConsolidatedHotel> hotels = new ArrayList<>();
            for (int i = 0; i < 57; i++) {
                hotels.add(hotel("Hotel " + i, i % 5 == 0 ? null : 50.0 + i, 8.0, i, 1.0));
            }

            double single = enricher.averagePrice(hotels, PartitionExecutor.sequential(), hotels.size());
            double chunked;
            try (PartitionExecutor executor = PartitionExecutor.create(3)) {
                chunked = enricher.averagePrice(hotels, executor, 7);
            }

            assertEquals(single, chunked, 1e-9);
        }
    }

    @Nested
    @DisplayName("Classification")
    class Classification {

        @ParameterizedTest(name = "{0} reviews -> {1}")
        @CsvSource({
                "0, NICHE",
                "49, NICHE",
                "50, ESTABLISHED",
                "299, ESTABLISHED",
                "300, POPULAR",
                "999, POPULAR",
                "1000, VERY_POPULAR",
                "25000, VERY_POPULAR"
        })
        void popularityTiers(int reviews, PopularityTier expected) {
            assertEquals(expected, enricher.popularityTier(reviews));
        }

        @ParameterizedTest(name = "{0} km -> {1}")
        @CsvSource({
                "0.0, CENTRAL",
                "0.99, CENTRAL",
                "1.0, NEAR_CENTER",
                "2.9, NEAR_CENTER",
                "3.0, OUTER",
                "8.0, REMOTE",
                "40.0, REMOTE"
        })
        void locationCategories(double km, LocationCategory expected) {
            assertEquals(expected, enricher.locationCategory(km));
        }

        @Test
        @DisplayName("Unknown distance is its own category")
        void unknownDistance() {
            assertEquals(LocationCategory.UNKNOWN, enricher.locationCategory(null));
        }

        @Test
        @DisplayName("Breakpoint counts must fit the categories")
        void breakpointCount() {
            assertThrows(ConfigurationException.class,
                    () -> new Enricher(Breakpoints.of(10, 20), Breakpoints.defaultLocation()));
            assertThrows(ConfigurationException.class,
                    () -> new Enricher(Breakpoints.defaultPopularity(), Breakpoints.of(1, 2, 3, 4)));
        }
    }

    @Nested
    @DisplayName("Breakpoints and accumulators")
    class Parts {

        @Test
        @DisplayName("Breakpoints must be strictly ascending, finite and non-negative")
        void invalidBreakpoints() {
            assertThrows(ConfigurationException.class, () -> Breakpoints.of(5, 5, 10));
            assertThrows(ConfigurationException.class, () -> Breakpoints.of(10, 5));
            assertThrows(ConfigurationException.class, () -> Breakpoints.of(-1, 5));
            assertThrows(ConfigurationException.class, () -> Breakpoints.of(1, Double.POSITIVE_INFINITY));
            assertThrows(ConfigurationException.class, () -> new Breakpoints(List.of()));
        }

        @Test
        @DisplayName("Partial sums combine into the overall average")
        void combinePartials() {
            PriceAccumulator left = PriceAccumulator.EMPTY.add(100.0).add(200.0);
            PriceAccumulator right = PriceAccumulator.EMPTY.add(60.0);

            PriceAccumulator total = left.combine(right).combine(PriceAccumulator.EMPTY);

            assertEquals(3, total.count());
            assertEquals(120.0, total.average(), 1e-9);
            assertThrows(InsufficientDataException.class, PriceAccumulator.EMPTY::average);
        }
    }
}

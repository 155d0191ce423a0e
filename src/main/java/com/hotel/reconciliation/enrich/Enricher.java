package com.hotel.reconciliation.enrich;

import com.hotel.reconciliation.concurrent.PartitionExecutor;
import com.hotel.reconciliation.config.ConfigurationException;
import com.hotel.reconciliation.core.model.ConsolidatedHotel;
import com.hotel.reconciliation.core.model.EnrichedHotel;
import com.hotel.reconciliation.core.model.LocationCategory;
import com.hotel.reconciliation.core.model.PopularityTier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Derives value score, popularity tier and location category for consolidated hotels.
 *
 * <p>Value score is {@code rating / (price / averagePrice)}, where the average is taken over
 * every hotel of the run with a valid price, single-source hotels included. Hotels without
 * price get no value score but are still classified.</p>
 */
public class Enricher {
    private static final Logger log = LoggerFactory.getLogger(Enricher.class);

    private final Breakpoints popularityBreakpoints;
    private final Breakpoints locationBreakpoints;

    public Enricher() {
        this(Breakpoints.defaultPopularity(), Breakpoints.defaultLocation());
    }

    public Enricher(Breakpoints popularityBreakpoints, Breakpoints locationBreakpoints) {
        this.popularityBreakpoints = Objects.requireNonNull(popularityBreakpoints, "popularityBreakpoints is required");
        this.locationBreakpoints = Objects.requireNonNull(locationBreakpoints, "locationBreakpoints is required");
        if (popularityBreakpoints.size() != PopularityTier.values().length - 1) {
            throw new ConfigurationException("popularity needs " + (PopularityTier.values().length - 1)
                    + " breakpoints, got " + popularityBreakpoints.values());
        }
        if (locationBreakpoints.size() != LocationCategory.orderedCount() - 1) {
            throw new ConfigurationException("location needs " + (LocationCategory.orderedCount() - 1)
                    + " breakpoints, got " + locationBreakpoints.values());
        }
    }

    /**
     * Enriches the full consolidated set on the calling thread.
     *
     * @throws InsufficientDataException when no hotel has a valid price
     */
    public List<EnrichedHotel> enrich(List<ConsolidatedHotel> hotels) {
        return enrich(hotels, PartitionExecutor.sequential(), Math.max(1, hotels.size()));
    }

    /**
     * Enriches the full consolidated set, averaging prices in chunks.
     *
     * @throws InsufficientDataException when no hotel has a valid price
     */
    public List<EnrichedHotel> enrich(List<ConsolidatedHotel> hotels, PartitionExecutor executor, int chunkSize) {
        double averagePrice = averagePrice(hotels, executor, chunkSize);
        List<EnrichedHotel> enriched = hotels.stream()
                .map(hotel -> enrich(hotel, averagePrice))
                .toList();
        long withoutScore = enriched.stream().filter(h -> !h.hasValueScore()).count();
        log.info("enrichment.completed hotels={} averagePrice={} withoutValueScore={}",
                enriched.size(), averagePrice, withoutScore);
        return enriched;
    }

    /**
     * Average valid price over the set.
     *
     * @throws InsufficientDataException when no hotel has a valid price
     */
    public double averagePrice(List<ConsolidatedHotel> hotels, PartitionExecutor executor, int chunkSize) {
        List<PriceAccumulator> partials = executor.map(PartitionExecutor.chunk(hotels, chunkSize), PriceAccumulator::of);
        PriceAccumulator total = PriceAccumulator.EMPTY;
        for (PriceAccumulator partial : partials) {
            total = total.combine(partial);
        }
        if (total.isEmpty()) {
            log.warn("enrichment.failed hotels={} reason=no-valid-price", hotels.size());
        }
        return total.average();
    }

    public EnrichedHotel enrich(ConsolidatedHotel hotel, double averagePrice) {
        Double valueScore = hotel.hasPrice()
                ? valueScore(hotel.rating(), hotel.price(), averagePrice)
                : null;
        return new EnrichedHotel(hotel, valueScore, popularityTier(hotel.reviewCount()),
                locationCategory(hotel.distanceToCenterKm()));
    }

    /**
     * rating / (price / averagePrice). For equal prices this orders hotels by rating.
     */
    public static double valueScore(double rating, double price, double averagePrice) {
        return rating / (price / averagePrice);
    }

    public PopularityTier popularityTier(int reviewCount) {
        return PopularityTier.values()[popularityBreakpoints.classify(reviewCount)];
    }

    public LocationCategory locationCategory(Double distanceKm) {
        if (distanceKm == null) {
            return LocationCategory.UNKNOWN;
        }
        return LocationCategory.values()[locationBreakpoints.classify(distanceKm)];
    }

    public Breakpoints getPopularityBreakpoints() {
        return popularityBreakpoints;
    }

    public Breakpoints getLocationBreakpoints() {
        return locationBreakpoints;
    }
}

package com.hotel.reconciliation.normalize;

import com.hotel.reconciliation.blocking.BucketKey;
import com.hotel.reconciliation.blocking.BucketKeyStrategy;
import com.hotel.reconciliation.concurrent.PartitionExecutor;
import com.hotel.reconciliation.core.model.DataQualityWarning;
import com.hotel.reconciliation.core.model.GeoPoint;
import com.hotel.reconciliation.core.model.NormalizedListing;
import com.hotel.reconciliation.core.model.RawListing;
import com.hotel.reconciliation.core.model.Source;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Converts raw listings into {@link NormalizedListing}s.
 *
 * <p>{@link #normalize(RawListing)} never fails on bad data: malformed prices, ratings,
 * review counts and coordinates are dropped or defaulted and a {@link DataQualityWarning}
 * is attached to the result. The function is pure, so listings can be normalized in any
 * order and on any thread.</p>
 */
public class ListingNormalizer {
    private static final Logger log = LoggerFactory.getLogger(ListingNormalizer.class);

    private final NameCleaner nameCleaner;
    private final Map<Source, RatingScale> ratingScales;
    private final BucketKeyStrategy bucketKeyStrategy;

    public ListingNormalizer(NameCleaner nameCleaner, Map<Source, RatingScale> ratingScales,
                             BucketKeyStrategy bucketKeyStrategy) {
        this.nameCleaner = Objects.requireNonNull(nameCleaner, "nameCleaner is required");
        this.bucketKeyStrategy = Objects.requireNonNull(bucketKeyStrategy, "bucketKeyStrategy is required");
        Map<Source, RatingScale> scales = new EnumMap<>(Source.class);
        for (Source source : Source.values()) {
            scales.put(source, ratingScales.getOrDefault(source, RatingScale.tenPoint()));
        }
        this.ratingScales = Map.copyOf(scales);
    }

    public NormalizedListing normalize(RawListing raw) {
        Objects.requireNonNull(raw, "raw listing is required");
        List<DataQualityWarning> warnings = new ArrayList<>(2);

        String cleanedName = nameCleaner.clean(raw.name());
        if (cleanedName.isEmpty()) {
            warnings.add(warning(raw, "name", "name is missing or has no letters or digits: '" + raw.name() + "'"));
        }

        Double price = raw.price();
        if (price == null) {
            warnings.add(warning(raw, "price", "price is missing"));
        } else if (!Double.isFinite(price) || price <= 0.0) {
            warnings.add(warning(raw, "price", "price " + price + " is not a positive amount, treated as missing"));
            price = null;
        }

        RatingScale scale = ratingScales.get(raw.source());
        double rating = 0.0;
        boolean unrated = true;
        if (raw.rating() == null) {
            warnings.add(warning(raw, "rating", "rating is missing, listing marked unrated"));
        } else if (!scale.contains(raw.rating())) {
            warnings.add(warning(raw, "rating", "rating " + raw.rating() + " outside scale ["
                    + scale.min() + ", " + scale.max() + "], listing marked unrated"));
        } else {
            rating = scale.toCommonScale(raw.rating());
            unrated = false;
        }

        int reviewCount = 0;
        if (raw.reviewCount() == null) {
            warnings.add(warning(raw, "reviewCount", "review count is missing, set to 0"));
        } else if (raw.reviewCount() < 0) {
            warnings.add(warning(raw, "reviewCount", "negative review count " + raw.reviewCount() + " set to 0"));
        } else {
            reviewCount = raw.reviewCount();
        }

        GeoPoint coordinates = null;
        if (raw.latitude() == null || raw.longitude() == null) {
            warnings.add(warning(raw, "coordinates", "coordinates are missing"));
        } else if (!GeoPoint.isValid(raw.latitude(), raw.longitude())) {
            warnings.add(warning(raw, "coordinates", "coordinates (" + raw.latitude() + ", "
                    + raw.longitude() + ") are out of range, treated as missing"));
        } else {
            coordinates = GeoPoint.of(raw.latitude(), raw.longitude());
        }

        Double distance = raw.distanceToCenterKm();
        if (distance != null && (!Double.isFinite(distance) || distance < 0.0)) {
            warnings.add(warning(raw, "distance", "distance to center " + distance + " is invalid, treated as missing"));
            distance = null;
        }

        BucketKey bucketKey = bucketKeyStrategy.keyFor(cleanedName, coordinates);
        if (!warnings.isEmpty() && log.isDebugEnabled()) {
            log.debug("listing.normalized.with-warnings source={} index={} warnings={}",
                    raw.source(), raw.index(), warnings);
        }
        return new NormalizedListing(raw, cleanedName, price, rating, unrated, reviewCount,
                coordinates, distance, bucketKey, warnings);
    }

    /**
     * Normalizes a whole source sequence in chunks, preserving input order.
     */
    public List<NormalizedListing> normalizeAll(List<RawListing> listings, PartitionExecutor executor,
                                                int chunkSize) {
        List<List<NormalizedListing>> chunks = executor.map(
                PartitionExecutor.chunk(listings, chunkSize),
                chunk -> chunk.stream().map(this::normalize).toList());
        List<NormalizedListing> normalized = new ArrayList<>(listings.size());
        chunks.forEach(normalized::addAll);
        return normalized;
    }

    public String cleanName(String name) {
        return nameCleaner.clean(name);
    }

    private static DataQualityWarning warning(RawListing raw, String field, String message) {
        return new DataQualityWarning(raw.source(), raw.index(), field, message);
    }
}

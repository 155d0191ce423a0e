package com.hotel.reconciliation.enrich;

import com.hotel.reconciliation.config.ConfigurationException;

import java.util.Arrays;
import java.util.List;

/**
 * Strictly ascending thresholds splitting a numeric range into {@code size() + 1} ordered buckets.
 * A value equal to a breakpoint belongs to the higher bucket.
 */
public record Breakpoints(List<Double> values) {

    public Breakpoints {
        if (values == null || values.isEmpty()) {
            throw new ConfigurationException("breakpoints must not be empty");
        }
        values = List.copyOf(values);
        double previous = Double.NEGATIVE_INFINITY;
        for (Double value : values) {
            if (value == null || !Double.isFinite(value) || value < 0.0) {
                throw new ConfigurationException("breakpoints must be finite and >= 0, got " + values);
            }
            if (value <= previous) {
                throw new ConfigurationException("breakpoints must be strictly ascending, got " + values);
            }
            previous = value;
        }
    }

    public static Breakpoints of(double... values) {
        return new Breakpoints(Arrays.stream(values).boxed().toList());
    }

    /**
     * Default review-count breakpoints: NICHE below 50, ESTABLISHED below 300, POPULAR below 1000.
     */
    public static Breakpoints defaultPopularity() {
        return of(50, 300, 1000);
    }

    /**
     * Default distance breakpoints in km: CENTRAL below 1, NEAR_CENTER below 3, OUTER below 8.
     */
    public static Breakpoints defaultLocation() {
        return of(1, 3, 8);
    }

    /**
     * Returns the bucket ordinal of {@code value}, from 0 to {@link #size()}.
     */
    public int classify(double value) {
        int bucket = 0;
        while (bucket < values.size() && value >= values.get(bucket)) {
            bucket++;
        }
        return bucket;
    }

    public int size() {
        return values.size();
    }
}

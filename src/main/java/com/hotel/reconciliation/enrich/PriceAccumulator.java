package com.hotel.reconciliation.enrich;

import com.hotel.reconciliation.core.model.ConsolidatedHotel;

import java.util.List;

/**
 * Partial sum and count of valid prices. Partials from independent partitions are
 * combined and finalized once into the city average.
 */
public record PriceAccumulator(double sum, long count) {

    public static final PriceAccumulator EMPTY = new PriceAccumulator(0.0, 0);

    public PriceAccumulator {
        if (count < 0) {
            throw new IllegalArgumentException("count must be >= 0");
        }
    }

    /**
     * Accumulates the priced hotels of one partition; hotels without price are skipped.
     */
    public static PriceAccumulator of(List<ConsolidatedHotel> hotels) {
        double sum = 0.0;
        long count = 0;
        for (ConsolidatedHotel hotel : hotels) {
            if (hotel.hasPrice()) {
                sum += hotel.price();
                count++;
            }
        }
        return new PriceAccumulator(sum, count);
    }

    public PriceAccumulator add(double price) {
        return new PriceAccumulator(sum + price, count + 1);
    }

    public PriceAccumulator combine(PriceAccumulator other) {
        return new PriceAccumulator(sum + other.sum, count + other.count);
    }

    public boolean isEmpty() {
        return count == 0;
    }

    /**
     * @throws InsufficientDataException when nothing was accumulated
     */
    public double average() {
        if (count == 0) {
            throw new InsufficientDataException("No hotel has a valid price; city average price is undefined");
        }
        return sum / count;
    }
}

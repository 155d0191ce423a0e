package com.hotel.reconciliation.core.model;

import java.util.Objects;

/**
 * A recoverable data problem found while normalizing a listing.
 * The offending value has already been defaulted or dropped when this is created;
 * the warning only records that it happened.
 *
 * @param source  source of the listing
 * @param index   index of the listing within its source
 * @param field   the field that was defaulted (name, price, rating, reviewCount, coordinates, distance)
 * @param message human readable description including the rejected value
 */
public record DataQualityWarning(Source source, int index, String field, String message) {

    public DataQualityWarning {
        Objects.requireNonNull(source, "source is required");
        Objects.requireNonNull(field, "field is required");
        Objects.requireNonNull(message, "message is required");
    }

    @Override
    public String toString() {
        return source + "#" + index + " " + field + ": " + message;
    }
}

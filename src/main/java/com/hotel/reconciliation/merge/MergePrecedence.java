package com.hotel.reconciliation.merge;

import com.hotel.reconciliation.core.model.GeoPoint;
import com.hotel.reconciliation.core.model.NormalizedListing;
import com.hotel.reconciliation.geo.CoordinatePrecision;

/**
 * Field-level precedence between the two listings of a match.
 * Every rule breaks ties in favor of the Source A listing.
 */
public final class MergePrecedence {

    private MergePrecedence() {
        // Utility class
    }

    /**
     * The listing whose rating and price are trusted: the one with more reviews.
     */
    public static NormalizedListing byReviewCount(NormalizedListing a, NormalizedListing b) {
        return a.reviewCount() >= b.reviewCount() ? a : b;
    }

    /**
     * The listing with the more precise coordinates, counted on the reported text when the
     * platform's text is known. An absent coordinate never wins against a present one.
     */
    public static NormalizedListing byCoordinatePrecision(NormalizedListing a, NormalizedListing b) {
        return CoordinatePrecision.decimalPlaces(a) >= CoordinatePrecision.decimalPlaces(b) ? a : b;
    }

    /**
     * The listing with the lowest valid price, or null when neither has one.
     */
    public static NormalizedListing byLowestPrice(NormalizedListing a, NormalizedListing b) {
        if (!a.hasPrice()) {
            return b.hasPrice() ? b : null;
        }
        if (!b.hasPrice()) {
            return a;
        }
        return a.price() <= b.price() ? a : b;
    }

    public static GeoPoint coordinates(NormalizedListing a, NormalizedListing b) {
        return byCoordinatePrecision(a, b).coordinates();
    }
}

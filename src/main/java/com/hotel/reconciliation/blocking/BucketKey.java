package com.hotel.reconciliation.blocking;

import java.util.Objects;

/**
 * Coarse pre-filter key: a grid cell combined with a name token.
 * Two listings are candidates when their tokens are equal and their cells are equal or adjacent.
 * An empty token means the name component is not used.
 */
public record BucketKey(GridCell cell, String nameToken) {

    public BucketKey {
        Objects.requireNonNull(cell, "cell is required");
        nameToken = nameToken != null ? nameToken : "";
    }

    /**
     * Returns the key for the same token in another cell.
     */
    public BucketKey inCell(GridCell other) {
        return new BucketKey(other, nameToken);
    }

    @Override
    public String toString() {
        return cell + "|" + nameToken;
    }
}

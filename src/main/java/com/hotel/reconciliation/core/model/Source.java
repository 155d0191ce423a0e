package com.hotel.reconciliation.core.model;

/**
 * One of the two independent platforms supplying listings for the same query.
 * Source A is the probing side of candidate generation; Source B is the indexed side.
 */
public enum Source {
    A,
    B;

    /**
     * Returns the opposite source.
     */
    public Source other() {
        return this == A ? B : A;
    }
}

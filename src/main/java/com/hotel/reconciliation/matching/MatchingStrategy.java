package com.hotel.reconciliation.matching;

/**
 * How qualifying pairs are reduced to a one-to-one matching.
 */
public enum MatchingStrategy {

    /**
     * Claim pairs in preference order (similarity desc, distance asc); a claimed listing
     * is out of candidacy for every later pair.
     */
    GREEDY,

    /**
     * Greedy claiming followed by augmenting paths: a claim is moved to a less preferred
     * partner only when that lets one more pair match. The result has maximum cardinality,
     * so loosening a threshold can never lose a match.
     */
    MAXIMUM
}

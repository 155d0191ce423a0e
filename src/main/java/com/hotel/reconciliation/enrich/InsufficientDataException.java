package com.hotel.reconciliation.enrich;

/**
 * Runtime exception thrown when city-level aggregates cannot be computed,
 * typically because no hotel in the run has a usable price.
 */
public class InsufficientDataException extends RuntimeException {

    public InsufficientDataException(String message) {
        super(message);
    }

    public InsufficientDataException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.hotel.reconciliation.config;

/**
 * Runtime exception thrown when reconciliation configuration is invalid.
 * Raised before any listing is processed; a run never starts with a bad configuration.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}

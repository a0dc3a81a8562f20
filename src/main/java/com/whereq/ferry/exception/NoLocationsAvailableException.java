package com.whereq.ferry.exception;

/**
 * No service location or compute zone matches the configured regions
 */
public class NoLocationsAvailableException extends ConfigurationException {
    public NoLocationsAvailableException(String message) {
        super(message);
    }
}

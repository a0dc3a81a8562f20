package com.whereq.ferry.exception;

/**
 * Fatal configuration problem (missing credentials, unsatisfiable location, bad sources).
 * Raised during startup and aborts it.
 */
public class ConfigurationException extends FerryException {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}

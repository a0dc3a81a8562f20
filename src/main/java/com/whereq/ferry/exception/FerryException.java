package com.whereq.ferry.exception;

/**
 * Base class for all errors raised by Ferry
 */
public class FerryException extends RuntimeException {
    public FerryException(String message) {
        super(message);
    }

    public FerryException(String message, Throwable cause) {
        super(message, cause);
    }
}

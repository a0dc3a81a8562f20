package com.whereq.ferry.exception;

/**
 * A job's resource request cannot be turned into a machine specification.
 * Fatal for the job, raised before anything is submitted.
 */
public class ResourceSpecException extends FerryException {
    public ResourceSpecException(String message) {
        super(message);
    }
}

package com.whereq.ferry.exception;

/**
 * A retryable remote call kept failing until the attempt budget ran out.
 * The last failure is the cause.
 */
public class RemoteCallExhaustedException extends FerryException {

    private final int attempts;

    public RemoteCallExhaustedException(int attempts, Throwable lastCause) {
        super("Remote call failed after " + attempts + " attempts: " + lastCause.getMessage(), lastCause);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}

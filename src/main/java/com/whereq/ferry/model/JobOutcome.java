package com.whereq.ferry.model;

import lombok.Value;

/**
 * Verdict over the events of a finished operation
 */
@Value
public class JobOutcome {
    boolean successful;

    /**
     * First failure seen, null on success
     */
    String failureMessage;

    public static JobOutcome success() {
        return new JobOutcome(true, null);
    }

    public static JobOutcome failure(String message) {
        return new JobOutcome(false, message);
    }
}

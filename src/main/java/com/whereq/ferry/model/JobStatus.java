package com.whereq.ferry.model;

/**
 * Job lifecycle states
 *
 * State transitions:
 * PENDING → SUBMITTED → RUNNING → {SUCCEEDED, FAILED, CANCELLED}
 * PENDING → FAILED (planning or submission rejected)
 */
public enum JobStatus {
    /**
     * Job descriptor accepted, nothing sent yet
     */
    PENDING,

    /**
     * Pipeline run accepted by the remote service
     */
    SUBMITTED,

    /**
     * Remote operation observed as not done
     */
    RUNNING,

    /**
     * Completed successfully
     */
    SUCCEEDED,

    /**
     * Terminated with error
     */
    FAILED,

    /**
     * Cancel requested by the caller
     */
    CANCELLED;

    /**
     * Check if this is a terminal state
     */
    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == CANCELLED;
    }
}

package com.whereq.ferry.service;

import com.whereq.ferry.model.SubmittedJob;

/**
 * Receives terminal job outcomes found while polling
 */
public interface JobReporter {

    void jobSucceeded(SubmittedJob job);

    /**
     * @param message failure detail, may be null when the operation vanished
     */
    void jobFailed(SubmittedJob job, String message);
}

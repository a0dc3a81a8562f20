package com.whereq.ferry.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * A job accepted by the pipelines API, identified by its long-running operation
 */
@Value
@Builder
public class SubmittedJob {
    JobRequest job;

    /**
     * Last path segment of the operation name
     */
    String externalJobId;

    /**
     * Full operation name: projects/{project}/locations/{location}/operations/{id}
     */
    String operationName;

    Instant submittedAt;

    public String getJobId() {
        return job.getJobId();
    }
}

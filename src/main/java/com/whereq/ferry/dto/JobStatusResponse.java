package com.whereq.ferry.dto;

import com.whereq.ferry.model.JobStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Response for job status query
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobStatusResponse {
    /**
     * Job identifier
     */
    private String jobId;

    /**
     * Job name
     */
    private String name;

    /**
     * Current status
     */
    private JobStatus status;

    /**
     * Life Sciences operation name, once submitted
     */
    private String operationName;

    /**
     * When the job was submitted
     */
    private Instant submittedAt;

    /**
     * When a terminal status was recorded
     */
    private Instant completedAt;

    /**
     * Error message (if failed)
     */
    private String errorMessage;
}

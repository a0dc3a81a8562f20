package com.whereq.ferry.dto;

import com.whereq.ferry.model.JobStatus;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Response for job submission
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobSubmitResponse {

    @Schema(description = "Job identifier", example = "42")
    private String jobId;

    @Schema(description = "Operation id assigned by Life Sciences", example = "11111111111111111111")
    private String externalJobId;

    @Schema(description = "Current job status")
    private JobStatus status;

    @Schema(description = "When the job was submitted")
    private Instant submittedAt;

    @Schema(description = "Error message (if submission failed)")
    private String errorMessage;

    /**
     * Create error response
     */
    public static JobSubmitResponse error(String message) {
        return JobSubmitResponse.builder()
            .status(JobStatus.FAILED)
            .errorMessage(message)
            .submittedAt(Instant.now())
            .build();
    }
}

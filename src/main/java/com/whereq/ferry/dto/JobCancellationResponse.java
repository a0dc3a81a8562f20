package com.whereq.ferry.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Response for a cancel-all sweep
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobCancellationResponse {
    /**
     * Jobs a cancel request was sent for
     */
    private List<String> jobIds;

    /**
     * When the sweep finished
     */
    private Instant cancelledAt;

    private String message;
}

package com.whereq.ferry.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;

/**
 * Backoff policy for remote calls
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RetryPolicy {

    /**
     * Total number of executions, the first call included
     */
    @Builder.Default
    private int maxAttempts = 4;

    /**
     * Delay before the first retry, doubled after every failure
     */
    @Builder.Default
    private Duration initialDelay = Duration.ofSeconds(2);

    /**
     * Get default retry policy
     */
    public static RetryPolicy defaultPolicy() {
        return RetryPolicy.builder().build();
    }
}

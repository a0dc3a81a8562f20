package com.whereq.ferry.service;

import com.whereq.ferry.model.JobStatus;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Track job status and metadata for the lifetime of the process
 */
@Slf4j
@Service
public class JobStatusTracker {

    private final Map<String, JobMetadata> jobs = new ConcurrentHashMap<>();

    /**
     * Register a job that has not been sent yet
     */
    public void register(String jobId, String name) {
        JobMetadata metadata = new JobMetadata();
        metadata.setJobId(jobId);
        metadata.setName(name);
        metadata.setStatus(JobStatus.PENDING);
        metadata.setCreatedAt(Instant.now());
        jobs.put(jobId, metadata);
    }

    /**
     * Update job status
     *
     * @param jobId job identifier
     * @param status new status
     */
    public void updateStatus(String jobId, JobStatus status) {
        updateStatus(jobId, status, null);
    }

    /**
     * Update job status with an error message. Terminal states are final.
     *
     * @param jobId job identifier
     * @param status new status
     * @param errorMessage failure detail, may be null
     */
    public void updateStatus(String jobId, JobStatus status, String errorMessage) {
        jobs.computeIfPresent(jobId, (id, metadata) -> {
            JobStatus previous = metadata.getStatus();
            if (previous.isTerminal()) {
                log.debug("Job {} already {}, ignoring {}", id, previous, status);
                return metadata;
            }

            Instant now = Instant.now();
            switch (status) {
                case SUBMITTED -> metadata.setSubmittedAt(now);
                case RUNNING -> {
                    if (metadata.getStartedAt() == null) {
                        metadata.setStartedAt(now);
                    }
                }
                case SUCCEEDED, FAILED, CANCELLED -> metadata.setCompletedAt(now);
                default -> {
                }
            }
            metadata.setStatus(status);
            if (errorMessage != null) {
                metadata.setErrorMessage(errorMessage);
            }
            if (previous != status) {
                log.info("Job {} status updated: {} -> {}", id, previous, status);
            }
            return metadata;
        });
    }

    public void recordOperation(String jobId, String operationName) {
        jobs.computeIfPresent(jobId, (id, metadata) -> {
            metadata.setOperationName(operationName);
            return metadata;
        });
    }

    /**
     * Copy of the job metadata
     */
    public Optional<JobMetadata> getMetadata(String jobId) {
        return Optional.ofNullable(jobs.get(jobId)).map(JobMetadata::copy);
    }

    public List<JobMetadata> getByStatus(JobStatus status) {
        return jobs.values().stream()
            .filter(metadata -> metadata.getStatus() == status)
            .map(JobMetadata::copy)
            .collect(Collectors.toCollection(ArrayList::new));
    }

    /**
     * Job metadata
     */
    @Data
    public static class JobMetadata {
        private String jobId;
        private String name;
        private JobStatus status;
        private String operationName;
        private Instant createdAt;
        private Instant submittedAt;
        private Instant startedAt;
        private Instant completedAt;
        private String errorMessage;

        JobMetadata copy() {
            JobMetadata copy = new JobMetadata();
            copy.setJobId(jobId);
            copy.setName(name);
            copy.setStatus(status);
            copy.setOperationName(operationName);
            copy.setCreatedAt(createdAt);
            copy.setSubmittedAt(submittedAt);
            copy.setStartedAt(startedAt);
            copy.setCompletedAt(completedAt);
            copy.setErrorMessage(errorMessage);
            return copy;
        }
    }
}

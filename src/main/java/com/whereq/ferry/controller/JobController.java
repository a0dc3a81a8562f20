package com.whereq.ferry.controller;

import com.whereq.ferry.dto.JobCancellationResponse;
import com.whereq.ferry.dto.JobStatusResponse;
import com.whereq.ferry.dto.JobSubmitResponse;
import com.whereq.ferry.exception.ResourceSpecException;
import com.whereq.ferry.exception.SingularityUnsupportedException;
import com.whereq.ferry.model.JobRequest;
import com.whereq.ferry.model.JobStatus;
import com.whereq.ferry.service.JobScheduler;
import com.whereq.ferry.service.JobStatusTracker;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Controller for Life Sciences job submission and management
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/jobs")
@RequiredArgsConstructor
@Tag(name = "Jobs", description = "Submit jobs to Google Cloud Life Sciences and track them")
public class JobController {

    private final JobScheduler jobScheduler;
    private final JobStatusTracker statusTracker;

    /**
     * Submit a job
     *
     * @param request job request
     * @return Mono with 202 Accepted response
     */
    @PostMapping
    @Operation(
        summary = "Submit job",
        description = "Plan the machine type for the job and submit it as a Life Sciences pipeline",
        requestBody = @io.swagger.v3.oas.annotations.parameters.RequestBody(
            content = @Content(
                mediaType = "application/json",
                schema = @Schema(implementation = JobRequest.class),
                examples = @ExampleObject(
                    name = "Single rule",
                    value = """
                    {
                      "jobId": "42",
                      "name": "align",
                      "rules": ["align"],
                      "resources": {
                        "cores": 2,
                        "memoryMb": 4096,
                        "diskMb": 10240
                      },
                      "command": "snakemake --snakefile Snakefile --force align"
                    }
                    """
                )
            )
        )
    )
    public Mono<ResponseEntity<JobSubmitResponse>> submitJob(@Valid @RequestBody JobRequest request) {
        log.info("Received job submission: jobId={}, name={}, rules={}",
            request.getJobId(), request.getName(), request.getRules());

        return Mono.fromCallable(() -> jobScheduler.submit(request))
            .subscribeOn(Schedulers.boundedElastic())
            .map(submitted -> ResponseEntity
                .status(HttpStatus.ACCEPTED)
                .location(URI.create("/api/v1/jobs/" + submitted.getJobId()))
                .body(JobSubmitResponse.builder()
                    .jobId(submitted.getJobId())
                    .externalJobId(submitted.getExternalJobId())
                    .status(JobStatus.SUBMITTED)
                    .submittedAt(submitted.getSubmittedAt())
                    .build()))
            .onErrorResume(ResourceSpecException.class, e -> {
                log.error("Resource error: {}", e.getMessage());
                return Mono.just(ResponseEntity
                    .badRequest()
                    .body(JobSubmitResponse.error(e.getMessage())));
            })
            .onErrorResume(SingularityUnsupportedException.class, e -> {
                log.error("Unsupported job: {}", e.getMessage());
                return Mono.just(ResponseEntity
                    .badRequest()
                    .body(JobSubmitResponse.error(e.getMessage())));
            })
            .onErrorResume(Exception.class, e -> {
                log.error("Unexpected error during job submission", e);
                return Mono.just(ResponseEntity
                    .status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(JobSubmitResponse.error("Internal server error: " + e.getMessage())));
            });
    }

    /**
     * Get job status
     *
     * @param jobId job identifier
     * @return Mono with job status
     */
    @GetMapping("/{jobId}")
    @Operation(summary = "Job status", description = "Current status of a submitted job")
    public Mono<ResponseEntity<JobStatusResponse>> getJobStatus(@PathVariable String jobId) {
        return Mono.justOrEmpty(statusTracker.getMetadata(jobId))
            .map(metadata -> ResponseEntity.ok(toResponse(metadata)))
            .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @GetMapping
    @Operation(summary = "Active jobs", description = "Jobs whose pipelines may still be running")
    public Mono<ResponseEntity<List<JobStatusResponse>>> listActiveJobs() {
        List<JobStatusResponse> active = jobScheduler.getActiveJobs().stream()
            .map(job -> statusTracker.getMetadata(job.getJobId()))
            .flatMap(Optional::stream)
            .map(this::toResponse)
            .collect(Collectors.toList());
        return Mono.just(ResponseEntity.ok(active));
    }

    /**
     * Cancel all active jobs
     *
     * @return Mono with cancellation response
     */
    @DeleteMapping
    @Operation(summary = "Cancel all", description = "Request cancellation of every active job")
    public Mono<ResponseEntity<JobCancellationResponse>> cancelAll() {
        log.info("Cancellation requested for all active jobs");

        return Mono.fromCallable(jobScheduler::cancelAll)
            .subscribeOn(Schedulers.boundedElastic())
            .map(cancelled -> ResponseEntity.ok(JobCancellationResponse.builder()
                .jobIds(cancelled)
                .cancelledAt(Instant.now())
                .message(cancelled.isEmpty() ? "No active jobs" : "Cancellation requested")
                .build()));
    }

    private JobStatusResponse toResponse(JobStatusTracker.JobMetadata metadata) {
        return JobStatusResponse.builder()
            .jobId(metadata.getJobId())
            .name(metadata.getName())
            .status(metadata.getStatus())
            .operationName(metadata.getOperationName())
            .submittedAt(metadata.getSubmittedAt())
            .completedAt(metadata.getCompletedAt())
            .errorMessage(metadata.getErrorMessage())
            .build();
    }
}

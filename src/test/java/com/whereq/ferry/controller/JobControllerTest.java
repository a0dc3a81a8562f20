package com.whereq.ferry.controller;

import com.whereq.ferry.exception.MissingResourceSpecException;
import com.whereq.ferry.exception.RemoteCallExhaustedException;
import com.whereq.ferry.model.JobRequest;
import com.whereq.ferry.model.JobStatus;
import com.whereq.ferry.model.ResourceRequirement;
import com.whereq.ferry.model.SubmittedJob;
import com.whereq.ferry.service.JobScheduler;
import com.whereq.ferry.service.JobStatusTracker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.io.IOException;
import java.time.Instant;
import java.util.List;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class JobControllerTest {

    private static final String BODY = """
        {
          "jobId": "42",
          "name": "align",
          "rules": ["align"],
          "resources": {"cores": 2, "memoryMb": 4096, "diskMb": 10240},
          "command": "snakemake --force align"
        }
        """;

    private JobScheduler scheduler;
    private JobStatusTracker statusTracker;
    private WebTestClient client;

    @BeforeEach
    void setUp() {
        scheduler = mock(JobScheduler.class);
        statusTracker = new JobStatusTracker();
        client = WebTestClient.bindToController(new JobController(scheduler, statusTracker)).build();
    }

    @Test
    void submitReturnsAcceptedWithLocation() {
        when(scheduler.submit(any())).thenAnswer(invocation -> {
            JobRequest job = invocation.getArgument(0);
            return SubmittedJob.builder()
                .job(job)
                .externalJobId("1234")
                .operationName("projects/p/locations/us-central1/operations/1234")
                .submittedAt(Instant.now())
                .build();
        });

        client.post().uri("/api/v1/jobs")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(BODY)
            .exchange()
            .expectStatus().isAccepted()
            .expectHeader().location("/api/v1/jobs/42")
            .expectBody()
            .jsonPath("$.jobId").isEqualTo("42")
            .jsonPath("$.externalJobId").isEqualTo("1234")
            .jsonPath("$.status").isEqualTo("SUBMITTED");
    }

    @Test
    void resourceErrorIsBadRequest() {
        when(scheduler.submit(any())).thenThrow(new MissingResourceSpecException("memory (mem, mem_mb)", "align"));

        client.post().uri("/api/v1/jobs")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(BODY)
            .exchange()
            .expectStatus().isBadRequest()
            .expectBody()
            .jsonPath("$.status").isEqualTo("FAILED")
            .jsonPath("$.errorMessage").value(containsString("memory (mem, mem_mb)"));
    }

    @Test
    void invalidRequestIsRejectedBeforeSubmission() {
        client.post().uri("/api/v1/jobs")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue("{\"jobId\": \"42\", \"name\": \"align\", \"rules\": [\"align\"]}")
            .exchange()
            .expectStatus().isBadRequest();

        verify(scheduler, never()).submit(any());
    }

    @Test
    void remoteFailureIsServerError() {
        when(scheduler.submit(any()))
            .thenThrow(new RemoteCallExhaustedException(4, new IOException("connection reset")));

        client.post().uri("/api/v1/jobs")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(BODY)
            .exchange()
            .expectStatus().is5xxServerError()
            .expectBody()
            .jsonPath("$.errorMessage")
            .isEqualTo("Internal server error: Remote call failed after 4 attempts: connection reset");
    }

    @Test
    void statusOfKnownJob() {
        statusTracker.register("42", "align");
        statusTracker.updateStatus("42", JobStatus.FAILED, "code 9: preempted");

        client.get().uri("/api/v1/jobs/42")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.name").isEqualTo("align")
            .jsonPath("$.status").isEqualTo("FAILED")
            .jsonPath("$.errorMessage").isEqualTo("code 9: preempted");
    }

    @Test
    void statusOfUnknownJobIsNotFound() {
        client.get().uri("/api/v1/jobs/unknown")
            .exchange()
            .expectStatus().isNotFound();
    }

    @Test
    void cancelAllReportsCancelledJobs() {
        when(scheduler.cancelAll()).thenReturn(List.of("1", "2"));

        client.delete().uri("/api/v1/jobs")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.jobIds.length()").isEqualTo(2)
            .jsonPath("$.message").isEqualTo("Cancellation requested");
    }

    @Test
    void cancelAllWithoutJobs() {
        when(scheduler.cancelAll()).thenReturn(List.of());

        client.delete().uri("/api/v1/jobs")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.message").isEqualTo("No active jobs");
    }

    @Test
    void listActiveJobs() {
        statusTracker.register("1", "sort");
        statusTracker.updateStatus("1", JobStatus.RUNNING);
        SubmittedJob active = SubmittedJob.builder()
            .job(JobRequest.builder().jobId("1").name("sort").rule("sort").command("true")
                .resources(ResourceRequirement.builder().build()).build())
            .externalJobId("op1")
            .operationName("projects/p/locations/l/operations/op1")
            .submittedAt(Instant.now())
            .build();
        when(scheduler.getActiveJobs()).thenReturn(List.of(active));

        client.get().uri("/api/v1/jobs")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$[0].jobId").isEqualTo("1")
            .jsonPath("$[0].status").isEqualTo("RUNNING");
    }
}

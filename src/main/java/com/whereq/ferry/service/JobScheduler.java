package com.whereq.ferry.service;

import com.whereq.ferry.model.JobRequest;
import com.whereq.ferry.model.JobStatus;
import com.whereq.ferry.model.SubmittedJob;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns the active jobs: submits them, polls them on a fixed delay and cancels
 * whatever is left at shutdown.
 */
@Slf4j
@Service
public class JobScheduler implements JobReporter {

    @Autowired
    private JobOrchestrator orchestrator;

    @Autowired
    private JobStatusTracker statusTracker;

    @Autowired
    private MeterRegistry meterRegistry;

    private final Map<String, SubmittedJob> activeJobs = new ConcurrentHashMap<>();

    private Counter submittedCounter;
    private Counter successCounter;
    private Counter failureCounter;
    private Counter cancelledCounter;

    @PostConstruct
    public void initialize() {
        // Register metrics
        submittedCounter = Counter.builder("ferry.jobs.submitted")
            .description("Number of pipelines submitted")
            .register(meterRegistry);

        successCounter = Counter.builder("ferry.jobs.succeeded")
            .description("Number of successfully completed jobs")
            .register(meterRegistry);

        failureCounter = Counter.builder("ferry.jobs.failed")
            .description("Number of failed jobs")
            .register(meterRegistry);

        cancelledCounter = Counter.builder("ferry.jobs.cancelled")
            .description("Number of jobs cancelled")
            .register(meterRegistry);

        orchestrator.initialize();
    }

    /**
     * Submit a job. Any planning or submission error marks the job FAILED and is rethrown.
     */
    public SubmittedJob submit(JobRequest job) {
        statusTracker.register(job.getJobId(), job.getName());
        try {
            SubmittedJob submitted = orchestrator.submit(job);
            activeJobs.put(job.getJobId(), submitted);
            statusTracker.recordOperation(job.getJobId(), submitted.getOperationName());
            statusTracker.updateStatus(job.getJobId(), JobStatus.SUBMITTED);
            submittedCounter.increment();
            return submitted;
        } catch (RuntimeException e) {
            log.error("Job {} could not be submitted: {}", job.getJobId(), e.getMessage());
            statusTracker.updateStatus(job.getJobId(), JobStatus.FAILED, e.getMessage());
            failureCounter.increment();
            throw e;
        }
    }

    /**
     * One polling sweep over the active jobs
     */
    @Scheduled(fixedDelayString = "${ferry.status.poll-interval-ms:10000}")
    public void pollActiveJobs() {
        if (activeJobs.isEmpty()) {
            return;
        }

        Iterator<SubmittedJob> stillRunning = orchestrator.poll(activeJobs.values(), this);
        while (stillRunning.hasNext()) {
            SubmittedJob job = stillRunning.next();
            statusTracker.updateStatus(job.getJobId(), JobStatus.RUNNING);
        }
    }

    @Override
    public void jobSucceeded(SubmittedJob job) {
        if (activeJobs.remove(job.getJobId()) == null) {
            return;
        }
        log.info("Job {} completed successfully", job.getJobId());
        statusTracker.updateStatus(job.getJobId(), JobStatus.SUCCEEDED);
        successCounter.increment();
    }

    @Override
    public void jobFailed(SubmittedJob job, String message) {
        if (activeJobs.remove(job.getJobId()) == null) {
            return;
        }
        log.error("Job {} failed: {}", job.getJobId(), message);
        statusTracker.updateStatus(job.getJobId(), JobStatus.FAILED, message);
        failureCounter.increment();
    }

    /**
     * Cancel every active job
     *
     * @return ids of the jobs a cancel request was sent for
     */
    public List<String> cancelAll() {
        List<SubmittedJob> jobs = new ArrayList<>(activeJobs.values());
        if (jobs.isEmpty()) {
            return Collections.emptyList();
        }

        orchestrator.cancel(jobs);

        List<String> cancelled = new ArrayList<>();
        for (SubmittedJob job : jobs) {
            if (activeJobs.remove(job.getJobId()) != null) {
                statusTracker.updateStatus(job.getJobId(), JobStatus.CANCELLED);
                cancelledCounter.increment();
                cancelled.add(job.getJobId());
            }
        }
        log.info("Cancelled {} jobs", cancelled.size());
        return cancelled;
    }

    @PreDestroy
    public void shutdown() {
        log.info("Shutting down, cancelling {} active jobs", activeJobs.size());
        cancelAll();
        orchestrator.shutdown();
    }

    public Collection<SubmittedJob> getActiveJobs() {
        return Collections.unmodifiableCollection(activeJobs.values());
    }
}

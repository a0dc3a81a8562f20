package com.whereq.ferry.service;

import com.google.common.collect.AbstractIterator;
import com.whereq.ferry.config.FerryProperties;
import com.whereq.ferry.dto.Operation;
import com.whereq.ferry.dto.PipelineRequest;
import com.whereq.ferry.dto.StorageBucket;
import com.whereq.ferry.exception.ConfigurationException;
import com.whereq.ferry.exception.FerryException;
import com.whereq.ferry.exception.RemoteApiException;
import com.whereq.ferry.exception.RemoteCallExhaustedException;
import com.whereq.ferry.exception.SingularityUnsupportedException;
import com.whereq.ferry.model.JobOutcome;
import com.whereq.ferry.model.JobRequest;
import com.whereq.ferry.model.ResourcePlan;
import com.whereq.ferry.model.SourcePackage;
import com.whereq.ferry.model.SubmittedJob;
import com.whereq.ferry.remote.CredentialProvider;
import com.whereq.ferry.remote.LifeSciencesApi;
import com.whereq.ferry.remote.ObjectStoreApi;
import com.whereq.ferry.remote.RemoteCallExecutor;
import com.whereq.ferry.resource.ResourcePlanner;
import com.whereq.ferry.storage.SourcePackageCache;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.UUID;

/**
 * Submits jobs as Life Sciences pipelines, checks on their operations and cancels them.
 * {@link #initialize()} must run once before the first submission.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobOrchestrator {

    static final String PROJECT_ENV = "GOOGLE_CLOUD_PROJECT";

    private final FerryProperties properties;
    private final CredentialProvider credentialProvider;
    private final LifeSciencesApi lifeSciencesApi;
    private final ObjectStoreApi objectStore;
    private final RemoteCallExecutor remoteCallExecutor;
    private final LocationResolver locationResolver;
    private final ResourcePlanner resourcePlanner;
    private final PipelineFactory pipelineFactory;
    private final OutcomeClassifier outcomeClassifier;
    private final SourcePackageCache sourcePackageCache;
    private final StatusRateLimiter statusRateLimiter;

    private final String runNamespace = UUID.randomUUID().toString();

    private volatile String project;
    private volatile String location;
    private volatile SourcePackage sourcePackage;

    /**
     * Check credentials, resolve project and location, ensure the bucket, then package
     * and upload the sources. Calling it again has no effect.
     */
    public synchronized void initialize() {
        if (sourcePackage != null) {
            return;
        }

        credentialProvider.accessToken();

        project = resolveProject();
        location = locationResolver.resolve(project, properties.getLocation(), properties.getRegions());

        FerryProperties.StorageConfig storage = properties.getStorage();
        StorageBucket bucket = remoteCallExecutor.execute(
            objectStore.getOrCreateBucket(storage.bucketName(), project));
        log.debug("bucket={}", bucket != null ? bucket.getName() : storage.bucketName());
        log.debug("subdir={}", storage.subdirectory());
        log.debug("logs={}", storage.logsPrefix());

        Path workdir = Paths.get(properties.getSource().getWorkdir()).toAbsolutePath().normalize();
        List<Path> paths = new ArrayList<>();
        properties.getSource().getPaths().forEach(p -> paths.add(Paths.get(p)));
        if (paths.isEmpty()) {
            paths.add(workdir);
        }
        if (properties.getSource().getMainFile() != null) {
            paths.add(Paths.get(properties.getSource().getMainFile()));
        }

        List<Path> sources = sourcePackageCache.collectSources(workdir, paths);
        SourcePackage prepared = sourcePackageCache.prepare(workdir, sources);
        sourcePackageCache.upload(prepared);
        sourcePackage = prepared;

        log.info("Using {} for Google Life Sciences jobs.", properties.getContainer().getImage());
        log.debug("regions={}", properties.getRegions());
        log.debug("location={}", location);
        log.debug("network={} subnetwork={} service_account_email={}", properties.getMachine().getNetwork(),
            properties.getMachine().getSubnetwork(), properties.getMachine().getServiceAccountEmail());
    }

    /**
     * Plan resources, build the pipeline and submit it
     *
     * @return the submitted job, identified by its operation
     * @throws SingularityUnsupportedException if the job needs Singularity while it is enabled
     */
    public SubmittedJob submit(JobRequest job) {
        if (sourcePackage == null) {
            throw new IllegalStateException("Orchestrator not initialized");
        }

        MDC.put("jobId", job.getJobId());
        try {
            if (job.isNeedsSingularity() && properties.getContainer().isUseSingularity()) {
                throw new SingularityUnsupportedException(job.getName());
            }

            ResourcePlan plan = resourcePlanner.plan(job, project);
            PipelineRequest body = pipelineFactory.create(job, plan, runNamespace, sourcePackage.getBlobName());

            Operation operation = remoteCallExecutor.execute(lifeSciencesApi.run(location, body));
            if (operation == null || operation.getName() == null) {
                throw new FerryException("pipelines.run returned no operation for job " + job.getJobId());
            }
            String operationName = operation.getName();
            String externalJobId = operationName.substring(operationName.lastIndexOf('/') + 1);

            log.info("Get status with:\n"
                    + "gcloud config set project {}\n"
                    + "gcloud beta lifesciences operations describe {}/operations/{}\n"
                    + "gcloud beta lifesciences operations list\n"
                    + "Logs will be saved to: {}/{}",
                project, location, externalJobId,
                properties.getStorage().bucketName(), properties.getStorage().logsPrefix());

            return SubmittedJob.builder()
                .job(job)
                .externalJobId(externalJobId)
                .operationName(operationName)
                .submittedAt(Instant.now())
                .build();
        } finally {
            MDC.remove("jobId");
        }
    }

    /**
     * Check every active job, lazily. Finished jobs are handed to the reporter; jobs
     * still running are returned by the iterator.
     */
    public Iterator<SubmittedJob> poll(Collection<SubmittedJob> activeJobs, JobReporter reporter) {
        Iterator<SubmittedJob> jobs = List.copyOf(activeJobs).iterator();
        return new AbstractIterator<>() {
            @Override
            protected SubmittedJob computeNext() {
                while (jobs.hasNext()) {
                    SubmittedJob job = jobs.next();
                    if (isStillRunning(job, reporter)) {
                        return job;
                    }
                }
                return endOfData();
            }
        };
    }

    private boolean isStillRunning(SubmittedJob job, JobReporter reporter) {
        MDC.put("jobId", job.getJobId());
        try {
            statusRateLimiter.acquire();
            log.debug("Checking status for operation {}", job.getExternalJobId());

            Operation operation;
            try {
                operation = remoteCallExecutor.execute(lifeSciencesApi.getOperation(job.getOperationName()));
            } catch (RemoteApiException e) {
                reporter.jobFailed(job, e.getKind() == RemoteApiException.Kind.NOT_FOUND
                    ? "Operation " + job.getOperationName() + " not found"
                    : e.getMessage());
                return false;
            } catch (RemoteCallExhaustedException e) {
                if (e.getCause() instanceof RemoteApiException rae
                    && rae.getKind() == RemoteApiException.Kind.SERVER_ERROR) {
                    reporter.jobFailed(job, rae.getBody());
                } else {
                    reporter.jobFailed(job, e.getMessage());
                }
                return false;
            } catch (RuntimeException e) {
                reporter.jobFailed(job, e.getMessage());
                return false;
            }

            if (operation == null || !operation.isDone()) {
                return true;
            }

            JobOutcome outcome = outcomeClassifier.classify(operation);
            if (outcome.isSuccessful()) {
                reporter.jobSucceeded(job);
            } else {
                reporter.jobFailed(job, outcome.getFailureMessage());
            }
            return false;
        } finally {
            MDC.remove("jobId");
        }
    }

    /**
     * Request cancellation of every job. Failures are logged and skipped.
     */
    public void cancel(Collection<SubmittedJob> activeJobs) {
        for (SubmittedJob job : activeJobs) {
            log.debug("Cancelling operation {}", job.getExternalJobId());
            try {
                remoteCallExecutor.execute(lifeSciencesApi.cancelOperation(job.getOperationName()));
            } catch (Exception e) {
                log.debug("Failed to cancel operation {}: {}", job.getExternalJobId(), e.getMessage());
            }
        }
    }

    /**
     * Clean up the source package cache
     */
    public void shutdown() {
        sourcePackageCache.shutdown();
    }

    private String resolveProject() {
        String configured = properties.getProject();
        if (configured != null && !configured.isBlank()) {
            return configured;
        }
        String fromEnv = System.getenv(PROJECT_ENV);
        if (fromEnv != null && !fromEnv.isBlank()) {
            return fromEnv;
        }
        throw new ConfigurationException(
            "No Google Cloud project configured. Set ferry.project or " + PROJECT_ENV + ".");
    }

    public String getProject() {
        return project;
    }

    public String getLocation() {
        return location;
    }

    public String getRunNamespace() {
        return runNamespace;
    }

    public SourcePackage getSourcePackage() {
        return sourcePackage;
    }
}

package com.whereq.ferry.service;

import com.whereq.ferry.config.FerryProperties;
import com.whereq.ferry.dto.Operation;
import com.whereq.ferry.dto.PipelineRequest;
import com.whereq.ferry.dto.StorageBucket;
import com.whereq.ferry.exception.ConfigurationException;
import com.whereq.ferry.exception.FerryException;
import com.whereq.ferry.exception.RemoteApiException;
import com.whereq.ferry.exception.SingularityUnsupportedException;
import com.whereq.ferry.model.JobRequest;
import com.whereq.ferry.model.MachineShape;
import com.whereq.ferry.model.ResourcePlan;
import com.whereq.ferry.model.ResourceRequirement;
import com.whereq.ferry.model.RetryPolicy;
import com.whereq.ferry.model.SourcePackage;
import com.whereq.ferry.model.SubmittedJob;
import com.whereq.ferry.remote.CredentialProvider;
import com.whereq.ferry.remote.LifeSciencesApi;
import com.whereq.ferry.remote.ObjectStoreApi;
import com.whereq.ferry.remote.RemoteCallExecutor;
import com.whereq.ferry.remote.RetryPredicates;
import com.whereq.ferry.resource.ResourcePlanner;
import com.whereq.ferry.storage.SourcePackageCache;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.nio.file.Paths;
import java.time.Instant;
import java.util.Iterator;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class JobOrchestratorTest {

    private static final String LOCATION = "projects/proj/locations/us-central1";
    private static final String BLOB = "source/cache/workdir-abc.tar.gz";

    private FerryProperties properties;
    private CredentialProvider credentialProvider;
    private LifeSciencesApi lifeSciencesApi;
    private ObjectStoreApi objectStore;
    private LocationResolver locationResolver;
    private ResourcePlanner resourcePlanner;
    private SourcePackageCache sourcePackageCache;
    private JobReporter reporter;

    private JobOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        properties = new FerryProperties();
        properties.setProject("proj");
        properties.getStorage().setRemotePrefix("ferry-bucket/runs");

        credentialProvider = mock(CredentialProvider.class);
        lifeSciencesApi = mock(LifeSciencesApi.class);
        objectStore = mock(ObjectStoreApi.class);
        locationResolver = mock(LocationResolver.class);
        resourcePlanner = mock(ResourcePlanner.class);
        sourcePackageCache = mock(SourcePackageCache.class);
        reporter = mock(JobReporter.class);

        RemoteCallExecutor executor = new RemoteCallExecutor(RetryPolicy.defaultPolicy(),
            RetryPredicates.transientFailures(), delay -> { });

        orchestrator = new JobOrchestrator(properties, credentialProvider, lifeSciencesApi, objectStore, executor,
            locationResolver, resourcePlanner, new PipelineFactory(properties, name -> null),
            new OutcomeClassifier(), sourcePackageCache, new StatusRateLimiter(1000));

        when(credentialProvider.accessToken()).thenReturn("token");
        when(locationResolver.resolve(eq("proj"), any(), anyList())).thenReturn(LOCATION);
        when(objectStore.getOrCreateBucket("ferry-bucket", "proj"))
            .thenReturn(() -> new StorageBucket("ferry-bucket", "US"));
        when(sourcePackageCache.collectSources(any(), anyCollection())).thenReturn(List.of());
        when(sourcePackageCache.prepare(any(), anyCollection()))
            .thenReturn(new SourcePackage("abc", Paths.get("/tmp/workdir-abc.tar.gz"), BLOB));
    }

    @Test
    void initializeResolvesEnvironmentAndUploadsSources() {
        orchestrator.initialize();
        orchestrator.initialize();

        assertThat(orchestrator.getProject()).isEqualTo("proj");
        assertThat(orchestrator.getLocation()).isEqualTo(LOCATION);
        assertThat(orchestrator.getSourcePackage().getBlobName()).isEqualTo(BLOB);
        verify(sourcePackageCache).upload(orchestrator.getSourcePackage());
    }

    @Test
    void initializeFailsWithoutCredentials() {
        when(credentialProvider.accessToken()).thenThrow(new ConfigurationException("no token"));

        assertThatThrownBy(orchestrator::initialize)
            .isInstanceOf(ConfigurationException.class)
            .hasMessage("no token");
        verifyNoInteractions(locationResolver, sourcePackageCache);
    }

    @Test
    void submitBeforeInitializeIsRejected() {
        assertThatThrownBy(() -> orchestrator.submit(job(false)))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void submitRunsPipelineAndKeepsOperationId() {
        orchestrator.initialize();
        JobRequest job = job(false);
        when(resourcePlanner.plan(job, "proj")).thenReturn(plan());
        when(lifeSciencesApi.run(eq(LOCATION), any()))
            .thenReturn(() -> Operation.builder().name(LOCATION + "/operations/1234567").build());

        SubmittedJob submitted = orchestrator.submit(job);

        assertThat(submitted.getExternalJobId()).isEqualTo("1234567");
        assertThat(submitted.getOperationName()).isEqualTo(LOCATION + "/operations/1234567");
        assertThat(submitted.getJobId()).isEqualTo("7");

        ArgumentCaptor<PipelineRequest> body = ArgumentCaptor.forClass(PipelineRequest.class);
        verify(lifeSciencesApi).run(eq(LOCATION), body.capture());
        assertThat(body.getValue().getLabels().get("name"))
            .isEqualTo("ferryjob-" + orchestrator.getRunNamespace() + "-sort-7");
        assertThat(body.getValue().getPipeline().getActions().get(0).getCommands().get(2)).contains(BLOB);
    }

    @Test
    void emptyRunResponseFailsSubmission() {
        orchestrator.initialize();
        JobRequest job = job(false);
        when(resourcePlanner.plan(job, "proj")).thenReturn(plan());
        when(lifeSciencesApi.run(eq(LOCATION), any())).thenReturn(() -> null);

        assertThatThrownBy(() -> orchestrator.submit(job))
            .isInstanceOf(FerryException.class)
            .hasMessage("pipelines.run returned no operation for job 7");
    }

    @Test
    void singularityJobsAreRejectedWhenEnabled() {
        properties.getContainer().setUseSingularity(true);
        orchestrator.initialize();

        assertThatThrownBy(() -> orchestrator.submit(job(true)))
            .isInstanceOf(SingularityUnsupportedException.class);
        verifyNoInteractions(resourcePlanner, lifeSciencesApi);
    }

    @Test
    void pollIsLazyAndReturnsRunningJobs() {
        SubmittedJob running = submitted("1");
        when(lifeSciencesApi.getOperation(running.getOperationName()))
            .thenReturn(() -> Operation.builder().name(running.getOperationName()).done(false).build());

        Iterator<SubmittedJob> stillRunning = orchestrator.poll(List.of(running), reporter);

        verifyNoInteractions(lifeSciencesApi);
        assertThat(stillRunning).toIterable().containsExactly(running);
        verifyNoInteractions(reporter);
    }

    @Test
    void pollReportsSuccessAndFailures() {
        SubmittedJob succeeded = submitted("1");
        SubmittedJob exitedNonZero = submitted("2");
        when(lifeSciencesApi.getOperation(succeeded.getOperationName()))
            .thenReturn(() -> Operation.builder().done(true).build());
        when(lifeSciencesApi.getOperation(exitedNonZero.getOperationName()))
            .thenReturn(() -> Operation.builder().done(true)
                .metadata(new Operation.Metadata(List.of(Operation.Event.builder()
                    .description("Execution failed: action 1: unexpected exit status 1 was not ignored")
                    .unexpectedExitStatus(new Operation.UnexpectedExitStatusEvent(1, 1, "boom"))
                    .build())))
                .build());

        Iterator<SubmittedJob> stillRunning = orchestrator.poll(List.of(succeeded, exitedNonZero), reporter);

        assertThat(stillRunning).isExhausted();
        verify(reporter).jobSucceeded(succeeded);
        verify(reporter).jobFailed(exitedNonZero,
            "Execution failed: action 1: unexpected exit status 1 was not ignored: boom");
    }

    @Test
    void pollReportsMissingOperation() {
        SubmittedJob job = submitted("1");
        when(lifeSciencesApi.getOperation(job.getOperationName()))
            .thenReturn(() -> {
                throw new RemoteApiException(404, "not found");
            });

        assertThat(orchestrator.poll(List.of(job), reporter)).isExhausted();

        verify(reporter).jobFailed(job, "Operation " + job.getOperationName() + " not found");
    }

    @Test
    void pollReportsServerErrorBodyOnceRetriesRunOut() {
        SubmittedJob job = submitted("1");
        when(lifeSciencesApi.getOperation(job.getOperationName()))
            .thenReturn(() -> {
                throw new RemoteApiException(500, "backend error");
            });

        assertThat(orchestrator.poll(List.of(job), reporter)).isExhausted();

        verify(reporter).jobFailed(job, "backend error");
        verify(reporter, never()).jobSucceeded(any());
    }

    @Test
    void cancelNeverRaises() {
        SubmittedJob first = submitted("1");
        SubmittedJob second = submitted("2");
        when(lifeSciencesApi.cancelOperation(first.getOperationName()))
            .thenReturn(() -> {
                throw new RemoteApiException(400, "already done");
            });
        when(lifeSciencesApi.cancelOperation(second.getOperationName())).thenReturn(() -> null);

        assertThatCode(() -> orchestrator.cancel(List.of(first, second))).doesNotThrowAnyException();

        verify(lifeSciencesApi).cancelOperation(second.getOperationName());
    }

    @Test
    void shutdownCleansSourceCache() {
        orchestrator.shutdown();

        verify(sourcePackageCache).shutdown();
    }

    private static JobRequest job(boolean singularity) {
        return JobRequest.builder()
            .jobId("7")
            .name("sort")
            .rule("sort")
            .command("snakemake sort")
            .needsSingularity(singularity)
            .resources(ResourceRequirement.builder().memoryMb(1024L).diskMb(1024L).build())
            .build();
    }

    private static ResourcePlan plan() {
        return ResourcePlan.builder()
            .machineShape(MachineShape.builder().name("n2-standard-2").zone("us-central1-a").cpus(2)
                .memoryMb(8192).build())
            .bootDiskSizeGb(11)
            .regions(List.of("us-central1"))
            .build();
    }

    private static SubmittedJob submitted(String id) {
        return SubmittedJob.builder()
            .job(JobRequest.builder().jobId(id).name("job" + id).rule("r").command("true")
                .resources(ResourceRequirement.builder().build()).build())
            .externalJobId("op" + id)
            .operationName(LOCATION + "/operations/op" + id)
            .submittedAt(Instant.now())
            .build();
    }
}

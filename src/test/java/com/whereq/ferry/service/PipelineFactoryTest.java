package com.whereq.ferry.service;

import com.whereq.ferry.config.FerryProperties;
import com.whereq.ferry.dto.PipelineRequest;
import com.whereq.ferry.model.Accelerator;
import com.whereq.ferry.model.JobRequest;
import com.whereq.ferry.model.MachineShape;
import com.whereq.ferry.model.ResourcePlan;
import com.whereq.ferry.model.ResourceRequirement;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

class PipelineFactoryTest {

    private static final String BLOB = "source/cache/workdir-abc.tar.gz";

    private FerryProperties properties;
    private PipelineFactory factory;

    @BeforeEach
    void setUp() {
        properties = new FerryProperties();
        properties.getStorage().setRemotePrefix("ferry-bucket/runs/exp1");
        properties.getContainer().setEnvVars(List.of("SAMPLES", "UNSET_VAR"));

        Map<String, String> host = Map.of("SAMPLES", "a,b,c", "TOKEN", "xyz");
        factory = new PipelineFactory(properties, host::get);
    }

    @Test
    void jobActionDownloadsPackageThenRunsCommand() {
        PipelineRequest request = factory.create(job(), plan(null), "ns-1", BLOB);

        List<PipelineRequest.Action> actions = request.getPipeline().getActions();
        assertThat(actions).hasSize(2);

        PipelineRequest.Action jobAction = actions.get(0);
        assertThat(jobAction.getContainerName()).isEqualTo("ferryjob-align-42");
        assertThat(jobAction.getImageUri()).isEqualTo("snakemake/snakemake:stable");
        assertThat(jobAction.getCommands()).hasSize(3).startsWith("/bin/bash", "-c");
        assertThat(jobAction.getCommands().get(2))
            .startsWith("mkdir -p /workdir && cd /workdir && wget -O /download.py ")
            .contains("source activate snakemake || true")
            .contains("python /download.py download ferry-bucket " + BLOB + " /tmp/workdir.tar.gz")
            .endsWith("tar -xzvf /tmp/workdir.tar.gz && snakemake --force align");
        assertThat(jobAction.getAlwaysRun()).isNull();
    }

    @Test
    void logActionAlwaysRunsAndSavesUnderLogsPrefix() {
        PipelineRequest request = factory.create(job(), plan(null), "ns-1", BLOB);

        PipelineRequest.Action logAction = request.getPipeline().getActions().get(1);
        assertThat(logAction.getContainerName()).isEqualTo("ferrylog-align-42");
        assertThat(logAction.getAlwaysRun()).isTrue();
        assertThat(logAction.getCommands().get(2)).endsWith(
            "python /gls.py save ferry-bucket /google/logs runs/exp1/google-lifesciences-logs/align/jobid_42");
    }

    @Test
    void labelsIdentifyRunAndJob() {
        PipelineRequest request = factory.create(job(), plan(null), "ns-1", BLOB);

        assertThat(request.getLabels())
            .containsExactly(entry("name", "ferryjob-ns-1-align-42"), entry("app", "ferry"));
        assertThat(request.getPipeline().getActions().get(0).getLabels()).isEqualTo(request.getLabels());
    }

    @Test
    void onlyVariablesSetOnTheHostArePropagated() {
        JobRequest withEnv = JobRequest.builder()
            .jobId("42").name("align").rule("align").command("snakemake --force align")
            .resources(ResourceRequirement.builder().memoryMb(1024L).diskMb(1024L).build())
            .envVar("TOKEN")
            .build();

        PipelineRequest request = factory.create(withEnv, plan(null), "ns-1", BLOB);

        assertThat(request.getPipeline().getEnvironment())
            .containsOnly(entry("SAMPLES", "a,b,c"), entry("TOKEN", "xyz"));
        assertThat(request.getPipeline().getActions().get(0).getEnvironment())
            .isEqualTo(request.getPipeline().getEnvironment());
    }

    @Test
    void virtualMachineFollowsPlan() {
        Accelerator t4 = Accelerator.builder().name("nvidia-tesla-t4").maximumCardsPerInstance(4)
            .zone("us-central1-a").build();

        PipelineRequest request = factory.create(job(), plan(t4), "ns-1", BLOB);

        PipelineRequest.Resources resources = request.getPipeline().getResources();
        assertThat(resources.getRegions()).containsExactly("us-central1");

        PipelineRequest.VirtualMachine vm = resources.getVirtualMachine();
        assertThat(vm.getMachineType()).isEqualTo("n1-standard-4");
        assertThat(vm.getBootDiskSizeGb()).isEqualTo(20L);
        assertThat(vm.getPreemptible()).isTrue();
        assertThat(vm.getLabels()).containsExactly(entry("app", "ferry"));
        assertThat(vm.getNetwork().getNetwork()).isEqualTo("default");
        assertThat(vm.getNetwork().getSubnetwork()).isEqualTo("default-sub");
        assertThat(vm.getNetwork().getUsePrivateAddress()).isFalse();
        assertThat(vm.getServiceAccount().getEmail()).isEqualTo("runner@p.iam.gserviceaccount.com");
        assertThat(vm.getServiceAccount().getScopes())
            .containsExactly("https://www.googleapis.com/auth/cloud-platform");
        assertThat(vm.getAccelerators()).singleElement().satisfies(a -> {
            assertThat(a.getType()).isEqualTo("nvidia-tesla-t4");
            assertThat(a.getCount()).isEqualTo(2L);
        });
        assertThat(request.getPipeline().getTimeout()).isNull();
    }

    @Test
    void optionalBlocksAreLeftOut() {
        ResourcePlan bare = ResourcePlan.builder()
            .machineShape(MachineShape.builder().name("n2-standard-2").cpus(2).memoryMb(8192).build())
            .bootDiskSizeGb(11)
            .regions(List.of("us-east1"))
            .build();

        PipelineRequest.VirtualMachine vm = factory.create(job(), bare, "ns-1", BLOB)
            .getPipeline().getResources().getVirtualMachine();

        assertThat(vm.getNetwork()).isNull();
        assertThat(vm.getServiceAccount()).isNull();
        assertThat(vm.getAccelerators()).isNull();
        assertThat(vm.getPreemptible()).isFalse();
    }

    @Test
    void jobImageOverridesConfiguredImage() {
        JobRequest custom = JobRequest.builder()
            .jobId("42").name("align").rule("align").command("bwa mem")
            .containerImage("quay.io/biocontainers/bwa:0.7.17")
            .resources(ResourceRequirement.builder().memoryMb(1024L).diskMb(1024L).build())
            .build();

        PipelineRequest request = factory.create(custom, plan(null), "ns-1", BLOB);

        assertThat(request.getPipeline().getActions())
            .extracting(PipelineRequest.Action::getImageUri)
            .containsOnly("quay.io/biocontainers/bwa:0.7.17");
    }

    private static JobRequest job() {
        return JobRequest.builder()
            .jobId("42")
            .name("align")
            .rule("align")
            .command("snakemake --force align")
            .resources(ResourceRequirement.builder().cores(4).memoryMb(15000L).diskMb(10240L).build())
            .build();
    }

    private static ResourcePlan plan(Accelerator accelerator) {
        return ResourcePlan.builder()
            .machineShape(MachineShape.builder().name("n1-standard-4").zone("us-central1-a").cpus(4)
                .memoryMb(15360).description("4 vCPUs, 15 GB RAM").build())
            .accelerator(accelerator)
            .acceleratorCount(accelerator == null ? 0 : 2)
            .bootDiskSizeGb(20)
            .preemptible(true)
            .regions(List.of("us-central1"))
            .network("default")
            .subnetwork("default-sub")
            .serviceAccountEmail("runner@p.iam.gserviceaccount.com")
            .build();
    }
}

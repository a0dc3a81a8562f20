package com.whereq.ferry.service;

import com.whereq.ferry.config.FerryProperties;
import com.whereq.ferry.dto.PipelineRequest;
import com.whereq.ferry.model.JobRequest;
import com.whereq.ferry.model.ResourcePlan;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Assembles the pipelines.run body of a job: the job action, the log action,
 * the virtual machine and the propagated environment.
 */
@Slf4j
@Component
public class PipelineFactory {

    static final String APP_LABEL = "ferry";
    static final String CLOUD_PLATFORM_SCOPE = "https://www.googleapis.com/auth/cloud-platform";

    private final FerryProperties properties;
    private final Function<String, String> hostEnvironment;

    @Autowired
    public PipelineFactory(FerryProperties properties) {
        this(properties, System::getenv);
    }

    PipelineFactory(FerryProperties properties, Function<String, String> hostEnvironment) {
        this.properties = properties;
        this.hostEnvironment = hostEnvironment;
    }

    /**
     * @param job job to run
     * @param plan machine specification from the planner
     * @param runNamespace identifier shared by all jobs of this process
     * @param packageBlobName object name of the uploaded source package
     */
    public PipelineRequest create(JobRequest job, ResourcePlan plan, String runNamespace, String packageBlobName) {
        Map<String, String> labels = labels(job, runNamespace);
        Map<String, String> environment = environment(job);

        PipelineRequest.Pipeline pipeline = PipelineRequest.Pipeline.builder()
            .actions(List.of(
                jobAction(job, labels, environment, packageBlobName),
                logAction(job, labels)))
            .resources(resources(plan))
            .environment(environment)
            .build();

        return PipelineRequest.builder()
            .pipeline(pipeline)
            .labels(labels)
            .build();
    }

    Map<String, String> labels(JobRequest job, String runNamespace) {
        Map<String, String> labels = new LinkedHashMap<>();
        labels.put("name", String.format("ferryjob-%s-%s-%s", runNamespace, job.getName(), job.getJobId()));
        labels.put("app", APP_LABEL);
        return labels;
    }

    /**
     * Host values of the configured and job specific variables; unset ones are skipped
     */
    Map<String, String> environment(JobRequest job) {
        Set<String> names = new LinkedHashSet<>(properties.getContainer().getEnvVars());
        if (job.getEnvVars() != null) {
            names.addAll(job.getEnvVars());
        }

        Map<String, String> environment = new LinkedHashMap<>();
        for (String name : names) {
            String value = hostEnvironment.apply(name);
            if (value != null) {
                environment.put(name, value);
            }
        }

        if (!environment.isEmpty()) {
            log.warn("This API does not support environment secrets.");
        }
        return environment;
    }

    private PipelineRequest.Action jobAction(JobRequest job, Map<String, String> labels,
                                             Map<String, String> environment, String packageBlobName) {
        FerryProperties.ContainerConfig container = properties.getContainer();
        String bucket = properties.getStorage().bucketName();

        String script = "mkdir -p /workdir && "
            + "cd /workdir && "
            + "wget -O /download.py " + container.getHelperScriptUrl() + " && "
            + "chmod +x /download.py && "
            + container.getActivateCommand() + " && "
            + "python /download.py download " + bucket + " " + packageBlobName + " /tmp/workdir.tar.gz && "
            + "tar -xzvf /tmp/workdir.tar.gz && "
            + job.getCommand();

        return PipelineRequest.Action.builder()
            .containerName(String.format("ferryjob-%s-%s", job.getName(), job.getJobId()))
            .imageUri(image(job))
            .commands(List.of("/bin/bash", "-c", script))
            .environment(environment)
            .labels(labels)
            .build();
    }

    private PipelineRequest.Action logAction(JobRequest job, Map<String, String> labels) {
        FerryProperties.ContainerConfig container = properties.getContainer();
        FerryProperties.StorageConfig storage = properties.getStorage();

        String script = "wget -O /gls.py " + container.getHelperScriptUrl() + " && "
            + "chmod +x /gls.py && "
            + container.getActivateCommand() + " && "
            + "python /gls.py save " + storage.bucketName() + " /google/logs "
            + storage.logsPrefix() + "/" + job.getName() + "/jobid_" + job.getJobId();

        return PipelineRequest.Action.builder()
            .containerName(String.format("ferrylog-%s-%s", job.getName(), job.getJobId()))
            .imageUri(image(job))
            .commands(List.of("/bin/bash", "-c", script))
            .labels(labels)
            .alwaysRun(true)
            .build();
    }

    private PipelineRequest.Resources resources(ResourcePlan plan) {
        PipelineRequest.VirtualMachine.VirtualMachineBuilder vm = PipelineRequest.VirtualMachine.builder()
            .machineType(plan.getMachineShape().getName())
            .labels(Map.of("app", APP_LABEL))
            .bootDiskSizeGb(plan.getBootDiskSizeGb())
            .preemptible(plan.isPreemptible());

        if (plan.getNetwork() != null && plan.getSubnetwork() != null) {
            vm.network(PipelineRequest.Network.builder()
                .network(plan.getNetwork())
                .usePrivateAddress(false)
                .subnetwork(plan.getSubnetwork())
                .build());
        }

        if (plan.getServiceAccountEmail() != null) {
            vm.serviceAccount(PipelineRequest.ServiceAccount.builder()
                .email(plan.getServiceAccountEmail())
                .scopes(List.of(CLOUD_PLATFORM_SCOPE))
                .build());
        }

        if (plan.hasAccelerator()) {
            List<PipelineRequest.AcceleratorConfig> accelerators = new ArrayList<>();
            accelerators.add(PipelineRequest.AcceleratorConfig.builder()
                .type(plan.getAccelerator().getName())
                .count((long) plan.getAcceleratorCount())
                .build());
            vm.accelerators(accelerators);
        }

        return PipelineRequest.Resources.builder()
            .regions(plan.getRegions())
            .virtualMachine(vm.build())
            .build();
    }

    private String image(JobRequest job) {
        return job.getContainerImage() != null ? job.getContainerImage() : properties.getContainer().getImage();
    }
}

package com.whereq.ferry.resource;

import com.whereq.ferry.config.FerryProperties;
import com.whereq.ferry.exception.MissingResourceSpecException;
import com.whereq.ferry.exception.NoAcceleratorAvailableException;
import com.whereq.ferry.exception.NoMachineTypeAvailableException;
import com.whereq.ferry.exception.PreemptibleMismatchException;
import com.whereq.ferry.model.Accelerator;
import com.whereq.ferry.model.JobRequest;
import com.whereq.ferry.model.MachineShape;
import com.whereq.ferry.model.ResourcePlan;
import com.whereq.ferry.model.ResourceRequirement;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Maps the resources a job declares onto the smallest machine type that fits
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ResourcePlanner {

    /**
     * Only the n1 family can attach GPUs
     */
    static final String GPU_MACHINE_PREFIX = "n1";

    /**
     * Extra boot disk for the container image
     */
    static final long IMAGE_DISK_GB = 10;

    // Reported maxima never go below these, even for a tiny catalog
    private static final int MIN_REPORTED_CPUS = 1;
    private static final long MIN_REPORTED_MEMORY_MB = 15360;

    private final InstanceCatalogResolver catalogResolver;
    private final PreemptiblePolicy preemptiblePolicy;
    private final FerryProperties properties;

    /**
     * Compute the machine specification of a job
     *
     * @param job job to plan
     * @param project Google Cloud project owning the catalog
     * @return plan with the selected shape and, for GPU jobs, the accelerator
     */
    public ResourcePlan plan(JobRequest job, String project) {
        ResourceRequirement resources = job.getResources();
        if (resources.getMemoryMb() == null) {
            throw new MissingResourceSpecException("memory (mem, mem_mb)", job.ruleName());
        }
        if (resources.getDiskMb() == null) {
            throw new MissingResourceSpecException("disk (disk, disk_mb)", job.ruleName());
        }

        int cores = Math.max(resources.getCores(), 1);
        long memoryMb = resources.getMemoryMb();
        int gpuCount = resources.effectiveGpuCount();

        String prefix = resources.getMachineTypePrefix();
        if (gpuCount > 0 && (prefix == null || !prefix.startsWith(GPU_MACHINE_PREFIX))) {
            log.debug("Found resource request for {} GPUs. This will limit to {} instance types.",
                gpuCount, GPU_MACHINE_PREFIX);
            prefix = GPU_MACHINE_PREFIX;
        }

        List<String> regions = properties.getRegions();
        List<MachineShape> catalog = catalogResolver.resolveCatalog(project, regions);
        MachineShape selected = selectMachineShape(catalog, cores, memoryMb, prefix);
        log.debug("Selected machine type {}:{}", selected.getName(), selected.getDescription());

        boolean preemptible = resolvePreemptible(job);

        ResourcePlan.ResourcePlanBuilder plan = ResourcePlan.builder()
            .machineShape(selected)
            .bootDiskSizeGb(bootDiskSizeGb(resources.getDiskMb()))
            .preemptible(preemptible)
            .regions(List.copyOf(regions));

        FerryProperties.MachineConfig machine = properties.getMachine();
        if (isSet(machine.getNetwork()) && isSet(machine.getSubnetwork())) {
            plan.network(machine.getNetwork()).subnetwork(machine.getSubnetwork());
        }
        if (isSet(machine.getServiceAccountEmail())) {
            plan.serviceAccountEmail(machine.getServiceAccountEmail());
        }

        if (gpuCount > 0) {
            List<Accelerator> accelerators = catalogResolver.listAccelerators(project, selected.getZone());
            Accelerator accelerator = selectAccelerator(accelerators, gpuCount, resources.getGpuModel(),
                selected.getZone());
            plan.accelerator(accelerator).acceleratorCount(gpuCount);
        }

        return plan.build();
    }

    /**
     * Keep shapes covering the request, narrow them to the prefix, then take the first shape
     * unless a later one has strictly fewer CPUs and strictly less memory.
     */
    static MachineShape selectMachineShape(List<MachineShape> catalog, int cores, long memoryMb, String prefix) {
        int maxCpus = MIN_REPORTED_CPUS;
        long maxMemoryMb = MIN_REPORTED_MEMORY_MB;

        List<MachineShape> keepers = new ArrayList<>();
        for (MachineShape shape : catalog) {
            maxCpus = Math.max(maxCpus, shape.getCpus());
            maxMemoryMb = Math.max(maxMemoryMb, shape.getMemoryMb());
            if (shape.getCpus() >= cores && shape.getMemoryMb() >= memoryMb) {
                keepers.add(shape);
            }
        }

        if (isSet(prefix)) {
            keepers = keepers.stream()
                .filter(shape -> shape.getName().startsWith(prefix))
                .collect(Collectors.toList());
        }

        if (keepers.isEmpty()) {
            if (isSet(prefix)) {
                throw NoMachineTypeAvailableException.prefixTooStrict(prefix);
            }
            throw NoMachineTypeAvailableException.exceedsCatalog(memoryMb, cores, maxMemoryMb, maxCpus);
        }

        MachineShape smallest = keepers.get(0);
        for (MachineShape shape : keepers) {
            if (shape.getCpus() < smallest.getCpus() && shape.getMemoryMb() < smallest.getMemoryMb()) {
                smallest = shape;
            }
        }
        return smallest;
    }

    /**
     * Smallest accelerator by cards per instance that still offers {@code gpuCount} cards.
     * Virtual workstation variants are never picked.
     */
    static Accelerator selectAccelerator(List<Accelerator> accelerators, int gpuCount, String gpuModel, String zone) {
        Accelerator smallest = null;
        for (Accelerator accelerator : accelerators) {
            String name = accelerator.getName();
            if (name.endsWith("vws") || (gpuModel != null && !name.equals(gpuModel))) {
                continue;
            }
            if (accelerator.getMaximumCardsPerInstance() < gpuCount) {
                continue;
            }
            if (smallest == null || accelerator.getMaximumCardsPerInstance() < smallest.getMaximumCardsPerInstance()) {
                smallest = accelerator;
            }
        }

        if (smallest == null) {
            throw new NoAcceleratorAvailableException(zone, gpuModel);
        }
        return smallest;
    }

    private boolean resolvePreemptible(JobRequest job) {
        if (!job.isGroup()) {
            return preemptiblePolicy.isPreemptible(job.ruleName());
        }

        boolean all = job.getRules().stream().allMatch(preemptiblePolicy::isPreemptible);
        boolean any = job.getRules().stream().anyMatch(preemptiblePolicy::isPreemptible);
        if (any && !all) {
            throw new PreemptibleMismatchException(job.getRules());
        }
        return all;
    }

    static long bootDiskSizeGb(long diskMb) {
        return (diskMb + 1023) / 1024 + IMAGE_DISK_GB;
    }

    private static boolean isSet(String value) {
        return value != null && !value.isEmpty();
    }
}

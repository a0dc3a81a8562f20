package com.whereq.ferry.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Machine specification derived for one job.
 * The shape covers the requested cores and memory; the accelerator, when present,
 * allows at least {@code acceleratorCount} cards per instance.
 */
@Value
@Builder
public class ResourcePlan {
    MachineShape machineShape;

    Accelerator accelerator;

    int acceleratorCount;

    /**
     * Requested disk plus room for the image itself
     */
    long bootDiskSizeGb;

    boolean preemptible;

    List<String> regions;

    String network;

    String subnetwork;

    String serviceAccountEmail;

    public boolean hasAccelerator() {
        return accelerator != null && acceleratorCount > 0;
    }
}

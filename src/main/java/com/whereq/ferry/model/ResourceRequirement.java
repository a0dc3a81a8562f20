package com.whereq.ferry.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.io.Serializable;

/**
 * Resources declared by a job
 */
@Value
@Builder
@Jacksonized
public class ResourceRequirement implements Serializable {
    private static final long serialVersionUID = 1L;

    /**
     * CPU cores needed
     */
    @Builder.Default
    int cores = 1;

    /**
     * Memory in MB, required for planning
     */
    Long memoryMb;

    /**
     * Scratch disk in MB, required for planning
     */
    Long diskMb;

    /**
     * Number of GPUs, if any
     */
    Integer gpuCount;

    /**
     * Exact accelerator model (e.g. nvidia-tesla-t4)
     */
    String gpuModel;

    /**
     * Restrict machine types to names starting with this prefix (e.g. n2-)
     */
    String machineTypePrefix;

    /**
     * GPU count after defaulting: a model without a count means one card
     */
    public int effectiveGpuCount() {
        if (gpuCount != null && gpuCount > 0) {
            return gpuCount;
        }
        return gpuModel != null ? 1 : 0;
    }
}

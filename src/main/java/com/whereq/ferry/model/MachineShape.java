package com.whereq.ferry.model;

import lombok.Builder;
import lombok.Value;

/**
 * A Compute Engine machine type in a zone
 */
@Value
@Builder
public class MachineShape {
    String name;
    String zone;
    int cpus;
    long memoryMb;
    String description;
}

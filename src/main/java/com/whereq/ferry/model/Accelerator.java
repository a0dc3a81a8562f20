package com.whereq.ferry.model;

import lombok.Builder;
import lombok.Value;

/**
 * An accelerator type (GPU) offered in a zone
 */
@Value
@Builder
public class Accelerator {
    String name;
    int maximumCardsPerInstance;
    String zone;
}

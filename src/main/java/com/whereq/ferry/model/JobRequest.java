package com.whereq.ferry.model;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Set;

/**
 * A job handed over by the workflow engine. Immutable once built.
 */
@Value
@Builder
@Jacksonized
public class JobRequest {

    /**
     * Stable job identifier
     */
    @NotBlank
    String jobId;

    /**
     * Human readable name, used in container names and labels
     */
    @NotBlank
    String name;

    /**
     * Rules this job executes. A single rule unless the job is a group.
     */
    @NotEmpty
    @Singular
    List<String> rules;

    /**
     * Job bundles several rules
     */
    boolean group;

    @NotNull
    @Valid
    ResourceRequirement resources;

    /**
     * Fully rendered shell command executed after the sources are extracted
     */
    @NotBlank
    String command;

    /**
     * Overrides the configured container image
     */
    String containerImage;

    /**
     * Host environment variables to pass into the container
     */
    @Singular
    Set<String> envVars;

    /**
     * Job runs inside Singularity
     */
    boolean needsSingularity;

    /**
     * Rule used in error messages: the first one
     */
    public String ruleName() {
        return rules.isEmpty() ? name : rules.get(0);
    }
}

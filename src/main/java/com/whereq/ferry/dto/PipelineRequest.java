package com.whereq.ferry.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Body of pipelines.run
 *
 * @see <a href="https://cloud.google.com/life-sciences/docs/reference/rest/v2beta/projects.locations.pipelines/run">pipelines.run</a>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PipelineRequest {

    private Pipeline pipeline;

    private Map<String, String> labels;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Pipeline {
        /**
         * Executed in order
         */
        private List<Action> actions;

        private Resources resources;

        private Map<String, String> environment;

        /**
         * Left unset so the service default applies
         */
        private String timeout;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Action {
        private String containerName;

        private String imageUri;

        private List<String> commands;

        private Map<String, String> environment;

        private Map<String, String> labels;

        /**
         * Run even when a previous action failed
         */
        private Boolean alwaysRun;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Resources {
        private List<String> regions;

        private VirtualMachine virtualMachine;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class VirtualMachine {
        private String machineType;

        private Map<String, String> labels;

        private Long bootDiskSizeGb;

        private Boolean preemptible;

        private Network network;

        private ServiceAccount serviceAccount;

        private List<AcceleratorConfig> accelerators;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Network {
        private String network;

        private Boolean usePrivateAddress;

        private String subnetwork;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ServiceAccount {
        private String email;

        private List<String> scopes;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class AcceleratorConfig {
        /**
         * Accelerator type name, e.g. nvidia-tesla-t4
         */
        private String type;

        private Long count;
    }
}

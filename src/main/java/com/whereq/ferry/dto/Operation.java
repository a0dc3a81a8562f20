package com.whereq.ferry.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Long-running operation returned by pipelines.run and operations.get
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Operation {

    /**
     * projects/{project}/locations/{location}/operations/{id}
     */
    private String name;

    private boolean done;

    private Metadata metadata;

    private Status error;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Metadata {
        /**
         * Lifecycle events, oldest last as delivered by the API
         */
        private List<Event> events;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Event {
        private String timestamp;

        private String description;

        private FailedEvent failed;

        private UnexpectedExitStatusEvent unexpectedExitStatus;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class FailedEvent {
        private String code;

        private String cause;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class UnexpectedExitStatusEvent {
        private Integer actionId;

        private Integer exitStatus;

        private String stderr;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Status {
        private Integer code;

        private String message;
    }
}

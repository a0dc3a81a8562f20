package com.whereq.ferry.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Response of projects.locations.list
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class LocationList {

    private List<Location> locations;

    private String nextPageToken;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Location {
        /**
         * projects/{project}/locations/{locationId}
         */
        private String name;

        /**
         * e.g. us-central1
         */
        private String locationId;
    }
}

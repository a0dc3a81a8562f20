package com.whereq.ferry.service;

import com.whereq.ferry.dto.LocationList;
import com.whereq.ferry.exception.ConfigurationException;
import com.whereq.ferry.exception.NoLocationsAvailableException;
import com.whereq.ferry.remote.LifeSciencesApi;
import com.whereq.ferry.remote.RemoteCallExecutor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Picks the Life Sciences location jobs are submitted to
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LocationResolver {

    private final LifeSciencesApi lifeSciencesApi;
    private final RemoteCallExecutor remoteCallExecutor;

    /**
     * Resolve the location in this order: the preferred location, a location starting with the
     * preference, a location named like one of the regions, a location sharing a region's
     * leading segment (us, europe...).
     *
     * @param project Google Cloud project
     * @param preferred location id or prefix, may be null
     * @param regions configured instance regions
     * @return location path, projects/{project}/locations/{id}
     */
    public String resolve(String project, String preferred, List<String> regions) {
        LocationList response = remoteCallExecutor.execute(lifeSciencesApi.listLocations(project));

        Map<String, String> locations = new LinkedHashMap<>();
        if (response != null && response.getLocations() != null) {
            response.getLocations().forEach(l -> locations.put(l.getLocationId(), l.getName()));
        }
        log.debug("locations-available: {}", locations.keySet());

        if (locations.isEmpty()) {
            throw new NoLocationsAvailableException("No locations found for Google Life Sciences API.");
        }

        if (preferred != null && !preferred.isEmpty()) {
            if (locations.containsKey(preferred)) {
                return locations.get(preferred);
            }
            return locations.entrySet().stream()
                .filter(e -> e.getKey().startsWith(preferred))
                .map(Map.Entry::getValue)
                .findFirst()
                .orElseThrow(() -> new ConfigurationException(
                    "Location or prefix requested " + preferred + " is not available."));
        }

        for (String region : regions) {
            if (locations.containsKey(region)) {
                return locations.get(region);
            }
        }

        Set<String> prefixes = regions.stream()
            .map(region -> region.split("-")[0])
            .collect(Collectors.toSet());
        return locations.entrySet().stream()
            .filter(e -> prefixes.stream().anyMatch(e.getKey()::startsWith))
            .map(Map.Entry::getValue)
            .findFirst()
            .orElseThrow(() -> new NoLocationsAvailableException(
                "No locations available for regions " + regions
                    + ". Please set ferry.location or extend ferry.regions to find a Life Sciences location."));
    }
}

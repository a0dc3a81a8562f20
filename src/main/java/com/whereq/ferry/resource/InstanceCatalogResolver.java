package com.whereq.ferry.resource;

import com.whereq.ferry.dto.AcceleratorType;
import com.whereq.ferry.dto.MachineType;
import com.whereq.ferry.dto.Zone;
import com.whereq.ferry.exception.NoLocationsAvailableException;
import com.whereq.ferry.model.Accelerator;
import com.whereq.ferry.model.MachineShape;
import com.whereq.ferry.remote.ComputeCatalogApi;
import com.whereq.ferry.remote.RemoteCallExecutor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Builds the machine type catalog shared by every zone of the configured regions.
 * Nothing is cached, each call hits the Compute API again.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InstanceCatalogResolver {

    private static final Pattern EXCLUDED_FAMILIES = Pattern.compile("^(e2|m1)");

    private final ComputeCatalogApi computeApi;
    private final RemoteCallExecutor remoteCallExecutor;

    /**
     * Machine types per zone, for every zone whose name starts with one of the regions.
     * Zones keep the order the API returned them in.
     */
    public Map<String, List<MachineShape>> listShapes(String project, List<String> regions) {
        List<Zone> zones = remoteCallExecutor.execute(computeApi.listZones(project));

        Map<String, List<MachineShape>> shapesByZone = new LinkedHashMap<>();
        for (Zone zone : zones) {
            if (!matchesRegion(zone.getName(), regions)) {
                continue;
            }
            List<MachineType> types = remoteCallExecutor.execute(
                computeApi.listMachineTypes(project, zone.getName()));
            shapesByZone.put(zone.getName(), types.stream()
                .map(type -> toShape(type, zone.getName()))
                .collect(Collectors.toList()));
        }
        return shapesByZone;
    }

    /**
     * Machine types available in every matched zone, minus shared-core and excluded families.
     * The shapes are the ones of the last matched zone.
     *
     * @throws NoLocationsAvailableException when no zone matches the regions
     */
    public List<MachineShape> resolveCatalog(String project, List<String> regions) {
        Map<String, List<MachineShape>> shapesByZone = listShapes(project, regions);
        if (shapesByZone.isEmpty()) {
            throw new NoLocationsAvailableException(
                "No Compute Engine zones found for regions " + regions + " in project " + project);
        }

        List<List<MachineShape>> perZone = new ArrayList<>(shapesByZone.values());
        List<MachineShape> base = perZone.get(perZone.size() - 1);

        List<Set<String>> otherZones = perZone.subList(0, perZone.size() - 1).stream()
            .map(shapes -> shapes.stream().map(MachineShape::getName).collect(Collectors.toSet()))
            .collect(Collectors.toList());

        List<MachineShape> catalog = base.stream()
            .filter(shape -> isEligible(shape.getName()))
            .filter(shape -> otherZones.stream().allMatch(names -> names.contains(shape.getName())))
            .collect(Collectors.toList());

        log.debug("Found {} machine types across regions {} before filtering. "
            + "To increase selection, define fewer regions", catalog.size(), regions);
        return catalog;
    }

    /**
     * Accelerator types offered in one zone
     */
    public List<Accelerator> listAccelerators(String project, String zone) {
        List<AcceleratorType> types = remoteCallExecutor.execute(computeApi.listAcceleratorTypes(project, zone));
        return types.stream()
            .map(type -> Accelerator.builder()
                .name(type.getName())
                .maximumCardsPerInstance(type.getMaximumCardsPerInstance())
                .zone(zone)
                .build())
            .collect(Collectors.toList());
    }

    static boolean matchesRegion(String zoneName, List<String> regions) {
        return zoneName != null && regions.stream().anyMatch(zoneName::startsWith);
    }

    static boolean isEligible(String machineTypeName) {
        return !machineTypeName.contains("micro") && !EXCLUDED_FAMILIES.matcher(machineTypeName).find();
    }

    private static MachineShape toShape(MachineType type, String zone) {
        return MachineShape.builder()
            .name(type.getName())
            .zone(zone)
            .cpus(type.getGuestCpus())
            .memoryMb(type.getMemoryMb())
            .description(type.getDescription())
            .build();
    }
}

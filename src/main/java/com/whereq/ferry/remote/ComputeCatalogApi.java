package com.whereq.ferry.remote;

import com.whereq.ferry.dto.AcceleratorType;
import com.whereq.ferry.dto.MachineType;
import com.whereq.ferry.dto.Zone;

import java.util.List;

/**
 * Compute Engine catalog: zones, machine types and accelerator types. List calls return every page.
 */
public interface ComputeCatalogApi {

    RemoteRequest<List<Zone>> listZones(String project);

    RemoteRequest<List<MachineType>> listMachineTypes(String project, String zone);

    RemoteRequest<List<AcceleratorType>> listAcceleratorTypes(String project, String zone);
}

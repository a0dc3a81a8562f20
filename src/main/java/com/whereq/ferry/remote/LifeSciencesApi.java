package com.whereq.ferry.remote;

import com.whereq.ferry.dto.LocationList;
import com.whereq.ferry.dto.Operation;
import com.whereq.ferry.dto.PipelineRequest;

/**
 * Life Sciences v2beta: locations, pipelines.run and operations
 */
public interface LifeSciencesApi {

    /**
     * All locations of the project, every page merged
     */
    RemoteRequest<LocationList> listLocations(String project);

    /**
     * @param parent projects/{project}/locations/{location}
     */
    RemoteRequest<Operation> run(String parent, PipelineRequest body);

    RemoteRequest<Operation> getOperation(String operationName);

    RemoteRequest<Void> cancelOperation(String operationName);
}

package com.whereq.ferry.remote;

import com.whereq.ferry.dto.AcceleratorType;
import com.whereq.ferry.dto.ComputeList;
import com.whereq.ferry.dto.MachineType;
import com.whereq.ferry.dto.Zone;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link ComputeCatalogApi} over the Compute Engine v1 REST endpoints
 */
public class WebClientComputeCatalogApi implements ComputeCatalogApi {

    private static final ParameterizedTypeReference<ComputeList<Zone>> ZONES =
        new ParameterizedTypeReference<>() {};
    private static final ParameterizedTypeReference<ComputeList<MachineType>> MACHINE_TYPES =
        new ParameterizedTypeReference<>() {};
    private static final ParameterizedTypeReference<ComputeList<AcceleratorType>> ACCELERATOR_TYPES =
        new ParameterizedTypeReference<>() {};

    private final WebClient wc;
    private final Duration timeout;

    public WebClientComputeCatalogApi(WebClient computeWebClient, Duration timeout) {
        this.wc = computeWebClient;
        this.timeout = timeout;
    }

    @Override
    public RemoteRequest<List<Zone>> listZones(String project) {
        return () -> fetchAll("/projects/{project}/zones", ZONES, project);
    }

    @Override
    public RemoteRequest<List<MachineType>> listMachineTypes(String project, String zone) {
        return () -> fetchAll("/projects/{project}/zones/{zone}/machineTypes", MACHINE_TYPES, project, zone);
    }

    @Override
    public RemoteRequest<List<AcceleratorType>> listAcceleratorTypes(String project, String zone) {
        return () -> fetchAll("/projects/{project}/zones/{zone}/acceleratorTypes", ACCELERATOR_TYPES, project, zone);
    }

    private <T> List<T> fetchAll(String path, ParameterizedTypeReference<ComputeList<T>> type, Object... vars) {
        List<T> items = new ArrayList<>();
        String pageToken = null;
        do {
            String token = pageToken;
            ComputeList<T> page = wc.get()
                .uri(b -> {
                    b.path(path);
                    if (token != null) {
                        b.queryParam("pageToken", token);
                    }
                    return b.build(vars);
                })
                .retrieve()
                .onStatus(HttpStatusCode::isError, RemoteErrors::decode)
                .bodyToMono(type)
                .timeout(timeout)
                .block();

            if (page == null) {
                break;
            }
            if (page.getItems() != null) {
                items.addAll(page.getItems());
            }
            pageToken = page.getNextPageToken();
        } while (pageToken != null && !pageToken.isEmpty());
        return items;
    }
}

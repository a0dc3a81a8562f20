package com.whereq.ferry.remote;

import com.whereq.ferry.dto.LocationList;
import com.whereq.ferry.dto.Operation;
import com.whereq.ferry.dto.PipelineRequest;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link LifeSciencesApi} over the REST endpoints
 */
public class WebClientLifeSciencesApi implements LifeSciencesApi {

    private final WebClient wc;
    private final Duration timeout;

    public WebClientLifeSciencesApi(WebClient lifeSciencesWebClient, Duration timeout) {
        this.wc = lifeSciencesWebClient;
        this.timeout = timeout;
    }

    @Override
    public RemoteRequest<LocationList> listLocations(String project) {
        return () -> {
            List<LocationList.Location> locations = new ArrayList<>();
            String pageToken = null;
            do {
                LocationList page = fetchLocations(project, pageToken);
                if (page != null && page.getLocations() != null) {
                    locations.addAll(page.getLocations());
                }
                pageToken = page == null ? null : page.getNextPageToken();
            } while (pageToken != null && !pageToken.isEmpty());
            return new LocationList(locations, null);
        };
    }

    private LocationList fetchLocations(String project, String pageToken) {
        return wc.get()
            .uri(b -> {
                b.path("/projects/{project}/locations");
                if (pageToken != null) {
                    b.queryParam("pageToken", pageToken);
                }
                return b.build(project);
            })
            .retrieve()
            .onStatus(HttpStatusCode::isError, RemoteErrors::decode)
            .bodyToMono(LocationList.class)
            .timeout(timeout)
            .block();
    }

    @Override
    public RemoteRequest<Operation> run(String parent, PipelineRequest body) {
        // parent is already a resource path, its slashes must stay unescaped
        return () -> wc.post()
            .uri(b -> b.path("/" + parent + "/pipelines:run").build())
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(body)
            .retrieve()
            .onStatus(HttpStatusCode::isError, RemoteErrors::decode)
            .bodyToMono(Operation.class)
            .timeout(timeout)
            .block();
    }

    @Override
    public RemoteRequest<Operation> getOperation(String operationName) {
        return () -> wc.get()
            .uri(b -> b.path("/" + operationName).build())
            .retrieve()
            .onStatus(HttpStatusCode::isError, RemoteErrors::decode)
            .bodyToMono(Operation.class)
            .timeout(timeout)
            .block();
    }

    @Override
    public RemoteRequest<Void> cancelOperation(String operationName) {
        return () -> wc.post()
            .uri(b -> b.path("/" + operationName + ":cancel").build())
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue("{}")
            .retrieve()
            .onStatus(HttpStatusCode::isError, RemoteErrors::decode)
            .bodyToMono(Void.class)
            .timeout(timeout)
            .block();
    }
}

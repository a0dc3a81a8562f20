package com.whereq.ferry.remote;

import com.whereq.ferry.dto.StorageBucket;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;

/**
 * {@link ObjectStoreApi} over the Cloud Storage JSON API
 */
public class WebClientObjectStoreApi implements ObjectStoreApi {

    private final WebClient wc;
    private final Duration timeout;

    public WebClientObjectStoreApi(WebClient storageWebClient, Duration timeout) {
        this.wc = storageWebClient;
        this.timeout = timeout;
    }

    @Override
    public RemoteRequest<StorageBucket> getOrCreateBucket(String bucket, String project) {
        return () -> wc.get()
            .uri("/storage/v1/b/{bucket}", bucket)
            .retrieve()
            .onStatus(HttpStatusCode::isError, RemoteErrors::decode)
            .bodyToMono(StorageBucket.class)
            .onErrorResume(RemoteErrors::isNotFound, e -> createBucket(bucket, project))
            .timeout(timeout)
            .block();
    }

    private Mono<StorageBucket> createBucket(String bucket, String project) {
        return wc.post()
            .uri(b -> b.path("/storage/v1/b").queryParam("project", "{project}").build(project))
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(Map.of("name", bucket))
            .retrieve()
            .onStatus(HttpStatusCode::isError, RemoteErrors::decode)
            .bodyToMono(StorageBucket.class);
    }

    @Override
    public RemoteRequest<Boolean> blobExists(String bucket, String name) {
        return () -> wc.get()
            .uri("/storage/v1/b/{bucket}/o/{object}", bucket, name)
            .retrieve()
            .onStatus(HttpStatusCode::isError, RemoteErrors::decode)
            .toBodilessEntity()
            .map(response -> Boolean.TRUE)
            .onErrorResume(RemoteErrors::isNotFound, e -> Mono.just(Boolean.FALSE))
            .timeout(timeout)
            .block();
    }

    @Override
    public RemoteRequest<Void> upload(String bucket, String name, byte[] content, String contentType) {
        return () -> wc.post()
            .uri(b -> b.path("/upload/storage/v1/b/{bucket}/o")
                .queryParam("uploadType", "media")
                .queryParam("name", "{name}")
                .build(bucket, name))
            .contentType(MediaType.parseMediaType(contentType))
            .bodyValue(content)
            .retrieve()
            .onStatus(HttpStatusCode::isError, RemoteErrors::decode)
            .bodyToMono(Void.class)
            .timeout(timeout)
            .block();
    }

    @Override
    public RemoteRequest<Void> delete(String bucket, String name) {
        return () -> wc.delete()
            .uri("/storage/v1/b/{bucket}/o/{object}", bucket, name)
            .retrieve()
            .onStatus(HttpStatusCode::isError, RemoteErrors::decode)
            .bodyToMono(Void.class)
            .timeout(timeout)
            .block();
    }
}

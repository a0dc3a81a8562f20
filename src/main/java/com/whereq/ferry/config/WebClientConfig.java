package com.whereq.ferry.config;

import com.whereq.ferry.model.RetryPolicy;
import com.whereq.ferry.remote.ComputeCatalogApi;
import com.whereq.ferry.remote.CredentialProvider;
import com.whereq.ferry.remote.LifeSciencesApi;
import com.whereq.ferry.remote.ObjectStoreApi;
import com.whereq.ferry.remote.RemoteCallExecutor;
import com.whereq.ferry.remote.RetryPredicates;
import com.whereq.ferry.remote.StaticTokenCredentialProvider;
import com.whereq.ferry.remote.WebClientComputeCatalogApi;
import com.whereq.ferry.remote.WebClientLifeSciencesApi;
import com.whereq.ferry.remote.WebClientObjectStoreApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * WebClient configuration for the Google Cloud APIs
 */
@Configuration
public class WebClientConfig {

    @Bean
    public WebClient.Builder webClientBuilder() {
        return WebClient.builder()
            .codecs(configurer -> configurer
                .defaultCodecs()
                .maxInMemorySize(16 * 1024 * 1024)); // 16MB, machine type pages are large
    }

    @Bean
    public CredentialProvider credentialProvider(FerryProperties properties) {
        return new StaticTokenCredentialProvider(properties.getCredentials().getAccessToken());
    }

    @Bean
    public LifeSciencesApi lifeSciencesApi(WebClient.Builder webClientBuilder, FerryProperties properties,
                                           CredentialProvider credentialProvider) {
        WebClient wc = authorized(webClientBuilder, properties.getApi().getLifeSciencesUrl(), credentialProvider);
        return new WebClientLifeSciencesApi(wc, timeout(properties));
    }

    @Bean
    public ComputeCatalogApi computeCatalogApi(WebClient.Builder webClientBuilder, FerryProperties properties,
                                               CredentialProvider credentialProvider) {
        WebClient wc = authorized(webClientBuilder, properties.getApi().getComputeUrl(), credentialProvider);
        return new WebClientComputeCatalogApi(wc, timeout(properties));
    }

    @Bean
    public ObjectStoreApi objectStoreApi(WebClient.Builder webClientBuilder, FerryProperties properties,
                                         CredentialProvider credentialProvider) {
        WebClient wc = authorized(webClientBuilder, properties.getApi().getStorageUrl(), credentialProvider);
        return new WebClientObjectStoreApi(wc, timeout(properties));
    }

    @Bean
    public RemoteCallExecutor remoteCallExecutor(FerryProperties properties) {
        RetryPolicy policy = RetryPolicy.builder()
            .maxAttempts(properties.getRetry().getMaxAttempts())
            .initialDelay(Duration.ofMillis(properties.getRetry().getInitialDelayMs()))
            .build();
        return new RemoteCallExecutor(policy, RetryPredicates.transientFailures());
    }

    private static WebClient authorized(WebClient.Builder builder, String baseUrl, CredentialProvider credentials) {
        return builder.clone()
            .baseUrl(baseUrl)
            .filter(bearerToken(credentials))
            .build();
    }

    /**
     * Adds the current access token to every request
     */
    static ExchangeFilterFunction bearerToken(CredentialProvider credentials) {
        return (request, next) -> next.exchange(ClientRequest.from(request)
            .headers(headers -> headers.setBearerAuth(credentials.accessToken()))
            .build());
    }

    private static Duration timeout(FerryProperties properties) {
        return Duration.ofMillis(properties.getApi().getTimeoutMs());
    }
}

package com.whereq.ferry.remote;

import com.whereq.ferry.exception.RemoteApiException;
import org.springframework.web.reactive.function.client.ClientResponse;
import reactor.core.publisher.Mono;

/**
 * Turns HTTP error responses into {@link RemoteApiException}. This is the only place
 * that looks at provider status codes.
 */
public final class RemoteErrors {

    private RemoteErrors() {
    }

    public static Mono<? extends Throwable> decode(ClientResponse response) {
        return response.bodyToMono(String.class)
            .defaultIfEmpty("")
            .flatMap(body -> Mono.error(new RemoteApiException(response.statusCode().value(), body)));
    }

    public static boolean isNotFound(Throwable e) {
        return e instanceof RemoteApiException rae && rae.getKind() == RemoteApiException.Kind.NOT_FOUND;
    }
}

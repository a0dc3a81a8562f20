package com.whereq.ferry.remote;

/**
 * A prepared call against a remote API. Nothing is sent until {@link #execute()},
 * and every execution sends the request again, which is what the retry wrapper relies on.
 *
 * @param <T> decoded response type
 */
@FunctionalInterface
public interface RemoteRequest<T> {

    /**
     * Send the request and block for the response
     *
     * @throws com.whereq.ferry.exception.RemoteApiException on an HTTP error status
     */
    T execute();
}

package com.whereq.ferry.remote;

/**
 * Supplies the bearer token sent to the compute, storage and Life Sciences APIs.
 * Called for every request, so implementations may refresh tokens.
 */
@FunctionalInterface
public interface CredentialProvider {

    /**
     * @return OAuth2 access token scoped for cloud-platform
     * @throws com.whereq.ferry.exception.ConfigurationException if no credential is available
     */
    String accessToken();
}

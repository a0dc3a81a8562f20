package com.whereq.ferry.remote;

import com.whereq.ferry.exception.ConfigurationException;

/**
 * Uses a configured access token, or GOOGLE_OAUTH_ACCESS_TOKEN from the environment
 */
public class StaticTokenCredentialProvider implements CredentialProvider {

    static final String TOKEN_ENV = "GOOGLE_OAUTH_ACCESS_TOKEN";

    private final String token;

    public StaticTokenCredentialProvider(String configuredToken) {
        this.token = configuredToken != null && !configuredToken.isBlank()
            ? configuredToken
            : System.getenv(TOKEN_ENV);
    }

    @Override
    public String accessToken() {
        if (token == null || token.isBlank()) {
            throw new ConfigurationException(
                "No Google Cloud credentials found. Set ferry.credentials.access-token or " + TOKEN_ENV + ".");
        }
        return token;
    }
}

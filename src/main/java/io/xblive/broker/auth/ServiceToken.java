package io.xblive.broker.auth;

import java.time.Instant;

/**
 * Game-services access token. {@code username} is the service account id and may be {@code null}.
 */
public record ServiceToken(String accessToken, String username, Instant expiresAt) {

    @Override
    public String toString() {
        return "ServiceToken[username=" + username + ", expiresAt=" + expiresAt + "]";
    }
}

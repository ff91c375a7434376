package io.xblive.broker.auth;

import java.time.Instant;

/**
 * Access and refresh token pair issued by the identity platform token endpoint.
 */
public record OAuthTokens(
    String accessToken,
    String refreshToken,
    String tokenType,
    String scope,
    Instant expiresAt
) {

    @Override
    public String toString() {
        return "OAuthTokens[tokenType=" + tokenType + ", scope=" + scope + ", expiresAt=" + expiresAt + "]";
    }
}

package io.xblive.broker.auth;

import java.time.Instant;

/**
 * User or XSTS token issued by the Xbox token services, with the account's user hash.
 */
public record XboxToken(String token, String userHash, Instant issuedAt, Instant notAfter) {

    /**
     * Formats the {@code XBL3.0} credential expected by Xbox Live APIs and the game-services login.
     */
    public static String identityToken(String userHash, String token) {
        return "XBL3.0 x=" + userHash + ";" + token;
    }

    public String identityToken() {
        return identityToken(userHash, token);
    }

    @Override
    public String toString() {
        return "XboxToken[userHash=" + userHash + ", issuedAt=" + issuedAt + ", notAfter=" + notAfter + "]";
    }
}

package io.xblive.broker.store;

import java.time.Instant;
import java.util.Objects;

/**
 * A stored credential. {@code userHash} is set for user and XSTS tokens; {@code expiresAt} is
 * {@code null} only for refresh tokens.
 */
public record TokenRecord(String value, String userHash, Instant expiresAt) {

    public TokenRecord {
        Objects.requireNonNull(value, "value");
        if (value.isBlank()) {
            throw new IllegalArgumentException("token value must be non-empty");
        }
    }

    public static TokenRecord refreshToken(String value) {
        return new TokenRecord(value, null, null);
    }

    public static TokenRecord expiring(String value, Instant expiresAt) {
        return new TokenRecord(value, null, Objects.requireNonNull(expiresAt, "expiresAt"));
    }

    public static TokenRecord withUserHash(String value, String userHash, Instant expiresAt) {
        return new TokenRecord(value, Objects.requireNonNull(userHash, "userHash"),
            Objects.requireNonNull(expiresAt, "expiresAt"));
    }

    /**
     * @return {@code true} when the record may be handed to a caller at {@code now}.
     */
    public boolean isUsableAt(Instant now) {
        return expiresAt == null || now.isBefore(expiresAt);
    }

    @Override
    public String toString() {
        return "TokenRecord[userHash=" + userHash + ", expiresAt=" + expiresAt + "]";
    }
}

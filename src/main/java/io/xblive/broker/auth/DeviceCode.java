package io.xblive.broker.auth;

import java.time.Duration;
import java.time.Instant;

/**
 * Device-authorization grant returned by the identity platform. {@code message} is the
 * ready-made prompt telling the user where to enter {@code userCode}.
 */
public record DeviceCode(
    String deviceCode,
    String userCode,
    String verificationUri,
    String message,
    Duration interval,
    Instant expiresAt
) {

    @Override
    public String toString() {
        return "DeviceCode[userCode=" + userCode + ", verificationUri=" + verificationUri
            + ", interval=" + interval + ", expiresAt=" + expiresAt + "]";
    }
}

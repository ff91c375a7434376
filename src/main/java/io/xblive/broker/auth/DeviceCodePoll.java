package io.xblive.broker.auth;

/**
 * Outcome of a single poll of the token endpoint during the device-code flow. Terminal failures
 * (denied, expired) are raised as exceptions rather than reported here.
 */
public record DeviceCodePoll(Status status, OAuthTokens tokens) {

    public enum Status {
        PENDING,
        SLOW_DOWN,
        AUTHORIZED
    }

    public static DeviceCodePoll pending() {
        return new DeviceCodePoll(Status.PENDING, null);
    }

    public static DeviceCodePoll slowDown() {
        return new DeviceCodePoll(Status.SLOW_DOWN, null);
    }

    public static DeviceCodePoll authorized(OAuthTokens tokens) {
        return new DeviceCodePoll(Status.AUTHORIZED, tokens);
    }
}

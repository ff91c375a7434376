package io.xblive.broker;

/**
 * Transport failure while talking to an upstream endpoint. Never retried internally.
 */
public final class NetworkException extends XboxLiveException {

    private static final long serialVersionUID = 1L;

    public NetworkException(String message, Throwable cause) {
        super(message, cause);
    }
}

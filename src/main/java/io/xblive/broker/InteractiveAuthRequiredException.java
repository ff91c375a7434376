package io.xblive.broker;

/**
 * No usable refresh token is available, so the chain cannot be renewed silently. Callers
 * must run the device-code bootstrap before retrying.
 */
public final class InteractiveAuthRequiredException extends XboxLiveException {

    private static final long serialVersionUID = 1L;

    public InteractiveAuthRequiredException(String message) {
        super(message);
    }

    public InteractiveAuthRequiredException(String message, Throwable cause) {
        super(message, cause);
    }
}

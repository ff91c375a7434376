package io.xblive.broker;

/**
 * The user declined the device-code authorization request.
 */
public final class AuthorizationDeniedException extends XboxLiveException {

    private static final long serialVersionUID = 1L;

    public AuthorizationDeniedException(String message) {
        super(message);
    }
}

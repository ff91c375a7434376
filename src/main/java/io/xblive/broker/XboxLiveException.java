package io.xblive.broker;

/**
 * Base exception thrown by the token broker.
 */
public class XboxLiveException extends Exception {

    private static final long serialVersionUID = 1L;

    public XboxLiveException(String message) {
        super(message);
    }

    public XboxLiveException(String message, Throwable cause) {
        super(message, cause);
    }
}

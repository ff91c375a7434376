package io.xblive.broker;

/**
 * An upstream response could not be decoded or did not have the expected shape.
 */
public final class MalformedResponseException extends XboxLiveException {

    private static final long serialVersionUID = 1L;

    public MalformedResponseException(String message) {
        super(message);
    }

    public MalformedResponseException(String message, Throwable cause) {
        super(message, cause);
    }
}

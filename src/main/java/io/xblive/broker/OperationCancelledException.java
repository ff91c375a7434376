package io.xblive.broker;

/**
 * The caller cancelled the operation, or the thread was interrupted while it was suspended.
 */
public final class OperationCancelledException extends XboxLiveException {

    private static final long serialVersionUID = 1L;

    public OperationCancelledException(String message) {
        super(message);
    }

    public OperationCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}

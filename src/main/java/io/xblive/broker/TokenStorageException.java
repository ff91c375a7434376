package io.xblive.broker;

/**
 * Raised when the token store cannot be read or written. The store keeps its last
 * successfully persisted state when this is thrown from a write.
 */
public final class TokenStorageException extends XboxLiveException {

    private static final long serialVersionUID = 1L;

    public TokenStorageException(String message) {
        super(message);
    }

    public TokenStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}

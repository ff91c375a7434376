package io.xblive.broker;

/**
 * The device code expired before the user completed authorization. The flow must be restarted.
 */
public final class DeviceCodeExpiredException extends XboxLiveException {

    private static final long serialVersionUID = 1L;

    public DeviceCodeExpiredException(String message) {
        super(message);
    }
}

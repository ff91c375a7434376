package io.xblive.broker;

/**
 * Exception representing a structured rejection returned by a Microsoft or Xbox endpoint. The
 * status code is always present; the error code is the OAuth {@code error} value, the Xbox
 * {@code XErr} number, or {@code null} when the body carried neither.
 */
public final class UpstreamRejectedException extends XboxLiveException {

    private static final long serialVersionUID = 1L;

    private final int statusCode;
    private final String code;

    public UpstreamRejectedException(int statusCode, String code, String message) {
        super(message == null || message.isBlank() ? defaultMessage(statusCode, code) : message);
        this.statusCode = statusCode;
        this.code = code;
    }

    /**
     * @return HTTP status code returned by the endpoint.
     */
    public int getStatusCode() {
        return statusCode;
    }

    /**
     * @return endpoint-specific error code (nullable when the response body did not include one).
     */
    public String getCode() {
        return code;
    }

    private static String defaultMessage(int status, String code) {
        if (code == null || code.isBlank()) {
            return "request failed with status " + status;
        }
        return "request failed with status " + status + " (" + code + ")";
    }
}

package io.xblive.broker.internal;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.xblive.broker.UpstreamRejectedException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Decodes error payloads from the identity platform, the Xbox token services, and the
 * game-services API into {@link UpstreamRejectedException}.
 *
 * <p>
 * Recognised shapes, in order: Xbox {@code {"XErr": n, "Message": ..., "Redirect": ...}}, OAuth
 * {@code {"error": ..., "error_description": ...}}, and generic {@code {"code"|"errorType": ...,
 * "message"|"errorMessage": ...}}. Anything else keeps the raw body as the message.
 * </p>
 */
public final class ApiErrorDecoder {

    private static final ObjectMapper MAPPER = Json.mapper();

    private static final Map<Long, String> XERR_MESSAGES = Map.of(
        2148916227L, "account is banned from Xbox Live",
        2148916233L, "account has no Xbox Live profile; sign in at xbox.com to create one",
        2148916235L, "Xbox Live is not available in the account's region",
        2148916236L, "account requires adult verification",
        2148916237L, "account requires adult verification",
        2148916238L, "account is a child account and must be added to a Microsoft family"
    );

    private ApiErrorDecoder() {
    }

    public static UpstreamRejectedException decode(int statusCode, InputStream bodyStream) throws IOException {
        if (bodyStream == null) {
            return new UpstreamRejectedException(statusCode, null, null);
        }
        return decode(statusCode, bodyStream.readAllBytes());
    }

    public static UpstreamRejectedException decode(int statusCode, byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            return new UpstreamRejectedException(statusCode, null, null);
        }

        JsonNode node;
        try {
            node = MAPPER.readTree(bytes);
        } catch (IOException ex) {
            return new UpstreamRejectedException(statusCode, null, raw(statusCode, bytes));
        }
        if (node == null || !node.isObject()) {
            return new UpstreamRejectedException(statusCode, null, raw(statusCode, bytes));
        }

        if (node.path("XErr").isNumber()) {
            long xerr = node.get("XErr").asLong();
            String message = XERR_MESSAGES.getOrDefault(xerr, text(node, "Message"));
            if (message == null) {
                message = "Xbox request failed with XErr " + xerr;
            }
            return new UpstreamRejectedException(statusCode, Long.toString(xerr), message);
        }

        String error = text(node, "error");
        if (error != null) {
            return new UpstreamRejectedException(statusCode, error, text(node, "error_description"));
        }

        String code = firstNonNull(text(node, "code"), text(node, "errorType"));
        String message = firstNonNull(text(node, "message"), text(node, "errorMessage"));
        if (code == null && message == null) {
            return new UpstreamRejectedException(statusCode, null, raw(statusCode, bytes));
        }
        return new UpstreamRejectedException(statusCode, code, message);
    }

    private static String raw(int statusCode, byte[] bytes) {
        return "request failed with status " + statusCode + ": " + new String(bytes, StandardCharsets.UTF_8);
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text == null || text.isBlank() ? null : text;
    }

    private static String firstNonNull(String first, String second) {
        return first != null ? first : second;
    }
}

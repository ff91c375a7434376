package io.xblive.broker.internal;

import com.fasterxml.jackson.databind.JsonNode;
import io.xblive.broker.MalformedResponseException;

/**
 * Reads the user hash out of the {@code DisplayClaims.xui} array returned by the user-token and
 * XSTS endpoints. The array holds single-key objects; the first one carrying {@code uhs} wins.
 */
public final class DisplayClaims {

    private DisplayClaims() {
    }

    public static String userHash(JsonNode response) throws MalformedResponseException {
        JsonNode xui = response.path("DisplayClaims").path("xui");
        if (!xui.isArray() || xui.isEmpty()) {
            throw new MalformedResponseException("response has no DisplayClaims.xui entries");
        }
        for (JsonNode claim : xui) {
            JsonNode uhs = claim.path("uhs");
            if (uhs.isTextual() && !uhs.asText().isBlank()) {
                return uhs.asText();
            }
        }
        throw new MalformedResponseException("DisplayClaims.xui carries no uhs claim");
    }
}

package io.xblive.broker;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.xblive.broker.auth.DeviceCode;
import io.xblive.broker.auth.TokenBroker;
import io.xblive.broker.auth.TokenExchange;
import io.xblive.broker.auth.XboxLiveExchange;
import io.xblive.broker.auth.XboxToken;
import io.xblive.broker.internal.ApiErrorDecoder;
import io.xblive.broker.internal.HttpUtil;
import io.xblive.broker.internal.Json;
import io.xblive.broker.store.FileTokenStore;
import io.xblive.broker.store.TokenKey;
import io.xblive.broker.store.TokenKind;
import io.xblive.broker.store.TokenRecord;
import io.xblive.broker.store.TokenStore;

import java.io.IOException;
import java.io.InputStream;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.logging.Logger;

/**
 * <p>
 * Primary entry point. The client is thread-safe: create one instance per process and reuse it.
 * Credentials live in the configured {@link TokenStore} (by default an owner-only JSON file under
 * {@code ~/.xblive}), so a restarted process resumes without asking the user to sign in again.
 * </p>
 *
 * <h2>Typical use</h2>
 * <ol>
 *   <li>Call any credential accessor. If it throws {@link InteractiveAuthRequiredException}, call
 *       {@link #authenticate(Consumer)} and show the user the {@link DeviceCode#message()}.</li>
 *   <li>Call accessors freely afterwards; only expired links of the chain hit the network.</li>
 * </ol>
 */
public final class XboxLiveClient {

    private static final Logger LOGGER = Logger.getLogger(XboxLiveClient.class.getName());

    static final String PROFILE_PATH = "/minecraft/profile";
    static final String ENTITLEMENTS_PATH = "/entitlements/mcstore";
    static final String PEOPLE_SEARCH_PATH = "/users/me/people/search/decoration/detail";
    static final String PEOPLE_HUB_CONTRACT_VERSION = "3";
    static final int SEARCH_MAX_ITEMS = 25;

    private final Config config;
    private final HttpClient httpClient;
    private final TokenBroker broker;

    public XboxLiveClient(Config config) {
        this(config, null, null);
    }

    /**
     * @param store    alternative store, or {@code null} for a {@link FileTokenStore} at the configured path.
     * @param exchange alternative exchange implementation, or {@code null} for {@link XboxLiveExchange}.
     */
    public XboxLiveClient(Config config, TokenStore store, TokenExchange exchange) {
        Objects.requireNonNull(config, "config");
        this.config = config.withDefaults();
        this.httpClient = this.config.getHttpClient();
        TokenStore resolvedStore = store != null ? store : new FileTokenStore(this.config.getCacheFile(), this.config.getClock());
        TokenExchange resolvedExchange = exchange != null ? exchange : new XboxLiveExchange(this.config);
        this.broker = new TokenBroker(resolvedStore, resolvedExchange, this.config.getServicesRelyingParty(), this.config.getClock());
    }

    /**
     * Runs the device-code sign-in and stores the resulting base tokens.
     *
     * @param prompt receives the code to display; typically prints {@link DeviceCode#message()}.
     */
    public void authenticate(Consumer<DeviceCode> prompt) throws XboxLiveException {
        authenticate(prompt, Cancellation.none());
    }

    public void authenticate(Consumer<DeviceCode> prompt, Cancellation cancellation) throws XboxLiveException {
        broker.bootstrap(prompt, cancellation);
    }

    /**
     * @return {@code true} when a refresh token is stored, so accessors can renew silently.
     */
    public boolean isAuthenticated() throws XboxLiveException {
        try {
            broker.ensure(TokenKind.REFRESH_TOKEN);
            return true;
        } catch (InteractiveAuthRequiredException ex) {
            return false;
        }
    }

    /**
     * @return the XSTS token for the Xbox Live relying party, with its user hash.
     */
    public TokenRecord xboxLiveToken() throws XboxLiveException {
        return broker.ensure(TokenKey.xsts(config.getXboxLiveRelyingParty()), Cancellation.none());
    }

    /**
     * @return the {@code Authorization} header value for Xbox Live API requests.
     */
    public String xboxLiveAuthorization() throws XboxLiveException {
        TokenRecord xsts = xboxLiveToken();
        return XboxToken.identityToken(xsts.userHash(), xsts.value());
    }

    public String gameServicesToken() throws XboxLiveException {
        return gameServicesToken(Cancellation.none());
    }

    public String gameServicesToken(Cancellation cancellation) throws XboxLiveException {
        return broker.ensure(TokenKey.of(TokenKind.SERVICE_TOKEN), cancellation).value();
    }

    /**
     * Fetches the game profile of the signed-in account as raw JSON.
     *
     * @throws UpstreamRejectedException with status 404 when the account does not own the game.
     */
    public JsonNode gameServicesProfile() throws XboxLiveException {
        return servicesGet(PROFILE_PATH, "fetch game profile");
    }

    public JsonNode gameServicesEntitlements() throws XboxLiveException {
        return servicesGet(ENTITLEMENTS_PATH, "fetch entitlements");
    }

    /**
     * Searches Xbox Live accounts by gamertag using the Xbox Live XSTS token.
     *
     * @return the raw search response; matches are listed under {@code people}.
     */
    public JsonNode searchGamertag(String gamertag) throws XboxLiveException {
        if (gamertag == null || gamertag.isBlank()) {
            throw new IllegalArgumentException("gamertag must be non-empty");
        }
        String url = config.getPeopleHubBaseUrl() + PEOPLE_SEARCH_PATH
            + "?q=" + URLEncoder.encode(gamertag.trim(), StandardCharsets.UTF_8)
            + "&maxItems=" + SEARCH_MAX_ITEMS;
        HttpRequest request = HttpUtil.xboxLiveGet(url, xboxLiveAuthorization(), PEOPLE_HUB_CONTRACT_VERSION,
            config.getHttpTimeout());
        return getJson(request, Cancellation.none(), "search gamertag");
    }

    public void logout() throws TokenStorageException {
        broker.logout();
    }

    public TokenBroker getBroker() {
        return broker;
    }

    private JsonNode servicesGet(String path, String operation) throws XboxLiveException {
        Cancellation cancellation = Cancellation.none();
        String bearer = gameServicesToken(cancellation);
        HttpRequest request = HttpUtil.bearerGet(config.getServicesBaseUrl() + path, bearer, config.getHttpTimeout());
        return getJson(request, cancellation, operation);
    }

    private JsonNode getJson(HttpRequest request, Cancellation cancellation, String operation) throws XboxLiveException {
        LOGGER.fine(() -> "[xblive] " + operation + " via " + request.uri().getPath());
        HttpResponse<InputStream> response = HttpUtil.send(httpClient, request, cancellation, operation);

        try (InputStream bodyStream = response.body()) {
            if (response.statusCode() / 100 != 2) {
                throw ApiErrorDecoder.decode(response.statusCode(), bodyStream);
            }
            try {
                return Json.mapper().readTree(bodyStream);
            } catch (JsonProcessingException ex) {
                throw new MalformedResponseException("decode " + operation + " response: " + ex.getMessage(), ex);
            }
        } catch (IOException ex) {
            throw new NetworkException(operation + ": " + ex.getMessage(), ex);
        }
    }
}

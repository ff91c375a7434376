package io.xblive.broker.auth;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.xblive.broker.AuthorizationDeniedException;
import io.xblive.broker.Cancellation;
import io.xblive.broker.Config;
import io.xblive.broker.DeviceCodeExpiredException;
import io.xblive.broker.MalformedResponseException;
import io.xblive.broker.NetworkException;
import io.xblive.broker.UpstreamRejectedException;
import io.xblive.broker.XboxLiveException;
import io.xblive.broker.internal.ApiErrorDecoder;
import io.xblive.broker.internal.DisplayClaims;
import io.xblive.broker.internal.HttpUtil;
import io.xblive.broker.internal.Json;

import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * {@link TokenExchange} talking to the Microsoft identity platform, the Xbox user/XSTS token
 * services, and the game-services login endpoint over {@link HttpClient}.
 */
public final class XboxLiveExchange implements TokenExchange {

    private static final Logger LOGGER = Logger.getLogger(XboxLiveExchange.class.getName());

    static final String DEVICE_CODE_GRANT = "urn:ietf:params:oauth:grant-type:device_code";
    static final String USER_TOKEN_RELYING_PARTY = "http://auth.xboxlive.com";
    static final String USER_TOKEN_SITE_NAME = "user.auth.xboxlive.com";
    static final String SERVICE_LOGIN_PATH = "/authentication/login_with_xbox";
    private static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(5);

    private final HttpClient httpClient;
    private final String clientId;
    private final String scope;
    private final String deviceCodeUrl;
    private final String tokenUrl;
    private final String userTokenUrl;
    private final String xstsUrl;
    private final String serviceLoginUrl;
    private final String rpsTicketPrefix;
    private final Duration requestTimeout;
    private final Clock clock;

    public XboxLiveExchange(Config config) {
        Config resolved = Objects.requireNonNull(config, "config").withDefaults();
        this.httpClient = resolved.getHttpClient();
        this.clientId = resolved.getClientId();
        this.scope = resolved.getScope();
        this.deviceCodeUrl = resolved.getDeviceCodeUrl();
        this.tokenUrl = resolved.getTokenUrl();
        this.userTokenUrl = resolved.getUserTokenUrl();
        this.xstsUrl = resolved.getXstsUrl();
        this.serviceLoginUrl = resolved.getServicesBaseUrl() + SERVICE_LOGIN_PATH;
        this.rpsTicketPrefix = resolved.getRpsTicketPrefix();
        this.requestTimeout = resolved.getHttpTimeout();
        this.clock = resolved.getClock();
    }

    @Override
    public DeviceCode requestDeviceCode(Cancellation cancellation) throws XboxLiveException {
        Map<String, String> form = new LinkedHashMap<>();
        form.put("client_id", clientId);
        form.put("scope", scope);

        Instant requestedAt = clock.instant();
        JsonNode node = execute(HttpUtil.formPost(deviceCodeUrl, form, requestTimeout), cancellation, "request device code");

        String deviceCode = requireText(node, "device_code", "device code response");
        String userCode = requireText(node, "user_code", "device code response");
        String verificationUri = requireText(node, "verification_uri", "device code response");
        long expiresIn = requirePositive(node, "expires_in", "device code response");
        long interval = node.path("interval").canConvertToLong() ? node.path("interval").asLong() : 0L;

        return new DeviceCode(
            deviceCode,
            userCode,
            verificationUri,
            node.path("message").asText(null),
            interval > 0 ? Duration.ofSeconds(interval) : DEFAULT_POLL_INTERVAL,
            requestedAt.plusSeconds(expiresIn)
        );
    }

    @Override
    public DeviceCodePoll pollDeviceCode(DeviceCode deviceCode, Cancellation cancellation) throws XboxLiveException {
        Map<String, String> form = new LinkedHashMap<>();
        form.put("grant_type", DEVICE_CODE_GRANT);
        form.put("client_id", clientId);
        form.put("device_code", deviceCode.deviceCode());

        try {
            return DeviceCodePoll.authorized(requestTokens(form, cancellation, "poll device code"));
        } catch (UpstreamRejectedException ex) {
            String code = ex.getCode() == null ? "" : ex.getCode();
            switch (code) {
                case "authorization_pending":
                    return DeviceCodePoll.pending();
                case "slow_down":
                    return DeviceCodePoll.slowDown();
                case "authorization_declined":
                case "access_denied":
                    throw new AuthorizationDeniedException("device authorization declined: " + ex.getMessage());
                case "expired_token":
                    throw new DeviceCodeExpiredException("device code expired: " + ex.getMessage());
                default:
                    throw ex;
            }
        }
    }

    @Override
    public OAuthTokens refresh(String refreshToken, Cancellation cancellation) throws XboxLiveException {
        Map<String, String> form = new LinkedHashMap<>();
        form.put("grant_type", "refresh_token");
        form.put("client_id", clientId);
        form.put("refresh_token", refreshToken);
        form.put("scope", scope);

        OAuthTokens tokens = requestTokens(form, cancellation, "refresh access token");
        if (tokens.refreshToken() == null) {
            // No rotation: the presented refresh token stays valid.
            return new OAuthTokens(tokens.accessToken(), refreshToken, tokens.tokenType(), tokens.scope(), tokens.expiresAt());
        }
        return tokens;
    }

    @Override
    public XboxToken userToken(String accessToken, Cancellation cancellation) throws XboxLiveException {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("AuthMethod", "RPS");
        properties.put("SiteName", USER_TOKEN_SITE_NAME);
        properties.put("RpsTicket", rpsTicketPrefix + accessToken);

        return xboxTokenRequest(userTokenUrl, USER_TOKEN_RELYING_PARTY, properties, cancellation, "request user token");
    }

    @Override
    public XboxToken xstsToken(String userToken, String relyingParty, Cancellation cancellation) throws XboxLiveException {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("SandboxId", "RETAIL");
        properties.put("UserTokens", List.of(userToken));

        return xboxTokenRequest(xstsUrl, relyingParty, properties, cancellation, "request XSTS token for " + relyingParty);
    }

    @Override
    public ServiceToken serviceToken(XboxToken xstsToken, Cancellation cancellation) throws XboxLiveException {
        Map<String, Object> payload = Map.of("identityToken", xstsToken.identityToken());

        Instant requestedAt = clock.instant();
        JsonNode node = execute(jsonPost(serviceLoginUrl, payload, Map.of()), cancellation, "request service token");

        String accessToken = requireText(node, "access_token", "service login response");
        long expiresIn = requirePositive(node, "expires_in", "service login response");
        return new ServiceToken(accessToken, node.path("username").asText(null), requestedAt.plusSeconds(expiresIn));
    }

    private OAuthTokens requestTokens(Map<String, String> form, Cancellation cancellation, String operation)
        throws XboxLiveException {

        Instant requestedAt = clock.instant();
        JsonNode node = execute(HttpUtil.formPost(tokenUrl, form, requestTimeout), cancellation, operation);

        String accessToken = requireText(node, "access_token", "token response");
        long expiresIn = requirePositive(node, "expires_in", "token response");
        String refreshToken = node.path("refresh_token").asText("");

        return new OAuthTokens(
            accessToken,
            refreshToken.isBlank() ? null : refreshToken,
            node.path("token_type").asText(null),
            node.path("scope").asText(null),
            requestedAt.plusSeconds(expiresIn)
        );
    }

    private XboxToken xboxTokenRequest(
        String url,
        String relyingParty,
        Map<String, Object> properties,
        Cancellation cancellation,
        String operation
    ) throws XboxLiveException {

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("RelyingParty", relyingParty);
        payload.put("TokenType", "JWT");
        payload.put("Properties", properties);

        JsonNode node = execute(jsonPost(url, payload, Map.of("x-xbl-contract-version", "1")), cancellation, operation);

        String token = requireText(node, "Token", operation + " response");
        Instant notAfter = requireInstant(node, "NotAfter", operation + " response");
        Instant issuedAt = node.hasNonNull("IssueInstant") ? requireInstant(node, "IssueInstant", operation + " response") : null;
        String userHash = DisplayClaims.userHash(node);
        return new XboxToken(token, userHash, issuedAt, notAfter);
    }

    private HttpRequest jsonPost(String url, Object payload, Map<String, String> headers) throws MalformedResponseException {
        try {
            return HttpUtil.jsonPost(url, payload, requestTimeout, headers);
        } catch (IOException ex) {
            throw new MalformedResponseException("encode request for " + url + ": " + ex.getMessage(), ex);
        }
    }

    private JsonNode execute(HttpRequest request, Cancellation cancellation, String operation) throws XboxLiveException {
        LOGGER.fine(() -> "[xblive] " + operation + " via " + request.uri());
        HttpResponse<InputStream> response = HttpUtil.send(httpClient, request, cancellation, operation);

        try (InputStream bodyStream = response.body()) {
            if (response.statusCode() / 100 != 2) {
                throw ApiErrorDecoder.decode(response.statusCode(), bodyStream);
            }
            JsonNode node;
            try {
                node = Json.mapper().readTree(bodyStream);
            } catch (JsonProcessingException ex) {
                throw new MalformedResponseException("decode " + operation + " response: " + ex.getMessage(), ex);
            }
            if (node == null || !node.isObject()) {
                throw new MalformedResponseException(operation + " response is not a JSON object");
            }
            return node;
        } catch (IOException ex) {
            throw new NetworkException(operation + ": " + ex.getMessage(), ex);
        }
    }

    private static String requireText(JsonNode node, String field, String context) throws MalformedResponseException {
        String value = node.path(field).asText("");
        if (value.isBlank()) {
            throw new MalformedResponseException(context + " missing " + field);
        }
        return value;
    }

    private static long requirePositive(JsonNode node, String field, String context) throws MalformedResponseException {
        JsonNode value = node.path(field);
        if (!value.canConvertToLong() || value.asLong() <= 0) {
            throw new MalformedResponseException(context + " missing positive " + field);
        }
        return value.asLong();
    }

    private static Instant requireInstant(JsonNode node, String field, String context) throws MalformedResponseException {
        String value = requireText(node, field, context);
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException ex) {
            throw new MalformedResponseException(context + " has unparseable " + field + ": " + value, ex);
        }
    }
}

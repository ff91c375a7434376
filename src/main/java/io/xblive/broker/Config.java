package io.xblive.broker;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * Immutable configuration container used to bootstrap {@link XboxLiveClient} instances.
 *
 * <p>
 * Only {@code clientId} is mandatory. Every endpoint defaults to the public Microsoft identity
 * platform, Xbox Live, and Minecraft services hosts; tests point them at a local stub.
 * </p>
 */
public final class Config {

    public static final String DEFAULT_DEVICE_CODE_URL = "https://login.microsoftonline.com/consumers/oauth2/v2.0/devicecode";
    public static final String DEFAULT_TOKEN_URL = "https://login.microsoftonline.com/consumers/oauth2/v2.0/token";
    public static final String DEFAULT_USER_TOKEN_URL = "https://user.auth.xboxlive.com/user/authenticate";
    public static final String DEFAULT_XSTS_URL = "https://xsts.auth.xboxlive.com/xsts/authorize";
    public static final String DEFAULT_SERVICES_BASE_URL = "https://api.minecraftservices.com";
    public static final String DEFAULT_PEOPLE_HUB_BASE_URL = "https://peoplehub.xboxlive.com";
    public static final String DEFAULT_SCOPE = "XboxLive.signin offline_access";
    public static final String DEFAULT_XBOX_LIVE_RELYING_PARTY = "http://xboxlive.com";
    public static final String DEFAULT_SERVICES_RELYING_PARTY = "rp://api.minecraftservices.com/";
    public static final String DEFAULT_RPS_TICKET_PREFIX = "d=";
    public static final Duration DEFAULT_HTTP_TIMEOUT = Duration.ofSeconds(30);

    private final String clientId;
    private final String scope;
    private final String deviceCodeUrl;
    private final String tokenUrl;
    private final String userTokenUrl;
    private final String xstsUrl;
    private final String servicesBaseUrl;
    private final String peopleHubBaseUrl;
    private final String xboxLiveRelyingParty;
    private final String servicesRelyingParty;
    private final String rpsTicketPrefix;
    private final Path cacheFile;
    private final HttpClient httpClient;
    private final Duration httpTimeout;
    private final Clock clock;

    private Config(Builder builder) {
        this.clientId = builder.clientId;
        this.scope = builder.scope;
        this.deviceCodeUrl = builder.deviceCodeUrl;
        this.tokenUrl = builder.tokenUrl;
        this.userTokenUrl = builder.userTokenUrl;
        this.xstsUrl = builder.xstsUrl;
        this.servicesBaseUrl = builder.servicesBaseUrl;
        this.peopleHubBaseUrl = builder.peopleHubBaseUrl;
        this.xboxLiveRelyingParty = builder.xboxLiveRelyingParty;
        this.servicesRelyingParty = builder.servicesRelyingParty;
        this.rpsTicketPrefix = builder.rpsTicketPrefix;
        this.cacheFile = builder.cacheFile;
        this.httpClient = builder.httpClient;
        this.httpTimeout = builder.httpTimeout;
        this.clock = builder.clock;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Path defaultCacheFile() {
        return Path.of(System.getProperty("user.home"), ".xblive", "tokens.json");
    }

    public Config withDefaults() {
        if (clientId == null || clientId.isBlank()) {
            throw new IllegalArgumentException("ClientID is required");
        }

        Duration resolvedTimeout = Optional.ofNullable(httpTimeout).orElse(DEFAULT_HTTP_TIMEOUT);
        if (resolvedTimeout.isNegative() || resolvedTimeout.isZero()) {
            resolvedTimeout = DEFAULT_HTTP_TIMEOUT;
        }

        HttpClient resolvedClient = httpClient;
        if (resolvedClient == null) {
            resolvedClient = HttpClient.newBuilder()
                .connectTimeout(resolvedTimeout)
                .build();
        }

        return new Builder()
            .clientId(clientId.trim())
            .scope(nonBlank(scope, DEFAULT_SCOPE))
            .deviceCodeUrl(sanitizeUrl(nonBlank(deviceCodeUrl, DEFAULT_DEVICE_CODE_URL)))
            .tokenUrl(sanitizeUrl(nonBlank(tokenUrl, DEFAULT_TOKEN_URL)))
            .userTokenUrl(sanitizeUrl(nonBlank(userTokenUrl, DEFAULT_USER_TOKEN_URL)))
            .xstsUrl(sanitizeUrl(nonBlank(xstsUrl, DEFAULT_XSTS_URL)))
            .servicesBaseUrl(sanitizeUrl(nonBlank(servicesBaseUrl, DEFAULT_SERVICES_BASE_URL)))
            .peopleHubBaseUrl(sanitizeUrl(nonBlank(peopleHubBaseUrl, DEFAULT_PEOPLE_HUB_BASE_URL)))
            .xboxLiveRelyingParty(nonBlank(xboxLiveRelyingParty, DEFAULT_XBOX_LIVE_RELYING_PARTY))
            .servicesRelyingParty(nonBlank(servicesRelyingParty, DEFAULT_SERVICES_RELYING_PARTY))
            .rpsTicketPrefix(rpsTicketPrefix == null ? DEFAULT_RPS_TICKET_PREFIX : rpsTicketPrefix)
            .cacheFile(Optional.ofNullable(cacheFile).orElseGet(Config::defaultCacheFile))
            .httpClient(resolvedClient)
            .httpTimeout(resolvedTimeout)
            .clock(Optional.ofNullable(clock).orElseGet(Clock::systemUTC))
            .buildInternal();
    }

    private static String nonBlank(String value, String fallback) {
        String trimmed = Optional.ofNullable(value).map(String::trim).orElse("");
        return trimmed.isEmpty() ? fallback : trimmed;
    }

    private static String sanitizeUrl(String url) {
        String trimmed = Optional.ofNullable(url).map(String::trim).orElse("");
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("URL must be non-empty");
        }
        try {
            URI uri = new URI(trimmed);
            if (uri.getScheme() == null || uri.getHost() == null) {
                throw new IllegalArgumentException("URL must include scheme and host");
            }
        } catch (URISyntaxException ex) {
            throw new IllegalArgumentException("Invalid URL: " + trimmed, ex);
        }
        if (trimmed.endsWith("/")) {
            return trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    public String getClientId() {
        return clientId;
    }

    public String getScope() {
        return scope;
    }

    public String getDeviceCodeUrl() {
        return deviceCodeUrl;
    }

    public String getTokenUrl() {
        return tokenUrl;
    }

    public String getUserTokenUrl() {
        return userTokenUrl;
    }

    public String getXstsUrl() {
        return xstsUrl;
    }

    public String getServicesBaseUrl() {
        return servicesBaseUrl;
    }

    /**
     * @return base URL of the Xbox Live people service used for gamertag search.
     */
    public String getPeopleHubBaseUrl() {
        return peopleHubBaseUrl;
    }

    /**
     * @return relying party whose XSTS token authorizes Xbox Live API calls.
     */
    public String getXboxLiveRelyingParty() {
        return xboxLiveRelyingParty;
    }

    /**
     * @return relying party whose XSTS token is exchanged for the game-services access token.
     */
    public String getServicesRelyingParty() {
        return servicesRelyingParty;
    }

    /**
     * @return prefix placed before the access token in the user-token {@code RpsTicket}; {@code d=}
     * for identity-platform tokens, {@code t=} for legacy live.com tokens.
     */
    public String getRpsTicketPrefix() {
        return rpsTicketPrefix;
    }

    public Path getCacheFile() {
        return cacheFile;
    }

    public HttpClient getHttpClient() {
        return httpClient;
    }

    public Duration getHttpTimeout() {
        return httpTimeout;
    }

    public Clock getClock() {
        return clock;
    }

    public static final class Builder {
        private String clientId;
        private String scope;
        private String deviceCodeUrl;
        private String tokenUrl;
        private String userTokenUrl;
        private String xstsUrl;
        private String servicesBaseUrl;
        private String peopleHubBaseUrl;
        private String xboxLiveRelyingParty;
        private String servicesRelyingParty;
        private String rpsTicketPrefix;
        private Path cacheFile;
        private HttpClient httpClient;
        private Duration httpTimeout;
        private Clock clock;

        public Builder clientId(String clientId) {
            this.clientId = clientId;
            return this;
        }

        public Builder scope(String scope) {
            this.scope = scope;
            return this;
        }

        public Builder deviceCodeUrl(String deviceCodeUrl) {
            this.deviceCodeUrl = deviceCodeUrl;
            return this;
        }

        public Builder tokenUrl(String tokenUrl) {
            this.tokenUrl = tokenUrl;
            return this;
        }

        public Builder userTokenUrl(String userTokenUrl) {
            this.userTokenUrl = userTokenUrl;
            return this;
        }

        public Builder xstsUrl(String xstsUrl) {
            this.xstsUrl = xstsUrl;
            return this;
        }

        public Builder servicesBaseUrl(String servicesBaseUrl) {
            this.servicesBaseUrl = servicesBaseUrl;
            return this;
        }

        public Builder peopleHubBaseUrl(String peopleHubBaseUrl) {
            this.peopleHubBaseUrl = peopleHubBaseUrl;
            return this;
        }

        public Builder xboxLiveRelyingParty(String xboxLiveRelyingParty) {
            this.xboxLiveRelyingParty = xboxLiveRelyingParty;
            return this;
        }

        public Builder servicesRelyingParty(String servicesRelyingParty) {
            this.servicesRelyingParty = servicesRelyingParty;
            return this;
        }

        public Builder rpsTicketPrefix(String rpsTicketPrefix) {
            this.rpsTicketPrefix = rpsTicketPrefix;
            return this;
        }

        public Builder cacheFile(Path cacheFile) {
            this.cacheFile = cacheFile;
            return this;
        }

        public Builder httpClient(HttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        public Builder httpTimeout(Duration httpTimeout) {
            this.httpTimeout = httpTimeout;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Config build() {
            return new Config(this).withDefaults();
        }

        private Config buildInternal() {
            return new Config(this);
        }
    }
}

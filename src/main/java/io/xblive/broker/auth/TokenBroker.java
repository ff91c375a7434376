package io.xblive.broker.auth;

import io.xblive.broker.Cancellation;
import io.xblive.broker.InteractiveAuthRequiredException;
import io.xblive.broker.MalformedResponseException;
import io.xblive.broker.OperationCancelledException;
import io.xblive.broker.TokenStorageException;
import io.xblive.broker.UpstreamRejectedException;
import io.xblive.broker.XboxLiveException;
import io.xblive.broker.store.TokenKey;
import io.xblive.broker.store.TokenKind;
import io.xblive.broker.store.TokenRecord;
import io.xblive.broker.store.TokenStore;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.logging.Logger;

/**
 * Resolves credentials along the chain
 * {@code REFRESH_TOKEN -> ACCESS_TOKEN -> USER_TOKEN -> XSTS_TOKEN[rp] -> SERVICE_TOKEN}.
 *
 * <p>
 * {@link #ensure(TokenKey, Cancellation)} returns the stored record when it is still valid and
 * otherwise re-derives only the stale suffix: it ensures the parent, performs one exchange, and
 * persists the result before returning. A warm cache costs no network calls.
 * </p>
 *
 * <h2>Policy</h2>
 * <ul>
 *   <li>The chain is renewed through the refresh token. When it is missing or the identity platform
 *       rejects it, {@link InteractiveAuthRequiredException} is raised; the device-code flow only runs
 *       through {@link #bootstrap(Consumer, Cancellation)}. A rejected refresh token stays stored.</li>
 *   <li>A failed exchange persists nothing, so the store keeps the last good record of every kind.</li>
 *   <li>Derivation is serialized per {@link TokenKey}: one lock per key is held across
 *       check, exchange and persist. Locks are taken child before parent, and sibling relying
 *       parties never share a lock.</li>
 * </ul>
 *
 * <p>
 * The broker holds no token state of its own; the {@link TokenStore} is the only owner.
 * </p>
 */
public final class TokenBroker {

    private static final Logger LOGGER = Logger.getLogger(TokenBroker.class.getName());

    private static final TokenKey REFRESH = TokenKey.of(TokenKind.REFRESH_TOKEN);
    private static final TokenKey ACCESS = TokenKey.of(TokenKind.ACCESS_TOKEN);
    private static final TokenKey USER = TokenKey.of(TokenKind.USER_TOKEN);

    private final TokenStore store;
    private final TokenExchange exchange;
    private final DeviceCodeFlow deviceCodeFlow;
    private final String servicesRelyingParty;
    private final Clock clock;

    private final Map<TokenKey, ReentrantLock> locks = new ConcurrentHashMap<>();

    /**
     * @param servicesRelyingParty relying party of the XSTS token exchanged for {@link TokenKind#SERVICE_TOKEN}.
     */
    public TokenBroker(TokenStore store, TokenExchange exchange, String servicesRelyingParty, Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.exchange = Objects.requireNonNull(exchange, "exchange");
        this.servicesRelyingParty = TokenKey.xsts(servicesRelyingParty).relyingParty();
        this.clock = Objects.requireNonNull(clock, "clock");
        this.deviceCodeFlow = new DeviceCodeFlow(exchange, clock);
    }

    public TokenRecord ensure(TokenKind kind) throws XboxLiveException {
        return ensure(TokenKey.of(kind), Cancellation.none());
    }

    public TokenRecord ensureXsts(String relyingParty) throws XboxLiveException {
        return ensure(TokenKey.xsts(relyingParty), Cancellation.none());
    }

    /**
     * Returns a record for {@code key} that is valid at return time, deriving and persisting stale
     * ancestors as needed.
     *
     * @throws InteractiveAuthRequiredException when the chain cannot be renewed without the user.
     * @throws UpstreamRejectedException when an exchange below the refresh step is rejected.
     * @throws TokenStorageException when the store cannot be read or written.
     */
    public TokenRecord ensure(TokenKey key, Cancellation cancellation) throws XboxLiveException {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(cancellation, "cancellation");

        Optional<TokenRecord> cached = store.get(key);
        if (cached.isPresent()) {
            LOGGER.fine(() -> "[xblive] cache hit for " + key);
            return cached.get();
        }
        if (key.kind() == TokenKind.REFRESH_TOKEN) {
            throw new InteractiveAuthRequiredException("no refresh token stored; device-code authentication required");
        }

        ReentrantLock lock = locks.computeIfAbsent(key, k -> new ReentrantLock());
        try {
            lock.lockInterruptibly();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new OperationCancelledException("waiting to derive " + key + " interrupted", ex);
        }
        try {
            cached = store.get(key);
            if (cached.isPresent()) {
                return cached.get();
            }
            cancellation.throwIfCancelled("derive " + key);
            LOGGER.fine(() -> "[xblive] " + key + " absent or expired, deriving");
            return derive(key, cancellation);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Runs the device-code flow and persists the issued access and refresh tokens together as the
     * base of the chain. Downstream records are left as they are; call {@link #logout()} first when
     * switching accounts.
     *
     * @param prompt receives the device code to present to the user before polling starts.
     * @return the stored access token record.
     */
    public TokenRecord bootstrap(Consumer<DeviceCode> prompt, Cancellation cancellation) throws XboxLiveException {
        Objects.requireNonNull(prompt, "prompt");
        DeviceCode code = deviceCodeFlow.start(cancellation);
        prompt.accept(code);
        OAuthTokens tokens = deviceCodeFlow.await(code, cancellation);

        ReentrantLock lock = locks.computeIfAbsent(ACCESS, k -> new ReentrantLock());
        lock.lock();
        try {
            TokenRecord access = persistOAuthTokens(tokens, true);
            LOGGER.info(() -> "[xblive] device-code authentication complete");
            return access;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes every stored credential.
     */
    public void logout() throws TokenStorageException {
        store.clear();
        LOGGER.info(() -> "[xblive] token cache cleared");
    }

    public String getServicesRelyingParty() {
        return servicesRelyingParty;
    }

    private TokenRecord derive(TokenKey key, Cancellation cancellation) throws XboxLiveException {
        switch (key.kind()) {
            case ACCESS_TOKEN:
                return deriveAccessToken(cancellation);
            case USER_TOKEN: {
                TokenRecord access = ensure(ACCESS, cancellation);
                XboxToken user = exchange.userToken(access.value(), cancellation);
                return persist(key, TokenRecord.withUserHash(user.token(), user.userHash(), user.notAfter()));
            }
            case XSTS_TOKEN: {
                TokenRecord user = ensure(USER, cancellation);
                XboxToken xsts = exchange.xstsToken(user.value(), key.relyingParty(), cancellation);
                return persist(key, TokenRecord.withUserHash(xsts.token(), xsts.userHash(), xsts.notAfter()));
            }
            case SERVICE_TOKEN: {
                TokenRecord xsts = ensure(TokenKey.xsts(servicesRelyingParty), cancellation);
                XboxToken credential = new XboxToken(xsts.value(), xsts.userHash(), null, xsts.expiresAt());
                ServiceToken service = exchange.serviceToken(credential, cancellation);
                return persist(key, TokenRecord.expiring(service.accessToken(), service.expiresAt()));
            }
            default:
                throw new IllegalStateException("no derivation for " + key);
        }
    }

    private TokenRecord deriveAccessToken(Cancellation cancellation) throws XboxLiveException {
        TokenRecord refresh = ensure(REFRESH, cancellation);
        OAuthTokens tokens;
        try {
            tokens = exchange.refresh(refresh.value(), cancellation);
        } catch (UpstreamRejectedException ex) {
            throw new InteractiveAuthRequiredException("refresh token rejected (" + ex.getMessage()
                + "); device-code authentication required", ex);
        }
        return persistOAuthTokens(tokens, false);
    }

    /**
     * @param signIn {@code true} for a fresh device-code sign-in, whose tokens replace any stored
     *               refresh token even when none was issued.
     */
    private TokenRecord persistOAuthTokens(OAuthTokens tokens, boolean signIn) throws XboxLiveException {
        TokenRecord access = TokenRecord.expiring(tokens.accessToken(), tokens.expiresAt());
        requireUsable(ACCESS, access);

        Map<TokenKey, TokenRecord> records = new LinkedHashMap<>();
        records.put(ACCESS, access);
        if (tokens.refreshToken() != null) {
            records.put(REFRESH, TokenRecord.refreshToken(tokens.refreshToken()));
        } else if (signIn) {
            store.remove(REFRESH);
            LOGGER.warning(() -> "[xblive] sign-in issued no refresh token (is offline_access in the scope?); "
                + "renewal will require signing in again");
        } else {
            LOGGER.fine(() -> "[xblive] refresh response did not rotate the refresh token; keeping the stored one");
        }
        store.setAll(records);
        return access;
    }

    private TokenRecord persist(TokenKey key, TokenRecord record) throws XboxLiveException {
        requireUsable(key, record);
        store.set(key, record);
        LOGGER.fine(() -> "[xblive] derived " + key + " valid until " + record.expiresAt());
        return record;
    }

    private void requireUsable(TokenKey key, TokenRecord record) throws MalformedResponseException {
        if (!record.isUsableAt(clock.instant())) {
            throw new MalformedResponseException(key + " was issued already expired (" + record.expiresAt() + ")");
        }
    }
}

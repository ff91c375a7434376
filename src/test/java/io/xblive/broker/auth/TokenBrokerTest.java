package io.xblive.broker.auth;

import io.xblive.broker.Cancellation;
import io.xblive.broker.InteractiveAuthRequiredException;
import io.xblive.broker.MutableClock;
import io.xblive.broker.OperationCancelledException;
import io.xblive.broker.UpstreamRejectedException;
import io.xblive.broker.store.InMemoryTokenStore;
import io.xblive.broker.store.TokenKey;
import io.xblive.broker.store.TokenKind;
import io.xblive.broker.store.TokenRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TokenBrokerTest {

    private static final String GAMING = "http://xboxlive.com";
    private static final String GAMES_SERVICE = "rp://api.minecraftservices.com/";

    private static final TokenKey REFRESH = TokenKey.of(TokenKind.REFRESH_TOKEN);
    private static final TokenKey ACCESS = TokenKey.of(TokenKind.ACCESS_TOKEN);
    private static final TokenKey USER = TokenKey.of(TokenKind.USER_TOKEN);
    private static final TokenKey SERVICE = TokenKey.of(TokenKind.SERVICE_TOKEN);

    private MutableClock clock;
    private InMemoryTokenStore store;
    private CountingExchange exchange;
    private TokenBroker broker;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingNow();
        store = new InMemoryTokenStore(clock);
        exchange = new CountingExchange(clock);
        broker = new TokenBroker(store, exchange, GAMES_SERVICE, clock);
    }

    @Test
    void emptyStoreRequiresInteractiveAuthWithoutNetwork() {
        assertThrows(InteractiveAuthRequiredException.class, () -> broker.ensure(TokenKind.ACCESS_TOKEN));
        assertThrows(InteractiveAuthRequiredException.class, () -> broker.ensure(TokenKind.SERVICE_TOKEN));
        assertThrows(InteractiveAuthRequiredException.class, () -> broker.ensureXsts(GAMING));
        assertEquals(0, exchange.total());
        assertTrue(store.snapshot().isEmpty());
    }

    @ParameterizedTest
    @EnumSource(value = TokenKind.class, names = {"ACCESS_TOKEN", "USER_TOKEN", "XSTS_TOKEN", "SERVICE_TOKEN"})
    void secondEnsureIsPureCacheHit(TokenKind kind) throws Exception {
        TokenKey key = kind == TokenKind.XSTS_TOKEN ? TokenKey.xsts(GAMING) : TokenKey.of(kind);
        seedAncestorsOf(key);

        TokenRecord first = broker.ensure(key, Cancellation.none());
        TokenRecord second = broker.ensure(key, Cancellation.none());

        assertEquals(1, exchange.total());
        assertEquals(first, second);
    }

    @Test
    void expiredRecordBehavesLikeAbsentRecord() throws Exception {
        seedAccess();
        store.set(USER, TokenRecord.withUserHash("UT-old", "uhs-1", clock.instant()));

        TokenRecord user = broker.ensure(TokenKind.USER_TOKEN);

        assertEquals(List.of("user:AT0"), exchange.calls);
        assertEquals(user, store.get(USER).orElseThrow());
    }

    @Test
    void partialStalenessRederivesOnlyTheStaleSuffix() throws Exception {
        seedAccess();
        store.set(USER, TokenRecord.withUserHash("UT0", "uhs-1", clock.instant().plus(Duration.ofHours(2))));
        store.set(TokenKey.xsts(GAMING), TokenRecord.withUserHash("XSTS-old", "uhs-1", clock.instant().minusSeconds(1)));

        broker.ensureXsts(GAMING);

        assertEquals(List.of("xsts:" + GAMING + ":UT0"), exchange.calls);
    }

    @Test
    void expiredAccessTokenRenewsSilentlyAndPersistsRotatedRefreshToken() throws Exception {
        store.setAll(Map.of(
            REFRESH, TokenRecord.refreshToken("RT0"),
            ACCESS, TokenRecord.expiring("AT0", clock.instant().minusSeconds(30))
        ));

        TokenRecord access = broker.ensure(TokenKind.ACCESS_TOKEN);

        assertEquals(List.of("refresh:RT0"), exchange.calls);
        assertEquals("AT-1", access.value());
        assertEquals("RT-1", store.get(REFRESH).orElseThrow().value());
    }

    @Test
    void rejectedRefreshRequiresInteractiveAuthAndKeepsStoredRefreshToken() throws Exception {
        store.set(REFRESH, TokenRecord.refreshToken("RT0"));
        exchange.rejectRefresh = true;

        InteractiveAuthRequiredException ex = assertThrows(InteractiveAuthRequiredException.class,
            () -> broker.ensure(TokenKind.USER_TOKEN));

        assertTrue(ex.getCause() instanceof UpstreamRejectedException);
        assertEquals("RT0", store.get(REFRESH).orElseThrow().value());
        assertFalse(store.get(ACCESS).isPresent());
        assertEquals(1, exchange.total());
    }

    @Test
    void siblingRelyingPartiesNeverOverwriteEachOther() throws Exception {
        seedAccess();
        TokenRecord gamesService = broker.ensureXsts(GAMES_SERVICE);
        long userExchanges = exchange.count("user:");

        TokenRecord gaming = broker.ensureXsts(GAMING);

        assertEquals(userExchanges, exchange.count("user:"));
        assertEquals(gamesService, store.get(TokenKey.xsts(GAMES_SERVICE)).orElseThrow());
        assertEquals(gaming, store.get(TokenKey.xsts(GAMING)).orElseThrow());
        assertFalse(gaming.value().equals(gamesService.value()));
    }

    @Test
    void rejectedXstsLeavesUserTokenUntouchedAndWritesNoXstsRecord() throws Exception {
        seedAccess();
        TokenRecord user = broker.ensure(TokenKind.USER_TOKEN);
        exchange.rejectXsts = true;

        UpstreamRejectedException ex = assertThrows(UpstreamRejectedException.class, () -> broker.ensureXsts(GAMING));

        assertEquals("2148916233", ex.getCode());
        assertSame(user, store.snapshot().get(USER));
        assertFalse(store.snapshot().containsKey(TokenKey.xsts(GAMING)));
    }

    @Test
    void failedRederivationKeepsLastKnownGoodRecord() throws Exception {
        seedAccess();
        TokenRecord previous = TokenRecord.withUserHash("UT-previous", "uhs-1", clock.instant().minusSeconds(5));
        store.set(USER, previous);
        exchange.rejectUserToken = true;

        assertThrows(UpstreamRejectedException.class, () -> broker.ensure(TokenKind.USER_TOKEN));

        assertSame(previous, store.snapshot().get(USER));
    }

    @Test
    void serviceTokenIsDerivedFromServicesRelyingParty() throws Exception {
        seedAccess();

        TokenRecord service = broker.ensure(TokenKind.SERVICE_TOKEN);

        assertEquals(List.of(
            "user:AT0",
            "xsts:" + GAMES_SERVICE + ":UT-1",
            "service:XBL3.0 x=uhs-1;XSTS-" + GAMES_SERVICE + "-2"
        ), exchange.calls);
        assertEquals(service, store.get(SERVICE).orElseThrow());
        assertTrue(store.get(TokenKey.xsts(GAMES_SERVICE)).isPresent());
        assertFalse(store.get(TokenKey.xsts(GAMING)).isPresent());
    }

    @Test
    void concurrentCallersShareOneExchangePerKey() throws Exception {
        seedAccess();
        store.set(USER, TokenRecord.withUserHash("UT0", "uhs-1", clock.instant().plus(Duration.ofHours(2))));
        exchange.xstsGate = new CountDownLatch(1);

        ExecutorService pool = Executors.newFixedThreadPool(6);
        try {
            List<Future<TokenRecord>> results = new ArrayList<>();
            for (int i = 0; i < 6; i++) {
                results.add(pool.submit(() -> broker.ensureXsts(GAMING)));
            }
            Thread.sleep(100);
            exchange.xstsGate.countDown();

            TokenRecord expected = results.get(0).get(5, TimeUnit.SECONDS);
            for (Future<TokenRecord> result : results) {
                assertEquals(expected, result.get(5, TimeUnit.SECONDS));
            }
        } finally {
            pool.shutdownNow();
        }
        assertEquals(1, exchange.count("xsts:"));
    }

    @Test
    void cancelledCallerDerivesNothingButStillGetsCacheHits() throws Exception {
        seedAccess();
        Cancellation cancellation = Cancellation.none();
        cancellation.cancel();

        assertThrows(OperationCancelledException.class, () -> broker.ensure(USER, cancellation));
        assertEquals(0, exchange.total());
        assertEquals("AT0", broker.ensure(ACCESS, cancellation).value());
    }

    @Test
    void bootstrapPersistsAccessAndRefreshTokensTogether() throws Exception {
        AtomicReference<DeviceCode> prompted = new AtomicReference<>();

        TokenRecord access = broker.bootstrap(prompted::set, Cancellation.none());

        assertEquals("USER-CODE", prompted.get().userCode());
        assertEquals("AT1", access.value());
        assertEquals(clock.instant().plus(CountingExchange.ACCESS_LIFETIME), access.expiresAt());
        assertEquals("RT1", store.get(REFRESH).orElseThrow().value());

        broker.ensure(TokenKind.USER_TOKEN);
        assertEquals(List.of("device-code", "poll", "user:AT1"), exchange.calls);
    }

    @Test
    void signInWithoutRefreshTokenDropsPreviousRefreshToken() throws Exception {
        store.set(REFRESH, TokenRecord.refreshToken("RT-other-account"));
        exchange.issueRefreshToken = false;

        TokenRecord access = broker.bootstrap(code -> { }, Cancellation.none());

        assertEquals("AT1", access.value());
        assertFalse(store.snapshot().containsKey(REFRESH));
        assertEquals(access, store.get(ACCESS).orElseThrow());
    }

    @Test
    void refreshWithoutRotationKeepsStoredRefreshToken() throws Exception {
        store.setAll(Map.of(
            REFRESH, TokenRecord.refreshToken("RT0"),
            ACCESS, TokenRecord.expiring("AT0", clock.instant().minusSeconds(1))
        ));
        exchange.issueRefreshToken = false;

        TokenRecord access = broker.ensure(TokenKind.ACCESS_TOKEN);

        assertEquals("AT-1", access.value());
        assertEquals("RT0", store.get(REFRESH).orElseThrow().value());
    }

    @Test
    void logoutReturnsEveryKindToAbsent() throws Exception {
        seedAccess();
        broker.ensure(TokenKind.SERVICE_TOKEN);

        broker.logout();

        assertTrue(store.snapshot().isEmpty());
        assertThrows(InteractiveAuthRequiredException.class, () -> broker.ensure(TokenKind.SERVICE_TOKEN));
    }

    private void seedAccess() throws Exception {
        store.setAll(Map.of(
            REFRESH, TokenRecord.refreshToken("RT0"),
            ACCESS, TokenRecord.expiring("AT0", clock.instant().plus(Duration.ofHours(1)))
        ));
    }

    private void seedAncestorsOf(TokenKey key) throws Exception {
        Instant later = clock.instant().plus(Duration.ofHours(2));
        store.set(REFRESH, TokenRecord.refreshToken("RT0"));
        if (key.kind().compareTo(TokenKind.USER_TOKEN) >= 0) {
            store.set(ACCESS, TokenRecord.expiring("AT0", later));
        }
        if (key.kind().compareTo(TokenKind.XSTS_TOKEN) >= 0) {
            store.set(USER, TokenRecord.withUserHash("UT0", "uhs-1", later));
        }
        if (key.kind() == TokenKind.SERVICE_TOKEN) {
            store.set(TokenKey.xsts(GAMES_SERVICE), TokenRecord.withUserHash("XSTS0", "uhs-1", later));
        }
    }
}

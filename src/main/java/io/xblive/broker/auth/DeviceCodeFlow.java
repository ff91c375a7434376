package io.xblive.broker.auth;

import io.xblive.broker.Cancellation;
import io.xblive.broker.DeviceCodeExpiredException;
import io.xblive.broker.OperationCancelledException;
import io.xblive.broker.XboxLiveException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Interactive bootstrap of the credential chain using the OAuth device-code grant.
 *
 * <p>
 * {@link #start(Cancellation)} obtains the code to show to the user; {@link #await(DeviceCode, Cancellation)}
 * then polls the token endpoint once per interval until the user authorizes, declines, or the
 * code expires. The wait between polls is a timed wait on the caller's {@link Cancellation}, so
 * cancelling aborts the flow without waiting out the interval.
 * </p>
 */
public final class DeviceCodeFlow {

    private static final Logger LOGGER = Logger.getLogger(DeviceCodeFlow.class.getName());

    static final Duration SLOW_DOWN_STEP = Duration.ofSeconds(5);

    private final TokenExchange exchange;
    private final Clock clock;

    public DeviceCodeFlow(TokenExchange exchange, Clock clock) {
        this.exchange = Objects.requireNonNull(exchange, "exchange");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public DeviceCode start(Cancellation cancellation) throws XboxLiveException {
        DeviceCode code = exchange.requestDeviceCode(cancellation);
        LOGGER.info(() -> "[xblive] device code issued, polling every " + code.interval().toSeconds()
            + "s until " + code.expiresAt());
        return code;
    }

    /**
     * Polls until the device code is authorized.
     *
     * @return the access and refresh tokens issued on authorization.
     * @throws DeviceCodeExpiredException when {@code expiresAt} passes first; the whole flow must be restarted.
     * @throws io.xblive.broker.AuthorizationDeniedException when the user declines.
     * @throws OperationCancelledException when {@code cancellation} fires or the thread is interrupted.
     */
    public OAuthTokens await(DeviceCode code, Cancellation cancellation) throws XboxLiveException {
        Objects.requireNonNull(code, "code");
        Duration interval = code.interval();
        int attempts = 0;

        while (true) {
            Instant now = clock.instant();
            if (!now.isBefore(code.expiresAt())) {
                throw new DeviceCodeExpiredException("device code expired at " + code.expiresAt()
                    + " before authorization completed");
            }

            Duration remaining = Duration.between(now, code.expiresAt());
            suspend(interval.compareTo(remaining) < 0 ? interval : remaining, cancellation);

            attempts++;
            DeviceCodePoll poll = exchange.pollDeviceCode(code, cancellation);
            switch (poll.status()) {
                case AUTHORIZED:
                    int polls = attempts;
                    LOGGER.info(() -> "[xblive] device code authorized after " + polls + " poll(s)");
                    return poll.tokens();
                case SLOW_DOWN:
                    interval = interval.plus(SLOW_DOWN_STEP);
                    Duration slowed = interval;
                    LOGGER.fine(() -> "[xblive] token endpoint asked to slow down, interval now " + slowed.toSeconds() + "s");
                    break;
                default:
                    break;
            }
        }
    }

    private static void suspend(Duration wait, Cancellation cancellation) throws OperationCancelledException {
        try {
            if (cancellation.await(wait)) {
                throw new OperationCancelledException("device code authorization cancelled");
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new OperationCancelledException("device code authorization interrupted", ex);
        }
    }
}

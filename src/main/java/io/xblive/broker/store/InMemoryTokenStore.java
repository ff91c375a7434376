package io.xblive.broker.store;

import java.time.Clock;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Map-backed store for tests and short-lived embeddings. Records vanish with the instance.
 */
public final class InMemoryTokenStore implements TokenStore {

    private final Map<TokenKey, TokenRecord> records = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryTokenStore() {
        this(Clock.systemUTC());
    }

    public InMemoryTokenStore(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Optional<TokenRecord> get(TokenKey key) {
        TokenRecord record = records.get(key);
        if (record == null || !record.isUsableAt(clock.instant())) {
            return Optional.empty();
        }
        return Optional.of(record);
    }

    @Override
    public void setAll(Map<TokenKey, TokenRecord> updates) {
        records.putAll(updates);
    }

    @Override
    public void remove(TokenKey key) {
        records.remove(key);
    }

    @Override
    public void clear() {
        records.clear();
    }

    /**
     * @return every record including expired ones, for inspection.
     */
    public Map<TokenKey, TokenRecord> snapshot() {
        return Map.copyOf(records);
    }
}

package io.xblive.broker.store;

import io.xblive.broker.TokenStorageException;

import java.util.Map;
import java.util.Optional;

/**
 * Durable keyed storage of token records. Implementations must be safe for concurrent use.
 */
public interface TokenStore {

    /**
     * @return the record for {@code key}, or empty when it is absent or expired at call time.
     */
    Optional<TokenRecord> get(TokenKey key) throws TokenStorageException;

    /**
     * Replaces the record for {@code key} and persists the full record set before returning. On
     * failure the prior state stays visible to later reads.
     */
    default void set(TokenKey key, TokenRecord record) throws TokenStorageException {
        setAll(Map.of(key, record));
    }

    /**
     * Replaces several records in a single persisted write.
     */
    void setAll(Map<TokenKey, TokenRecord> records) throws TokenStorageException;

    /**
     * Removes the record for {@code key}, if any, and persists the remaining set.
     */
    void remove(TokenKey key) throws TokenStorageException;

    /**
     * Removes every record. Clearing an empty store succeeds.
     */
    void clear() throws TokenStorageException;
}

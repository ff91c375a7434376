package io.xblive.broker.store;

/**
 * Credential kinds in the derivation chain, listed root first. Each kind except
 * {@link #REFRESH_TOKEN} is produced from its parent by exactly one exchange.
 */
public enum TokenKind {
    REFRESH_TOKEN,
    ACCESS_TOKEN,
    USER_TOKEN,
    XSTS_TOKEN,
    SERVICE_TOKEN;

    /**
     * @return {@code true} for kinds stored once per relying party.
     */
    public boolean isRelyingPartyScoped() {
        return this == XSTS_TOKEN;
    }

    /**
     * @return {@code true} for kinds that carry a user hash alongside the token value.
     */
    public boolean carriesUserHash() {
        return this == USER_TOKEN || this == XSTS_TOKEN;
    }

    /**
     * @return {@code true} for kinds with an absolute expiry. Refresh tokens have none; their
     * revocation only shows up as a rejected exchange.
     */
    public boolean expires() {
        return this != REFRESH_TOKEN;
    }
}

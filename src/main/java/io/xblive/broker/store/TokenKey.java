package io.xblive.broker.store;

import java.util.Objects;

/**
 * Identifies one stored record: a kind plus, for XSTS tokens only, the relying party.
 */
public record TokenKey(TokenKind kind, String relyingParty) {

    public TokenKey {
        Objects.requireNonNull(kind, "kind");
        if (kind.isRelyingPartyScoped()) {
            if (relyingParty == null || relyingParty.isBlank()) {
                throw new IllegalArgumentException(kind + " requires a relying party");
            }
            relyingParty = relyingParty.trim();
        } else if (relyingParty != null) {
            throw new IllegalArgumentException(kind + " is not scoped by relying party");
        }
    }

    public static TokenKey of(TokenKind kind) {
        return new TokenKey(kind, null);
    }

    public static TokenKey xsts(String relyingParty) {
        return new TokenKey(TokenKind.XSTS_TOKEN, relyingParty);
    }

    @Override
    public String toString() {
        return relyingParty == null ? kind.name() : kind.name() + "[" + relyingParty + "]";
    }
}

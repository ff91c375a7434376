package io.xblive.broker.store;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * On-disk shape of the token cache: one block per kind, XSTS blocks keyed by relying party.
 */
record CacheDocument(
    @JsonProperty("refresh_token") Entry refreshToken,
    @JsonProperty("access_token") Entry accessToken,
    @JsonProperty("user_token") Entry userToken,
    @JsonProperty("xsts_tokens") Map<String, Entry> xstsTokens,
    @JsonProperty("service_token") Entry serviceToken
) {

    record Entry(
        @JsonProperty("value") String value,
        @JsonProperty("user_hash") String userHash,
        @JsonProperty("expires_at") Instant expiresAt
    ) {

        static Entry of(TokenRecord record) {
            return record == null ? null : new Entry(record.value(), record.userHash(), record.expiresAt());
        }
    }

    static CacheDocument from(Map<TokenKey, TokenRecord> records) {
        Map<String, Entry> xsts = new TreeMap<>();
        records.forEach((key, record) -> {
            if (key.kind() == TokenKind.XSTS_TOKEN) {
                xsts.put(key.relyingParty(), Entry.of(record));
            }
        });
        return new CacheDocument(
            Entry.of(records.get(TokenKey.of(TokenKind.REFRESH_TOKEN))),
            Entry.of(records.get(TokenKey.of(TokenKind.ACCESS_TOKEN))),
            Entry.of(records.get(TokenKey.of(TokenKind.USER_TOKEN))),
            xsts.isEmpty() ? null : xsts,
            Entry.of(records.get(TokenKey.of(TokenKind.SERVICE_TOKEN)))
        );
    }

    /**
     * @throws IllegalArgumentException when a block is incomplete for its kind.
     */
    Map<TokenKey, TokenRecord> toRecords() {
        Map<TokenKey, TokenRecord> records = new LinkedHashMap<>();
        put(records, TokenKey.of(TokenKind.REFRESH_TOKEN), refreshToken);
        put(records, TokenKey.of(TokenKind.ACCESS_TOKEN), accessToken);
        put(records, TokenKey.of(TokenKind.USER_TOKEN), userToken);
        if (xstsTokens != null) {
            xstsTokens.forEach((relyingParty, entry) -> put(records, TokenKey.xsts(relyingParty), entry));
        }
        put(records, TokenKey.of(TokenKind.SERVICE_TOKEN), serviceToken);
        return records;
    }

    private static void put(Map<TokenKey, TokenRecord> records, TokenKey key, Entry entry) {
        if (entry == null) {
            return;
        }
        TokenKind kind = key.kind();
        if (kind.expires() && entry.expiresAt() == null) {
            throw new IllegalArgumentException(key + " block is missing expires_at");
        }
        if (kind.carriesUserHash() && (entry.userHash() == null || entry.userHash().isBlank())) {
            throw new IllegalArgumentException(key + " block is missing user_hash");
        }
        records.put(key, new TokenRecord(entry.value(), entry.userHash(), kind.expires() ? entry.expiresAt() : null));
    }
}

package com.authcore.backend.modules.auth.application;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

import com.authcore.backend.modules.auth.application.JwtTokenService.IssuedPurposeToken;
import com.authcore.backend.modules.auth.application.JwtTokenService.VerifiedPurposeToken;
import com.authcore.backend.modules.auth.infrastructure.redis.FastStore;

import org.springframework.stereotype.Component;

/**
 * Single-use bookkeeping for email verification and password reset tokens. The signed token proves who issued it;
 * the fast-store entry proves it has not been redeemed yet.
 */
@Component
public class PendingTokenStore {

    static final String KEY_PREFIX = "auth:purpose:";

    private static final String SEPARATOR = "|";

    private final FastStore fastStore;
    private final Clock clock;

    public PendingTokenStore(FastStore fastStore, Clock clock) {
        this.fastStore = fastStore;
        this.clock = clock;
    }

    public void remember(String purpose, IssuedPurposeToken token, UUID accountId, String email) {
        Duration ttl = Duration.between(clock.instant(), token.expiresAt());
        if (ttl.isNegative() || ttl.isZero()) {
            return;
        }
        fastStore.set(key(purpose, token.tokenId()), accountId + SEPARATOR + (email != null ? email : ""), ttl);
    }

    /**
     * Removes the entry and returns what was stored at issuance. Empty when the token was already consumed or
     * has expired from the store.
     */
    public Optional<PendingToken> consume(VerifiedPurposeToken token) {
        return fastStore.getAndDelete(key(token.claims().purpose(), token.tokenId()))
                .flatMap(PendingTokenStore::decode);
    }

    private static Optional<PendingToken> decode(String raw) {
        int separator = raw.indexOf(SEPARATOR);
        if (separator < 0) {
            return Optional.empty();
        }
        try {
            UUID accountId = UUID.fromString(raw.substring(0, separator));
            String email = raw.substring(separator + 1);
            return Optional.of(new PendingToken(accountId, email.isEmpty() ? null : email));
        } catch (IllegalArgumentException ex) {
            return Optional.empty();
        }
    }

    private static String key(String purpose, String tokenId) {
        return KEY_PREFIX + purpose + ":" + tokenId;
    }

    public record PendingToken(UUID accountId, String email) {
    }
}

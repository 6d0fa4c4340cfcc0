package com.authcore.backend.modules.auth.application;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.UUID;

import com.authcore.backend.modules.auth.domain.AccountRole;
import com.authcore.backend.modules.auth.domain.PurposeClaims;
import com.authcore.backend.modules.auth.domain.PurposeClaims.EmailVerification;
import com.authcore.backend.modules.auth.domain.PurposeClaims.MfaChallenge;
import com.authcore.backend.modules.auth.domain.PurposeClaims.PasswordReset;
import com.authcore.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtBuilder;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.Jwts.SIG;
import org.apache.commons.codec.binary.Hex;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Token codec. Access tokens, purpose tokens and the refresh credential wrapper are all HS256 JWTs told apart by
 * the {@code typ} claim, so one kind can never be replayed as another.
 */
@Service
public class JwtTokenService {

    static final String TYPE_CLAIM = "typ";
    static final String ROLE_CLAIM = "role";
    static final String PURPOSE_CLAIM = "pur";
    static final String EMAIL_CLAIM = "email";
    static final String TYPE_ACCESS = "access";
    static final String TYPE_PURPOSE = "purpose";
    static final String TYPE_REFRESH = "refresh";

    private static final int TOKEN_ID_BYTES = 16;

    private final JwtTokenProvider tokenProvider;
    private final long accessTokenTtlMillis;
    private final long refreshTokenTtlMillis;
    private final Clock clock;
    private final SecureRandom secureRandom = new SecureRandom();

    public JwtTokenService(
            JwtTokenProvider tokenProvider,
            @Value("${jwt.expiration:900000}") long accessTokenTtlMillis,
            @Value("${jwt.refresh-expiration:604800000}") long refreshTokenTtlMillis,
            Clock clock
    ) {
        this.tokenProvider = tokenProvider;
        this.accessTokenTtlMillis = accessTokenTtlMillis;
        this.refreshTokenTtlMillis = refreshTokenTtlMillis;
        this.clock = clock;
    }

    public String issueAccessToken(UUID accountId, AccountRole role) {
        return issueAccessToken(accountId, role, clock.instant());
    }

    /**
     * Signs an access token as of {@code issuedAt}. The output depends only on its arguments, which is what lets the
     * ledger hand back the identical pair on a retried rotation.
     */
    public String issueAccessToken(UUID accountId, AccountRole role, Instant issuedAt) {
        return Jwts.builder()
                .subject(accountId.toString())
                .claim(TYPE_CLAIM, TYPE_ACCESS)
                .claim(ROLE_CLAIM, role.name())
                .issuedAt(Date.from(issuedAt))
                .expiration(Date.from(issuedAt.plusMillis(accessTokenTtlMillis)))
                .signWith(tokenProvider.getSecretKey(), SIG.HS256)
                .compact();
    }

    public IssuedPurposeToken issuePurposeToken(PurposeClaims payload, Duration ttl) {
        Instant now = clock.instant();
        Instant expiresAt = now.plus(ttl);
        String tokenId = newTokenId();

        JwtBuilder builder = Jwts.builder()
                .subject(payload.accountId().toString())
                .id(tokenId)
                .claim(TYPE_CLAIM, TYPE_PURPOSE)
                .claim(PURPOSE_CLAIM, payload.purpose());
        if (payload instanceof EmailVerification verification) {
            builder.claim(EMAIL_CLAIM, verification.email());
        }
        String token = builder
                .issuedAt(Date.from(now))
                .expiration(Date.from(expiresAt))
                .signWith(tokenProvider.getSecretKey(), SIG.HS256)
                .compact();
        return new IssuedPurposeToken(token, tokenId, expiresAt);
    }

    public String issueRefreshCredential(UUID accountId, String tokenValue, Instant issuedAt, Instant expiresAt) {
        return Jwts.builder()
                .subject(accountId.toString())
                .id(tokenValue)
                .claim(TYPE_CLAIM, TYPE_REFRESH)
                .issuedAt(Date.from(issuedAt))
                .expiration(Date.from(expiresAt))
                .signWith(tokenProvider.getSecretKey(), SIG.HS256)
                .compact();
    }

    public ParsedAccessToken parseAccessToken(String token) {
        Claims claims = parseClaims(token, TYPE_ACCESS);
        String role = claims.get(ROLE_CLAIM, String.class);
        if (role == null || role.isBlank()) {
            throw new InvalidTokenException(InvalidTokenException.Reason.MALFORMED, "Access token without role", null);
        }
        return new ParsedAccessToken(
                parseSubject(claims),
                role,
                claims.getIssuedAt().toInstant(),
                claims.getExpiration().toInstant()
        );
    }

    public VerifiedPurposeToken parsePurposeToken(String token) {
        Claims claims = parseClaims(token, TYPE_PURPOSE);
        UUID accountId = parseSubject(claims);
        String purpose = claims.get(PURPOSE_CLAIM, String.class);
        PurposeClaims payload;
        if (MfaChallenge.PURPOSE.equals(purpose)) {
            payload = new MfaChallenge(accountId);
        } else if (EmailVerification.PURPOSE.equals(purpose)) {
            String email = claims.get(EMAIL_CLAIM, String.class);
            if (email == null || email.isBlank()) {
                throw new InvalidTokenException(InvalidTokenException.Reason.MALFORMED,
                        "Email verification token without email", null);
            }
            payload = new EmailVerification(accountId, email);
        } else if (PasswordReset.PURPOSE.equals(purpose)) {
            payload = new PasswordReset(accountId);
        } else {
            throw new InvalidTokenException(InvalidTokenException.Reason.MALFORMED, "Unknown token purpose", null);
        }
        if (claims.getId() == null || claims.getId().isBlank()) {
            throw new InvalidTokenException(InvalidTokenException.Reason.MALFORMED, "Purpose token without id", null);
        }
        return new VerifiedPurposeToken(payload, claims.getId(), claims.getExpiration().toInstant());
    }

    /**
     * Verifies the purpose token and insists on a specific variant.
     */
    public <T extends PurposeClaims> T parsePurposeToken(String token, Class<T> expected) {
        PurposeClaims claims = parsePurposeToken(token).claims();
        if (!expected.isInstance(claims)) {
            throw new InvalidTokenException(InvalidTokenException.Reason.MALFORMED, "Unexpected token purpose", null);
        }
        return expected.cast(claims);
    }

    /**
     * Verifies the signature of a refresh credential. Expiry is deliberately not enforced here: the ledger row is
     * the authority on whether the credential is still usable.
     */
    public RefreshCredential parseRefreshCredential(String token) {
        Claims claims = parseClaims(token, TYPE_REFRESH, true);
        String tokenValue = claims.getId();
        if (tokenValue == null || tokenValue.isBlank()) {
            throw new InvalidTokenException(InvalidTokenException.Reason.MALFORMED, "Refresh credential without id", null);
        }
        return new RefreshCredential(parseSubject(claims), tokenValue);
    }

    public long getAccessTokenTtlMillis() {
        return accessTokenTtlMillis;
    }

    public long getRefreshTokenTtlMillis() {
        return refreshTokenTtlMillis;
    }

    private Claims parseClaims(String token, String expectedType) {
        return parseClaims(token, expectedType, false);
    }

    private Claims parseClaims(String token, String expectedType, boolean allowExpired) {
        Claims claims;
        try {
            claims = Jwts.parser()
                    .verifyWith(tokenProvider.getSecretKey())
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
        } catch (ExpiredJwtException e) {
            if (!allowExpired) {
                throw new InvalidTokenException(InvalidTokenException.Reason.EXPIRED, "Token expired", e);
            }
            // signature was verified before the expiry check
            claims = e.getClaims();
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidTokenException(InvalidTokenException.Reason.MALFORMED, "Invalid token", e);
        }
        if (!expectedType.equals(claims.get(TYPE_CLAIM, String.class))
                || claims.getIssuedAt() == null
                || claims.getExpiration() == null) {
            throw new InvalidTokenException(InvalidTokenException.Reason.MALFORMED, "Unexpected token type", null);
        }
        return claims;
    }

    private UUID parseSubject(Claims claims) {
        try {
            return UUID.fromString(claims.getSubject());
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new InvalidTokenException(InvalidTokenException.Reason.MALFORMED, "Invalid token subject", e);
        }
    }

    private String newTokenId() {
        byte[] bytes = new byte[TOKEN_ID_BYTES];
        secureRandom.nextBytes(bytes);
        return Hex.encodeHexString(bytes);
    }

    public record ParsedAccessToken(UUID accountId, String role, Instant issuedAt, Instant expiresAt) {
    }

    public record IssuedPurposeToken(String token, String tokenId, Instant expiresAt) {
    }

    public record VerifiedPurposeToken(PurposeClaims claims, String tokenId, Instant expiresAt) {
    }

    public record RefreshCredential(UUID accountId, String tokenValue) {
    }

    public static class InvalidTokenException extends RuntimeException {

        public enum Reason {
            EXPIRED,
            MALFORMED
        }

        private final Reason reason;

        public InvalidTokenException(Reason reason, String message, Throwable cause) {
            super(message, cause);
            this.reason = reason;
        }

        public Reason getReason() {
            return reason;
        }
    }
}

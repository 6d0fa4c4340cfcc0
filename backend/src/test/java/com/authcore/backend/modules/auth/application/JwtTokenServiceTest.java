package com.authcore.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.UUID;

import com.authcore.backend.modules.auth.application.JwtTokenService.InvalidTokenException;
import com.authcore.backend.modules.auth.application.JwtTokenService.IssuedPurposeToken;
import com.authcore.backend.modules.auth.application.JwtTokenService.ParsedAccessToken;
import com.authcore.backend.modules.auth.application.JwtTokenService.RefreshCredential;
import com.authcore.backend.modules.auth.application.JwtTokenService.VerifiedPurposeToken;
import com.authcore.backend.modules.auth.domain.AccountRole;
import com.authcore.backend.modules.auth.domain.PurposeClaims.EmailVerification;
import com.authcore.backend.modules.auth.domain.PurposeClaims.MfaChallenge;
import com.authcore.backend.modules.auth.domain.PurposeClaims.PasswordReset;
import com.authcore.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;
import com.authcore.backend.support.MutableClock;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class JwtTokenServiceTest {

    private static final String SECRET = "test-secret-key-with-at-least-32-bytes!!";
    private static final UUID ACCOUNT_ID = UUID.fromString("00000000-0000-0000-0000-000000000101");

    private MutableClock clock;
    private JwtTokenService jwtTokenService;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2025-01-01T00:00:00Z");
        jwtTokenService = new JwtTokenService(new JwtTokenProvider(SECRET), 900_000L, 604_800_000L, clock);
    }

    @Test
    @DisplayName("액세스 토큰은 계정 ID와 역할을 담고 15분 뒤 만료된다")
    void accessTokenCarriesSubjectAndRole() {
        String token = jwtTokenService.issueAccessToken(ACCOUNT_ID, AccountRole.ADMIN);

        ParsedAccessToken parsed = jwtTokenService.parseAccessToken(token);

        assertThat(parsed.accountId()).isEqualTo(ACCOUNT_ID);
        assertThat(parsed.role()).isEqualTo("ADMIN");
        assertThat(Duration.between(parsed.issuedAt(), parsed.expiresAt())).isEqualTo(Duration.ofMinutes(15));
    }

    @Test
    void expiredAccessTokenIsReportedAsExpired() {
        String token = jwtTokenService.issueAccessToken(ACCOUNT_ID, AccountRole.USER);
        clock.advance(Duration.ofMinutes(16));

        assertThatThrownBy(() -> jwtTokenService.parseAccessToken(token))
                .isInstanceOfSatisfying(InvalidTokenException.class,
                        ex -> assertThat(ex.getReason()).isEqualTo(InvalidTokenException.Reason.EXPIRED));
    }

    @Test
    void tokenSignedForAnotherPayloadIsMalformed() {
        String first = jwtTokenService.issueAccessToken(ACCOUNT_ID, AccountRole.USER);
        String second = jwtTokenService.issueAccessToken(UUID.randomUUID(), AccountRole.ADMIN);
        String[] a = first.split("\\.");
        String[] b = second.split("\\.");
        String spliced = a[0] + "." + b[1] + "." + a[2];

        assertThatThrownBy(() -> jwtTokenService.parseAccessToken(spliced))
                .isInstanceOfSatisfying(InvalidTokenException.class,
                        ex -> assertThat(ex.getReason()).isEqualTo(InvalidTokenException.Reason.MALFORMED));
    }

    @Test
    void tokenFromAnotherKeyIsMalformed() {
        JwtTokenService foreign = new JwtTokenService(
                new JwtTokenProvider("another-secret-key-with-at-least-32-bytes"), 900_000L, 604_800_000L, clock);
        String token = foreign.issueAccessToken(ACCOUNT_ID, AccountRole.USER);

        assertThatThrownBy(() -> jwtTokenService.parseAccessToken(token))
                .isInstanceOf(InvalidTokenException.class);
    }

    @Test
    @DisplayName("토큰 종류(typ)가 다르면 다른 용도로 쓸 수 없다")
    void tokenKindsAreNotInterchangeable() {
        String access = jwtTokenService.issueAccessToken(ACCOUNT_ID, AccountRole.USER);
        String purpose = jwtTokenService.issuePurposeToken(new MfaChallenge(ACCOUNT_ID), Duration.ofMinutes(5)).token();

        assertThatThrownBy(() -> jwtTokenService.parsePurposeToken(access)).isInstanceOf(InvalidTokenException.class);
        assertThatThrownBy(() -> jwtTokenService.parseAccessToken(purpose)).isInstanceOf(InvalidTokenException.class);
        assertThatThrownBy(() -> jwtTokenService.parseRefreshCredential(access))
                .isInstanceOf(InvalidTokenException.class);
    }

    @Test
    void purposeTokenResolvesToItsVariant() {
        IssuedPurposeToken issued = jwtTokenService.issuePurposeToken(
                new EmailVerification(ACCOUNT_ID, "alice@example.com"), Duration.ofHours(24));

        VerifiedPurposeToken verified = jwtTokenService.parsePurposeToken(issued.token());

        assertThat(verified.claims()).isEqualTo(new EmailVerification(ACCOUNT_ID, "alice@example.com"));
        assertThat(verified.tokenId()).isEqualTo(issued.tokenId()).hasSize(32);
        assertThat(verified.expiresAt()).isEqualTo(clock.instant().plus(Duration.ofHours(24)));
    }

    @Test
    void purposeTokenIsOnlyAcceptedForTheRequestedPurpose() {
        String mfaToken = jwtTokenService.issuePurposeToken(new MfaChallenge(ACCOUNT_ID), Duration.ofMinutes(5)).token();

        assertThat(jwtTokenService.parsePurposeToken(mfaToken, MfaChallenge.class).accountId()).isEqualTo(ACCOUNT_ID);
        assertThatThrownBy(() -> jwtTokenService.parsePurposeToken(mfaToken, PasswordReset.class))
                .isInstanceOf(InvalidTokenException.class);
    }

    @Test
    void expiredPurposeTokenIsRejected() {
        String token = jwtTokenService.issuePurposeToken(new PasswordReset(ACCOUNT_ID), Duration.ofHours(1)).token();
        clock.advance(Duration.ofMinutes(61));

        assertThatThrownBy(() -> jwtTokenService.parsePurposeToken(token))
                .isInstanceOfSatisfying(InvalidTokenException.class,
                        ex -> assertThat(ex.getReason()).isEqualTo(InvalidTokenException.Reason.EXPIRED));
    }

    @Test
    @DisplayName("리프레시 자격 증명은 만료 후에도 서명만 확인하고 원장에 판단을 맡긴다")
    void refreshCredentialIsReadableAfterExpiry() {
        String credential = jwtTokenService.issueRefreshCredential(ACCOUNT_ID, "opaque-value",
                clock.instant(), clock.instant().plus(Duration.ofDays(7)));
        clock.advance(Duration.ofDays(8));

        RefreshCredential parsed = jwtTokenService.parseRefreshCredential(credential);

        assertThat(parsed.accountId()).isEqualTo(ACCOUNT_ID);
        assertThat(parsed.tokenValue()).isEqualTo("opaque-value");
    }

    @Test
    void signingIsDeterministicForTheSameInstant() {
        String first = jwtTokenService.issueAccessToken(ACCOUNT_ID, AccountRole.USER, clock.instant());
        clock.advance(Duration.ofSeconds(30));
        String second = jwtTokenService.issueAccessToken(ACCOUNT_ID, AccountRole.USER,
                clock.instant().minusSeconds(30));

        assertThat(second).isEqualTo(first);
    }

    @Test
    void shortSecretIsRejectedAtStartup() {
        assertThatThrownBy(() -> new JwtTokenProvider("too-short"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("32 bytes");
        assertThatThrownBy(() -> new JwtTokenProvider(" "))
                .isInstanceOf(IllegalStateException.class);
    }
}

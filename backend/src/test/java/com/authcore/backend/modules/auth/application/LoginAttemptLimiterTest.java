package com.authcore.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import java.time.Duration;
import java.util.UUID;

import com.authcore.backend.global.config.AuthProperties;
import com.authcore.backend.global.error.RetryableProblemException;
import com.authcore.backend.modules.audit.application.AuditLogService;
import com.authcore.backend.support.InMemoryFastStore;
import com.authcore.backend.support.MutableClock;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;

@ExtendWith(MockitoExtension.class)
class LoginAttemptLimiterTest {

    private static final UUID ACCOUNT_ID = UUID.fromString("00000000-0000-0000-0000-000000000201");

    @Mock
    private AuditLogService auditLogService;

    private MutableClock clock;
    private InMemoryFastStore fastStore;
    private LoginAttemptLimiter limiter;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2025-01-01T00:00:00Z");
        fastStore = new InMemoryFastStore(clock);
        limiter = new LoginAttemptLimiter(fastStore, auditLogService, AuthProperties.defaults(), clock);
    }

    @Test
    @DisplayName("임계값(5회)에 도달하면 잠기고 감사 로그가 남는다")
    void locksWhenThresholdReached() {
        for (int i = 1; i <= 4; i++) {
            assertThat(limiter.recordFailure(ACCOUNT_ID, "10.0.0.1")).isEqualTo(i);
            assertThat(limiter.isLocked(ACCOUNT_ID)).isFalse();
        }

        assertThat(limiter.recordFailure(ACCOUNT_ID, "10.0.0.1")).isEqualTo(5);

        assertThat(limiter.isLocked(ACCOUNT_ID)).isTrue();
        verify(auditLogService, times(1))
                .recordAccountEvent(eq(AuthAuditActions.ACCOUNT_LOCKED), eq(ACCOUNT_ID), anyMap());
    }

    @Test
    void counterWindowDoesNotSlideOnEveryFailure() {
        limiter.recordFailure(ACCOUNT_ID, "10.0.0.1");
        clock.advance(Duration.ofMinutes(20));
        limiter.recordFailure(ACCOUNT_ID, "10.0.0.1");
        clock.advance(Duration.ofMinutes(11));

        // the first failure opened a 30 minute window which has now closed
        assertThat(limiter.recordFailure(ACCOUNT_ID, "10.0.0.1")).isEqualTo(1);
    }

    @Test
    @DisplayName("잠금 플래그는 카운터와 별개로 자체 TTL 동안 유지된다")
    void lockOutlivesTheCounterWindow() {
        for (int i = 0; i < 4; i++) {
            limiter.recordFailure(ACCOUNT_ID, "10.0.0.1");
        }
        clock.advance(Duration.ofMinutes(29));
        limiter.recordFailure(ACCOUNT_ID, "10.0.0.1");

        clock.advance(Duration.ofMinutes(5));
        assertThat(limiter.isLocked(ACCOUNT_ID)).isTrue();
        assertThat(limiter.remainingLock(ACCOUNT_ID)).isEqualTo(Duration.ofMinutes(25));

        clock.advance(Duration.ofMinutes(25));
        assertThat(limiter.isLocked(ACCOUNT_ID)).isFalse();
    }

    @Test
    @DisplayName("잠금이 풀린 뒤에는 창 안에 남은 카운터로 다시 잠기지 않는다")
    void expiredLockIsNotReArmedFromTheSameCounter() {
        LoginAttemptLimiter shortLock = new LoginAttemptLimiter(fastStore, auditLogService, new AuthProperties(null,
                new AuthProperties.Lockout(5, Duration.ofMinutes(30), Duration.ofMinutes(5)),
                null, null, null, null, null, null), clock);
        for (int i = 0; i < 5; i++) {
            shortLock.recordFailure(ACCOUNT_ID, "10.0.0.1");
        }
        assertThat(shortLock.isLocked(ACCOUNT_ID)).isTrue();

        clock.advance(Duration.ofMinutes(6));

        assertThat(shortLock.isLocked(ACCOUNT_ID)).isFalse();
        assertThat(shortLock.isLocked(ACCOUNT_ID)).isFalse();
        verify(auditLogService, times(1))
                .recordAccountEvent(eq(AuthAuditActions.ACCOUNT_LOCKED), eq(ACCOUNT_ID), anyMap());

        assertThat(shortLock.recordFailure(ACCOUNT_ID, "10.0.0.1")).isEqualTo(6);
        assertThat(shortLock.isLocked(ACCOUNT_ID)).isTrue();
    }

    @Test
    void counterAtThresholdWithoutAnyLockIsRecovered() {
        fastStore.set(LoginAttemptLimiter.ATTEMPTS_KEY_PREFIX + ACCOUNT_ID, "5", Duration.ofMinutes(30));

        assertThat(limiter.isLocked(ACCOUNT_ID)).isTrue();
        assertThat(limiter.remainingLock(ACCOUNT_ID)).isEqualTo(Duration.ofMinutes(30));
    }

    @Test
    void lockedExceptionDisclosesRetryAfter() {
        for (int i = 0; i < 5; i++) {
            limiter.recordFailure(ACCOUNT_ID, "10.0.0.1");
        }

        RetryableProblemException ex = limiter.lockedException(ACCOUNT_ID);

        assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.LOCKED);
        assertThat(ex.getCode()).isEqualTo("ACCOUNT_LOCKED");
        assertThat(ex.getRetryAfterSeconds()).isEqualTo(Duration.ofMinutes(30).toSeconds());
    }

    @Test
    void clearRemovesCounterAndLock() {
        for (int i = 0; i < 5; i++) {
            limiter.recordFailure(ACCOUNT_ID, "10.0.0.1");
        }

        limiter.clear(ACCOUNT_ID);

        assertThat(limiter.isLocked(ACCOUNT_ID)).isFalse();
        assertThat(limiter.recordFailure(ACCOUNT_ID, "10.0.0.1")).isEqualTo(1);
    }

    @Test
    @DisplayName("저장소 장애 시 잠긴 것으로 간주한다 (fail closed)")
    void storeOutageIsTreatedAsLocked() {
        fastStore.setAvailable(false);

        assertThat(limiter.isLocked(ACCOUNT_ID)).isTrue();
        assertThat(limiter.remainingLock(ACCOUNT_ID)).isEqualTo(Duration.ofMinutes(30));
        verify(auditLogService, never()).recordAccountEvent(eq(AuthAuditActions.ACCOUNT_LOCKED), eq(ACCOUNT_ID),
                anyMap());
    }
}

package com.authcore.backend.modules.auth.application;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.UUID;

import com.authcore.backend.global.config.AuthProperties;
import com.authcore.backend.global.error.RetryableProblemException;
import com.authcore.backend.global.error.StoreUnavailableException;
import com.authcore.backend.modules.audit.application.AuditLogService;
import com.authcore.backend.modules.auth.infrastructure.redis.FastStore;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;

/**
 * Per-account brute-force lockout. Failed attempts count inside a rolling window; reaching the threshold sets a
 * separate lock flag with its own TTL. Any store failure while checking is reported as locked.
 *
 * <p>Each lock also leaves an issued marker that lives as long as the counter window, so a lock that has run its
 * course is not re-armed from a counter still sitting at the threshold.
 */
@Component
public class LoginAttemptLimiter {

    private static final Logger log = LoggerFactory.getLogger(LoginAttemptLimiter.class);

    static final String ATTEMPTS_KEY_PREFIX = "auth:login-attempts:";
    static final String LOCK_KEY_PREFIX = "auth:account-locked:";
    static final String LOCK_ISSUED_KEY_PREFIX = "auth:account-lock-issued:";

    private final FastStore fastStore;
    private final AuditLogService auditLogService;
    private final AuthProperties.Lockout policy;
    private final Clock clock;

    public LoginAttemptLimiter(FastStore fastStore, AuditLogService auditLogService, AuthProperties properties,
                               Clock clock) {
        this.fastStore = fastStore;
        this.auditLogService = auditLogService;
        this.policy = properties.lockout();
        this.clock = clock;
    }

    public long recordFailure(UUID accountId, String clientIp) {
        long attempts = fastStore.incrementWithExpiry(attemptsKey(accountId), policy.window());
        log.warn("Failed login attempt: account={}, ip={}, attempt={}", accountId, clientIp, attempts);
        if (attempts >= policy.maxAttempts()) {
            lock(accountId, attempts);
        }
        return attempts;
    }

    public boolean isLocked(UUID accountId) {
        try {
            if (fastStore.exists(lockKey(accountId))) {
                return true;
            }
            long attempts = fastStore.get(attemptsKey(accountId))
                    .map(LoginAttemptLimiter::parseCount)
                    .orElse(0L);
            if (attempts >= policy.maxAttempts() && !fastStore.exists(lockIssuedKey(accountId))) {
                // counter reached the threshold but the flag write was lost
                lock(accountId, attempts);
                return true;
            }
            return false;
        } catch (StoreUnavailableException ex) {
            log.error("Lockout state unavailable for account={}; treating as locked", accountId, ex);
            return true;
        }
    }

    public Duration remainingLock(UUID accountId) {
        try {
            Duration remaining = fastStore.timeToLive(lockKey(accountId));
            return remaining.isZero() ? policy.duration() : remaining;
        } catch (StoreUnavailableException ex) {
            return policy.duration();
        }
    }

    public void clear(UUID accountId) {
        fastStore.delete(attemptsKey(accountId));
        fastStore.delete(lockKey(accountId));
        fastStore.delete(lockIssuedKey(accountId));
    }

    public RetryableProblemException lockedException(UUID accountId) {
        Duration remaining = remainingLock(accountId);
        long seconds = Math.max(1L, (remaining.toMillis() + 999L) / 1000L);
        long minutes = Math.max(1L, (seconds + 59L) / 60L);
        return new RetryableProblemException(
                HttpStatus.LOCKED,
                "ACCOUNT_LOCKED",
                "Account is temporarily locked due to too many failed login attempts. Try again in " + minutes
                        + " minute(s).",
                seconds
        );
    }

    private void lock(UUID accountId, long attempts) {
        String lockedAt = clock.instant().toString();
        fastStore.set(lockKey(accountId), lockedAt, policy.duration());
        Duration counterLeft = fastStore.timeToLive(attemptsKey(accountId));
        fastStore.set(lockIssuedKey(accountId), lockedAt, counterLeft.isZero() ? policy.window() : counterLeft);
        log.warn("Account locked after {} failed attempts: account={}, duration={}", attempts, accountId,
                policy.duration());
        auditLogService.recordAccountEvent(AuthAuditActions.ACCOUNT_LOCKED, accountId, Map.of(
                "attempts", attempts,
                "duration", policy.duration().toString()
        ));
    }

    private static long parseCount(String raw) {
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException ex) {
            return 0L;
        }
    }

    private static String attemptsKey(UUID accountId) {
        return ATTEMPTS_KEY_PREFIX + accountId;
    }

    private static String lockKey(UUID accountId) {
        return LOCK_KEY_PREFIX + accountId;
    }

    private static String lockIssuedKey(UUID accountId) {
        return LOCK_ISSUED_KEY_PREFIX + accountId;
    }
}

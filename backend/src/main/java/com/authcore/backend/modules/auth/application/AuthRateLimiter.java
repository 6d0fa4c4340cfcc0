package com.authcore.backend.modules.auth.application;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;

import com.authcore.backend.global.common.EmailMasker;
import com.authcore.backend.global.config.AuthProperties;
import com.authcore.backend.global.error.RetryableProblemException;
import com.authcore.backend.modules.audit.application.AuditLogService;
import com.authcore.backend.modules.auth.infrastructure.redis.FastStore;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;

/**
 * Fixed-window request throttling for the unauthenticated auth endpoints, keyed by client address and, for flows
 * that send mail, by target email.
 */
@Component
public class AuthRateLimiter {

    private static final Logger log = LoggerFactory.getLogger(AuthRateLimiter.class);

    static final String IP_KEY_PREFIX = "auth:rate:ip:";
    static final String EMAIL_KEY_PREFIX = "auth:rate:email:";

    private final FastStore fastStore;
    private final AuditLogService auditLogService;
    private final AuthProperties.RateLimit policy;

    public AuthRateLimiter(FastStore fastStore, AuditLogService auditLogService, AuthProperties properties) {
        this.fastStore = fastStore;
        this.auditLogService = auditLogService;
        this.policy = properties.rateLimit();
    }

    public void checkClient(String clientIp) {
        String identifier = clientIp != null && !clientIp.isBlank() ? clientIp : "unknown";
        check(IP_KEY_PREFIX + identifier, policy.ip(), "ip", identifier);
    }

    public void checkEmail(String email) {
        String identifier = email.trim().toLowerCase(Locale.ROOT);
        check(EMAIL_KEY_PREFIX + identifier, policy.email(), "email", EmailMasker.mask(identifier));
    }

    private void check(String key, AuthProperties.Limit limit, String dimension, String loggable) {
        long count = fastStore.incrementWithExpiry(key, limit.window());
        if (count <= limit.maxRequests()) {
            return;
        }
        Duration retryAfter = fastStore.timeToLive(key);
        long seconds = Math.max(1L, retryAfter.isZero() ? limit.window().toSeconds() : retryAfter.toSeconds());
        if (count == limit.maxRequests() + 1L) {
            log.warn("Rate limit exceeded: {}={}, limit={}/{}", dimension, loggable, limit.maxRequests(),
                    limit.window());
            auditLogService.recordAccountEvent(AuthAuditActions.RATE_LIMITED, null, Map.of(
                    "dimension", dimension,
                    "identifier", loggable,
                    "retryAfterSeconds", seconds
            ));
        }
        throw new RetryableProblemException(HttpStatus.TOO_MANY_REQUESTS, "TOO_MANY_REQUESTS",
                "Too many requests. Please try again later.", seconds);
    }
}

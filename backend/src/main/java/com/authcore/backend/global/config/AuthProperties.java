package com.authcore.backend.global.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Policy knobs under {@code app.auth}. Any group or value left out of the configuration falls back to the
 * defaults below, so the record is always fully populated.
 */
@ConfigurationProperties(prefix = "app.auth")
public record AuthProperties(
        Refresh refresh,
        Lockout lockout,
        RateLimit rateLimit,
        Mfa mfa,
        PurposeTokens purposeTokens,
        Session session,
        Cookie cookie,
        Mail mail
) {

    public AuthProperties {
        refresh = refresh != null ? refresh : new Refresh(null);
        lockout = lockout != null ? lockout : new Lockout(0, null, null);
        rateLimit = rateLimit != null ? rateLimit : new RateLimit(null, null);
        mfa = mfa != null ? mfa : new Mfa(null, null, 0, null);
        purposeTokens = purposeTokens != null ? purposeTokens : new PurposeTokens(null, null);
        session = session != null ? session : new Session(null);
        cookie = cookie != null ? cookie : new Cookie(null, null, null, null);
        mail = mail != null ? mail : new Mail(false, null, null);
    }

    public static AuthProperties defaults() {
        return new AuthProperties(null, null, null, null, null, null, null, null);
    }

    public record Refresh(Duration reuseGraceWindow) {
        public Refresh {
            reuseGraceWindow = reuseGraceWindow != null ? reuseGraceWindow : Duration.ofSeconds(60);
        }
    }

    public record Lockout(int maxAttempts, Duration window, Duration duration) {
        public Lockout {
            maxAttempts = maxAttempts > 0 ? maxAttempts : 5;
            window = window != null ? window : Duration.ofMinutes(30);
            duration = duration != null ? duration : Duration.ofMinutes(30);
        }
    }

    public record RateLimit(Limit ip, Limit email) {
        public RateLimit {
            ip = ip != null ? ip : new Limit(20, Duration.ofMinutes(15));
            email = email != null ? email : new Limit(5, Duration.ofMinutes(15));
        }
    }

    public record Limit(int maxRequests, Duration window) {
        public Limit {
            maxRequests = maxRequests > 0 ? maxRequests : 20;
            window = window != null ? window : Duration.ofMinutes(15);
        }
    }

    public record Mfa(String issuer, Duration challengeTtl, int backupCodeCount, Integer allowedSkewSteps) {
        public Mfa {
            issuer = issuer != null && !issuer.isBlank() ? issuer : "AuthCore";
            challengeTtl = challengeTtl != null ? challengeTtl : Duration.ofMinutes(5);
            backupCodeCount = backupCodeCount > 0 ? backupCodeCount : 10;
            allowedSkewSteps = allowedSkewSteps != null && allowedSkewSteps >= 0 ? allowedSkewSteps : 1;
        }
    }

    public record PurposeTokens(Duration emailVerificationTtl, Duration passwordResetTtl) {
        public PurposeTokens {
            emailVerificationTtl = emailVerificationTtl != null ? emailVerificationTtl : Duration.ofHours(24);
            passwordResetTtl = passwordResetTtl != null ? passwordResetTtl : Duration.ofHours(1);
        }
    }

    public record Session(Duration retention) {
        public Session {
            retention = retention != null ? retention : Duration.ofDays(7);
        }
    }

    public record Cookie(String name, Boolean secure, String sameSite, String path) {
        public Cookie {
            name = name != null && !name.isBlank() ? name : "refresh_token";
            secure = secure != null ? secure : Boolean.TRUE;
            sameSite = sameSite != null && !sameSite.isBlank() ? sameSite : "Strict";
            path = path != null && !path.isBlank() ? path : "/auth";
        }
    }

    public record Mail(boolean enabled, String from, String baseUrl) {
        public Mail {
            from = from != null && !from.isBlank() ? from : "no-reply@authcore.local";
            baseUrl = baseUrl != null && !baseUrl.isBlank() ? baseUrl : "http://localhost:3000";
        }
    }
}

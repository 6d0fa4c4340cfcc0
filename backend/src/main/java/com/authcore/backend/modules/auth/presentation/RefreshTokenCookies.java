package com.authcore.backend.modules.auth.presentation;

import java.time.Duration;

import com.authcore.backend.global.config.AuthProperties;

import org.springframework.http.ResponseCookie;
import org.springframework.stereotype.Component;

/**
 * Builds the HTTP-only cookie that mirrors the refresh credential returned in the body.
 */
@Component
public class RefreshTokenCookies {

    private final AuthProperties.Cookie cookie;

    public RefreshTokenCookies(AuthProperties properties) {
        this.cookie = properties.cookie();
    }

    public String cookieName() {
        return cookie.name();
    }

    public ResponseCookie issue(String refreshToken, long maxAgeSeconds) {
        return base(refreshToken).maxAge(Duration.ofSeconds(maxAgeSeconds)).build();
    }

    public ResponseCookie clear() {
        return base("").maxAge(Duration.ZERO).build();
    }

    /**
     * Body value wins over the cookie so that non-browser clients can ignore cookies entirely.
     */
    public String resolve(String bodyValue, String cookieValue) {
        if (bodyValue != null && !bodyValue.isBlank()) {
            return bodyValue;
        }
        return cookieValue;
    }

    private ResponseCookie.ResponseCookieBuilder base(String value) {
        return ResponseCookie.from(cookie.name(), value)
                .httpOnly(true)
                .secure(cookie.secure())
                .sameSite(cookie.sameSite())
                .path(cookie.path());
    }
}

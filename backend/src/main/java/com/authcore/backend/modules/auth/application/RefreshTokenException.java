package com.authcore.backend.modules.auth.application;

import com.authcore.backend.global.error.ProblemException;

import org.springframework.http.HttpStatus;

/**
 * Outcome of a refresh credential that could not be rotated. Always 401; the code tells the client whether a silent
 * retry makes sense ({@code EXPIRED}) or whether every session is gone ({@code REUSE_DETECTED}).
 */
public class RefreshTokenException extends ProblemException {

    public enum Reason {
        NOT_FOUND("Refresh token not recognised"),
        REVOKED("Refresh token has been revoked"),
        REUSE_DETECTED("Refresh token reuse detected; all sessions have been signed out"),
        EXPIRED("Refresh token has expired");

        private final String detail;

        Reason(String detail) {
            this.detail = detail;
        }
    }

    private final Reason reason;

    public RefreshTokenException(Reason reason) {
        super(HttpStatus.UNAUTHORIZED, "REFRESH_TOKEN_" + reason.name(), reason.detail);
        this.reason = reason;
    }

    public Reason getRefreshReason() {
        return reason;
    }
}

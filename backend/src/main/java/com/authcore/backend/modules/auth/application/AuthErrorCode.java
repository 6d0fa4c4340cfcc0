package com.authcore.backend.modules.auth.application;

import com.authcore.backend.global.error.ProblemException;

import org.springframework.http.HttpStatus;

/**
 * Stable error codes of the auth API. Credential failures share one generic detail so a caller cannot tell which
 * check failed.
 */
public enum AuthErrorCode {

    INVALID_EMAIL(HttpStatus.BAD_REQUEST, "Email address is not valid"),
    WEAK_PASSWORD(HttpStatus.BAD_REQUEST,
            "Password must be at least 8 characters and contain upper and lower case letters, a digit and a special character"),
    PASSWORD_UNCHANGED(HttpStatus.BAD_REQUEST, "New password must differ from the current password"),
    EMAIL_ALREADY_REGISTERED(HttpStatus.CONFLICT, "An account with this email already exists"),
    INVALID_CREDENTIALS(HttpStatus.UNAUTHORIZED, "Invalid email or password"),
    INVALID_CURRENT_PASSWORD(HttpStatus.BAD_REQUEST, "Current password is incorrect"),
    INVALID_MFA_TOKEN(HttpStatus.UNAUTHORIZED, "Invalid or expired MFA challenge"),
    INVALID_MFA_CODE(HttpStatus.UNAUTHORIZED, "Invalid MFA code"),
    INVALID_OR_EXPIRED_TOKEN(HttpStatus.BAD_REQUEST, "Invalid or expired token"),
    ACCOUNT_NOT_ACTIVE(HttpStatus.FORBIDDEN, "Account is not active"),
    EMAIL_NOT_VERIFIED(HttpStatus.FORBIDDEN, "Please verify your email address before logging in"),
    ACCOUNT_NOT_FOUND(HttpStatus.NOT_FOUND, "Account not found"),
    SESSION_NOT_FOUND(HttpStatus.NOT_FOUND, "Session not found"),
    MFA_ALREADY_ENABLED(HttpStatus.CONFLICT, "MFA is already enabled"),
    MFA_NOT_ENABLED(HttpStatus.CONFLICT, "MFA is not enabled"),
    MFA_NOT_ENROLLED(HttpStatus.BAD_REQUEST, "Start MFA enrollment before confirming it");

    private final HttpStatus status;
    private final String detail;

    AuthErrorCode(HttpStatus status, String detail) {
        this.status = status;
        this.detail = detail;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public ProblemException exception() {
        return new ProblemException(status, name(), detail);
    }
}

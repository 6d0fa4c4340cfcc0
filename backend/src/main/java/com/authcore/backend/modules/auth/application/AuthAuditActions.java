package com.authcore.backend.modules.auth.application;

/**
 * Action types written to the audit trail by the auth module.
 */
public final class AuthAuditActions {

    public static final String ACCOUNT_REGISTERED = "ACCOUNT_REGISTERED";
    public static final String EMAIL_VERIFIED = "EMAIL_VERIFIED";
    public static final String LOGIN_SUCCEEDED = "LOGIN_SUCCEEDED";
    public static final String LOGIN_FAILED = "LOGIN_FAILED";
    public static final String MFA_CHALLENGE_ISSUED = "MFA_CHALLENGE_ISSUED";
    public static final String ACCOUNT_LOCKED = "ACCOUNT_LOCKED";
    public static final String RATE_LIMITED = "RATE_LIMITED";
    public static final String REFRESH_REUSE_DETECTED = "REFRESH_REUSE_DETECTED";
    public static final String LOGOUT = "LOGOUT";
    public static final String LOGOUT_ALL = "LOGOUT_ALL";
    public static final String SESSION_REVOKED = "SESSION_REVOKED";
    public static final String PASSWORD_CHANGED = "PASSWORD_CHANGED";
    public static final String PASSWORD_RESET_REQUESTED = "PASSWORD_RESET_REQUESTED";
    public static final String PASSWORD_RESET = "PASSWORD_RESET";
    public static final String MFA_ENROLLMENT_STARTED = "MFA_ENROLLMENT_STARTED";
    public static final String MFA_ENABLED = "MFA_ENABLED";
    public static final String MFA_DISABLED = "MFA_DISABLED";
    public static final String MFA_BACKUP_CODE_USED = "MFA_BACKUP_CODE_USED";
    public static final String MFA_BACKUP_CODES_REGENERATED = "MFA_BACKUP_CODES_REGENERATED";

    private AuthAuditActions() {
    }
}

package com.authcore.backend.modules.auth.domain;

/**
 * Why a refresh record stopped being usable. {@link #REUSE_DETECTED} marks the record whose second presentation
 * triggered a reuse event; every other record torn down by that event gets {@link #REUSE_CASCADE}.
 */
public enum RevocationReason {
    LOGOUT,
    LOGOUT_ALL,
    SESSION_REVOKED,
    PASSWORD_CHANGED,
    PASSWORD_RESET,
    REUSE_DETECTED,
    REUSE_CASCADE,
    ACCOUNT_INACTIVE
}

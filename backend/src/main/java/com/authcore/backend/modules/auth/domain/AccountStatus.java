package com.authcore.backend.modules.auth.domain;

public enum AccountStatus {
    PENDING,
    ACTIVE,
    SUSPENDED,
    BANNED
}

package com.authcore.backend.modules.auth.domain;

public enum AccountRole {
    USER,
    ADMIN
}

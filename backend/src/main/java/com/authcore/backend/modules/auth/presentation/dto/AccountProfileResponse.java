package com.authcore.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

public record AccountProfileResponse(
        UUID id,
        String email,
        String firstName,
        String lastName,
        String role,
        String status,
        boolean mfaEnabled,
        OffsetDateTime emailVerifiedAt,
        OffsetDateTime lastLoginAt,
        OffsetDateTime createdAt
) {
}

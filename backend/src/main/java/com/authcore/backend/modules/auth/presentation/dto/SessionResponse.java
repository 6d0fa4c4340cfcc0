package com.authcore.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

public record SessionResponse(
        UUID id,
        OffsetDateTime createdAt,
        OffsetDateTime lastUsed,
        OffsetDateTime expiresAt,
        String ipAddress,
        String userAgent
) {
}

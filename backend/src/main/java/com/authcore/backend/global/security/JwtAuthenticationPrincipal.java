package com.authcore.backend.global.security;

import java.util.UUID;

public record JwtAuthenticationPrincipal(UUID accountId, String role) {
}

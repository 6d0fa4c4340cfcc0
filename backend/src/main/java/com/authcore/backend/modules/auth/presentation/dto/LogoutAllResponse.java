package com.authcore.backend.modules.auth.presentation.dto;

public record LogoutAllResponse(int revokedSessions) {
}

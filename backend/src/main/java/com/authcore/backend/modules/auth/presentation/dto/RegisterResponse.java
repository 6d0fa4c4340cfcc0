package com.authcore.backend.modules.auth.presentation.dto;

import java.util.UUID;

public record RegisterResponse(UUID id, String email) {
}

package com.authcore.backend.modules.auth.presentation.dto;

import java.util.UUID;

public record AccountSummaryResponse(UUID id, String email, String firstName, String lastName, String role) {
}

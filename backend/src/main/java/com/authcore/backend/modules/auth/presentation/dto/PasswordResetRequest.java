package com.authcore.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.NotBlank;

public record PasswordResetRequest(@NotBlank(message = "email is required") String email) {
}

package com.authcore.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.NotBlank;

public record EmailVerificationRequest(@NotBlank(message = "token is required") String token) {
}

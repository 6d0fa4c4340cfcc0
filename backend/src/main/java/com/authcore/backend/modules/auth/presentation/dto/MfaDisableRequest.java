package com.authcore.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.NotBlank;

public record MfaDisableRequest(@NotBlank(message = "password is required") String password) {
}

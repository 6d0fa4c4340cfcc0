package com.authcore.backend.modules.auth.presentation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record PasswordResetCompleteRequest(
        @NotBlank(message = "token is required") String token,
        @JsonProperty("new") @NotBlank(message = "new is required") @Size(max = 128) String newPassword
) {
}

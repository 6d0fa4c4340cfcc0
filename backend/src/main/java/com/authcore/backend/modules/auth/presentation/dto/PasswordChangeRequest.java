package com.authcore.backend.modules.auth.presentation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record PasswordChangeRequest(
        @NotBlank(message = "current is required") String current,
        @JsonProperty("new") @NotBlank(message = "new is required") @Size(max = 128) String newPassword
) {
}

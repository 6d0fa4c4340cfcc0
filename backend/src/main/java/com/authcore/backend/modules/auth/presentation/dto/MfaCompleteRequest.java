package com.authcore.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record MfaCompleteRequest(
        @NotBlank(message = "mfaToken is required") String mfaToken,
        @NotBlank(message = "code is required") @Size(max = 16) String code
) {
}

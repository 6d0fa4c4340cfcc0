package com.authcore.backend.modules.auth.presentation.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Either a full session ({@code requiresMFA=false}) or an MFA challenge carrying only {@code mfaToken}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LoginResponse(
        boolean requiresMFA,
        String mfaToken,
        String accessToken,
        String tokenType,
        Long expiresIn,
        String refreshToken,
        Long refreshExpiresIn,
        AccountSummaryResponse user
) {

    public static LoginResponse authenticated(TokenPairResponse tokens, AccountSummaryResponse user) {
        return new LoginResponse(
                false,
                null,
                tokens.accessToken(),
                tokens.tokenType(),
                tokens.expiresIn(),
                tokens.refreshToken(),
                tokens.refreshExpiresIn(),
                user
        );
    }

    public static LoginResponse mfaRequired(String mfaToken) {
        return new LoginResponse(true, mfaToken, null, null, null, null, null, null);
    }
}

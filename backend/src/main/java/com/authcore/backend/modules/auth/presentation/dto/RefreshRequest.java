package com.authcore.backend.modules.auth.presentation.dto;

/**
 * Body of refresh and logout calls. The credential may instead arrive in the refresh cookie.
 */
public record RefreshRequest(String refreshToken) {
}

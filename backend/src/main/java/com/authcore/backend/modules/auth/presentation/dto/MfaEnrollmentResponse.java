package com.authcore.backend.modules.auth.presentation.dto;

import java.util.List;

/**
 * Returned exactly once, when enrollment starts. The secret is never shown again.
 */
public record MfaEnrollmentResponse(String secret, String otpauthUri, List<String> backupCodes) {
}

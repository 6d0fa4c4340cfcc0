package com.authcore.backend.modules.auth.application;

/**
 * Outbound channel for verification and reset links. Implementations must not log the token.
 */
public interface AuthNotifier {

    void sendVerification(String email, String token);

    void sendReset(String email, String token);
}

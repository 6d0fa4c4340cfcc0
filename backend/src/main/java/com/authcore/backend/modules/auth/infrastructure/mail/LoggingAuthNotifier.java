package com.authcore.backend.modules.auth.infrastructure.mail;

import com.authcore.backend.global.common.EmailMasker;
import com.authcore.backend.modules.auth.application.AuthNotifier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Default notifier for local and test environments: records that a message would have been sent.
 */
@Component
@ConditionalOnProperty(prefix = "app.auth.mail", name = "enabled", havingValue = "false", matchIfMissing = true)
public class LoggingAuthNotifier implements AuthNotifier {

    private static final Logger log = LoggerFactory.getLogger(LoggingAuthNotifier.class);

    @Override
    public void sendVerification(String email, String token) {
        log.info("Verification mail suppressed (mail disabled): to={}", EmailMasker.mask(email));
    }

    @Override
    public void sendReset(String email, String token) {
        log.info("Password reset mail suppressed (mail disabled): to={}", EmailMasker.mask(email));
    }
}

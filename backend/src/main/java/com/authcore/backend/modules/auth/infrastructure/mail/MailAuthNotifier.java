package com.authcore.backend.modules.auth.infrastructure.mail;

import java.nio.charset.StandardCharsets;

import com.authcore.backend.global.common.EmailMasker;
import com.authcore.backend.global.config.AuthProperties;
import com.authcore.backend.modules.auth.application.AuthNotifier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.mail.MailException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriUtils;

/**
 * Sends verification and reset links as plain-text mail. Delivery failures are logged and do not fail the calling
 * request; the user can ask for a new link.
 */
@Component
@ConditionalOnProperty(prefix = "app.auth.mail", name = "enabled", havingValue = "true")
public class MailAuthNotifier implements AuthNotifier {

    private static final Logger log = LoggerFactory.getLogger(MailAuthNotifier.class);

    private final JavaMailSender mailSender;
    private final AuthProperties.Mail mail;

    public MailAuthNotifier(JavaMailSender mailSender, AuthProperties properties) {
        this.mailSender = mailSender;
        this.mail = properties.mail();
    }

    @Override
    public void sendVerification(String email, String token) {
        send(email, "Verify your email address",
                "Confirm your email address by opening the link below. It expires in 24 hours.\n\n"
                        + link("/verify-email", token));
    }

    @Override
    public void sendReset(String email, String token) {
        send(email, "Reset your password",
                "A password reset was requested for your account. The link below expires in 1 hour.\n"
                        + "If you did not ask for this, ignore this message.\n\n"
                        + link("/reset-password", token));
    }

    private void send(String to, String subject, String body) {
        SimpleMailMessage message = new SimpleMailMessage();
        message.setFrom(mail.from());
        message.setTo(to);
        message.setSubject(subject);
        message.setText(body);
        try {
            mailSender.send(message);
            log.info("Mail sent: subject='{}', to={}", subject, EmailMasker.mask(to));
        } catch (MailException ex) {
            log.error("Mail delivery failed: subject='{}', to={}", subject, EmailMasker.mask(to), ex);
        }
    }

    private String link(String path, String token) {
        return mail.baseUrl() + path + "?token=" + UriUtils.encodeQueryParam(token, StandardCharsets.UTF_8);
    }
}

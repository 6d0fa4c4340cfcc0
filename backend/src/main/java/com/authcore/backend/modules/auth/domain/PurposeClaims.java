package com.authcore.backend.modules.auth.domain;

import java.util.Objects;
import java.util.UUID;

/**
 * Payload of a short-lived purpose token. The set of purposes is closed; a token is only ever accepted for the
 * variant it was issued as.
 */
public sealed interface PurposeClaims
        permits PurposeClaims.MfaChallenge, PurposeClaims.EmailVerification, PurposeClaims.PasswordReset {

    UUID accountId();

    /**
     * Wire tag stored in the {@code pur} claim and used as the fast-store key segment.
     */
    String purpose();

    record MfaChallenge(UUID accountId) implements PurposeClaims {
        public static final String PURPOSE = "mfa";

        public MfaChallenge {
            Objects.requireNonNull(accountId, "accountId");
        }

        @Override
        public String purpose() {
            return PURPOSE;
        }
    }

    record EmailVerification(UUID accountId, String email) implements PurposeClaims {
        public static final String PURPOSE = "email_verification";

        public EmailVerification {
            Objects.requireNonNull(accountId, "accountId");
            Objects.requireNonNull(email, "email");
        }

        @Override
        public String purpose() {
            return PURPOSE;
        }
    }

    record PasswordReset(UUID accountId) implements PurposeClaims {
        public static final String PURPOSE = "password_reset";

        public PasswordReset {
            Objects.requireNonNull(accountId, "accountId");
        }

        @Override
        public String purpose() {
            return PURPOSE;
        }
    }
}

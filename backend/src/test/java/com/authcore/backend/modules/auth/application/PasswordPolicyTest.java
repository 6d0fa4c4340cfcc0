package com.authcore.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.authcore.backend.global.error.ProblemException;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

class PasswordPolicyTest {

    private final PasswordPolicy passwordPolicy = new PasswordPolicy();

    @ParameterizedTest
    @ValueSource(strings = {"Passw0rd!", "Tr1cky:pass", "LongerPassword1?"})
    void acceptsPasswordsWithEveryCharacterClass(String password) {
        assertThat(passwordPolicy.isStrong(password)).isTrue();
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"Pa0!", "password1!", "PASSWORD1!", "Password!!", "Password11", "Pass word1"})
    void rejectsPasswordsMissingLengthOrAClass(String password) {
        assertThat(passwordPolicy.isStrong(password)).isFalse();
    }

    @ParameterizedTest
    @ValueSource(strings = {"a@b.io", "first.last+tag@example.co.kr"})
    void acceptsPlainEmailAddresses(String email) {
        assertThatCode(() -> passwordPolicy.requireValidEmail(email)).doesNotThrowAnyException();
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"plain", "no-domain@", "@example.com", "two@@example.com", "spa ce@example.com",
            "missing@tld"})
    void rejectsMalformedEmails(String email) {
        assertThat(passwordPolicy.isValidEmail(email)).isFalse();
    }

    @Test
    void requireStrongRaisesWeakPassword() {
        assertThatThrownBy(() -> passwordPolicy.requireStrong("short"))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("WEAK_PASSWORD"));
    }
}

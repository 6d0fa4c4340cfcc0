package com.authcore.backend.modules.auth.application;

import java.util.regex.Pattern;

import org.springframework.stereotype.Component;

@Component
public class PasswordPolicy {

    static final int MIN_LENGTH = 8;

    private static final Pattern EMAIL_PATTERN = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");
    private static final Pattern UPPER = Pattern.compile("[A-Z]");
    private static final Pattern LOWER = Pattern.compile("[a-z]");
    private static final Pattern DIGIT = Pattern.compile("\\d");
    private static final Pattern SPECIAL = Pattern.compile("[!@#$%^&*(),.?\":{}|<>]");

    public boolean isValidEmail(String email) {
        return email != null && EMAIL_PATTERN.matcher(email).matches();
    }

    public boolean isStrong(String password) {
        return password != null
                && password.length() >= MIN_LENGTH
                && UPPER.matcher(password).find()
                && LOWER.matcher(password).find()
                && DIGIT.matcher(password).find()
                && SPECIAL.matcher(password).find();
    }

    public void requireValidEmail(String email) {
        if (!isValidEmail(email)) {
            throw AuthErrorCode.INVALID_EMAIL.exception();
        }
    }

    public void requireStrong(String password) {
        if (!isStrong(password)) {
            throw AuthErrorCode.WEAK_PASSWORD.exception();
        }
    }
}

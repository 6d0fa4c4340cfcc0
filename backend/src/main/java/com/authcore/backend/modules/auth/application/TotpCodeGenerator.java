package com.authcore.backend.modules.auth.application;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.time.Instant;
import java.util.Locale;
import java.util.OptionalLong;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

import org.apache.commons.codec.binary.Base32;
import org.springframework.stereotype.Component;

/**
 * RFC 6238 time-based one-time passwords: HMAC-SHA1, 30 second steps, 6 digits.
 */
@Component
public class TotpCodeGenerator {

    static final int STEP_SECONDS = 30;
    static final int DIGITS = 6;

    private static final int SECRET_BYTES = 20;
    private static final String HMAC_ALGORITHM = "HmacSHA1";
    private static final int[] POWERS_OF_TEN = {1, 10, 100, 1_000, 10_000, 100_000, 1_000_000};

    private final SecureRandom secureRandom = new SecureRandom();

    /**
     * @return a fresh 160-bit secret, Base32 without padding
     */
    public String newSecret() {
        byte[] bytes = new byte[SECRET_BYTES];
        secureRandom.nextBytes(bytes);
        return new Base32().encodeToString(bytes).replace("=", "");
    }

    public long timeStep(Instant instant) {
        return Math.floorDiv(instant.getEpochSecond(), STEP_SECONDS);
    }

    public String generate(String base32Secret, long timeStep) {
        byte[] hash = hmac(decodeSecret(base32Secret), ByteBuffer.allocate(Long.BYTES).putLong(timeStep).array());
        int offset = hash[hash.length - 1] & 0x0f;
        int binary = ((hash[offset] & 0x7f) << 24)
                | ((hash[offset + 1] & 0xff) << 16)
                | ((hash[offset + 2] & 0xff) << 8)
                | (hash[offset + 3] & 0xff);
        int otp = binary % POWERS_OF_TEN[DIGITS];
        return String.format(Locale.ROOT, "%0" + DIGITS + "d", otp);
    }

    /**
     * Finds the time step whose code equals {@code code}, looking {@code skewSteps} steps either side of now.
     */
    public OptionalLong matchingStep(String base32Secret, String code, Instant now, int skewSteps) {
        if (code == null || code.length() != DIGITS || !code.chars().allMatch(Character::isDigit)) {
            return OptionalLong.empty();
        }
        byte[] presented = code.getBytes(StandardCharsets.US_ASCII);
        long current = timeStep(now);
        for (long step = current - skewSteps; step <= current + skewSteps; step++) {
            byte[] expected = generate(base32Secret, step).getBytes(StandardCharsets.US_ASCII);
            if (MessageDigest.isEqual(expected, presented)) {
                return OptionalLong.of(step);
            }
        }
        return OptionalLong.empty();
    }

    private static byte[] decodeSecret(String base32Secret) {
        byte[] key = new Base32().decode(base32Secret.trim().toUpperCase(Locale.ROOT));
        if (key.length == 0) {
            throw new IllegalArgumentException("TOTP secret is empty");
        }
        return key;
    }

    private static byte[] hmac(byte[] key, byte[] message) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(key, HMAC_ALGORITHM));
            return mac.doFinal(message);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA1 is not available", e);
        }
    }
}

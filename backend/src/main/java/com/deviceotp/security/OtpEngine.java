package com.deviceotp.security;

import com.deviceotp.config.AppConfig;
import dev.samstevens.totp.code.CodeGenerator;
import dev.samstevens.totp.code.DefaultCodeGenerator;
import dev.samstevens.totp.code.HashingAlgorithm;
import dev.samstevens.totp.exceptions.CodeGenerationException;
import java.time.Instant;
import org.apache.commons.codec.binary.Base32;
import ru.tinkoff.kora.common.Component;

/**
 * RFC 6238 time-based codes over HMAC-SHA1. The moving factor is the epoch second divided by the
 * period; any monotonically increasing counter works as well.
 */
@Component
public final class OtpEngine {
    static final int MAX_WINDOW = 1;

    public enum Status {
        ACCEPTED,
        INVALID_CODE,
        REPLAY_DETECTED
    }

    /**
     * @param matchedOffset steps between the matched factor and the current one, 0 when nothing matched
     * @param movingFactor  the matched factor, or -1 when nothing matched
     */
    public record Check(Status status, int matchedOffset, long movingFactor) {
        public boolean accepted() {
            return status == Status.ACCEPTED;
        }
    }

    private final CodeGenerator codeGenerator;
    private final Base32 base32 = new Base32();
    private final int digits;
    private final int periodSec;
    private final int window;

    public OtpEngine(AppConfig appConfig) {
        this.digits = appConfig.otp().digits();
        this.periodSec = appConfig.otp().periodSec();
        if (digits < 6 || digits > 8) {
            throw new IllegalStateException("app.otp.digits must be within 6..8");
        }
        if (periodSec <= 0) {
            throw new IllegalStateException("app.otp.periodSec must be positive");
        }
        this.window = Math.max(0, Math.min(appConfig.otp().window(), MAX_WINDOW));
        this.codeGenerator = new DefaultCodeGenerator(HashingAlgorithm.SHA1, digits);
    }

    public int digits() {
        return digits;
    }

    public long movingFactorAt(Instant instant) {
        return Math.floorDiv(instant.getEpochSecond(), periodSec);
    }

    public String computeExpected(byte[] key, long movingFactor) {
        return generate(base32.encodeToString(key), movingFactor);
    }

    /**
     * Compares the code against every factor in {@code current ± window} without stopping at the
     * first hit. A match at or below {@code consumedUpTo} counts as a replay unless an unconsumed
     * factor also matches.
     *
     * @param consumedUpTo highest factor already accepted for this device, or null
     */
    public Check verify(byte[] key, String submittedCode, long currentFactor, Long consumedUpTo) {
        if (submittedCode == null || submittedCode.length() != digits) {
            return new Check(Status.INVALID_CODE, 0, -1);
        }

        String encodedKey = base32.encodeToString(key);
        boolean freshMatch = false;
        long freshFactor = -1;
        int freshOffset = 0;
        boolean replayMatch = false;
        for (int offset = -window; offset <= window; offset++) {
            long factor = currentFactor + offset;
            boolean match = SecretHashService.constantTimeEquals(generate(encodedKey, factor), submittedCode);
            if (!match) {
                continue;
            }
            if (consumedUpTo != null && factor <= consumedUpTo) {
                replayMatch = true;
            } else {
                freshMatch = true;
                freshFactor = factor;
                freshOffset = offset;
            }
        }

        if (freshMatch) {
            return new Check(Status.ACCEPTED, freshOffset, freshFactor);
        }
        if (replayMatch) {
            return new Check(Status.REPLAY_DETECTED, 0, -1);
        }
        return new Check(Status.INVALID_CODE, 0, -1);
    }

    private String generate(String encodedKey, long movingFactor) {
        try {
            return asciiDigits(codeGenerator.generate(encodedKey, movingFactor));
        } catch (CodeGenerationException e) {
            throw new IllegalStateException("Cannot generate OTP", e);
        }
    }

    /**
     * The generator zero-pads with the default locale, which may render non-Latin digits.
     */
    static String asciiDigits(String code) {
        char[] chars = code.toCharArray();
        for (int i = 0; i < chars.length; i++) {
            int digit = Character.digit(chars[i], 10);
            if (digit < 0) {
                throw new IllegalStateException("Generated OTP contains a non-digit character");
            }
            chars[i] = (char) ('0' + digit);
        }
        return new String(chars);
    }
}

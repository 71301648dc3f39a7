package com.deviceotp.security;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Locale;
import ru.tinkoff.kora.common.Component;

@Component
public final class SecretHashService {

    /**
     * Lowercase hex SHA-256, always 64 chars.
     */
    public String sha256Hex(byte[] value) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(value);
            StringBuilder sb = new StringBuilder(digest.length * 2);
            for (byte b : digest) {
                sb.append(Character.forDigit((b >> 4) & 0xF, 16));
                sb.append(Character.forDigit(b & 0xF, 16));
            }
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public boolean matches(byte[] value, String expectedHex) {
        if (expectedHex == null) {
            return false;
        }
        return constantTimeEquals(sha256Hex(value), expectedHex.trim().toLowerCase(Locale.ROOT));
    }

    /**
     * Runs in time independent of where the inputs differ. Length mismatch returns early.
     */
    public static boolean constantTimeEquals(String a, String b) {
        if (a == null || b == null) {
            return false;
        }
        return MessageDigest.isEqual(
            a.getBytes(StandardCharsets.UTF_8),
            b.getBytes(StandardCharsets.UTF_8)
        );
    }
}

package com.deviceotp.service;

import java.util.regex.Pattern;

final class RequestValidator {
    static final int MAX_ID_LENGTH = 100;
    private static final Pattern ID_PATTERN = Pattern.compile("^[A-Za-z0-9._:@-]+$");
    private static final Pattern DIGITS_PATTERN = Pattern.compile("^[0-9]+$");

    private RequestValidator() {
    }

    static String normalizeDeviceId(String value) {
        return normalizeId(value, "device_id_required", "invalid_device_id");
    }

    static String normalizeUserId(String value) {
        return normalizeId(value, "user_id_required", "invalid_user_id");
    }

    /**
     * Accepts 1..digits decimal digits and left-pads with zeros, so a code sent as 12345 matches "012345".
     */
    static String normalizeOtp(String value, int digits) {
        if (value == null || value.isBlank()) {
            throw ApiException.badRequest("otp_required");
        }
        String trimmed = value.trim();
        if (trimmed.length() > digits || !DIGITS_PATTERN.matcher(trimmed).matches()) {
            throw ApiException.badRequest("invalid_otp_format");
        }
        return "0".repeat(digits - trimmed.length()) + trimmed;
    }

    private static String normalizeId(String value, String requiredCode, String invalidCode) {
        if (value == null || value.isBlank()) {
            throw ApiException.badRequest(requiredCode);
        }
        String trimmed = value.trim();
        if (trimmed.length() > MAX_ID_LENGTH || !ID_PATTERN.matcher(trimmed).matches()) {
            throw ApiException.badRequest(invalidCode);
        }
        return trimmed;
    }
}

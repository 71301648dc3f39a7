package com.deviceotp.domain;

import java.util.Optional;

/**
 * Outcome of a single OTP verification. Each value has its own response status and audit code;
 * {@link #INVALID_CODE} and {@link #REPLAY_DETECTED} share a status but never an audit code.
 */
public enum VerificationResult {
    ACCEPTED(200, "accepted"),
    INVALID_CODE(401, "invalid_code"),
    REPLAY_DETECTED(401, "replay_detected"),
    DEVICE_INACTIVE(403, "device_inactive"),
    DEVICE_NOT_FOUND(404, "device_not_found"),
    RATE_LIMITED(429, "rate_limited");

    private final int status;
    private final String code;

    VerificationResult(int status, String code) {
        this.status = status;
        this.code = code;
    }

    public int status() {
        return status;
    }

    public String code() {
        return code;
    }

    public boolean accepted() {
        return this == ACCEPTED;
    }

    public static Optional<VerificationResult> fromCode(String code) {
        for (VerificationResult value : values()) {
            if (value.code.equals(code)) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }
}

package com.deviceotp.domain;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class VerificationResultTest {

    @Test
    void codesMapBackToResults() {
        assertThat(VerificationResult.fromCode("replay_detected")).contains(VerificationResult.REPLAY_DETECTED);
        assertThat(VerificationResult.fromCode("device_inactive")).contains(VerificationResult.DEVICE_INACTIVE);
        assertThat(VerificationResult.fromCode("storage_unavailable")).isEmpty();
    }

    @Test
    void invalidAndReplayShareStatusButNotCode() {
        assertThat(VerificationResult.INVALID_CODE.status()).isEqualTo(VerificationResult.REPLAY_DETECTED.status());
        assertThat(VerificationResult.INVALID_CODE.code()).isNotEqualTo(VerificationResult.REPLAY_DETECTED.code());
        assertThat(VerificationResult.ACCEPTED.accepted()).isTrue();
        assertThat(VerificationResult.RATE_LIMITED.accepted()).isFalse();
    }
}

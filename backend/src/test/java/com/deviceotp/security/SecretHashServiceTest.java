package com.deviceotp.security;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class SecretHashServiceTest {

    private final SecretHashService hashService = new SecretHashService();

    @Test
    void computesLowercaseSha256Hex() {
        assertThat(hashService.sha256Hex("abc".getBytes(StandardCharsets.US_ASCII)))
            .isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
    }

    @Test
    void constantTimeEqualsComparesWholeValue() {
        assertThat(SecretHashService.constantTimeEquals("287082", "287082")).isTrue();
        assertThat(SecretHashService.constantTimeEquals("287082", "287083")).isFalse();
        assertThat(SecretHashService.constantTimeEquals("287082", "2870820")).isFalse();
        assertThat(SecretHashService.constantTimeEquals(null, "287082")).isFalse();
    }
}

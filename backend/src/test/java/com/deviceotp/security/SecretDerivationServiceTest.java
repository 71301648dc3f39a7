package com.deviceotp.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.deviceotp.TestAppConfig;
import java.util.Base64;
import java.util.Locale;
import org.junit.jupiter.api.Test;

class SecretDerivationServiceTest {

    private final SecretHashService hashService = new SecretHashService();
    private final SecretDerivationService service = new SecretDerivationService(new TestAppConfig(), hashService);

    @Test
    void derivesRandomSecretWithStorableHash() {
        var derived = service.derive("D1", "u1");

        assertThat(Base64.getDecoder().decode(derived.secret())).hasSize(32).isEqualTo(derived.keyMaterial());
        assertThat(derived.hash()).hasSize(64).matches("[0-9a-f]{64}");
        assertThat(derived.hash()).isEqualTo(hashService.sha256Hex(derived.keyMaterial()));
        assertThat(service.hash(derived.secret())).isEqualTo(derived.hash());
    }

    @Test
    void everyDerivationIsFresh() {
        var first = service.derive("D1", "u1");
        var second = service.derive("D1", "u1");

        assertThat(first.secret()).isNotEqualTo(second.secret());
        assertThat(first.hash()).isNotEqualTo(second.hash());
    }

    @Test
    void toStringDoesNotExposeSecret() {
        var derived = service.derive("D1", "u1");

        assertThat(derived.toString()).doesNotContain(derived.secret());
    }

    @Test
    void decodeRejectsNonBase64() {
        assertThatThrownBy(() -> service.decode("not base64 !!"))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.decode(" "))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void hashMatchIsCaseInsensitiveOnStoredValue() {
        var derived = service.derive("D2", "u1");

        assertThat(hashService.matches(derived.keyMaterial(), derived.hash().toUpperCase(Locale.ROOT))).isTrue();
        assertThat(hashService.matches(new byte[32], derived.hash())).isFalse();
    }
}

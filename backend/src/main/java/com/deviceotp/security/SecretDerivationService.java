package com.deviceotp.security;

import com.deviceotp.config.AppConfig;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.tinkoff.kora.common.Component;

/**
 * Issues device secrets. The secret travels as standard base64 of the raw key material; only
 * its SHA-256 and an encrypted copy are ever stored.
 */
@Component
public final class SecretDerivationService {
    private static final Logger logger = LoggerFactory.getLogger(SecretDerivationService.class);

    static final int MIN_SECRET_BYTES = 16;

    public record DerivedSecret(String secret, byte[] keyMaterial, String hash) {
        @Override
        public String toString() {
            return "DerivedSecret[hash=" + hash + "]";
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof DerivedSecret other
                && secret.equals(other.secret)
                && Arrays.equals(keyMaterial, other.keyMaterial)
                && hash.equals(other.hash);
        }

        @Override
        public int hashCode() {
            return hash.hashCode();
        }
    }

    private final SecureRandom random = new SecureRandom();
    private final SecretHashService secretHashService;
    private final int secretBytes;

    public SecretDerivationService(AppConfig appConfig, SecretHashService secretHashService) {
        this.secretHashService = secretHashService;
        this.secretBytes = appConfig.otp().secretBytes();
        if (secretBytes < MIN_SECRET_BYTES) {
            throw new IllegalStateException("app.otp.secretBytes must be at least " + MIN_SECRET_BYTES);
        }
    }

    public DerivedSecret derive(String deviceId, String userId) {
        byte[] keyMaterial = new byte[secretBytes];
        random.nextBytes(keyMaterial);
        String secret = Base64.getEncoder().encodeToString(keyMaterial);
        logger.debug("Generated {}-byte secret for device {} of user {}", secretBytes, deviceId, userId);
        return new DerivedSecret(secret, keyMaterial, secretHashService.sha256Hex(keyMaterial));
    }

    public String hash(String secret) {
        return secretHashService.sha256Hex(decode(secret));
    }

    /**
     * @throws IllegalArgumentException when the value is not base64
     */
    public byte[] decode(String secret) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalArgumentException("secret is empty");
        }
        return Base64.getDecoder().decode(secret.trim());
    }
}

package com.deviceotp.config;

import ru.tinkoff.kora.config.common.annotation.ConfigSource;
import ru.tinkoff.kora.config.common.annotation.ConfigValueExtractor;

@ConfigSource("app")
@ConfigValueExtractor
public interface AppConfig {
    boolean debug();
    OtpConfig otp();
    VerificationConfig verification();
    SecurityConfig security();

    @ConfigValueExtractor
    interface OtpConfig {
        int digits();
        int periodSec();
        int window();
        int secretBytes();
    }

    @ConfigValueExtractor
    interface VerificationConfig {
        int maxAttempts();
        int attemptWindowSec();
    }

    @ConfigValueExtractor
    interface SecurityConfig {
        String encryptionKey();
        String apiKey();
    }
}

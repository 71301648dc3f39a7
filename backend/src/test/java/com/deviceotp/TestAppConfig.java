package com.deviceotp;

import com.deviceotp.config.AppConfig;
import com.deviceotp.config.DbConfig;

public final class TestAppConfig implements AppConfig {
    public static final String ENCRYPTION_KEY = "MDEyMzQ1Njc4OWFiY2RlZjAxMjM0NTY3ODlhYmNkZWY=";
    public static final String API_KEY = "test-api-key";

    private final boolean debug;
    private final OtpConfig otp;
    private final VerificationConfig verification;
    private final SecurityConfig security;

    public TestAppConfig() {
        this(1, 0);
    }

    public TestAppConfig(int window, int maxAttempts) {
        this(false, window, maxAttempts, ENCRYPTION_KEY, API_KEY);
    }

    public TestAppConfig(boolean debug, int window, int maxAttempts, String encryptionKey, String apiKey) {
        this(debug, 6, window, maxAttempts, encryptionKey, apiKey);
    }

    public TestAppConfig(boolean debug,
                         int digits,
                         int window,
                         int maxAttempts,
                         String encryptionKey,
                         String apiKey) {
        this.debug = debug;
        this.otp = new OtpConfig() {
            @Override
            public int digits() {
                return digits;
            }

            @Override
            public int periodSec() {
                return 30;
            }

            @Override
            public int window() {
                return window;
            }

            @Override
            public int secretBytes() {
                return 32;
            }
        };
        this.verification = new VerificationConfig() {
            @Override
            public int maxAttempts() {
                return maxAttempts;
            }

            @Override
            public int attemptWindowSec() {
                return 300;
            }
        };
        this.security = new SecurityConfig() {
            @Override
            public String encryptionKey() {
                return encryptionKey;
            }

            @Override
            public String apiKey() {
                return apiKey;
            }
        };
    }

    @Override
    public boolean debug() {
        return debug;
    }

    @Override
    public OtpConfig otp() {
        return otp;
    }

    @Override
    public VerificationConfig verification() {
        return verification;
    }

    @Override
    public SecurityConfig security() {
        return security;
    }

    public static DbConfig dbConfig(int readRetries) {
        return new DbConfig() {
            @Override
            public String jdbcUrl() {
                return "jdbc:postgresql://localhost:5432/otpdb";
            }

            @Override
            public String username() {
                return "otp";
            }

            @Override
            public String password() {
                return "otp";
            }

            @Override
            public int maxPoolSize() {
                return 2;
            }

            @Override
            public String poolName() {
                return "test";
            }

            @Override
            public long connectionTimeoutMs() {
                return 1000;
            }

            @Override
            public int queryTimeoutSec() {
                return 1;
            }

            @Override
            public int readRetries() {
                return readRetries;
            }
        };
    }
}

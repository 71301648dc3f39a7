package com.deviceotp.config;

import ru.tinkoff.kora.config.common.annotation.ConfigSource;
import ru.tinkoff.kora.config.common.annotation.ConfigValueExtractor;

@ConfigSource("db")
@ConfigValueExtractor
public interface DbConfig {
    String jdbcUrl();
    String username();
    String password();
    int maxPoolSize();
    String poolName();
    long connectionTimeoutMs();
    int queryTimeoutSec();
    int readRetries();
}

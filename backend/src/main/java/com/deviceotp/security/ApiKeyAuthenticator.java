package com.deviceotp.security;

import com.deviceotp.config.AppConfig;
import com.deviceotp.service.ApiException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.tinkoff.kora.common.Component;

@Component
public final class ApiKeyAuthenticator {
    private static final Logger logger = LoggerFactory.getLogger(ApiKeyAuthenticator.class);
    private static final String BEARER_PREFIX = "bearer ";

    private final String apiKey;

    public ApiKeyAuthenticator(AppConfig appConfig) {
        String configured = appConfig.security().apiKey();
        this.apiKey = configured == null ? "" : configured.trim();
        if (apiKey.isEmpty()) {
            logger.warn("API_KEY is not configured, every authenticated request will be rejected");
        }
    }

    public void requireBearer(String authorizationHeader) {
        if (apiKey.isEmpty() || authorizationHeader == null) {
            throw ApiException.unauthorized("invalid_api_key");
        }
        String header = authorizationHeader.trim();
        if (header.length() <= BEARER_PREFIX.length()
            || !header.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            throw ApiException.unauthorized("invalid_api_key");
        }
        String presented = header.substring(BEARER_PREFIX.length()).trim();
        if (!SecretHashService.constantTimeEquals(apiKey, presented)) {
            throw ApiException.unauthorized("invalid_api_key");
        }
    }
}

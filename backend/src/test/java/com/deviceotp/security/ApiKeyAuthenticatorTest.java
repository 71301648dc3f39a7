package com.deviceotp.security;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.deviceotp.TestAppConfig;
import com.deviceotp.service.ApiException;
import org.junit.jupiter.api.Test;

class ApiKeyAuthenticatorTest {

    private final ApiKeyAuthenticator authenticator = new ApiKeyAuthenticator(new TestAppConfig());

    @Test
    void acceptsMatchingBearerKey() {
        assertThatCode(() -> authenticator.requireBearer("Bearer " + TestAppConfig.API_KEY))
            .doesNotThrowAnyException();
        assertThatCode(() -> authenticator.requireBearer("bearer " + TestAppConfig.API_KEY))
            .doesNotThrowAnyException();
    }

    @Test
    void rejectsMissingOrWrongKey() {
        assertThatThrownBy(() -> authenticator.requireBearer(null))
            .isInstanceOf(ApiException.class)
            .hasMessageContaining("invalid_api_key");
        assertThatThrownBy(() -> authenticator.requireBearer("Bearer wrong"))
            .isInstanceOf(ApiException.class);
        assertThatThrownBy(() -> authenticator.requireBearer(TestAppConfig.API_KEY))
            .isInstanceOf(ApiException.class);
    }

    @Test
    void emptyConfiguredKeyRejectsEverything() {
        var open = new ApiKeyAuthenticator(new TestAppConfig(false, 1, 0, TestAppConfig.ENCRYPTION_KEY, ""));

        assertThatThrownBy(() -> open.requireBearer("Bearer "))
            .isInstanceOf(ApiException.class);
        assertThatThrownBy(() -> open.requireBearer("Bearer anything"))
            .isInstanceOf(ApiException.class);
    }
}

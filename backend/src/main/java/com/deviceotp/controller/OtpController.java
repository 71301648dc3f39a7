package com.deviceotp.controller;

import com.deviceotp.config.AppConfig;
import com.deviceotp.domain.DeviceApi;
import com.deviceotp.domain.Provenance;
import com.deviceotp.domain.VerificationResult;
import com.deviceotp.security.ApiKeyAuthenticator;
import com.deviceotp.security.OtpEngine;
import com.deviceotp.security.SecretDerivationService;
import com.deviceotp.service.ApiException;
import com.deviceotp.service.OtpVerificationService;
import com.deviceotp.util.HttpResponseFactory;
import jakarta.annotation.Nullable;
import java.time.Clock;
import java.util.Arrays;
import java.util.Map;
import ru.tinkoff.kora.common.Component;
import ru.tinkoff.kora.http.common.HttpMethod;
import ru.tinkoff.kora.http.common.annotation.Header;
import ru.tinkoff.kora.http.common.annotation.HttpRoute;
import ru.tinkoff.kora.http.server.common.HttpServerResponse;
import ru.tinkoff.kora.http.server.common.annotation.HttpController;
import ru.tinkoff.kora.json.common.annotation.Json;

@Component
@HttpController
public final class OtpController {
    private final OtpVerificationService otpVerificationService;
    private final ApiKeyAuthenticator apiKeyAuthenticator;
    private final OtpEngine otpEngine;
    private final SecretDerivationService secretDerivationService;
    private final HttpResponseFactory responses;
    private final AppConfig appConfig;
    private final Clock clock;

    public OtpController(OtpVerificationService otpVerificationService,
                         ApiKeyAuthenticator apiKeyAuthenticator,
                         OtpEngine otpEngine,
                         SecretDerivationService secretDerivationService,
                         HttpResponseFactory responses,
                         AppConfig appConfig,
                         Clock clock) {
        this.otpVerificationService = otpVerificationService;
        this.apiKeyAuthenticator = apiKeyAuthenticator;
        this.otpEngine = otpEngine;
        this.secretDerivationService = secretDerivationService;
        this.responses = responses;
        this.appConfig = appConfig;
        this.clock = clock;
    }

    @HttpRoute(method = HttpMethod.POST, path = "/api/v1/otp/verify")
    public HttpServerResponse verify(@Nullable @Header("Authorization") String authorization,
                                     @Nullable @Header("X-Forwarded-For") String forwardedFor,
                                     @Nullable @Header("X-Real-IP") String realIp,
                                     @Nullable @Header("User-Agent") String userAgent,
                                     @Json DeviceApi.VerifyRequest request) {
        try {
            apiKeyAuthenticator.requireBearer(authorization);
            var provenance = Provenance.fromHeaders(forwardedFor, realIp, userAgent);
            String deviceId = request == null ? null : request.deviceId();
            VerificationResult result = otpVerificationService.verifyOtp(
                deviceId,
                request == null || request.otp() == null ? null : request.otp().text(),
                provenance
            );
            if (!result.accepted()) {
                return responses.json(result.status(), Map.of("error", result.code(), "valid", false));
            }
            return responses.json(200, new DeviceApi.VerifyResponse(deviceId.trim(), true, result.code()));
        } catch (ApiException e) {
            return responses.fromException(e);
        } catch (Exception e) {
            return responses.internalError(e);
        }
    }

    @HttpRoute(method = HttpMethod.POST, path = "/api/v1/test/generate-otp")
    public HttpServerResponse generateOtp(@Json DeviceApi.GenerateOtpRequest request) {
        try {
            if (!appConfig.debug()) {
                throw ApiException.notFound("not_found");
            }
            if (request == null || request.secret() == null) {
                throw ApiException.badRequest("secret_required");
            }
            byte[] key;
            try {
                key = secretDerivationService.decode(request.secret());
            } catch (IllegalArgumentException e) {
                throw ApiException.badRequest("invalid_secret");
            }
            try {
                String otp = otpEngine.computeExpected(key, otpEngine.movingFactorAt(clock.instant()));
                return responses.json(200, new DeviceApi.GenerateOtpResponse(otp, "OTP generated for testing"));
            } finally {
                Arrays.fill(key, (byte) 0);
            }
        } catch (ApiException e) {
            return responses.fromException(e);
        } catch (Exception e) {
            return responses.internalError(e);
        }
    }
}

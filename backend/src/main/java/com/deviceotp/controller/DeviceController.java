package com.deviceotp.controller;

import com.deviceotp.domain.DeviceApi;
import com.deviceotp.domain.Provenance;
import com.deviceotp.security.ApiKeyAuthenticator;
import com.deviceotp.service.ApiException;
import com.deviceotp.service.DeviceLifecycleService;
import com.deviceotp.util.HttpResponseFactory;
import jakarta.annotation.Nullable;
import ru.tinkoff.kora.common.Component;
import ru.tinkoff.kora.http.common.HttpMethod;
import ru.tinkoff.kora.http.common.annotation.Header;
import ru.tinkoff.kora.http.common.annotation.HttpRoute;
import ru.tinkoff.kora.http.common.annotation.Path;
import ru.tinkoff.kora.http.common.annotation.Query;
import ru.tinkoff.kora.http.server.common.HttpServerResponse;
import ru.tinkoff.kora.http.server.common.annotation.HttpController;
import ru.tinkoff.kora.json.common.annotation.Json;

@Component
@HttpController
public final class DeviceController {
    private final DeviceLifecycleService deviceLifecycleService;
    private final ApiKeyAuthenticator apiKeyAuthenticator;
    private final HttpResponseFactory responses;

    public DeviceController(DeviceLifecycleService deviceLifecycleService,
                            ApiKeyAuthenticator apiKeyAuthenticator,
                            HttpResponseFactory responses) {
        this.deviceLifecycleService = deviceLifecycleService;
        this.apiKeyAuthenticator = apiKeyAuthenticator;
        this.responses = responses;
    }

    @HttpRoute(method = HttpMethod.POST, path = "/api/v1/devices/register")
    public HttpServerResponse register(@Nullable @Header("Authorization") String authorization,
                                       @Nullable @Header("X-Forwarded-For") String forwardedFor,
                                       @Nullable @Header("X-Real-IP") String realIp,
                                       @Nullable @Header("User-Agent") String userAgent,
                                       @Json DeviceApi.RegisterRequest request) {
        try {
            apiKeyAuthenticator.requireBearer(authorization);
            var provenance = Provenance.fromHeaders(forwardedFor, realIp, userAgent);
            var result = deviceLifecycleService.register(
                request == null ? null : request.deviceId(),
                request == null ? null : request.userId(),
                provenance
            );
            return responses.json(201, result);
        } catch (ApiException e) {
            return responses.fromException(e);
        } catch (Exception e) {
            return responses.internalError(e);
        }
    }

    @HttpRoute(method = HttpMethod.POST, path = "/api/v1/devices/{deviceId}/deactivate")
    public HttpServerResponse deactivate(@Nullable @Header("Authorization") String authorization,
                                         @Nullable @Header("X-Forwarded-For") String forwardedFor,
                                         @Nullable @Header("X-Real-IP") String realIp,
                                         @Nullable @Header("User-Agent") String userAgent,
                                         @Path("deviceId") String deviceId) {
        try {
            apiKeyAuthenticator.requireBearer(authorization);
            var provenance = Provenance.fromHeaders(forwardedFor, realIp, userAgent);
            return responses.json(200, deviceLifecycleService.deactivate(deviceId, provenance));
        } catch (ApiException e) {
            return responses.fromException(e);
        } catch (Exception e) {
            return responses.internalError(e);
        }
    }

    @HttpRoute(method = HttpMethod.GET, path = "/api/v1/devices/{deviceId}")
    public HttpServerResponse getDevice(@Nullable @Header("Authorization") String authorization,
                                        @Path("deviceId") String deviceId) {
        try {
            apiKeyAuthenticator.requireBearer(authorization);
            return responses.json(200, deviceLifecycleService.getDevice(deviceId));
        } catch (ApiException e) {
            return responses.fromException(e);
        } catch (Exception e) {
            return responses.internalError(e);
        }
    }

    @HttpRoute(method = HttpMethod.GET, path = "/api/v1/users/{userId}/devices")
    public HttpServerResponse listDevices(@Nullable @Header("Authorization") String authorization,
                                          @Path("userId") String userId) {
        try {
            apiKeyAuthenticator.requireBearer(authorization);
            return responses.json(200, deviceLifecycleService.listDevices(userId));
        } catch (ApiException e) {
            return responses.fromException(e);
        } catch (Exception e) {
            return responses.internalError(e);
        }
    }

    @HttpRoute(method = HttpMethod.GET, path = "/api/v1/devices/{deviceId}/audit")
    public HttpServerResponse listAudit(@Nullable @Header("Authorization") String authorization,
                                        @Path("deviceId") String deviceId,
                                        @Nullable @Query("action") String action,
                                        @Nullable @Query("page") Integer page,
                                        @Nullable @Query("size") Integer size) {
        try {
            apiKeyAuthenticator.requireBearer(authorization);
            int resolvedPage = page == null ? 0 : page;
            int resolvedSize = size == null ? 50 : size;
            return responses.json(200, deviceLifecycleService.listAudit(deviceId, action, resolvedPage, resolvedSize));
        } catch (ApiException e) {
            return responses.fromException(e);
        } catch (Exception e) {
            return responses.internalError(e);
        }
    }
}

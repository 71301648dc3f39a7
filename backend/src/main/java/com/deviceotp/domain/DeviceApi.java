package com.deviceotp.domain;

import jakarta.annotation.Nullable;
import java.time.Instant;
import java.util.Map;
import ru.tinkoff.kora.json.common.annotation.Json;
import ru.tinkoff.kora.json.common.annotation.JsonField;

public final class DeviceApi {
    private DeviceApi() {
    }

    @Json
    public record RegisterRequest(@Nullable @JsonField("device_id") String deviceId,
                                  @Nullable @JsonField("user_id") String userId) {
    }

    @Json
    public record RegisterResponse(String deviceId, String secret, String warning) {
    }

    @Json
    public record VerifyRequest(@Nullable @JsonField("device_id") String deviceId,
                                @Nullable @JsonField("otp") OtpValue otp) {
    }

    @Json
    public record VerifyResponse(String deviceId, boolean valid, String result) {
    }

    @Json
    public record DeactivateResponse(String deviceId, Instant deactivatedAt) {
    }

    @Json
    public record DeviceView(String deviceId,
                             String userId,
                             boolean active,
                             Instant createdAt,
                             @Nullable Instant lastUsed,
                             long usageCount,
                             @Nullable Instant deactivatedAt) {
    }

    @Json
    public record AuditLogRecord(long id,
                                 String deviceId,
                                 String action,
                                 boolean success,
                                 Instant timestamp,
                                 @Nullable String ipAddress,
                                 @Nullable String userAgent,
                                 Map<String, Object> additionalData) {
    }

    @Json
    public record GenerateOtpRequest(@Nullable @JsonField("secret") String secret) {
    }

    @Json
    public record GenerateOtpResponse(String otp, String message) {
    }

    @Json
    public record HealthResponse(String status, Instant timestamp, String version, String database) {
    }
}

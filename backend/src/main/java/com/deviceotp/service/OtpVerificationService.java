package com.deviceotp.service;

import com.deviceotp.config.AppConfig;
import com.deviceotp.dao.AuditStore;
import com.deviceotp.dao.DeviceStore;
import com.deviceotp.dao.StorageException;
import com.deviceotp.domain.AuditAction;
import com.deviceotp.domain.Provenance;
import com.deviceotp.domain.VerificationResult;
import com.deviceotp.security.OtpEngine;
import com.deviceotp.security.SecretCryptoService;
import com.deviceotp.security.SecretHashService;
import java.time.Clock;
import java.time.Instant;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.tinkoff.kora.common.Component;

/**
 * Answers whether a device and code are valid right now. Every call writes exactly one
 * {@code verify} audit entry, whatever the outcome, including failures that end in an exception.
 */
@Component
public final class OtpVerificationService {
    private static final Logger logger = LoggerFactory.getLogger(OtpVerificationService.class);

    private final DeviceRegistry registry;
    private final AuditLogWriter auditLogWriter;
    private final AuditStore auditStore;
    private final OtpEngine otpEngine;
    private final SecretCryptoService secretCryptoService;
    private final SecretHashService secretHashService;
    private final Clock clock;
    private final int maxAttempts;
    private final int attemptWindowSec;

    public OtpVerificationService(DeviceRegistry registry,
                                  AuditLogWriter auditLogWriter,
                                  AuditStore auditStore,
                                  OtpEngine otpEngine,
                                  SecretCryptoService secretCryptoService,
                                  SecretHashService secretHashService,
                                  AppConfig appConfig,
                                  Clock clock) {
        this.registry = registry;
        this.auditLogWriter = auditLogWriter;
        this.auditStore = auditStore;
        this.otpEngine = otpEngine;
        this.secretCryptoService = secretCryptoService;
        this.secretHashService = secretHashService;
        this.clock = clock;
        this.maxAttempts = appConfig.verification().maxAttempts();
        this.attemptWindowSec = appConfig.verification().attemptWindowSec();
    }

    public VerificationResult verifyOtp(String rawDeviceId, String rawOtp, Provenance provenance) {
        String auditDeviceId = rawDeviceId == null ? "" : rawDeviceId.trim();
        Map<String, Object> details = new LinkedHashMap<>();
        VerificationResult result = null;
        try {
            String deviceId = RequestValidator.normalizeDeviceId(rawDeviceId);
            auditDeviceId = deviceId;
            String otp = RequestValidator.normalizeOtp(rawOtp, otpEngine.digits());

            result = evaluate(deviceId, otp, details);
            return result;
        } catch (ApiException e) {
            details.put("reason", e.publicMessage());
            logger.warn("OTP verification failed: device={} reason={}", auditDeviceId, e.publicMessage());
            throw e;
        } catch (RuntimeException e) {
            details.put("reason", "internal_error");
            throw e;
        } finally {
            if (result != null) {
                details.put("result", result.code());
                if (!result.accepted()) {
                    details.putIfAbsent("reason", result.code());
                }
                logOutcome(auditDeviceId, result, provenance);
            }
            boolean success = result != null && result.accepted();
            auditLogWriter.record(auditDeviceId, AuditAction.VERIFY, success, provenance, details);
        }
    }

    private VerificationResult evaluate(String deviceId, String otp, Map<String, Object> details) {
        var found = registry.find(deviceId);
        if (found.isEmpty()) {
            return VerificationResult.DEVICE_NOT_FOUND;
        }
        DeviceStore.DeviceRow device = found.get();
        if (!device.active()) {
            return VerificationResult.DEVICE_INACTIVE;
        }
        if (isRateLimited(deviceId)) {
            return VerificationResult.RATE_LIMITED;
        }

        Instant now = clock.instant();
        byte[] key;
        try {
            key = secretCryptoService.decrypt(device.encryptedSecret());
        } catch (IllegalStateException e) {
            logger.error("Stored secret of device {} cannot be decrypted", deviceId);
            throw ApiException.storageUnavailable(e);
        }
        OtpEngine.Check check;
        try {
            if (!secretHashService.matches(key, device.derivedKeyHash())) {
                logger.error("Stored secret of device {} does not match its hash", deviceId);
                throw ApiException.storageUnavailable(
                    new IllegalStateException("Secret integrity check failed for device " + deviceId));
            }
            check = otpEngine.verify(key, otp, otpEngine.movingFactorAt(now), device.lastMovingFactor());
        } finally {
            Arrays.fill(key, (byte) 0);
        }

        switch (check.status()) {
            case INVALID_CODE:
                return VerificationResult.INVALID_CODE;
            case REPLAY_DETECTED:
                return VerificationResult.REPLAY_DETECTED;
            default:
                break;
        }

        details.put("matched_offset", check.matchedOffset());
        try {
            registry.recordSuccessfulVerification(deviceId, check.movingFactor(), now);
        } catch (ApiException e) {
            // lost a race with another verification or a deactivation
            return VerificationResult.fromCode(e.publicMessage()).orElseThrow(() -> e);
        }
        return VerificationResult.ACCEPTED;
    }

    private boolean isRateLimited(String deviceId) {
        if (maxAttempts <= 0) {
            return false;
        }
        Instant since = clock.instant().minusSeconds(attemptWindowSec);
        try {
            int attempts = auditStore.countAuditLogsSince(
                deviceId,
                AuditAction.VERIFY.code(),
                VerificationResult.RATE_LIMITED.code(),
                since
            );
            return attempts >= maxAttempts;
        } catch (StorageException e) {
            throw ApiException.storageUnavailable(e);
        }
    }

    private static void logOutcome(String deviceId, VerificationResult result, Provenance provenance) {
        String ip = provenance == null ? null : provenance.ipAddress();
        if (result.accepted()) {
            logger.info("OTP accepted: device={} ip={}", deviceId, ip);
        } else {
            logger.warn("OTP rejected: device={} result={} ip={}", deviceId, result.code(), ip);
        }
    }
}

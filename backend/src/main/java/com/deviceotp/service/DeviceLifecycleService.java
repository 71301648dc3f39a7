package com.deviceotp.service;

import com.deviceotp.dao.AuditStore;
import com.deviceotp.dao.DeviceStore;
import com.deviceotp.dao.StorageException;
import com.deviceotp.domain.AuditAction;
import com.deviceotp.domain.DeviceApi;
import com.deviceotp.domain.Provenance;
import com.deviceotp.security.SecretCryptoService;
import com.deviceotp.security.SecretDerivationService;
import com.deviceotp.util.Jsons;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.tinkoff.kora.common.Component;

@Component
public final class DeviceLifecycleService {
    private static final Logger logger = LoggerFactory.getLogger(DeviceLifecycleService.class);

    static final String SECRET_WARNING = "Secret is shown once. Store it on the device.";
    static final int MAX_AUDIT_PAGE_SIZE = 200;

    private final DeviceRegistry registry;
    private final AuditLogWriter auditLogWriter;
    private final AuditStore auditStore;
    private final SecretDerivationService secretDerivationService;
    private final SecretCryptoService secretCryptoService;

    public DeviceLifecycleService(DeviceRegistry registry,
                                  AuditLogWriter auditLogWriter,
                                  AuditStore auditStore,
                                  SecretDerivationService secretDerivationService,
                                  SecretCryptoService secretCryptoService) {
        this.registry = registry;
        this.auditLogWriter = auditLogWriter;
        this.auditStore = auditStore;
        this.secretDerivationService = secretDerivationService;
        this.secretCryptoService = secretCryptoService;
    }

    public DeviceApi.RegisterResponse register(String rawDeviceId, String rawUserId, Provenance provenance) {
        String auditDeviceId = rawDeviceId == null ? "" : rawDeviceId.trim();
        Map<String, Object> details = new LinkedHashMap<>();
        boolean success = false;
        try {
            String deviceId = RequestValidator.normalizeDeviceId(rawDeviceId);
            auditDeviceId = deviceId;
            String userId = RequestValidator.normalizeUserId(rawUserId);
            details.put("user_id", userId);

            var secret = secretDerivationService.derive(deviceId, userId);
            registry.register(deviceId, userId, secret.hash(), secretCryptoService.encrypt(secret.keyMaterial()));

            success = true;
            logger.info("Device registered: device={} user={}", deviceId, userId);
            return new DeviceApi.RegisterResponse(deviceId, secret.secret(), SECRET_WARNING);
        } catch (ApiException e) {
            details.put("reason", e.publicMessage());
            logger.warn("Device registration rejected: device={} reason={}", auditDeviceId, e.publicMessage());
            throw e;
        } catch (RuntimeException e) {
            details.put("reason", "internal_error");
            throw e;
        } finally {
            auditLogWriter.record(auditDeviceId, AuditAction.REGISTER, success, provenance, details);
        }
    }

    public DeviceApi.DeactivateResponse deactivate(String rawDeviceId, Provenance provenance) {
        String auditDeviceId = rawDeviceId == null ? "" : rawDeviceId.trim();
        Map<String, Object> details = new LinkedHashMap<>();
        boolean success = false;
        try {
            String deviceId = RequestValidator.normalizeDeviceId(rawDeviceId);
            auditDeviceId = deviceId;

            Instant deactivatedAt = registry.deactivate(deviceId);

            success = true;
            logger.info("Device deactivated: device={}", deviceId);
            return new DeviceApi.DeactivateResponse(deviceId, deactivatedAt);
        } catch (ApiException e) {
            details.put("reason", e.publicMessage());
            logger.warn("Device deactivation rejected: device={} reason={}", auditDeviceId, e.publicMessage());
            throw e;
        } catch (RuntimeException e) {
            details.put("reason", "internal_error");
            throw e;
        } finally {
            auditLogWriter.record(auditDeviceId, AuditAction.DEACTIVATE, success, provenance, details);
        }
    }

    public DeviceApi.DeviceView getDevice(String rawDeviceId) {
        String deviceId = RequestValidator.normalizeDeviceId(rawDeviceId);
        return toView(registry.load(deviceId));
    }

    public List<DeviceApi.DeviceView> listDevices(String rawUserId) {
        String userId = RequestValidator.normalizeUserId(rawUserId);
        List<DeviceApi.DeviceView> result = new ArrayList<>();
        for (var row : registry.listByUser(userId)) {
            result.add(toView(row));
        }
        return result;
    }

    public List<DeviceApi.AuditLogRecord> listAudit(String rawDeviceId, String action, int page, int size) {
        String deviceId = RequestValidator.normalizeDeviceId(rawDeviceId);
        String actionFilter = action == null || action.isBlank() ? null : action.trim().toLowerCase(Locale.ROOT);

        int boundedSize = Math.max(1, Math.min(size, MAX_AUDIT_PAGE_SIZE));
        int offset;
        try {
            offset = Math.multiplyExact(Math.max(page, 0), boundedSize);
        } catch (ArithmeticException e) {
            throw ApiException.badRequest("invalid_page");
        }

        List<AuditStore.AuditLogRow> rows;
        try {
            rows = auditStore.listAuditLogs(deviceId, actionFilter, boundedSize, offset);
        } catch (StorageException e) {
            throw ApiException.storageUnavailable(e);
        }

        List<DeviceApi.AuditLogRecord> result = new ArrayList<>();
        for (var row : rows) {
            result.add(new DeviceApi.AuditLogRecord(
                row.id(),
                row.deviceId(),
                row.action(),
                row.success(),
                row.timestamp(),
                row.ipAddress(),
                row.userAgent(),
                parseDetails(row.additionalDataJson())
            ));
        }
        return result;
    }

    private static DeviceApi.DeviceView toView(DeviceStore.DeviceRow row) {
        return new DeviceApi.DeviceView(
            row.deviceId(),
            row.userId(),
            row.active(),
            row.createdAt(),
            row.lastUsed(),
            row.usageCount(),
            row.deactivatedAt()
        );
    }

    private static Map<String, Object> parseDetails(String json) {
        try {
            return Jsons.parseObject(json);
        } catch (IllegalStateException e) {
            logger.warn("Cannot parse audit additional_data", e);
            return Map.of("raw", json);
        }
    }
}

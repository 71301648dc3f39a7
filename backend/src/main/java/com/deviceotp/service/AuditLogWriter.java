package com.deviceotp.service;

import com.deviceotp.dao.AuditStore;
import com.deviceotp.domain.AuditAction;
import com.deviceotp.domain.Provenance;
import com.deviceotp.util.Jsons;
import java.time.Clock;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.tinkoff.kora.common.Component;

/**
 * Appends one audit entry per action. A failed write is logged and never reaches the caller,
 * so it cannot change the outcome of the action it documents.
 */
@Component
public final class AuditLogWriter {
    private static final Logger logger = LoggerFactory.getLogger(AuditLogWriter.class);

    static final int MAX_DEVICE_ID_LENGTH = 255;
    static final int MAX_IP_LENGTH = 64;
    static final int MAX_USER_AGENT_LENGTH = 512;

    private final AuditStore auditStore;
    private final Clock clock;

    public AuditLogWriter(AuditStore auditStore, Clock clock) {
        this.auditStore = auditStore;
        this.clock = clock;
    }

    public void record(String deviceId,
                       AuditAction action,
                       boolean success,
                       Provenance provenance,
                       Map<String, Object> details) {
        Provenance source = provenance == null ? Provenance.unknown() : provenance;
        try {
            auditStore.insertAuditLog(
                truncate(deviceId == null ? "" : deviceId, MAX_DEVICE_ID_LENGTH),
                action.code(),
                success,
                clock.instant(),
                truncate(source.ipAddress(), MAX_IP_LENGTH),
                truncate(source.userAgent(), MAX_USER_AGENT_LENGTH),
                details == null || details.isEmpty() ? null : Jsons.stringify(details)
            );
        } catch (RuntimeException e) {
            logger.error("Audit write failed: device={} action={} success={}", deviceId, action.code(), success, e);
        }
    }

    private static String truncate(String value, int max) {
        if (value == null || value.length() <= max) {
            return value;
        }
        return value.substring(0, max);
    }
}

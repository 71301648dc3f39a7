package com.deviceotp.dao;

import java.time.Instant;
import java.util.List;

/**
 * Append-only audit table. There is no update or delete.
 */
public interface AuditStore {

    record AuditLogRow(long id,
                       String deviceId,
                       String action,
                       boolean success,
                       Instant timestamp,
                       String ipAddress,
                       String userAgent,
                       String additionalDataJson) {}

    void insertAuditLog(String deviceId,
                        String action,
                        boolean success,
                        Instant timestamp,
                        String ipAddress,
                        String userAgent,
                        String additionalDataJson);

    /**
     * Counts entries newer than {@code since}, skipping those whose {@code result} detail equals
     * {@code excludedResult} when it is given.
     */
    int countAuditLogsSince(String deviceId, String action, String excludedResult, Instant since);

    List<AuditLogRow> listAuditLogs(String deviceId, String actionFilter, int limit, int offset);
}

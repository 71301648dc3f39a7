package com.deviceotp.dao;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.tinkoff.kora.common.Component;

@Component
public final class StorageService implements DeviceStore, AuditStore {
    private static final Logger logger = LoggerFactory.getLogger(StorageService.class);

    private static final String DEVICE_COLUMNS = """
        device_id, user_id, derived_key_hash, encrypted_secret, is_active, created_at,
        last_used, usage_count, last_moving_factor, deactivated_at
        """;

    private final DbClient dbClient;

    public StorageService(DbClient dbClient) {
        this.dbClient = dbClient;
    }

    @Override
    public boolean insertDevice(String deviceId,
                                String userId,
                                String derivedKeyHash,
                                byte[] encryptedSecret,
                                Instant createdAt) {
        String sql = """
            INSERT INTO devices(device_id, user_id, derived_key_hash, encrypted_secret, is_active, created_at, usage_count)
            VALUES (?, ?, ?, ?, TRUE, ?, 0)
            """;
        try (Connection connection = dbClient.getConnection();
             PreparedStatement st = prepare(connection, sql)) {
            st.setString(1, deviceId);
            st.setString(2, userId);
            st.setString(3, derivedKeyHash);
            st.setBytes(4, encryptedSecret);
            st.setTimestamp(5, Timestamp.from(createdAt));
            st.executeUpdate();
            return true;
        } catch (SQLException e) {
            if ("23505".equals(e.getSQLState())) {
                return false;
            }
            throw fail("insertDevice", e);
        }
    }

    @Override
    public Optional<DeviceRow> findDevice(String deviceId) {
        String sql = "SELECT " + DEVICE_COLUMNS + " FROM devices WHERE device_id=?";
        try (Connection connection = dbClient.getConnection();
             PreparedStatement st = prepare(connection, sql)) {
            st.setString(1, deviceId);
            try (ResultSet rs = st.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(mapDevice(rs));
            }
        } catch (SQLException e) {
            throw fail("findDevice", e);
        }
    }

    @Override
    public List<DeviceRow> listDevicesByUser(String userId) {
        String sql = "SELECT " + DEVICE_COLUMNS + " FROM devices WHERE user_id=? ORDER BY created_at DESC";
        List<DeviceRow> rows = new ArrayList<>();
        try (Connection connection = dbClient.getConnection();
             PreparedStatement st = prepare(connection, sql)) {
            st.setString(1, userId);
            try (ResultSet rs = st.executeQuery()) {
                while (rs.next()) {
                    rows.add(mapDevice(rs));
                }
            }
            return rows;
        } catch (SQLException e) {
            throw fail("listDevicesByUser", e);
        }
    }

    @Override
    public boolean markVerified(String deviceId, long movingFactor, Instant usedAt) {
        String sql = """
            UPDATE devices
            SET usage_count = usage_count + 1,
                last_used = CASE WHEN last_used IS NULL OR last_used < ? THEN ? ELSE last_used END,
                last_moving_factor = ?
            WHERE device_id = ?
              AND is_active = TRUE
              AND (last_moving_factor IS NULL OR last_moving_factor < ?)
            """;
        Timestamp ts = Timestamp.from(usedAt);
        try (Connection connection = dbClient.getConnection();
             PreparedStatement st = prepare(connection, sql)) {
            st.setTimestamp(1, ts);
            st.setTimestamp(2, ts);
            st.setLong(3, movingFactor);
            st.setString(4, deviceId);
            st.setLong(5, movingFactor);
            return st.executeUpdate() == 1;
        } catch (SQLException e) {
            throw fail("markVerified", e);
        }
    }

    @Override
    public boolean deactivate(String deviceId, Instant deactivatedAt) {
        String sql = """
            UPDATE devices
            SET is_active = FALSE,
                deactivated_at = ?
            WHERE device_id = ? AND is_active = TRUE
            """;
        try (Connection connection = dbClient.getConnection();
             PreparedStatement st = prepare(connection, sql)) {
            st.setTimestamp(1, Timestamp.from(deactivatedAt));
            st.setString(2, deviceId);
            return st.executeUpdate() == 1;
        } catch (SQLException e) {
            throw fail("deactivate", e);
        }
    }

    @Override
    public boolean ping() {
        try (Connection connection = dbClient.getConnection();
             PreparedStatement st = prepare(connection, "SELECT 1");
             ResultSet rs = st.executeQuery()) {
            return rs.next();
        } catch (SQLException e) {
            logger.warn("Database ping failed: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public void insertAuditLog(String deviceId,
                               String action,
                               boolean success,
                               Instant timestamp,
                               String ipAddress,
                               String userAgent,
                               String additionalDataJson) {
        String sql = """
            INSERT INTO audit_logs(device_id, action, success, timestamp, ip_address, user_agent, additional_data)
            VALUES (?, ?, ?, ?, ?, ?, ?::jsonb)
            """;
        try (Connection connection = dbClient.getConnection();
             PreparedStatement st = prepare(connection, sql)) {
            st.setString(1, deviceId);
            st.setString(2, action);
            st.setBoolean(3, success);
            st.setTimestamp(4, Timestamp.from(timestamp));
            st.setString(5, ipAddress);
            st.setString(6, userAgent);
            st.setString(7, additionalDataJson);
            st.executeUpdate();
        } catch (SQLException e) {
            throw fail("insertAuditLog", e);
        }
    }

    @Override
    public int countAuditLogsSince(String deviceId, String action, String excludedResult, Instant since) {
        StringBuilder sql = new StringBuilder(
            "SELECT COUNT(*) FROM audit_logs WHERE device_id=? AND action=? AND timestamp > ?"
        );
        boolean excluding = excludedResult != null;
        if (excluding) {
            sql.append(" AND COALESCE(additional_data ->> 'result', '') <> ?");
        }
        try (Connection connection = dbClient.getConnection();
             PreparedStatement st = prepare(connection, sql.toString())) {
            st.setString(1, deviceId);
            st.setString(2, action);
            st.setTimestamp(3, Timestamp.from(since));
            if (excluding) {
                st.setString(4, excludedResult);
            }
            try (ResultSet rs = st.executeQuery()) {
                rs.next();
                return rs.getInt(1);
            }
        } catch (SQLException e) {
            throw fail("countAuditLogsSince", e);
        }
    }

    @Override
    public List<AuditLogRow> listAuditLogs(String deviceId, String actionFilter, int limit, int offset) {
        StringBuilder sql = new StringBuilder("""
            SELECT id, device_id, action, success, timestamp, ip_address, user_agent,
                   additional_data::text AS additional_data
            FROM audit_logs
            WHERE device_id=?
            """);
        boolean filtered = actionFilter != null && !actionFilter.isBlank();
        if (filtered) {
            sql.append(" AND action=? ");
        }
        sql.append(" ORDER BY timestamp DESC, id DESC LIMIT ? OFFSET ? ");

        List<AuditLogRow> rows = new ArrayList<>();
        try (Connection connection = dbClient.getConnection();
             PreparedStatement st = prepare(connection, sql.toString())) {
            int i = 1;
            st.setString(i++, deviceId);
            if (filtered) {
                st.setString(i++, actionFilter);
            }
            st.setInt(i++, limit);
            st.setInt(i, offset);

            try (ResultSet rs = st.executeQuery()) {
                while (rs.next()) {
                    rows.add(new AuditLogRow(
                        rs.getLong("id"),
                        rs.getString("device_id"),
                        rs.getString("action"),
                        rs.getBoolean("success"),
                        rs.getTimestamp("timestamp").toInstant(),
                        rs.getString("ip_address"),
                        rs.getString("user_agent"),
                        rs.getString("additional_data")
                    ));
                }
            }
            return rows;
        } catch (SQLException e) {
            throw fail("listAuditLogs", e);
        }
    }

    private PreparedStatement prepare(Connection connection, String sql) throws SQLException {
        PreparedStatement st = connection.prepareStatement(sql);
        st.setQueryTimeout(dbClient.queryTimeoutSec());
        return st;
    }

    private DeviceRow mapDevice(ResultSet rs) throws SQLException {
        Timestamp lastUsed = rs.getTimestamp("last_used");
        Timestamp deactivatedAt = rs.getTimestamp("deactivated_at");
        long movingFactor = rs.getLong("last_moving_factor");
        Long lastMovingFactor = rs.wasNull() ? null : movingFactor;

        return new DeviceRow(
            rs.getString("device_id"),
            rs.getString("user_id"),
            rs.getString("derived_key_hash"),
            rs.getBytes("encrypted_secret"),
            rs.getBoolean("is_active"),
            rs.getTimestamp("created_at").toInstant(),
            lastUsed == null ? null : lastUsed.toInstant(),
            rs.getLong("usage_count"),
            lastMovingFactor,
            deactivatedAt == null ? null : deactivatedAt.toInstant()
        );
    }

    private StorageException fail(String op, SQLException e) {
        logger.error("DB operation {} failed", op, e);
        return StorageException.of(op, e);
    }
}

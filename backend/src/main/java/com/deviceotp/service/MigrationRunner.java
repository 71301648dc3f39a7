package com.deviceotp.service;

import com.deviceotp.dao.DbClient;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.FlywayException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.tinkoff.kora.common.Component;
import ru.tinkoff.kora.common.annotation.Root;

/**
 * Brings the schema up at startup. Flyway owns versioning; when it cannot run (for example a
 * locked-down history table) the idempotent init script is applied directly.
 */
@Component
@Root
public final class MigrationRunner {
    private static final Logger logger = LoggerFactory.getLogger(MigrationRunner.class);

    static final String INIT_SCRIPT = "/db/migration/V1__init.sql";
    static final List<String> REQUIRED_TABLES = List.of("devices", "audit_logs");

    public MigrationRunner(DbClient dbClient) {
        try {
            var result = Flyway.configure()
                .dataSource(dbClient.dataSource())
                .locations("classpath:db/migration")
                .load()
                .migrate();
            logger.info("Schema at version {}, {} migration(s) applied", result.targetSchemaVersion, result.migrationsExecuted);
        } catch (FlywayException e) {
            logger.warn("Flyway failed, applying {} directly: {}", INIT_SCRIPT, e.getMessage());
        }

        try (Connection connection = dbClient.getConnection()) {
            List<String> missing = missingTables(connection);
            if (!missing.isEmpty()) {
                logger.warn("Tables {} are missing after Flyway, running {}", missing, INIT_SCRIPT);
                try (Statement st = connection.createStatement()) {
                    st.execute(loadScript(INIT_SCRIPT));
                }
                missing = missingTables(connection);
                if (!missing.isEmpty()) {
                    throw new IllegalStateException("Schema is incomplete, missing tables " + missing);
                }
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Cannot prepare database schema", e);
        }
    }

    private static List<String> missingTables(Connection connection) throws SQLException {
        DatabaseMetaData meta = connection.getMetaData();
        List<String> missing = new ArrayList<>();
        for (String table : REQUIRED_TABLES) {
            try (ResultSet rs = meta.getTables(null, null, table, new String[] {"TABLE"})) {
                if (!rs.next()) {
                    missing.add(table);
                }
            }
        }
        return missing;
    }

    static String loadScript(String resourcePath) {
        try (InputStream in = MigrationRunner.class.getResourceAsStream(resourcePath)) {
            if (in == null) {
                throw new IllegalStateException("Missing migration script: " + resourcePath);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read migration script: " + resourcePath, e);
        }
    }
}

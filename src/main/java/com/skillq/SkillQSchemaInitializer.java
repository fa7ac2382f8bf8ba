package com.skillq;

import com.skillq.config.SkillQProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.EncodedResource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.core.io.support.ResourcePatternResolver;
import org.springframework.jdbc.datasource.init.ScriptUtils;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;

import javax.sql.DataSource;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Applies the versioned scripts under {@value #MIGRATION_LOCATION} in version order, each in its own
 * transaction, and records them in {@value #HISTORY_TABLE}. On PostgreSQL concurrent starts are
 * serialized through an advisory lock. A script edited after it was applied stops the startup.
 */
@Component
@ConditionalOnProperty(prefix = "skillq.database", name = "skip-create", havingValue = "false", matchIfMissing = true)
public class SkillQSchemaInitializer implements InitializingBean {

    private static final Logger log = LoggerFactory.getLogger(SkillQSchemaInitializer.class);

    static final String MIGRATION_LOCATION = "classpath*:skillq/migration/V*__*.sql";
    static final String HISTORY_TABLE = "skillq_schema_history";
    private static final Pattern FILE_NAME = Pattern.compile("^V(\\d+(?:_\\d+)*)__([A-Za-z0-9_\\-]+)\\.sql$");
    private static final long ADVISORY_LOCK_KEY = 0x536b696c6c51L;

    private final DataSource dataSource;
    private final boolean failOnMigrationError;
    private final ResourcePatternResolver resolver = new PathMatchingResourcePatternResolver();

    public SkillQSchemaInitializer(DataSource dataSource, SkillQProperties properties) {
        this.dataSource = dataSource;
        this.failOnMigrationError = properties.getDatabase().isFailOnMigrationError();
    }

    @Override
    public void afterPropertiesSet() {
        try {
            int applied = migrate();
            if (applied > 0) {
                log.info("Applied {} SkillQ schema migration(s)", applied);
            } else {
                log.info("SkillQ schema is up to date");
            }
        } catch (Exception e) {
            if (failOnMigrationError) {
                throw new IllegalStateException("SkillQ schema migration failed", e);
            }
            log.error("SkillQ schema migration failed, continuing because "
                    + "skillq.database.fail-on-migration-error=false", e);
        }
    }

    /**
     * @return number of scripts applied by this call
     */
    int migrate() throws SQLException, IOException {
        List<Migration> migrations = discover();
        if (migrations.isEmpty()) {
            throw new IllegalStateException("No migration scripts found at " + MIGRATION_LOCATION);
        }
        try (Connection connection = dataSource.getConnection()) {
            boolean locked = lock(connection);
            try {
                createHistoryTable(connection);
                Map<String, String> history = readHistory(connection);
                verify(migrations, history);
                int applied = 0;
                for (Migration migration : migrations) {
                    if (!history.containsKey(migration.version())) {
                        apply(connection, migration);
                        applied++;
                    }
                }
                return applied;
            } finally {
                if (locked) {
                    unlock(connection);
                }
            }
        }
    }

    List<Migration> discover() throws IOException {
        List<Migration> migrations = new ArrayList<>();
        Map<String, String> fileByVersion = new HashMap<>();
        for (Resource resource : resolver.getResources(MIGRATION_LOCATION)) {
            String fileName = resource.getFilename();
            if (fileName == null) {
                continue;
            }
            Matcher matcher = FILE_NAME.matcher(fileName);
            if (!matcher.matches()) {
                throw new IllegalStateException("Migration file '" + fileName
                        + "' does not follow V<version>__<description>.sql");
            }
            String version = matcher.group(1);
            String previous = fileByVersion.putIfAbsent(version, fileName);
            if (previous != null) {
                throw new IllegalStateException("Migration version V" + version + " is used by both " + previous
                        + " and " + fileName);
            }
            String sql = StreamUtils.copyToString(resource.getInputStream(), StandardCharsets.UTF_8);
            migrations.add(new Migration(version, matcher.group(2).replace('_', ' '), fileName, sql, checksum(sql)));
        }
        migrations.sort(Comparator.comparing(Migration::version, SkillQSchemaInitializer::compareVersions));
        return migrations;
    }

    private void createHistoryTable(Connection connection) throws SQLException {
        try (Statement statement = connection.createStatement()) {
            statement.execute("""
                    CREATE TABLE IF NOT EXISTS %s (
                        version VARCHAR(64) PRIMARY KEY,
                        description VARCHAR(255) NOT NULL,
                        checksum CHAR(64) NOT NULL,
                        installed_on TIMESTAMP WITH TIME ZONE NOT NULL DEFAULT CURRENT_TIMESTAMP,
                        execution_time_ms BIGINT NOT NULL
                    )
                    """.formatted(HISTORY_TABLE));
        }
    }

    private Map<String, String> readHistory(Connection connection) throws SQLException {
        Map<String, String> history = new HashMap<>();
        try (PreparedStatement statement = connection.prepareStatement(
                "SELECT version, checksum FROM " + HISTORY_TABLE);
                ResultSet rows = statement.executeQuery()) {
            while (rows.next()) {
                history.put(rows.getString("version"), rows.getString("checksum").trim());
            }
        }
        return history;
    }

    static void verify(List<Migration> migrations, Map<String, String> history) {
        Map<String, Migration> byVersion = new HashMap<>();
        migrations.forEach(migration -> byVersion.put(migration.version(), migration));
        history.forEach((version, checksum) -> {
            Migration migration = byVersion.get(version);
            if (migration == null) {
                throw new IllegalStateException("Applied migration V" + version + " is missing from the classpath");
            }
            if (!migration.checksum().equals(checksum)) {
                throw new IllegalStateException("Migration " + migration.fileName() + " was modified after it was applied");
            }
        });
    }

    private void apply(Connection connection, Migration migration) throws SQLException {
        boolean autoCommit = connection.getAutoCommit();
        long started = System.nanoTime();
        connection.setAutoCommit(false);
        try {
            ScriptUtils.executeSqlScript(connection, new EncodedResource(
                    new ByteArrayResource(migration.sql().getBytes(StandardCharsets.UTF_8), migration.fileName()),
                    StandardCharsets.UTF_8));
            long elapsedMs = Duration.ofNanos(System.nanoTime() - started).toMillis();
            try (PreparedStatement statement = connection.prepareStatement("INSERT INTO " + HISTORY_TABLE
                    + " (version, description, checksum, execution_time_ms) VALUES (?, ?, ?, ?)")) {
                statement.setString(1, migration.version());
                statement.setString(2, migration.description());
                statement.setString(3, migration.checksum());
                statement.setLong(4, elapsedMs);
                statement.executeUpdate();
            }
            connection.commit();
            log.info("Applied migration {} in {} ms", migration.fileName(), elapsedMs);
        } catch (RuntimeException | SQLException e) {
            connection.rollback();
            throw new IllegalStateException("Migration " + migration.fileName() + " failed", e);
        } finally {
            connection.setAutoCommit(autoCommit);
        }
    }

    private boolean lock(Connection connection) throws SQLException {
        String product = connection.getMetaData().getDatabaseProductName();
        if (product == null || !product.toLowerCase(Locale.ROOT).contains("postgresql")) {
            return false;
        }
        try (PreparedStatement statement = connection.prepareStatement("SELECT pg_advisory_lock(?)")) {
            statement.setLong(1, ADVISORY_LOCK_KEY);
            statement.execute();
        }
        return true;
    }

    private void unlock(Connection connection) {
        try (PreparedStatement statement = connection.prepareStatement("SELECT pg_advisory_unlock(?)")) {
            statement.setLong(1, ADVISORY_LOCK_KEY);
            statement.execute();
        } catch (SQLException e) {
            log.warn("Failed to release schema migration lock: {}", e.getMessage());
        }
    }

    static int compareVersions(String left, String right) {
        String[] l = left.split("_");
        String[] r = right.split("_");
        for (int i = 0; i < Math.max(l.length, r.length); i++) {
            int a = i < l.length ? Integer.parseInt(l[i]) : 0;
            int b = i < r.length ? Integer.parseInt(r[i]) : 0;
            if (a != b) {
                return Integer.compare(a, b);
            }
        }
        return 0;
    }

    static String checksum(String sql) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(sql.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    record Migration(String version, String description, String fileName, String sql, String checksum) {
    }
}

package com.delayq;

import com.delayq.config.DelayQProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.env.Environment;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.EncodedResource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
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
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Applies the versioned scripts under {@code delayq/migration} once each, recording
 * them with a checksum. On PostgreSQL concurrent starts are serialized with an
 * advisory lock.
 */
@Component
@ConditionalOnProperty(prefix = "delayq.database", name = "skip-create", havingValue = "false", matchIfMissing = true)
public class JobSchemaInitializer implements InitializingBean {

    private static final Logger log = LoggerFactory.getLogger(JobSchemaInitializer.class);
    private static final Pattern SAFE_IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final Pattern SCRIPT_NAME = Pattern.compile("^V([0-9]+)__([A-Za-z0-9_\\-]+)\\.sql$");
    private static final String SCRIPT_LOCATION = "classpath*:delayq/migration/V*__*.sql";
    private static final long ADVISORY_LOCK_KEY = 5_120_393_771_004_218_113L;

    private final DataSource dataSource;
    private final String tablePrefix;
    private final boolean failOnMigrationError;

    public JobSchemaInitializer(
            DataSource dataSource,
            ObjectProvider<DelayQProperties> propertiesProvider,
            Environment environment) {
        this.dataSource = dataSource;
        DelayQProperties properties = propertiesProvider.getIfAvailable();
        String configuredPrefix = properties != null
                ? properties.getDatabase().getTablePrefix()
                : environment.getProperty("delayq.database.table-prefix", "");
        this.failOnMigrationError = properties != null
                ? properties.getDatabase().isFailOnMigrationError()
                : environment.getProperty("delayq.database.fail-on-migration-error", Boolean.class, true);
        this.tablePrefix = normalizePrefix(configuredPrefix);
    }

    @Override
    public void afterPropertiesSet() {
        String historyTable = identifier("delayq_schema_migrations");
        String jobsTable = identifier("delayq_jobs");

        try (Connection connection = dataSource.getConnection()) {
            boolean postgres = isPostgres(connection);
            if (postgres) {
                advisoryLock(connection, "pg_advisory_lock");
            }
            try {
                createHistoryTable(connection, historyTable);
                List<Script> scripts = loadScripts();
                Map<Integer, String> applied = appliedChecksums(connection, historyTable);
                verify(scripts, applied);

                int count = 0;
                for (Script script : scripts) {
                    if (!applied.containsKey(script.version())) {
                        apply(connection, historyTable, jobsTable, script);
                        count++;
                    }
                }
                log.info("DelayQ schema {} is up to date ({} migration(s) applied now, {} before)", jobsTable,
                        count, applied.size());
            } finally {
                if (postgres) {
                    advisoryLock(connection, "pg_advisory_unlock");
                }
            }
        } catch (Exception e) {
            if (failOnMigrationError) {
                throw new IllegalStateException("Failed to initialize DelayQ database schema", e);
            }
            log.error("Failed to initialize DelayQ database schema "
                    + "(continuing because delayq.database.fail-on-migration-error=false)", e);
        }
    }

    private void createHistoryTable(Connection connection, String historyTable) throws SQLException {
        try (Statement statement = connection.createStatement()) {
            statement.execute("""
                    CREATE TABLE IF NOT EXISTS %s (
                        version INTEGER PRIMARY KEY,
                        description VARCHAR(255) NOT NULL,
                        checksum VARCHAR(64) NOT NULL,
                        installed_on TIMESTAMP WITH TIME ZONE NOT NULL DEFAULT CURRENT_TIMESTAMP
                    )
                    """.formatted(historyTable));
        }
    }

    private List<Script> loadScripts() throws IOException {
        Resource[] resources = new PathMatchingResourcePatternResolver().getResources(SCRIPT_LOCATION);
        List<Script> scripts = new ArrayList<>();
        for (Resource resource : resources) {
            String fileName = resource.getFilename();
            Matcher matcher = fileName == null ? null : SCRIPT_NAME.matcher(fileName);
            if (matcher == null || !matcher.matches()) {
                throw new IllegalStateException("Invalid DelayQ migration filename '" + fileName
                        + "'. Expected V{version}__{description}.sql");
            }
            String sql = StreamUtils.copyToString(resource.getInputStream(), StandardCharsets.UTF_8);
            scripts.add(new Script(Integer.parseInt(matcher.group(1)), matcher.group(2).replace('_', ' '),
                    fileName, sql, sha256(sql)));
        }
        if (scripts.isEmpty()) {
            throw new IllegalStateException("No DelayQ migrations found at " + SCRIPT_LOCATION);
        }
        scripts.sort(Comparator.comparingInt(Script::version));
        for (int i = 1; i < scripts.size(); i++) {
            if (scripts.get(i).version() == scripts.get(i - 1).version()) {
                throw new IllegalStateException("Duplicate DelayQ migration version V" + scripts.get(i).version());
            }
        }
        return scripts;
    }

    private Map<Integer, String> appliedChecksums(Connection connection, String historyTable) throws SQLException {
        Map<Integer, String> applied = new TreeMap<>();
        try (PreparedStatement statement = connection.prepareStatement(
                "SELECT version, checksum FROM " + historyTable);
                ResultSet rs = statement.executeQuery()) {
            while (rs.next()) {
                applied.put(rs.getInt("version"), rs.getString("checksum"));
            }
        }
        return applied;
    }

    private void verify(List<Script> scripts, Map<Integer, String> applied) {
        for (Map.Entry<Integer, String> entry : applied.entrySet()) {
            Script script = scripts.stream().filter(s -> s.version() == entry.getKey()).findFirst()
                    .orElseThrow(() -> new IllegalStateException("Migration V" + entry.getKey()
                            + " was applied but is missing from the classpath"));
            if (!script.checksum().equals(entry.getValue())) {
                throw new IllegalStateException("Migration " + script.fileName() + " changed after being applied");
            }
        }
    }

    private void apply(Connection connection, String historyTable, String jobsTable, Script script)
            throws SQLException {
        boolean autoCommit = connection.getAutoCommit();
        connection.setAutoCommit(false);
        try {
            // Index and constraint names embed the table name, so they get the prefix too.
            String sql = script.sql().replace("delayq_jobs", jobsTable);
            ScriptUtils.executeSqlScript(connection, new EncodedResource(
                    new ByteArrayResource(sql.getBytes(StandardCharsets.UTF_8), script.fileName()),
                    StandardCharsets.UTF_8));
            try (PreparedStatement statement = connection.prepareStatement(
                    "INSERT INTO " + historyTable + " (version, description, checksum) VALUES (?, ?, ?)")) {
                statement.setInt(1, script.version());
                statement.setString(2, script.description());
                statement.setString(3, script.checksum());
                statement.executeUpdate();
            }
            connection.commit();
            log.info("Applied DelayQ migration V{} ({})", script.version(), script.description());
        } catch (SQLException | RuntimeException e) {
            connection.rollback();
            throw new IllegalStateException("Failed to apply DelayQ migration " + script.fileName(), e);
        } finally {
            connection.setAutoCommit(autoCommit);
        }
    }

    private void advisoryLock(Connection connection, String function) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement("SELECT " + function + "(?)")) {
            statement.setLong(1, ADVISORY_LOCK_KEY);
            statement.execute();
        }
    }

    private boolean isPostgres(Connection connection) throws SQLException {
        String product = connection.getMetaData().getDatabaseProductName();
        return product != null && product.toLowerCase(Locale.ROOT).contains("postgresql");
    }

    private String identifier(String name) {
        String identifier = tablePrefix + name;
        if (!SAFE_IDENTIFIER.matcher(identifier).matches()) {
            throw new IllegalArgumentException("Unsupported SQL identifier for DelayQ: " + identifier);
        }
        return identifier;
    }

    private static String normalizePrefix(String configuredPrefix) {
        String trimmed = configuredPrefix == null ? "" : configuredPrefix.trim();
        if (!trimmed.isEmpty() && !SAFE_IDENTIFIER.matcher(trimmed).matches()) {
            throw new IllegalArgumentException("Unsupported DelayQ table-prefix: " + trimmed);
        }
        return trimmed;
    }

    private static String sha256(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(input.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    private record Script(int version, String description, String fileName, String sql, String checksum) {
    }
}

package de.leipzig.htwk.gitrdf.fixstrategy.repository;

import java.nio.charset.StandardCharsets;
import java.util.List;

import javax.sql.DataSource;

import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.core.io.Resource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;

import lombok.extern.slf4j.Slf4j;

/**
 * Creates the attempt log tables when the store opens a database file.
 *
 * The bundled script is preferred; when it cannot be found or read a minimal built-in schema
 * without secondary indexes is used. Failures are logged and never stop the store from being
 * constructed.
 */
@Slf4j
class AttemptSchemaInitializer {

    enum SchemaSource {
        BUNDLED, FALLBACK, FAILED
    }

    private static final List<String> FALLBACK_SCHEMA = List.of(
        """
        CREATE TABLE IF NOT EXISTS fix_attempts (
            id INTEGER PRIMARY KEY AUTOINCREMENT,
            issue_type TEXT NOT NULL,
            issue_message TEXT NOT NULL,
            file_path TEXT,
            stage TEXT,
            issue_embedding BLOB,
            tfidf_vector TEXT,
            embedding_dim INTEGER NOT NULL,
            agent_used TEXT NOT NULL,
            strategy TEXT NOT NULL,
            success BOOLEAN NOT NULL,
            confidence REAL NOT NULL DEFAULT 0.0,
            timestamp TEXT NOT NULL,
            session_id TEXT,
            CHECK ((issue_embedding IS NULL) <> (tfidf_vector IS NULL))
        )
        """,
        """
        CREATE TABLE IF NOT EXISTS strategy_effectiveness (
            agent_strategy TEXT PRIMARY KEY,
            total_attempts INTEGER NOT NULL,
            successful_attempts INTEGER NOT NULL,
            success_rate REAL NOT NULL,
            last_attempted TEXT,
            last_successful TEXT
        )
        """,
        """
        CREATE TABLE IF NOT EXISTS recommendation_feedback (
            id INTEGER PRIMARY KEY AUTOINCREMENT,
            agent_strategy TEXT NOT NULL,
            accepted BOOLEAN NOT NULL,
            confidence REAL,
            issue_type TEXT,
            session_id TEXT,
            timestamp TEXT NOT NULL
        )
        """);

    // Columns added after the first released schema; older files get them on open.
    private static final List<String[]> LATE_COLUMNS = List.of(
        new String[] {"tfidf_vector", "TEXT"},
        new String[] {"embedding_dim", "INTEGER NOT NULL DEFAULT 0"},
        new String[] {"session_id", "TEXT"});

    private final DataSource dataSource;
    private final JdbcTemplate jdbcTemplate;

    AttemptSchemaInitializer(DataSource dataSource) {
        this.dataSource = dataSource;
        this.jdbcTemplate = new JdbcTemplate(dataSource);
    }

    SchemaSource initialize(String schemaLocation) {
        SchemaSource source;
        try {
            if (tableExists("fix_attempts")) {
                log.info("fix_attempts table already exists");
                ensureRequiredColumns();
            }
            source = applyBundledSchema(schemaLocation) ? SchemaSource.BUNDLED : applyFallbackSchema();
        } catch (Exception e) {
            log.error("Failed to initialize fix strategy schema: {}", e.getMessage());
            log.error("Recording and retrieval will run in degraded mode until the database is reachable");
            return SchemaSource.FAILED;
        }
        return source;
    }

    private boolean applyBundledSchema(String schemaLocation) {
        Resource script = new DefaultResourceLoader().getResource(schemaLocation);
        if (!script.exists()) {
            log.warn("Schema resource {} not found, creating built-in schema", schemaLocation);
            return false;
        }

        try {
            ResourceDatabasePopulator populator = new ResourceDatabasePopulator(script);
            populator.setSqlScriptEncoding(StandardCharsets.UTF_8.name());
            populator.execute(dataSource);
            log.info("Applied schema script {}", schemaLocation);
            return true;
        } catch (Exception e) {
            log.warn("Schema script {} could not be applied ({}), creating built-in schema",
                    schemaLocation, e.getMessage());
            return false;
        }
    }

    private SchemaSource applyFallbackSchema() {
        for (String statement : FALLBACK_SCHEMA) {
            jdbcTemplate.execute(statement);
        }
        log.info("Created built-in fix strategy schema (no secondary indexes)");
        return SchemaSource.FALLBACK;
    }

    private boolean tableExists(String tableName) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM sqlite_master WHERE type = 'table' AND name = ?", Integer.class, tableName);
        return count != null && count > 0;
    }

    private void ensureRequiredColumns() {
        List<String> existing = jdbcTemplate.query("PRAGMA table_info(fix_attempts)",
            (rs, rowNum) -> rs.getString("name"));

        for (String[] column : LATE_COLUMNS) {
            if (existing.contains(column[0])) {
                continue;
            }
            try {
                log.warn("Column '{}' missing, adding it...", column[0]);
                jdbcTemplate.execute("ALTER TABLE fix_attempts ADD COLUMN " + column[0] + " " + column[1]);
                log.info("Added column '{}' to fix_attempts table", column[0]);
            } catch (Exception e) {
                log.warn("Could not add column '{}': {}", column[0], e.getMessage());
            }
        }
    }
}

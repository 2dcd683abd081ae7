package de.leipzig.htwk.gitrdf.fixstrategy.repository;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteDataSource;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

import de.leipzig.htwk.gitrdf.fixstrategy.model.FixAttempt;
import de.leipzig.htwk.gitrdf.fixstrategy.model.FixResult;
import de.leipzig.htwk.gitrdf.fixstrategy.model.FixStrategyStatistics;
import de.leipzig.htwk.gitrdf.fixstrategy.model.Issue;
import de.leipzig.htwk.gitrdf.fixstrategy.model.IssueType;
import de.leipzig.htwk.gitrdf.fixstrategy.model.RecommendationFeedback;
import de.leipzig.htwk.gitrdf.fixstrategy.model.SimilarAttempt;
import de.leipzig.htwk.gitrdf.fixstrategy.model.StoreRecommendation;
import de.leipzig.htwk.gitrdf.fixstrategy.model.StrategyEffectivenessSummary;
import de.leipzig.htwk.gitrdf.fixstrategy.model.StrategyScore;
import de.leipzig.htwk.gitrdf.fixstrategy.model.embedding.DenseVector;
import de.leipzig.htwk.gitrdf.fixstrategy.model.embedding.EmbeddingKind;
import de.leipzig.htwk.gitrdf.fixstrategy.model.embedding.EmbeddingVector;
import de.leipzig.htwk.gitrdf.fixstrategy.model.embedding.SparseVector;
import de.leipzig.htwk.gitrdf.fixstrategy.service.embedding.EmbeddingSimilarity;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Persistent log of fix attempts in a single SQLite file.
 *
 * Every operation borrows its own pooled connection, so one store can be shared by any
 * number of threads. Storage failures never escape: writes answer {@code false}, reads
 * answer empty results, and the cause is logged.
 */
@Slf4j
public class AttemptStore implements AutoCloseable {

    public static final String DEFAULT_SCHEMA_LOCATION = "classpath:db/fix_strategy_schema.sql";
    public static final double STORE_MIN_SIMILARITY = 0.3;
    public static final int TOP_STRATEGIES_LIMIT = 10;

    private static final String ATTEMPT_COLUMNS = """
        id, issue_type, issue_message, file_path, stage, issue_embedding, tfidf_vector,
        agent_used, strategy, success, confidence, timestamp, session_id
        """;

    private static final String INSERT_ATTEMPT_SQL = """
        INSERT INTO fix_attempts (
            issue_type, issue_message, file_path, stage, issue_embedding, tfidf_vector,
            embedding_dim, agent_used, strategy, success, confidence, timestamp, session_id
        ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
        """;

    private static final String REBUILD_SUMMARY_SQL = """
        INSERT INTO strategy_effectiveness (
            agent_strategy, total_attempts, successful_attempts, success_rate, last_attempted, last_successful
        )
        SELECT agent_used || ':' || strategy,
               COUNT(*),
               SUM(CASE WHEN success THEN 1 ELSE 0 END),
               CAST(SUM(CASE WHEN success THEN 1 ELSE 0 END) AS REAL) / COUNT(*),
               MAX(timestamp),
               MAX(CASE WHEN success THEN timestamp END)
        FROM fix_attempts
        GROUP BY agent_used || ':' || strategy
        """;

    private static final String SUMMARY_COLUMNS = """
        agent_strategy, total_attempts, successful_attempts, success_rate, last_attempted, last_successful
        """;

    @Getter
    private final Path databasePath;

    private final HikariDataSource dataSource;
    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final EmbeddingCodec codec;
    private final Clock clock;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public AttemptStore(Path databasePath) {
        this(databasePath, DEFAULT_SCHEMA_LOCATION, 4, 5000, new ObjectMapper(), Clock.systemUTC());
    }

    public AttemptStore(Path databasePath, String schemaLocation, int maxPoolSize, int busyTimeoutMillis,
                        ObjectMapper objectMapper, Clock clock) {
        this.databasePath = databasePath.toAbsolutePath();
        this.codec = new EmbeddingCodec(objectMapper);
        this.clock = clock;

        createParentDirectories(this.databasePath);
        this.dataSource = createDataSource(this.databasePath, maxPoolSize, busyTimeoutMillis);
        this.jdbcTemplate = new JdbcTemplate(dataSource);
        this.transactionTemplate = new TransactionTemplate(new DataSourceTransactionManager(dataSource));

        AttemptSchemaInitializer.SchemaSource schema = new AttemptSchemaInitializer(dataSource).initialize(schemaLocation);
        log.info("Attempt store opened at {} (schema: {})", this.databasePath, schema);
    }

    /**
     * Append one attempt to the log.
     *
     * @return {@code true} when the row was written
     */
    public boolean record(Issue issue, FixResult result, String agentUsed, String strategy,
                          EmbeddingVector embedding, String sessionId) {
        byte[] denseBlob = null;
        String sparseJson = null;
        try {
            switch (embedding.kind()) {
                case DENSE -> denseBlob = codec.encodeDense((DenseVector) embedding);
                case SPARSE -> sparseJson = codec.encodeSparse((SparseVector) embedding);
            }

            jdbcTemplate.update(INSERT_ATTEMPT_SQL,
                issue.type().getValue(),
                issue.message(),
                issue.filePath(),
                issue.stage(),
                denseBlob,
                sparseJson,
                embedding.dimensions(),
                agentUsed,
                strategy,
                result.success(),
                result.confidence(),
                EmbeddingCodec.formatTimestamp(clock.instant()),
                sessionId);

            log.debug("Recorded {} attempt for {} ({})", result.success() ? "successful" : "failed",
                    FixAttempt.strategyKey(agentUsed, strategy), issue.type());
            return true;
        } catch (Exception e) {
            log.error("Failed to record fix attempt for {}: {}", FixAttempt.strategyKey(agentUsed, strategy), e.getMessage());
            return false;
        }
    }

    /**
     * Nearest stored attempts by cosine similarity.
     *
     * Rows stored with the other embedding variant (or another width) are skipped. Results are
     * ordered by similarity descending, equal similarities by insertion order.
     *
     * @param issueType optional filter, {@code null} scans every type
     */
    public List<SimilarAttempt> findSimilar(EmbeddingVector query, IssueType issueType, int k, double minSimilarity) {
        if (k <= 0) {
            return List.of();
        }

        String sql = "SELECT " + ATTEMPT_COLUMNS + " FROM fix_attempts"
            + (issueType != null ? " WHERE issue_type = ?" : "")
            + " ORDER BY id";
        Object[] args = issueType != null ? new Object[] {issueType.getValue()} : new Object[0];

        List<SimilarAttempt> matches = new ArrayList<>();
        int[] skippedVariant = {0};
        int[] skippedCorrupt = {0};

        RowCallbackHandler collector = rs -> {
            boolean sparseRow = rs.getString("tfidf_vector") != null;
            if (sparseRow != (query.kind() == EmbeddingKind.SPARSE)) {
                skippedVariant[0]++;
                return;
            }

            FixAttempt attempt;
            try {
                attempt = mapAttempt(rs);
            } catch (IllegalArgumentException e) {
                skippedCorrupt[0]++;
                log.warn("Skipping corrupt attempt row {}: {}", rs.getLong("id"), e.getMessage());
                return;
            }

            if (!EmbeddingSimilarity.comparable(query, attempt.embedding())) {
                skippedVariant[0]++;
                return;
            }

            double similarity = EmbeddingSimilarity.cosine(query, attempt.embedding());
            if (similarity >= minSimilarity) {
                matches.add(new SimilarAttempt(attempt, similarity));
            }
        };

        try {
            jdbcTemplate.query(sql, collector, args);
        } catch (Exception e) {
            log.error("Similarity search failed: {}", e.getMessage());
            return List.of();
        }

        if (skippedVariant[0] > 0 || skippedCorrupt[0] > 0) {
            log.debug("Skipped {} attempts stored with an incompatible embedding and {} corrupt rows",
                    skippedVariant[0], skippedCorrupt[0]);
        }

        matches.sort(Comparator.comparingDouble(SimilarAttempt::similarity).reversed()
            .thenComparing(match -> match.attempt().id()));
        return matches.size() > k ? List.copyOf(matches.subList(0, k)) : List.copyOf(matches);
    }

    /**
     * Minimal recommendation straight from the log: successful neighbours only, weighted by
     * similarity and historical confidence.
     */
    public Optional<StoreRecommendation> recommendFromStore(Issue issue, EmbeddingVector embedding, int k) {
        List<SimilarAttempt> similar = findSimilar(embedding, issue.type(), k, STORE_MIN_SIMILARITY);

        Map<String, Double> scores = new LinkedHashMap<>();
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (SimilarAttempt match : similar) {
            if (!match.attempt().success()) {
                continue;
            }
            String key = match.attempt().strategyKey();
            double weight = StrategyScore.similarityWeight(match.similarity()) * match.attempt().confidence();
            scores.merge(key, weight, Double::sum);
            counts.merge(key, 1, Integer::sum);
        }

        if (scores.isEmpty()) {
            return Optional.empty();
        }

        StrategyScore best = scores.entrySet().stream()
            .map(entry -> new StrategyScore(entry.getKey(), entry.getValue()))
            .sorted(StrategyScore.RANKING)
            .findFirst()
            .orElseThrow();

        int count = counts.get(best.agentStrategy());
        double confidence = Math.min(1.0, best.score() / count + Math.min(0.1, 0.02 * count));
        return Optional.of(new StoreRecommendation(best.agentStrategy(), confidence));
    }

    /**
     * Recompute the effectiveness summary from the attempt log in one transaction.
     */
    public void rebuildEffectivenessSummary() {
        try {
            transactionTemplate.executeWithoutResult(status -> {
                jdbcTemplate.update("DELETE FROM strategy_effectiveness");
                int rows = jdbcTemplate.update(REBUILD_SUMMARY_SQL);
                log.info("Rebuilt strategy effectiveness summary ({} strategies)", rows);
            });
        } catch (Exception e) {
            log.error("Failed to rebuild strategy effectiveness summary: {}", e.getMessage());
        }
    }

    public FixStrategyStatistics statistics() {
        try {
            Map<String, Object> counts = jdbcTemplate.queryForMap("""
                SELECT COUNT(*) AS total_attempts,
                       COALESCE(SUM(CASE WHEN success THEN 1 ELSE 0 END), 0) AS successful_attempts
                FROM fix_attempts
                """);
            long total = ((Number) counts.get("total_attempts")).longValue();
            long successful = ((Number) counts.get("successful_attempts")).longValue();
            double rate = total > 0 ? (double) successful / total : 0.0;

            List<StrategyEffectivenessSummary> top = jdbcTemplate.query(
                "SELECT " + SUMMARY_COLUMNS + " FROM strategy_effectiveness"
                    + " ORDER BY success_rate DESC, total_attempts DESC, agent_strategy LIMIT ?",
                (rs, rowNum) -> mapSummary(rs), TOP_STRATEGIES_LIMIT);

            return new FixStrategyStatistics(total, successful, rate, top);
        } catch (Exception e) {
            log.error("Failed to read fix strategy statistics: {}", e.getMessage());
            return FixStrategyStatistics.empty();
        }
    }

    public List<StrategyEffectivenessSummary> effectivenessSummary() {
        try {
            return jdbcTemplate.query(
                "SELECT " + SUMMARY_COLUMNS + " FROM strategy_effectiveness"
                    + " ORDER BY success_rate DESC, total_attempts DESC, agent_strategy",
                (rs, rowNum) -> mapSummary(rs));
        } catch (Exception e) {
            log.error("Failed to read strategy effectiveness summary: {}", e.getMessage());
            return List.of();
        }
    }

    public boolean recordFeedback(RecommendationFeedback feedback) {
        try {
            Instant timestamp = feedback.timestamp() != null ? feedback.timestamp() : clock.instant();
            jdbcTemplate.update("""
                INSERT INTO recommendation_feedback (agent_strategy, accepted, confidence, issue_type, session_id, timestamp)
                VALUES (?, ?, ?, ?, ?, ?)
                """,
                feedback.agentStrategy(),
                feedback.accepted(),
                feedback.confidence(),
                feedback.issueType() != null ? feedback.issueType().getValue() : null,
                feedback.sessionId(),
                EmbeddingCodec.formatTimestamp(timestamp));
            return true;
        } catch (Exception e) {
            log.error("Failed to record feedback for {}: {}", feedback.agentStrategy(), e.getMessage());
            return false;
        }
    }

    /**
     * Number of feedback rows stored for one strategy key, accepted or not.
     */
    public int feedbackCount(String agentStrategy) {
        try {
            Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM recommendation_feedback WHERE agent_strategy = ?", Integer.class, agentStrategy);
            return count != null ? count : 0;
        } catch (Exception e) {
            log.error("Failed to count feedback for {}: {}", agentStrategy, e.getMessage());
            return 0;
        }
    }

    /**
     * Delete attempts recorded before {@code cutoff}. The effectiveness summary is not touched
     * until the next rebuild.
     *
     * @return number of deleted attempts, 0 on failure
     */
    public int pruneOlderThan(Instant cutoff) {
        try {
            int deleted = jdbcTemplate.update("DELETE FROM fix_attempts WHERE timestamp < ?",
                EmbeddingCodec.formatTimestamp(cutoff));
            log.info("Pruned {} fix attempts older than {}", deleted, cutoff);
            return deleted;
        } catch (Exception e) {
            log.error("Failed to prune fix attempts older than {}: {}", cutoff, e.getMessage());
            return 0;
        }
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            dataSource.close();
            log.info("Attempt store at {} closed", databasePath);
        }
    }

    private FixAttempt mapAttempt(ResultSet rs) throws SQLException {
        String sparseJson = rs.getString("tfidf_vector");
        EmbeddingVector embedding = sparseJson != null
            ? codec.decodeSparse(sparseJson)
            : codec.decodeDense(rs.getBytes("issue_embedding"));

        return FixAttempt.builder()
            .id(rs.getLong("id"))
            .issueType(IssueType.fromString(rs.getString("issue_type")))
            .issueMessage(rs.getString("issue_message"))
            .filePath(rs.getString("file_path"))
            .stage(rs.getString("stage"))
            .embedding(embedding)
            .agentUsed(rs.getString("agent_used"))
            .strategy(rs.getString("strategy"))
            .success(rs.getBoolean("success"))
            .confidence(rs.getDouble("confidence"))
            .timestamp(EmbeddingCodec.parseTimestamp(rs.getString("timestamp")))
            .sessionId(rs.getString("session_id"))
            .build();
    }

    private static StrategyEffectivenessSummary mapSummary(ResultSet rs) throws SQLException {
        return new StrategyEffectivenessSummary(
            rs.getString("agent_strategy"),
            rs.getInt("total_attempts"),
            rs.getInt("successful_attempts"),
            rs.getDouble("success_rate"),
            EmbeddingCodec.parseTimestamp(rs.getString("last_attempted")),
            EmbeddingCodec.parseTimestamp(rs.getString("last_successful")));
    }

    private static void createParentDirectories(Path databasePath) {
        Path parent = databasePath.getParent();
        if (parent == null) {
            return;
        }
        try {
            Files.createDirectories(parent);
        } catch (IOException e) {
            log.error("Could not create directory {} for the attempt store: {}", parent, e.getMessage());
        }
    }

    private static HikariDataSource createDataSource(Path databasePath, int maxPoolSize, int busyTimeoutMillis) {
        SQLiteConfig sqliteConfig = new SQLiteConfig();
        sqliteConfig.setJournalMode(SQLiteConfig.JournalMode.WAL);
        sqliteConfig.setSynchronous(SQLiteConfig.SynchronousMode.NORMAL);
        sqliteConfig.setBusyTimeout(busyTimeoutMillis);

        SQLiteDataSource sqliteDataSource = new SQLiteDataSource(sqliteConfig);
        sqliteDataSource.setUrl("jdbc:sqlite:" + databasePath);

        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setPoolName("fix-strategy-store");
        hikariConfig.setDataSource(sqliteDataSource);
        hikariConfig.setMaximumPoolSize(Math.max(1, maxPoolSize));
        hikariConfig.setMinimumIdle(1);
        // Open lazily so an unreachable file degrades operations instead of failing construction
        hikariConfig.setInitializationFailTimeout(-1);
        return new HikariDataSource(hikariConfig);
    }
}

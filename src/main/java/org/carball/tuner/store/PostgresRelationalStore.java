package org.carball.tuner.store;

import lombok.extern.slf4j.Slf4j;
import org.carball.tuner.model.index.IndexDescriptor;
import org.carball.tuner.model.index.TableScanStats;
import org.carball.tuner.model.query.BufferStats;
import org.carball.tuner.model.query.SlowQueryRecord;
import org.carball.tuner.model.query.StoreKind;

import java.sql.*;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reads pg_stat_statements, pg_stat_user_tables and pg_stat_user_indexes over JDBC.
 */
@Slf4j
public class PostgresRelationalStore implements RelationalStore {

    private static final String ENABLE_STATISTICS_EXTENSION = "CREATE EXTENSION IF NOT EXISTS pg_stat_statements";

    private static final String SLOW_STATEMENTS = """
        SELECT
            query,
            calls,
            total_exec_time,
            mean_exec_time,
            rows,
            shared_blks_hit,
            shared_blks_read,
            shared_blks_dirtied,
            shared_blks_written,
            temp_blks_read,
            temp_blks_written
        FROM pg_stat_statements
        WHERE total_exec_time > ?
          AND query NOT LIKE '%pg_stat_statements%'
        ORDER BY total_exec_time DESC
        LIMIT ?
    """;

    private static final String SEQUENTIAL_SCAN_HOTSPOTS = """
        SELECT
            t.relname AS table_name,
            a.attname AS column_name,
            t.n_live_tup,
            t.seq_scan,
            COALESCE(t.idx_scan, 0) AS idx_scan
        FROM pg_stat_user_tables t
        JOIN pg_attribute a ON t.relid = a.attrelid
        WHERE a.attnum > 0 AND NOT a.attisdropped
          AND t.seq_scan > ?
          AND COALESCE(t.idx_scan, 0) < t.seq_scan
          AND t.n_live_tup > ?
        ORDER BY t.seq_scan DESC, a.attnum
        LIMIT ?
    """;

    private static final String USER_INDEXES = """
        SELECT
            s.relname AS table_name,
            s.indexrelname AS index_name,
            s.idx_scan,
            pg_relation_size(s.indexrelid) AS index_size_bytes,
            i.indisunique,
            i.indisprimary,
            t.n_live_tup,
            array_agg(a.attname::text ORDER BY array_position(i.indkey::int2[], a.attnum))
                FILTER (WHERE a.attname IS NOT NULL) AS columns
        FROM pg_stat_user_indexes s
        JOIN pg_index i ON i.indexrelid = s.indexrelid
        JOIN pg_stat_user_tables t ON t.relid = s.relid
        LEFT JOIN pg_attribute a ON a.attrelid = i.indrelid AND a.attnum > 0 AND a.attnum = ANY(i.indkey)
        GROUP BY s.relname, s.indexrelname, s.idx_scan, s.indexrelid, i.indisunique, i.indisprimary, t.n_live_tup
        ORDER BY s.relname, s.indexrelname
    """;

    private static final String DATABASE_METRICS = """
        SELECT
            (SELECT count(*) FROM pg_stat_activity) AS active_connections,
            (SELECT setting::int FROM pg_settings WHERE name = 'max_connections') AS max_connections,
            (SELECT sum(xact_commit) FROM pg_stat_database) AS transactions_committed,
            (SELECT sum(xact_rollback) FROM pg_stat_database) AS transactions_rolled_back,
            (SELECT sum(blks_read) FROM pg_stat_database) AS blocks_read,
            (SELECT sum(blks_hit) FROM pg_stat_database) AS blocks_hit,
            (SELECT sum(tup_returned) FROM pg_stat_database) AS rows_returned,
            (SELECT sum(tup_fetched) FROM pg_stat_database) AS rows_fetched
    """;

    private static final String CONNECTION_TEST = "SELECT 1 AS connection_test";

    private static final String HEALTH_METRICS = """
        SELECT
            (SELECT count(*) FROM pg_stat_activity) AS active_connections,
            pg_size_pretty(pg_database_size(current_database())) AS database_size,
            (SELECT count(*) FROM information_schema.tables WHERE table_schema = 'public') AS table_count,
            (SELECT setting::int FROM pg_settings WHERE name = 'max_connections') AS max_connections,
            (SELECT count(*) FROM pg_stat_user_tables
              WHERE n_dead_tup > ? OR last_vacuum < NOW() - INTERVAL '1 week') AS tables_needing_vacuum
    """;

    private static final String VACUUM_ANALYZE = "VACUUM ANALYZE";

    private static final long VACUUM_DEAD_TUPLES = 10_000;

    /**
     * Opens JDBC connections; lets tests and pooled setups replace {@link DriverManager}.
     */
    @FunctionalInterface
    public interface ConnectionFactory {
        Connection open() throws SQLException;
    }

    private final ConnectionFactory connectionFactory;
    private final int queryTimeoutSeconds;

    public PostgresRelationalStore(String jdbcUrl, int queryTimeoutSeconds) {
        this(() -> DriverManager.getConnection(jdbcUrl), queryTimeoutSeconds);
    }

    public PostgresRelationalStore(ConnectionFactory connectionFactory, int queryTimeoutSeconds) {
        this.connectionFactory = connectionFactory;
        this.queryTimeoutSeconds = queryTimeoutSeconds;
    }

    @Override
    public void ensureStatisticsExtension() {
        execute(ENABLE_STATISTICS_EXTENSION);
    }

    @Override
    public List<SlowQueryRecord> findSlowStatements(long thresholdMs, int limit) {
        List<SlowQueryRecord> results = new ArrayList<>();

        try (Connection conn = connectionFactory.open();
             PreparedStatement stmt = prepare(conn, SLOW_STATEMENTS)) {
            stmt.setDouble(1, thresholdMs);
            stmt.setInt(2, limit);

            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    BufferStats bufferStats = new BufferStats(
                            rs.getLong("shared_blks_hit"),
                            rs.getLong("shared_blks_read"),
                            rs.getLong("shared_blks_dirtied"),
                            rs.getLong("shared_blks_written"),
                            rs.getLong("temp_blks_read"),
                            rs.getLong("temp_blks_written")
                    );

                    results.add(SlowQueryRecord.relational(
                            rs.getString("query"),
                            rs.getLong("calls"),
                            rs.getDouble("total_exec_time"),
                            rs.getDouble("mean_exec_time"),
                            rs.getLong("rows"),
                            bufferStats
                    ));
                }
            }
        } catch (SQLException e) {
            throw new StoreException(StoreKind.RELATIONAL, "failed to read pg_stat_statements", e);
        }

        log.debug("Read {} slow statements above {} ms", results.size(), thresholdMs);
        return results;
    }

    /**
     * EXPLAIN ANALYZE executes the statement, so it runs in a transaction that is always rolled back.
     */
    @Override
    public String explain(String sql) {
        try (Connection conn = connectionFactory.open()) {
            conn.setAutoCommit(false);
            try (Statement stmt = conn.createStatement()) {
                stmt.setQueryTimeout(queryTimeoutSeconds);

                try (ResultSet rs = stmt.executeQuery("EXPLAIN (ANALYZE, BUFFERS, FORMAT JSON) " + sql)) {
                    StringBuilder plan = new StringBuilder();
                    while (rs.next()) {
                        plan.append(rs.getString(1));
                    }
                    return plan.toString();
                }
            } finally {
                conn.rollback();
            }
        } catch (SQLException e) {
            // The driver message may echo the statement; callers sanitize before logging
            throw new StoreException(StoreKind.RELATIONAL, "EXPLAIN failed: " + e.getMessage(), e);
        }
    }

    @Override
    public List<TableScanStats> findSequentialScanHotspots(long minLiveRows, long minSeqScans, int limit) {
        List<TableScanStats> results = new ArrayList<>();

        try (Connection conn = connectionFactory.open();
             PreparedStatement stmt = prepare(conn, SEQUENTIAL_SCAN_HOTSPOTS)) {
            stmt.setLong(1, minSeqScans);
            stmt.setLong(2, minLiveRows);
            stmt.setInt(3, limit);

            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    results.add(new TableScanStats(
                            rs.getString("table_name"),
                            rs.getString("column_name"),
                            rs.getLong("n_live_tup"),
                            rs.getLong("seq_scan"),
                            rs.getLong("idx_scan")
                    ));
                }
            }
        } catch (SQLException e) {
            throw new StoreException(StoreKind.RELATIONAL, "failed to read table scan statistics", e);
        }

        return results;
    }

    @Override
    public List<IndexDescriptor> findIndexes() {
        List<IndexDescriptor> results = new ArrayList<>();

        try (Connection conn = connectionFactory.open();
             PreparedStatement stmt = prepare(conn, USER_INDEXES);
             ResultSet rs = stmt.executeQuery()) {

            while (rs.next()) {
                results.add(IndexDescriptor.builder()
                        .store(StoreKind.RELATIONAL)
                        .owner(rs.getString("table_name"))
                        .name(rs.getString("index_name"))
                        .columns(readColumns(rs.getArray("columns")))
                        .scanCount(rs.getLong("idx_scan"))
                        .sizeBytes(rs.getLong("index_size_bytes"))
                        .unique(rs.getBoolean("indisunique"))
                        .primary(rs.getBoolean("indisprimary"))
                        .ownerRowCount(rs.getLong("n_live_tup"))
                        .build());
            }
        } catch (SQLException e) {
            throw new StoreException(StoreKind.RELATIONAL, "failed to read index statistics", e);
        }

        return results;
    }

    @Override
    public void execute(String ddl) {
        try (Connection conn = connectionFactory.open();
             Statement stmt = conn.createStatement()) {
            stmt.setQueryTimeout(queryTimeoutSeconds);
            stmt.execute(ddl);
        } catch (SQLException e) {
            throw new StoreException(StoreKind.RELATIONAL, e.getMessage(), e);
        }
    }

    @Override
    public void vacuumAnalyze() {
        // Autocommit, without the per-call query timeout
        try (Connection conn = connectionFactory.open();
             Statement stmt = conn.createStatement()) {
            stmt.execute(VACUUM_ANALYZE);
        } catch (SQLException e) {
            throw new StoreException(StoreKind.RELATIONAL, "VACUUM ANALYZE failed: " + e.getMessage(), e);
        }
    }

    @Override
    public Map<String, Object> healthCheck() {
        Map<String, Object> health = new LinkedHashMap<>();

        try (Connection conn = connectionFactory.open()) {
            try (PreparedStatement stmt = prepare(conn, CONNECTION_TEST);
                 ResultSet rs = stmt.executeQuery()) {
                rs.next();
            }

            try (PreparedStatement stmt = prepare(conn, HEALTH_METRICS)) {
                stmt.setLong(1, VACUUM_DEAD_TUPLES);
                try (ResultSet rs = stmt.executeQuery()) {
                    if (rs.next()) {
                        health.put("active_connections", rs.getLong("active_connections"));
                        health.put("database_size", rs.getString("database_size"));
                        health.put("table_count", rs.getLong("table_count"));
                        health.put("max_connections", rs.getLong("max_connections"));
                        health.put("tables_needing_vacuum", rs.getLong("tables_needing_vacuum"));
                    }
                }
            }
        } catch (SQLException e) {
            throw new StoreException(StoreKind.RELATIONAL, "health check failed: " + e.getMessage(), e);
        }

        long active = asLong(health.get("active_connections"));
        long max = asLong(health.get("max_connections"));
        if (max > 0) {
            health.put("connection_utilization", Math.round(active * 100.0 / max) + "%");
        }

        return health;
    }

    @Override
    public Map<String, Object> collectMetrics() {
        Map<String, Object> metrics = new LinkedHashMap<>();

        try (Connection conn = connectionFactory.open();
             PreparedStatement stmt = prepare(conn, DATABASE_METRICS);
             ResultSet rs = stmt.executeQuery()) {

            if (rs.next()) {
                ResultSetMetaData meta = rs.getMetaData();
                for (int i = 1; i <= meta.getColumnCount(); i++) {
                    metrics.put(meta.getColumnLabel(i), rs.getObject(i));
                }
            }
        } catch (SQLException e) {
            throw new StoreException(StoreKind.RELATIONAL, "failed to read database metrics", e);
        }

        long blocksRead = asLong(metrics.get("blocks_read"));
        long blocksHit = asLong(metrics.get("blocks_hit"));
        if (blocksRead > 0 || blocksHit > 0) {
            metrics.put("cache_hit_ratio", (double) blocksHit / (blocksHit + blocksRead));
        }

        return metrics;
    }

    @Override
    public void close() {
        // Connections are opened per call
    }

    private PreparedStatement prepare(Connection conn, String sql) throws SQLException {
        PreparedStatement stmt = conn.prepareStatement(sql);
        stmt.setQueryTimeout(queryTimeoutSeconds);
        return stmt;
    }

    private static List<String> readColumns(Array array) throws SQLException {
        if (array == null) {
            return List.of();
        }
        Object[] values = (Object[]) array.getArray();
        // Expression index keys have no column name
        return Arrays.stream(values).filter(Objects::nonNull).map(String::valueOf).toList();
    }

    private static long asLong(Object value) {
        return value instanceof Number number ? number.longValue() : 0L;
    }
}

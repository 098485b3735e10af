package org.carball.tuner.store;

import org.carball.tuner.model.index.IndexDescriptor;
import org.carball.tuner.model.index.TableScanStats;
import org.carball.tuner.model.query.SlowQueryRecord;

import java.util.List;
import java.util.Map;

/**
 * Read access to the instrumentation of a relational database. Every method throws
 * {@link StoreException} when the database call fails or times out.
 */
public interface RelationalStore extends AutoCloseable {

    /**
     * Enables the statement statistics extension when it is absent. Safe to call on every run.
     */
    void ensureStatisticsExtension();

    /**
     * Statements whose total execution time exceeds {@code thresholdMs}, worst first.
     */
    List<SlowQueryRecord> findSlowStatements(long thresholdMs, int limit);

    /**
     * Raw JSON output of {@code EXPLAIN (ANALYZE, BUFFERS, FORMAT JSON)} for the statement.
     */
    String explain(String sql);

    /**
     * Per-column scan counters of tables where sequential scans outnumber index scans.
     */
    List<TableScanStats> findSequentialScanHotspots(long minLiveRows, long minSeqScans, int limit);

    /**
     * All user indexes with their ordered columns and usage counters.
     */
    List<IndexDescriptor> findIndexes();

    /**
     * Runs a DDL statement produced by the index advisor.
     */
    void execute(String ddl);

    /**
     * Runs {@code VACUUM ANALYZE} on the whole database.
     */
    void vacuumAnalyze();

    /**
     * Tests the connection and reads size, connection usage and the number of tables needing vacuum.
     */
    Map<String, Object> healthCheck();

    Map<String, Object> collectMetrics();

    @Override
    void close();
}

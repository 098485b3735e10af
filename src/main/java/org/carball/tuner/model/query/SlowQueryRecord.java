package org.carball.tuner.model.query;

/**
 * A slow operation as captured from a store's own instrumentation. The raw text may contain
 * personal data and is only ever held in memory.
 *
 * @param source       namespace the operation ran against for documents, {@code null} for SQL
 * @param bufferStats  relational buffer counters, {@code null} for documents
 * @param operationStats document profiler details, {@code null} for relational statements
 */
public record SlowQueryRecord(
        StoreKind storeKind,
        String rawText,
        String source,
        long callCount,
        double totalTime,
        double meanTime,
        long rowsAffected,
        BufferStats bufferStats,
        OperationStats operationStats
) {

    public static SlowQueryRecord relational(String sql, long calls, double totalTime, double meanTime,
                                             long rows, BufferStats bufferStats) {
        return new SlowQueryRecord(StoreKind.RELATIONAL, sql, null, calls, totalTime, meanTime, rows,
                bufferStats, null);
    }

    public static SlowQueryRecord document(String command, String namespace, double millis,
                                           OperationStats operationStats) {
        return new SlowQueryRecord(StoreKind.DOCUMENT, command, namespace, 1, millis, millis,
                operationStats.documentsReturned(), null, operationStats);
    }
}

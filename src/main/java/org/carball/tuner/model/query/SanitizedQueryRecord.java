package org.carball.tuner.model.query;

/**
 * The persistable form of a {@link SlowQueryRecord}: identical metrics, redacted text.
 * Instances are created by {@link org.carball.tuner.sanitize.QuerySanitizer} only.
 */
public record SanitizedQueryRecord(
        StoreKind storeKind,
        String queryText,
        String source,
        long callCount,
        double totalTime,
        double meanTime,
        long rowsAffected,
        BufferStats bufferStats,
        OperationStats operationStats
) {}

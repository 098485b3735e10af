package org.carball.tuner.model.query;

/**
 * Shared and temp buffer counters reported by pg_stat_statements for one statement.
 */
public record BufferStats(
        long sharedBlocksHit,
        long sharedBlocksRead,
        long sharedBlocksDirtied,
        long sharedBlocksWritten,
        long tempBlocksRead,
        long tempBlocksWritten
) {

    public double cacheHitRatio() {
        long total = sharedBlocksHit + sharedBlocksRead;
        return total == 0 ? 1.0 : (double) sharedBlocksHit / total;
    }
}

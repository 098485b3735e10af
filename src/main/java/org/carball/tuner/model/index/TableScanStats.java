package org.carball.tuner.model.index;

/**
 * Scan counters of a table, reported once per column so that a candidate index can be named.
 */
public record TableScanStats(String table, String column, long liveRows, long seqScans, long indexScans) {

    public boolean sequentialScansDominate() {
        return indexScans < seqScans;
    }
}

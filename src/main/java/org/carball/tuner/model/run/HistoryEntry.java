package org.carball.tuner.model.run;

import java.time.Instant;

/**
 * One entry of the rolling optimization history.
 */
public record HistoryEntry(Instant timestamp, String action, Object details) {

    public static final String OPTIMIZATION_RUN = "optimization_run";
    public static final String VACUUM_ANALYZE = "vacuum_analyze";
}

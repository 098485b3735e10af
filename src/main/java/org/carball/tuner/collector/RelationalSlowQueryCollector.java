package org.carball.tuner.collector;

import lombok.extern.slf4j.Slf4j;
import org.carball.tuner.model.query.SlowQueryRecord;
import org.carball.tuner.model.query.StoreKind;
import org.carball.tuner.store.RelationalStore;
import org.carball.tuner.store.StoreException;

import java.util.Comparator;
import java.util.List;

@Slf4j
public class RelationalSlowQueryCollector implements SlowQueryCollector {

    private final RelationalStore store;
    private final long thresholdMs;
    private final int limit;

    public RelationalSlowQueryCollector(RelationalStore store, long thresholdMs, int limit) {
        this.store = store;
        this.thresholdMs = thresholdMs;
        this.limit = limit;
    }

    @Override
    public StoreKind storeKind() {
        return StoreKind.RELATIONAL;
    }

    @Override
    public List<SlowQueryRecord> collect() {
        try {
            store.ensureStatisticsExtension();
        } catch (StoreException e) {
            // Statistics may still be readable when the extension exists but CREATE is not permitted
            log.warn("Could not enable pg_stat_statements: {}", e.getMessage());
        }

        try {
            List<SlowQueryRecord> records = store.findSlowStatements(thresholdMs, limit).stream()
                    .sorted(Comparator.comparingDouble(SlowQueryRecord::totalTime).reversed())
                    .limit(limit)
                    .toList();
            log.info("Found {} slow {} queries", records.size(), storeKind().getDisplayName());
            return records;
        } catch (StoreException e) {
            log.error("Error collecting {} slow queries: {}", storeKind().getDisplayName(), e.getMessage());
            return List.of();
        }
    }
}

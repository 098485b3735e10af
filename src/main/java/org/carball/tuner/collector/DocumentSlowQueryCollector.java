package org.carball.tuner.collector;

import lombok.extern.slf4j.Slf4j;
import org.carball.tuner.model.query.SlowQueryRecord;
import org.carball.tuner.model.query.StoreKind;
import org.carball.tuner.store.DocumentStore;
import org.carball.tuner.store.StoreException;

import java.util.Comparator;
import java.util.List;

/**
 * Reads the profiler collection. Only operations the server chose to profile are visible, so the
 * profiling level and slow threshold of the monitored database decide what is collected.
 */
@Slf4j
public class DocumentSlowQueryCollector implements SlowQueryCollector {

    private final DocumentStore store;
    private final int limit;

    public DocumentSlowQueryCollector(DocumentStore store, int limit) {
        this.store = store;
        this.limit = limit;
    }

    @Override
    public StoreKind storeKind() {
        return StoreKind.DOCUMENT;
    }

    @Override
    public List<SlowQueryRecord> collect() {
        try {
            List<SlowQueryRecord> records = store.findSlowOperations(limit).stream()
                    .sorted(Comparator.comparingDouble(SlowQueryRecord::totalTime).reversed())
                    .limit(limit)
                    .toList();
            log.info("Found {} slow {} operations in {}", records.size(), storeKind().getDisplayName(),
                    store.databaseName());
            return records;
        } catch (StoreException e) {
            log.error("Error collecting {} slow operations: {}", storeKind().getDisplayName(), e.getMessage());
            return List.of();
        }
    }
}

package org.carball.tuner.collector;

import org.carball.tuner.model.query.SlowQueryRecord;
import org.carball.tuner.model.query.StoreKind;

import java.util.List;

/**
 * Fetches the worst slow operations from one store's own instrumentation.
 *
 * <p>Collectors are read-only and never throw: an unreachable store yields whatever was gathered
 * before the failure, usually nothing.
 */
public interface SlowQueryCollector {

    StoreKind storeKind();

    /**
     * Slow operations ranked by total time, worst first, capped at the collector's limit.
     */
    List<SlowQueryRecord> collect();
}

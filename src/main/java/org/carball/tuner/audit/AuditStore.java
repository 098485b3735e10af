package org.carball.tuner.audit;

import com.fasterxml.jackson.databind.JsonNode;
import org.carball.tuner.model.plan.PlanSnapshot;
import org.carball.tuner.model.query.SlowQueryRecord;
import org.carball.tuner.model.query.StoreKind;
import org.carball.tuner.model.run.OptimizationRun;

import java.util.List;
import java.util.Optional;

/**
 * Bounded, sanitized history of optimization runs, slow-query captures and plan snapshots.
 *
 * <p>Implementations redact query text on every write, whatever the caller passes in, and keep
 * at most the configured number of entries per log, evicting the oldest first. Write failures
 * surface as {@link PersistenceException}.
 */
public interface AuditStore {

    /**
     * Appends one {@code optimization_run} entry to the history log.
     */
    void appendRun(OptimizationRun run);

    /**
     * Appends one entry with the given action name to the history log.
     */
    void appendHistory(String action, Object details);

    /**
     * Appends one entry holding the sanitized form of {@code records} to the slow-query log.
     */
    void appendQueryLog(StoreKind storeKind, List<SlowQueryRecord> records);

    Optional<PlanSnapshot> getLatestSnapshot(String fingerprint);

    /**
     * Replaces the stored snapshot of {@code fingerprint}.
     */
    void putSnapshot(String fingerprint, PlanSnapshot snapshot);

    List<JsonNode> readRunLog();

    List<JsonNode> readQueryLog();
}

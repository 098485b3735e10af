package org.carball.tuner.orchestrator;

import lombok.extern.slf4j.Slf4j;
import org.carball.tuner.alert.AlertDispatcher;
import org.carball.tuner.analyzer.DocumentProfileAnalyzer;
import org.carball.tuner.analyzer.IndexAdvice;
import org.carball.tuner.analyzer.IndexAdvisor;
import org.carball.tuner.analyzer.PlanCaptureService;
import org.carball.tuner.audit.AuditStore;
import org.carball.tuner.collector.DocumentSlowQueryCollector;
import org.carball.tuner.collector.RelationalSlowQueryCollector;
import org.carball.tuner.collector.SlowQueryCollector;
import org.carball.tuner.config.AdvisorThresholds;
import org.carball.tuner.config.TunerConfig;
import org.carball.tuner.model.plan.PlanMetrics;
import org.carball.tuner.model.query.SanitizedQueryRecord;
import org.carball.tuner.model.query.SlowQueryRecord;
import org.carball.tuner.model.query.StoreKind;
import org.carball.tuner.model.recommendation.MaintenanceAction;
import org.carball.tuner.model.run.HistoryEntry;
import org.carball.tuner.model.run.OptimizationRun;
import org.carball.tuner.model.run.QueryAnalysis;
import org.carball.tuner.model.run.RunState;
import org.carball.tuner.model.run.StoreHealth;
import org.carball.tuner.output.OptimizationReport;
import org.carball.tuner.parser.StatementInspector;
import org.carball.tuner.sanitize.QuerySanitizer;
import org.carball.tuner.store.DocumentStore;
import org.carball.tuner.store.RelationalStore;

import java.time.Instant;
import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Runs one optimization cycle: collect, sanitize, analyze plans, detect regressions, advise on
 * indexes, check store health, persist and alert.
 *
 * <p>At most one cycle runs at a time. A trigger arriving while a cycle is running is skipped,
 * not queued. Sub-step failures are logged and recorded on the run; the remaining steps still run.
 */
@Slf4j
public class OptimizationOrchestrator {

    private static final int PREVIEW_LENGTH = 150;

    private final RelationalStore relationalStore;
    private final DocumentStore documentStore;
    private final AuditStore auditStore;
    private final AlertDispatcher alertDispatcher;
    private final boolean executeRecommendations;

    private final List<SlowQueryCollector> collectors = new ArrayList<>();
    private final PlanCaptureService planCapture;
    private final DocumentProfileAnalyzer documentAnalyzer;
    private final IndexAdvisor indexAdvisor;

    private final AtomicReference<RunState> state = new AtomicReference<>(RunState.IDLE);

    /**
     * @param relationalStore relational gateway, or {@code null} when no relational store is monitored
     * @param documentStore   document gateway, or {@code null} when no document store is monitored
     */
    public OptimizationOrchestrator(RelationalStore relationalStore, DocumentStore documentStore,
                                    AuditStore auditStore, AlertDispatcher alertDispatcher, TunerConfig config) {
        this.relationalStore = relationalStore;
        this.documentStore = documentStore;
        this.auditStore = auditStore;
        this.alertDispatcher = alertDispatcher;
        this.executeRecommendations = config.isExecuteRecommendations();

        AdvisorThresholds thresholds = config.getThresholds() != null
                ? config.getThresholds() : AdvisorThresholds.defaults();

        if (relationalStore != null) {
            collectors.add(new RelationalSlowQueryCollector(relationalStore, config.getSlowQueryThresholdMs(),
                    thresholds.getSlowQueryLimit()));
        }
        if (documentStore != null) {
            collectors.add(new DocumentSlowQueryCollector(documentStore, thresholds.getSlowQueryLimit()));
        }

        this.planCapture = relationalStore != null
                ? new PlanCaptureService(relationalStore, auditStore, thresholds) : null;
        this.documentAnalyzer = new DocumentProfileAnalyzer(thresholds);
        this.indexAdvisor = new IndexAdvisor(relationalStore, documentStore, thresholds);

        log.info("Initialized orchestrator with {} collectors (execute recommendations: {})",
                collectors.size(), executeRecommendations);
    }

    public RunState getState() {
        return state.get();
    }

    /**
     * Runs a full cycle unless one is already running.
     *
     * @return the finished run, or empty when the trigger was skipped
     */
    public Optional<OptimizationRun> runOnce() {
        if (!state.compareAndSet(RunState.IDLE, RunState.RUNNING)) {
            log.warn("Optimization run already in progress, skipping trigger");
            return Optional.empty();
        }

        try {
            return Optional.of(execute());
        } finally {
            state.set(RunState.IDLE);
        }
    }

    private OptimizationRun execute() {
        long startTime = System.currentTimeMillis();
        log.info("Starting database optimization run");

        OptimizationRun run = OptimizationRun.builder()
                .timestamp(Instant.now())
                .executeRecommendations(executeRecommendations)
                .build();

        // Step 1: Collect from both stores in parallel
        Map<StoreKind, List<SlowQueryRecord>> collected = collect(run.getErrors());
        List<SlowQueryRecord> relational = collected.getOrDefault(StoreKind.RELATIONAL, List.of());
        List<SlowQueryRecord> document = collected.getOrDefault(StoreKind.DOCUMENT, List.of());

        // Step 2: Sanitize before anything is kept on the run
        run.setRelationalSlowQueries(sanitize(relational));
        run.setDocumentSlowQueries(sanitize(document));

        // Step 3: Plan analysis and regression detection
        if (planCapture != null && !relational.isEmpty()) {
            step("plan analysis", run, () -> run.getQueryAnalyses().addAll(
                    planCapture.capture(relational, run.getErrors())));
        }

        // Step 4: Document profile analysis
        step("document profile analysis", run, () -> run.getDocumentSlowQueries()
                .forEach(record -> run.getQueryAnalyses().add(analyzeDocumentOperation(record))));

        // Step 5: Index advisor
        step("index advisor", run, () -> {
            IndexAdvice advice = indexAdvisor.advise(executeRecommendations);
            run.getRecommendations().addAll(advice.recommendations());
            run.getIndexActions().addAll(advice.actions());
            run.getErrors().addAll(advice.errors());
        });

        // Step 6: Maintenance, only when recommendations are executed
        if (executeRecommendations && relationalStore != null) {
            run.getMaintenanceActions().add(vacuumAnalyze());
        }

        // Step 7: Database metrics and health
        if (relationalStore != null) {
            step("relational metrics", run, () -> run.getMetrics().put(metricsKey(StoreKind.RELATIONAL),
                    relationalStore.collectMetrics()));
        }
        if (documentStore != null) {
            step("document metrics", run, () -> run.getMetrics().put(metricsKey(StoreKind.DOCUMENT),
                    documentStore.collectMetrics()));
        }
        run.getHealth().put(metricsKey(StoreKind.RELATIONAL), checkHealth(StoreKind.RELATIONAL,
                relationalStore != null ? relationalStore::healthCheck : null));
        run.getHealth().put(metricsKey(StoreKind.DOCUMENT), checkHealth(StoreKind.DOCUMENT,
                documentStore != null ? documentStore::healthCheck : null));

        run.getAlerts().addAll(summarizeFindings(run));

        // Step 8: Persist
        for (SlowQueryCollector collector : collectors) {
            StoreKind kind = collector.storeKind();
            step(kind.getDisplayName() + " query log", run,
                    () -> auditStore.appendQueryLog(kind, collected.getOrDefault(kind, List.of())));
        }
        for (MaintenanceAction action : run.getMaintenanceActions()) {
            step("maintenance history", run, () -> auditStore.appendHistory(HistoryEntry.VACUUM_ANALYZE, action));
        }
        step("history log", run, () -> auditStore.appendRun(run));

        // Step 9: Alert
        if (run.hasAnomalies()) {
            OptimizationReport report = new OptimizationReport(run);
            try {
                alertDispatcher.dispatch(report.getAlertSubject(), report.toAlertBody());
            } catch (RuntimeException e) {
                log.error("Failed to dispatch optimization alert: {}", e.getMessage());
            }
        }

        long duration = System.currentTimeMillis() - startTime;
        log.info("Optimization run completed in {} ms: {} slow queries, {} regressions, {} recommendations, {} errors",
                duration, run.getSlowQueryCount(), run.getRegressions().size(),
                run.getRecommendations().size(), run.getErrors().size());
        return run;
    }

    private Map<StoreKind, List<SlowQueryRecord>> collect(List<String> errors) {
        Map<StoreKind, List<SlowQueryRecord>> results = new EnumMap<>(StoreKind.class);
        if (collectors.isEmpty()) {
            log.warn("No data store configured, nothing to collect");
            return results;
        }

        ExecutorService executor = Executors.newFixedThreadPool(collectors.size());
        try {
            Map<StoreKind, CompletableFuture<List<SlowQueryRecord>>> futures = new EnumMap<>(StoreKind.class);
            for (SlowQueryCollector collector : collectors) {
                futures.put(collector.storeKind(), CompletableFuture.supplyAsync(collector::collect, executor));
            }

            futures.forEach((kind, future) -> {
                try {
                    results.put(kind, future.join());
                } catch (CompletionException e) {
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    log.error("Error collecting {} slow queries: {}", kind.getDisplayName(), cause.getMessage());
                    errors.add(kind.getDisplayName() + " collection: " + cause.getMessage());
                    results.put(kind, List.of());
                }
            });
        } finally {
            executor.shutdown();
        }
        return results;
    }

    private MaintenanceAction vacuumAnalyze() {
        String command = "VACUUM ANALYZE";
        log.info("Running {} on {}", command, StoreKind.RELATIONAL.getDisplayName());
        try {
            relationalStore.vacuumAnalyze();
            log.info("{} completed successfully", command);
            return MaintenanceAction.completed(command);
        } catch (RuntimeException e) {
            String message = QuerySanitizer.sanitize(e.getMessage());
            log.error("Error running {}: {}", command, message);
            return MaintenanceAction.failed(command, message);
        }
    }

    private static StoreHealth checkHealth(StoreKind kind, Supplier<Map<String, Object>> healthCheck) {
        if (healthCheck == null) {
            return StoreHealth.notConnected("No " + kind.getDisplayName() + " store configured");
        }
        try {
            return StoreHealth.connected(healthCheck.get());
        } catch (RuntimeException e) {
            String message = QuerySanitizer.sanitize(e.getMessage());
            log.error("{} health check failed: {}", kind.getDisplayName(), message);
            return StoreHealth.error(message);
        }
    }

    private QueryAnalysis analyzeDocumentOperation(SanitizedQueryRecord record) {
        List<String> recommendations = documentAnalyzer.analyze(record);
        return QueryAnalysis.builder()
                .storeKind(StoreKind.DOCUMENT)
                .queryFingerprint(StatementInspector.fingerprint(record.queryText()))
                .queryPreview(QuerySanitizer.preview(record.queryText(), PREVIEW_LENGTH))
                .metrics(new PlanMetrics(record.callCount(), record.totalTime(), record.meanTime(),
                        record.rowsAffected()))
                .recommendations(recommendations)
                .build();
    }

    private static List<SanitizedQueryRecord> sanitize(List<SlowQueryRecord> records) {
        return records.stream()
                .map(QuerySanitizer::sanitize)
                .collect(Collectors.toCollection(ArrayList::new));
    }

    private static List<String> summarizeFindings(OptimizationRun run) {
        List<String> alerts = new ArrayList<>();

        if (!run.getRelationalSlowQueries().isEmpty()) {
            alerts.add(String.format("Found %d slow %s queries",
                    run.getRelationalSlowQueries().size(), StoreKind.RELATIONAL.getDisplayName()));
        }
        if (!run.getDocumentSlowQueries().isEmpty()) {
            alerts.add(String.format("Found %d slow %s operations",
                    run.getDocumentSlowQueries().size(), StoreKind.DOCUMENT.getDisplayName()));
        }
        if (!run.getRegressions().isEmpty()) {
            alerts.add(String.format("Detected %d performance regressions", run.getRegressions().size()));
        }
        if (!run.getRecommendations().isEmpty()) {
            alerts.add(String.format("Index advisor proposed %d index changes", run.getRecommendations().size()));
        }
        run.getHealth().forEach((store, health) -> {
            if (health.status() == StoreHealth.Status.ERROR) {
                alerts.add(String.format("Health check of %s failed", store));
            }
        });
        run.getMaintenanceActions().stream()
                .filter(action -> !action.success())
                .forEach(action -> alerts.add(action.command() + " failed"));

        return alerts;
    }

    private static String metricsKey(StoreKind kind) {
        return kind.getDisplayName().toLowerCase(Locale.ROOT);
    }

    private static void step(String name, OptimizationRun run, Runnable action) {
        try {
            action.run();
        } catch (RuntimeException e) {
            String message = QuerySanitizer.sanitize(e.getMessage());
            log.error("Optimization step '{}' failed: {}", name, message);
            run.getErrors().add(name + ": " + message);
        }
    }
}

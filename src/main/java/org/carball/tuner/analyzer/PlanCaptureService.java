package org.carball.tuner.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.tuner.audit.AuditStore;
import org.carball.tuner.config.AdvisorThresholds;
import org.carball.tuner.model.plan.PlanIssue;
import org.carball.tuner.model.plan.PlanMetrics;
import org.carball.tuner.model.plan.PlanSnapshot;
import org.carball.tuner.model.query.SlowQueryRecord;
import org.carball.tuner.model.query.StoreKind;
import org.carball.tuner.model.regression.Regression;
import org.carball.tuner.model.run.QueryAnalysis;
import org.carball.tuner.parser.ExplainPlanParser;
import org.carball.tuner.parser.StatementInspector;
import org.carball.tuner.sanitize.QuerySanitizer;
import org.carball.tuner.store.RelationalStore;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Captures the execution plan of the worst explainable relational statements, analyzes it and
 * compares it with the snapshot kept from the previous capture of the same statement.
 *
 * <p>The stored snapshot is replaced only after the comparison. A statement whose plan cannot be
 * captured or parsed is skipped; the others are still analyzed.
 */
@Slf4j
public class PlanCaptureService {

    private static final int PREVIEW_LENGTH = 150;

    private final RelationalStore relationalStore;
    private final AuditStore auditStore;
    private final ExplainPlanParser planParser;
    private final PlanTreeAnalyzer planAnalyzer;
    private final RegressionDetector regressionDetector;
    private final int captureLimit;
    private final Clock clock;

    public PlanCaptureService(RelationalStore relationalStore, AuditStore auditStore, AdvisorThresholds thresholds) {
        this(relationalStore, auditStore, new ExplainPlanParser(), new PlanTreeAnalyzer(thresholds),
                new RegressionDetector(thresholds), thresholds.getPlanCaptureLimit(), Clock.systemUTC());
    }

    public PlanCaptureService(RelationalStore relationalStore, AuditStore auditStore, ExplainPlanParser planParser,
                              PlanTreeAnalyzer planAnalyzer, RegressionDetector regressionDetector,
                              int captureLimit, Clock clock) {
        this.relationalStore = relationalStore;
        this.auditStore = auditStore;
        this.planParser = planParser;
        this.planAnalyzer = planAnalyzer;
        this.regressionDetector = regressionDetector;
        this.captureLimit = captureLimit;
        this.clock = clock;
    }

    /**
     * Analyzes up to the capture limit of explainable statements, in the order given. Statements with
     * {@code $n} placeholders are skipped without an error line.
     *
     * @param errors receives one line per statement that could not be analyzed
     */
    public List<QueryAnalysis> capture(List<SlowQueryRecord> records, List<String> errors) {
        List<QueryAnalysis> analyses = new ArrayList<>();

        List<SlowQueryRecord> candidates = records.stream()
                .filter(record -> record.storeKind() == StoreKind.RELATIONAL)
                .filter(record -> StatementInspector.canExplain(record.rawText()))
                .filter(PlanCaptureService::hasLiteralParameters)
                .limit(captureLimit)
                .toList();

        log.info("Capturing plans for {} of {} relational slow queries", candidates.size(), records.size());

        for (SlowQueryRecord record : candidates) {
            String fingerprint = StatementInspector.fingerprint(record.rawText());
            try {
                analyses.add(analyze(fingerprint, record, errors));
            } catch (RuntimeException e) {
                // Driver and parser messages may quote the statement
                String message = QuerySanitizer.sanitize(e.getMessage());
                log.warn("Skipping plan analysis of query {}: {}", fingerprint, message);
                errors.add("plan analysis of query " + fingerprint + ": " + message);
            }
        }

        return analyses;
    }

    private static boolean hasLiteralParameters(SlowQueryRecord record) {
        if (StatementInspector.hasPlaceholders(record.rawText())) {
            log.debug("Skipping plan capture of parameterized query {}",
                    StatementInspector.fingerprint(record.rawText()));
            return false;
        }
        return true;
    }

    private QueryAnalysis analyze(String fingerprint, SlowQueryRecord record, List<String> errors) {
        ExplainPlanParser.ParsedPlan plan = planParser.parse(relationalStore.explain(record.rawText()));
        List<PlanIssue> issues = planAnalyzer.analyze(plan.root());

        PlanSnapshot current = PlanSnapshot.builder()
                .queryFingerprint(fingerprint)
                .capturedAt(Instant.now(clock))
                .queryText(QuerySanitizer.sanitize(record.rawText()))
                .executionTimeMs(plan.executionTimeMs())
                .root(plan.root())
                .metrics(new PlanMetrics(record.callCount(), record.totalTime(), record.meanTime(),
                        record.rowsAffected()))
                .build();

        Optional<PlanSnapshot> previous = auditStore.getLatestSnapshot(fingerprint);
        List<Regression> regressions = regressionDetector.detect(previous.orElse(null), current);

        try {
            auditStore.putSnapshot(fingerprint, current);
        } catch (RuntimeException e) {
            log.error("Failed to store plan snapshot of query {}: {}", fingerprint, e.getMessage());
            errors.add("snapshot of query " + fingerprint + ": " + e.getMessage());
        }

        List<String> recommendations = new ArrayList<>();
        issues.forEach(issue -> recommendations.add(issue.getRecommendation()));
        regressions.forEach(regression -> recommendations.add(regression.recommendation()));

        log.debug("Query {}: {} issues, {} regressions{}", fingerprint, issues.size(), regressions.size(),
                previous.isPresent() ? "" : " (first capture)");

        return QueryAnalysis.builder()
                .storeKind(StoreKind.RELATIONAL)
                .queryFingerprint(fingerprint)
                .queryPreview(QuerySanitizer.preview(record.rawText(), PREVIEW_LENGTH))
                .metrics(current.getMetrics())
                .issues(issues)
                .regressions(regressions)
                .recommendations(recommendations)
                .build();
    }
}

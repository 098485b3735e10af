package org.carball.tuner.output;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.carball.tuner.model.query.SanitizedQueryRecord;
import org.carball.tuner.model.recommendation.IndexAction;
import org.carball.tuner.model.recommendation.MaintenanceAction;
import org.carball.tuner.model.recommendation.Recommendation;
import org.carball.tuner.model.regression.Regression;
import org.carball.tuner.model.run.OptimizationRun;
import org.carball.tuner.model.run.QueryAnalysis;
import org.carball.tuner.model.run.StoreHealth;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Renders one run as the JSON report handed to collaborators and as the plain-text alert body.
 */
@Slf4j
public class OptimizationReport {

    public static final String ALERT_SUBJECT = "Database Optimization Alert";

    private final OptimizationRun run;
    private final ObjectMapper objectMapper;

    public OptimizationReport(OptimizationRun run) {
        this.run = run;

        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    public String toJson() {
        try {
            return objectMapper.writeValueAsString(buildReportData());
        } catch (JsonProcessingException e) {
            log.error("Error generating JSON report", e);
            throw new IllegalStateException("Failed to generate JSON report", e);
        }
    }

    public void writeTo(Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(path, toJson());
        log.info("Report written to: {}", path);
    }

    public String getAlertSubject() {
        return ALERT_SUBJECT;
    }

    public String toAlertBody() {
        StringBuilder body = new StringBuilder();

        body.append("Database optimization run at ").append(run.getTimestamp()).append("\n\n");
        body.append("Slow queries: ").append(run.getSlowQueryCount())
                .append(" (relational: ").append(run.getRelationalSlowQueries().size())
                .append(", document: ").append(run.getDocumentSlowQueries().size()).append(")\n");
        body.append("Regressions: ").append(run.getRegressions().size()).append("\n");
        body.append("Index suggestions: ").append(run.getRecommendations().size()).append("\n");

        if (!run.getAlerts().isEmpty()) {
            body.append("\nFindings:\n");
            run.getAlerts().forEach(alert -> body.append("- ").append(alert).append("\n"));
        }

        List<Regression> regressions = run.getRegressions();
        if (!regressions.isEmpty()) {
            body.append("\nRegressions:\n");
            regressions.forEach(regression -> body.append("- ").append(regression.recommendation()).append("\n"));
        }

        if (!run.getRecommendations().isEmpty()) {
            body.append("\nIndex suggestions:\n");
            for (Recommendation recommendation : run.getRecommendations()) {
                body.append("- ").append(recommendation.command()).append("\n");
                body.append("  ").append(recommendation.reason()).append("\n");
            }
        }

        if (!run.getMaintenanceActions().isEmpty()) {
            body.append("\nMaintenance:\n");
            for (MaintenanceAction action : run.getMaintenanceActions()) {
                body.append("- ").append(action.command())
                        .append(action.success() ? ": completed" : ": failed (" + action.error() + ")")
                        .append("\n");
            }
        }

        run.getHealth().forEach((store, health) -> {
            if (health.status() == StoreHealth.Status.ERROR) {
                body.append("\nHealth check of ").append(store).append(" failed: ").append(health.error()).append("\n");
            }
        });

        if (!run.getErrors().isEmpty()) {
            body.append("\nErrors during this run:\n");
            run.getErrors().forEach(error -> body.append("- ").append(error).append("\n"));
        }

        return body.toString();
    }

    private ReportData buildReportData() {
        ReportData report = new ReportData();
        report.setTimestamp(run.getTimestamp());
        report.setSlowQueries(new SlowQueries(run.getRelationalSlowQueries(), run.getDocumentSlowQueries()));
        report.setIndexSuggestions(run.getRecommendations());
        report.setIndexActions(run.getIndexActions());
        report.setExecuteRecommendations(run.isExecuteRecommendations());
        report.setQueryAnalyses(run.getQueryAnalyses());
        report.setMetrics(run.getMetrics());
        report.setHealth(run.getHealth());
        report.setMaintenanceActions(run.getMaintenanceActions().isEmpty() ? null : run.getMaintenanceActions());
        report.setAlerts(run.getAlerts());
        report.setErrors(run.getErrors().isEmpty() ? null : run.getErrors());
        return report;
    }

    // Inner classes for JSON structure
    @lombok.Data
    private static class ReportData {
        private Instant timestamp;
        private SlowQueries slowQueries;
        private List<Recommendation> indexSuggestions;
        private List<IndexAction> indexActions;
        private boolean executeRecommendations;
        private List<QueryAnalysis> queryAnalyses;
        private Map<String, Object> metrics;
        private Map<String, StoreHealth> health;
        private List<MaintenanceAction> maintenanceActions;
        private List<String> alerts;
        private List<String> errors;
    }

    @lombok.Data
    @lombok.AllArgsConstructor
    private static class SlowQueries {
        private List<SanitizedQueryRecord> relational;
        private List<SanitizedQueryRecord> document;
    }
}

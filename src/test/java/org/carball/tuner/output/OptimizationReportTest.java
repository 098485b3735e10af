package org.carball.tuner.output;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.carball.tuner.model.query.SanitizedQueryRecord;
import org.carball.tuner.model.query.StoreKind;
import org.carball.tuner.model.recommendation.IndexAction;
import org.carball.tuner.model.recommendation.MissingIndex;
import org.carball.tuner.model.regression.ExecutionTimeRegression;
import org.carball.tuner.model.run.OptimizationRun;
import org.carball.tuner.model.run.QueryAnalysis;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class OptimizationReportTest {

    private OptimizationRun run;

    @BeforeEach
    void setUp() {
        run = OptimizationRun.builder().timestamp(Instant.parse("2024-04-01T02:00:00Z")).build();
        run.getRelationalSlowQueries().add(new SanitizedQueryRecord(StoreKind.RELATIONAL,
                "SELECT * FROM orders", null, 3, 900, 300, 30, null, null));
        String command = "CREATE INDEX IF NOT EXISTS \"idx_orders_customer_id\" ON \"orders\" (\"customer_id\");";
        run.getRecommendations().add(new MissingIndex(StoreKind.RELATIONAL, "orders", "customer_id",
                "Table has 400 sequential scans vs 3 index scans over 120000 live rows", command));
        run.getIndexActions().add(IndexAction.suggested(command));
        run.getQueryAnalyses().add(QueryAnalysis.builder()
                .storeKind(StoreKind.RELATIONAL)
                .queryFingerprint("0a1b2c3d4e")
                .queryPreview("SELECT * FROM orders")
                .regressions(List.of(new ExecutionTimeRegression(100, 130, 30)))
                .build());
        run.getAlerts().add("Found 1 slow PostgreSQL queries");
    }

    @Test
    void shouldSummarizeRunInAlertBody() {
        // When
        String body = new OptimizationReport(run).toAlertBody();

        // Then
        assertThat(body)
                .contains("Slow queries: 1 (relational: 1, document: 0)")
                .contains("Regressions: 1")
                .contains("Index suggestions: 1")
                .contains("- Found 1 slow PostgreSQL queries")
                .contains("CREATE INDEX IF NOT EXISTS \"idx_orders_customer_id\"")
                .doesNotContain("Errors during this run");
    }

    @Test
    void shouldListErrorsWhenStepsFailed() {
        // Given
        run.getErrors().add("index advisor: PostgreSQL: connection refused");

        // Then
        assertThat(new OptimizationReport(run).toAlertBody())
                .contains("Errors during this run:")
                .contains("- index advisor: PostgreSQL: connection refused");
    }

    @Test
    void shouldRenderTypedJsonReport() throws Exception {
        // When
        JsonNode report = new ObjectMapper().readTree(new OptimizationReport(run).toJson());

        // Then
        assertThat(report.get("timestamp").asText()).isEqualTo("2024-04-01T02:00:00Z");
        assertThat(report.get("slowQueries").get("relational")).hasSize(1);
        assertThat(report.get("slowQueries").get("document")).isEmpty();
        assertThat(report.get("indexSuggestions").get(0).get("kind").asText()).isEqualTo("missing_index");
        assertThat(report.get("indexActions").get(0).get("status").asText()).isEqualTo("SUGGESTED");
        assertThat(report.get("queryAnalyses").get(0).get("regressions").get(0).get("type").asText())
                .isEqualTo("execution_time_regression");
        assertThat(report.has("errors")).isFalse();
    }

    @Test
    void shouldWriteReportFile(@TempDir Path directory) throws Exception {
        // Given
        Path target = directory.resolve("reports").resolve("run.json");

        // When
        new OptimizationReport(run).writeTo(target);

        // Then
        assertThat(target).exists();
        assertThat(Files.readString(target)).contains("\"executeRecommendations\" : false");
    }
}

package org.carball.tuner.audit;

import com.fasterxml.jackson.databind.JsonNode;
import org.carball.tuner.model.plan.PlanMetrics;
import org.carball.tuner.model.plan.PlanNode;
import org.carball.tuner.model.plan.PlanSnapshot;
import org.carball.tuner.model.query.SanitizedQueryRecord;
import org.carball.tuner.model.query.SlowQueryRecord;
import org.carball.tuner.model.query.StoreKind;
import org.carball.tuner.model.recommendation.MaintenanceAction;
import org.carball.tuner.model.run.HistoryEntry;
import org.carball.tuner.model.run.OptimizationRun;
import org.carball.tuner.model.run.QueryAnalysis;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonFileAuditStoreTest {

    @TempDir
    Path directory;

    private JsonFileAuditStore store;

    @BeforeEach
    void setUp() {
        store = new JsonFileAuditStore(directory, 100);
    }

    @Test
    void shouldKeepOnlyMostRecentEntriesInOrder() {
        // Given
        Instant start = Instant.parse("2024-01-01T00:00:00Z");

        // When
        for (int i = 0; i < 150; i++) {
            store.appendRun(OptimizationRun.builder().timestamp(start.plusSeconds(i)).build());
        }

        // Then
        List<JsonNode> entries = store.readRunLog();
        assertThat(entries).hasSize(100);
        assertThat(entries.get(0).get("timestamp").asText()).isEqualTo(start.plusSeconds(50).toString());
        assertThat(entries.get(99).get("timestamp").asText()).isEqualTo(start.plusSeconds(149).toString());
        assertThat(entries).allMatch(entry -> "optimization_run".equals(entry.get("action").asText()));
    }

    @Test
    void shouldKeepOnlyMostRecentQueryLogEntriesInOrder() {
        // When
        for (int i = 0; i < 150; i++) {
            SlowQueryRecord record = SlowQueryRecord.relational("SELECT * FROM events_" + i, 1, 900, 900, 1, null);
            store.appendQueryLog(StoreKind.RELATIONAL, List.of(record));
        }

        // Then
        List<JsonNode> entries = store.readQueryLog();
        assertThat(entries).hasSize(100);
        assertThat(entries.get(0).get("sanitizedQueries").get(0).get("queryText").asText())
                .isEqualTo("SELECT * FROM events_50");
        assertThat(entries.get(99).get("sanitizedQueries").get(0).get("queryText").asText())
                .isEqualTo("SELECT * FROM events_149");
    }

    @Test
    void shouldAppendMaintenanceEntriesToHistoryLog() {
        // When
        store.appendHistory(HistoryEntry.VACUUM_ANALYZE, MaintenanceAction.failed("VACUUM ANALYZE", "permission denied"));

        // Then
        JsonNode entry = store.readRunLog().get(0);
        assertThat(entry.get("action").asText()).isEqualTo("vacuum_analyze");
        assertThat(entry.get("details").get("success").asBoolean()).isFalse();
        assertThat(entry.get("details").get("error").asText()).isEqualTo("permission denied");
    }

    @Test
    void shouldSanitizeQueryLogEntries() throws Exception {
        // Given
        SlowQueryRecord record = SlowQueryRecord.relational(
                "SELECT * FROM users WHERE email = 'ann@shop.com' AND phone = '555-123-4567'", 3, 900, 300, 1, null);

        // When
        store.appendQueryLog(StoreKind.RELATIONAL, List.of(record));

        // Then
        String content = Files.readString(directory.resolve(JsonFileAuditStore.QUERY_LOG_FILE));
        assertThat(content).doesNotContain("ann@shop.com", "555-123-4567");

        JsonNode entry = store.readQueryLog().get(0);
        assertThat(entry.get("storeKind").asText()).isEqualTo("RELATIONAL");
        assertThat(entry.get("sanitizedQueries").get(0).get("queryText").asText())
                .isEqualTo("SELECT * FROM users WHERE email = '[EMAIL]' AND phone = '[PHONE]'");
    }

    @Test
    void shouldRedactTextFieldsOfRunsAtAnyDepth() throws Exception {
        // Given
        OptimizationRun run = OptimizationRun.builder().timestamp(Instant.now()).build();
        run.getQueryAnalyses().add(QueryAnalysis.builder()
                .storeKind(StoreKind.RELATIONAL)
                .queryFingerprint("0a1b2c3d4e")
                .queryPreview("SELECT * FROM users WHERE email = 'leak@corp.io'")
                .build());
        run.getErrors().add("plan analysis failed near 'other@corp.io'");
        run.getRelationalSlowQueries().add(new SanitizedQueryRecord(StoreKind.RELATIONAL,
                "token=abc123", null, 1, 1, 1, 1, null, null));

        // When
        store.appendRun(run);

        // Then
        String content = Files.readString(directory.resolve(JsonFileAuditStore.HISTORY_LOG_FILE));
        assertThat(content).doesNotContain("leak@corp.io", "other@corp.io", "abc123");
        assertThat(content).contains("[EMAIL]", "[REDACTED]");
    }

    @Test
    void shouldRoundTripPlanSnapshots() {
        // Given
        PlanNode scan = PlanNode.builder().nodeType(PlanNode.INDEX_SCAN).relationName("orders")
                .filterExpression("(email = 'x@y.com'::text)").actualRows(3).build();
        PlanNode root = PlanNode.builder().nodeType(PlanNode.NESTED_LOOP).children(List.of(scan)).build();
        PlanSnapshot snapshot = PlanSnapshot.builder()
                .queryFingerprint("0a1b2c3d4e")
                .capturedAt(Instant.parse("2024-02-02T02:00:00Z"))
                .queryText("SELECT * FROM orders WHERE email = 'x@y.com'")
                .executionTimeMs(12.5)
                .root(root)
                .metrics(new PlanMetrics(4, 50, 12.5, 3))
                .build();

        // When
        store.putSnapshot("0a1b2c3d4e", snapshot);
        Optional<PlanSnapshot> loaded = store.getLatestSnapshot("0a1b2c3d4e");

        // Then
        assertThat(loaded).isPresent();
        assertThat(loaded.get().getRoot().flattenNodeTypes()).containsExactly("Nested Loop", "Index Scan");
        assertThat(loaded.get().getRoot().getChildren().get(0).getFilterExpression())
                .isEqualTo("(email = '[EMAIL]'::text)");
        assertThat(loaded.get().getQueryText()).isEqualTo("SELECT * FROM orders WHERE email = '[EMAIL]'");
        assertThat(loaded.get().getMetrics().meanTime()).isEqualTo(12.5);
        assertThat(directory.resolve("plans").resolve("plan_0a1b2c3d4e.json")).exists();
    }

    @Test
    void shouldReturnEmptyForUnknownOrUnreadableSnapshot() throws Exception {
        // Given
        Files.createDirectories(directory.resolve("plans"));
        Files.writeString(directory.resolve("plans").resolve("plan_ffff.json"), "{ not json");

        // Then
        assertThat(store.getLatestSnapshot("abcd")).isEmpty();
        assertThat(store.getLatestSnapshot("ffff")).isEmpty();
    }

    @Test
    void shouldRejectFingerprintsThatCouldEscapeTheDirectory() {
        assertThatThrownBy(() -> store.getLatestSnapshot("../../etc/passwd"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> store.putSnapshot("ABC", PlanSnapshot.builder().build()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldStartFreshWhenLogIsCorrupt() throws Exception {
        // Given
        Files.writeString(directory.resolve(JsonFileAuditStore.HISTORY_LOG_FILE), "{\"not\": \"an array\"}");

        // When
        store.appendRun(OptimizationRun.builder().timestamp(Instant.now()).build());

        // Then
        assertThat(store.readRunLog()).hasSize(1);
    }

    @Test
    void shouldFailWhenDirectoryCannotBeWritten() throws Exception {
        // Given
        Path file = directory.resolve("occupied");
        Files.writeString(file, "x");
        JsonFileAuditStore blocked = new JsonFileAuditStore(file, 10);

        // Then
        assertThatThrownBy(() -> blocked.appendRun(OptimizationRun.builder().timestamp(Instant.now()).build()))
                .isInstanceOf(PersistenceException.class);
    }

    @Test
    void shouldRejectNonPositiveRetention() {
        assertThatThrownBy(() -> new JsonFileAuditStore(directory, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}

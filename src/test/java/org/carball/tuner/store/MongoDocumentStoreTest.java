package org.carball.tuner.store;

import org.bson.Document;
import org.carball.tuner.model.query.OperationStats;
import org.carball.tuner.model.query.SlowQueryRecord;
import org.carball.tuner.model.query.StoreKind;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class MongoDocumentStoreTest {

    @Test
    void shouldMapProfiledFindWithSort() {
        // Given
        Document entry = new Document("op", "query")
                .append("ns", "appdb.orders")
                .append("millis", 640)
                .append("planSummary", "COLLSCAN")
                .append("docsExamined", 120_000)
                .append("keysExamined", 0)
                .append("nreturned", 20)
                .append("command", new Document("find", "orders")
                        .append("filter", new Document("customerId", 42))
                        .append("sort", new Document("createdAt", -1)));

        // When
        SlowQueryRecord record = MongoDocumentStore.toRecord(entry);

        // Then
        assertThat(record.storeKind()).isEqualTo(StoreKind.DOCUMENT);
        assertThat(record.source()).isEqualTo("appdb.orders");
        assertThat(record.totalTime()).isEqualTo(640.0);
        assertThat(record.rawText()).contains("\"find\": \"orders\"");

        OperationStats stats = record.operationStats();
        assertThat(stats.docsExamined()).isEqualTo(120_000);
        assertThat(stats.documentsReturned()).isEqualTo(20);
        assertThat(stats.hasSort()).isTrue();
        assertThat(stats.aggregation()).isFalse();
        assertThat(stats.usedIndex()).isFalse();
    }

    @Test
    void shouldRecognizeAggregationAndBlockingSortStage() {
        // Given
        Document entry = new Document("op", "command")
                .append("ns", "appdb.events")
                .append("millis", 1200L)
                .append("planSummary", "IXSCAN { type: 1 }")
                .append("hasSortStage", true)
                .append("command", new Document("aggregate", "events").append("pipeline", List.of()));

        // When
        OperationStats stats = MongoDocumentStore.toRecord(entry).operationStats();

        // Then
        assertThat(stats.aggregation()).isTrue();
        assertThat(stats.hasSort()).isTrue();
        assertThat(stats.usedIndex()).isTrue();
    }

    @Test
    void shouldFallBackToLegacyQueryField() {
        // Given
        Document entry = new Document("op", "query")
                .append("ns", "appdb.users")
                .append("millis", 300)
                .append("query", new Document("email", "ann@shop.com"));

        // When
        SlowQueryRecord record = MongoDocumentStore.toRecord(entry);

        // Then
        assertThat(record.rawText()).contains("email");
        assertThat(record.operationStats().docsExamined()).isZero();
    }

    @Test
    void shouldListQueriedFieldsWithoutOperators() {
        // Given
        Document modern = new Document("command", new Document("find", "events")
                .append("filter", new Document("userId", 7).append("type", "click")
                        .append("$or", List.of(new Document("a", 1)))));
        Document legacy = new Document("query", new Document("status", "open"));
        Document none = new Document("command", new Document("insert", "events"));

        // Then
        assertThat(MongoDocumentStore.queriedFields(modern)).containsExactly("userId", "type");
        assertThat(MongoDocumentStore.queriedFields(legacy)).containsExactly("status");
        assertThat(MongoDocumentStore.queriedFields(none)).isEmpty();
    }

    @Test
    void shouldSummarizeDatabaseStatsForHealthCheck() {
        // Given
        Document dbStats = new Document("db", "appdb")
                .append("dataSize", 5_242_880L)
                .append("indexes", 14);

        // When
        Map<String, Object> health = MongoDocumentStore.healthMetrics(dbStats, 6);

        // Then
        assertThat(health)
                .containsEntry("database_size", "5 MB")
                .containsEntry("collection_count", 6)
                .containsEntry("index_count", 14L);
    }

    @Test
    void shouldFormatByteCounts() {
        assertThat(MongoDocumentStore.formatBytes(0)).isEqualTo("0 Bytes");
        assertThat(MongoDocumentStore.formatBytes(512)).isEqualTo("512 Bytes");
        assertThat(MongoDocumentStore.formatBytes(1536)).isEqualTo("1.50 KB");
    }
}

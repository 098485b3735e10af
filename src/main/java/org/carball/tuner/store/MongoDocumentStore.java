package org.carball.tuner.store;

import com.mongodb.MongoException;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.Indexes;
import com.mongodb.client.model.Sorts;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.carball.tuner.model.index.CollectionProfile;
import org.carball.tuner.model.index.DocumentIndexUsage;
import org.carball.tuner.model.query.OperationStats;
import org.carball.tuner.model.query.SlowQueryRecord;
import org.carball.tuner.model.query.StoreKind;

import java.util.*;
import java.util.concurrent.TimeUnit;

/**
 * Reads the MongoDB profiler collection, {@code $indexStats} and {@code serverStatus}
 * with the synchronous driver.
 */
@Slf4j
public class MongoDocumentStore implements DocumentStore {

    private static final String PROFILE_COLLECTION = "system.profile";

    private final MongoClient client;
    private final MongoDatabase database;
    private final long queryTimeoutMillis;

    public MongoDocumentStore(String connectionString, String databaseName, int queryTimeoutSeconds) {
        this(MongoClients.create(connectionString), databaseName, queryTimeoutSeconds);
    }

    public MongoDocumentStore(MongoClient client, String databaseName, int queryTimeoutSeconds) {
        this.client = client;
        this.database = client.getDatabase(databaseName);
        this.queryTimeoutMillis = TimeUnit.SECONDS.toMillis(queryTimeoutSeconds);
    }

    @Override
    public String databaseName() {
        return database.getName();
    }

    @Override
    public List<SlowQueryRecord> findSlowOperations(int limit) {
        List<SlowQueryRecord> results = new ArrayList<>();

        try {
            for (Document entry : database.getCollection(PROFILE_COLLECTION)
                    .find()
                    .sort(Sorts.descending("millis"))
                    .limit(limit)
                    .maxTime(queryTimeoutMillis, TimeUnit.MILLISECONDS)) {
                results.add(toRecord(entry));
            }
        } catch (MongoException e) {
            throw new StoreException(StoreKind.DOCUMENT, "failed to read " + PROFILE_COLLECTION, e);
        }

        log.debug("Read {} profiled operations from {}", results.size(), databaseName());
        return results;
    }

    @Override
    public List<CollectionProfile> listCollections() {
        List<CollectionProfile> profiles = new ArrayList<>();

        try {
            for (String name : database.listCollectionNames()) {
                MongoCollection<Document> collection = database.getCollection(name);
                int indexCount = 0;
                for (Document ignored : collection.listIndexes()) {
                    indexCount++;
                }
                profiles.add(new CollectionProfile(name, collection.estimatedDocumentCount(), indexCount));
            }
        } catch (MongoException e) {
            throw new StoreException(StoreKind.DOCUMENT, "failed to list collections", e);
        }

        return profiles;
    }

    @Override
    public List<List<String>> recentQueryFields(String collection, int limit) {
        List<List<String>> fields = new ArrayList<>();
        String namespace = databaseName() + "." + collection;

        try {
            for (Document entry : database.getCollection(PROFILE_COLLECTION)
                    .find(Filters.eq("ns", namespace))
                    .sort(Sorts.descending("millis"))
                    .limit(limit)
                    .maxTime(queryTimeoutMillis, TimeUnit.MILLISECONDS)) {
                fields.add(queriedFields(entry));
            }
        } catch (MongoException e) {
            throw new StoreException(StoreKind.DOCUMENT, "failed to read profile of " + collection, e);
        }

        return fields;
    }

    @Override
    public List<DocumentIndexUsage> indexUsage(String collection) {
        MongoCollection<Document> target = database.getCollection(collection);
        Map<String, Long> operations = new HashMap<>();
        List<DocumentIndexUsage> usage = new ArrayList<>();

        try {
            for (Document stats : target.aggregate(List.of(new Document("$indexStats", new Document())))) {
                Document accesses = stats.get("accesses", Document.class);
                long ops = accesses != null ? asLong(accesses.get("ops")) : 0L;
                operations.put(stats.getString("name"), ops);
            }

            // Indexes never accessed since restart are absent from $indexStats on some versions
            for (Document index : target.listIndexes()) {
                String name = index.getString("name");
                Document key = index.get("key", Document.class);
                usage.add(new DocumentIndexUsage(collection, name,
                        key != null ? key.toJson() : "{}", operations.getOrDefault(name, 0L)));
            }
        } catch (MongoException e) {
            throw new StoreException(StoreKind.DOCUMENT, "failed to read index statistics of " + collection, e);
        }

        return usage;
    }

    @Override
    public void createIndex(String collection, String field) {
        try {
            String name = database.getCollection(collection).createIndex(Indexes.ascending(field));
            log.info("Created index {} on {}.{}", name, databaseName(), collection);
        } catch (MongoException e) {
            throw new StoreException(StoreKind.DOCUMENT, e.getMessage(), e);
        }
    }

    @Override
    public Map<String, Object> collectMetrics() {
        Map<String, Object> metrics = new LinkedHashMap<>();

        try {
            Document status = database.runCommand(new Document("serverStatus", 1));
            metrics.put("version", status.getString("version"));
            metrics.put("uptime_seconds", asLong(status.get("uptime")));

            Document connections = status.get("connections", Document.class);
            if (connections != null) {
                metrics.put("current_connections", asLong(connections.get("current")));
                metrics.put("available_connections", asLong(connections.get("available")));
            }

            Document opcounters = status.get("opcounters", Document.class);
            if (opcounters != null) {
                for (String op : List.of("insert", "query", "update", "delete", "getmore", "command")) {
                    metrics.put("op_" + op, asLong(opcounters.get(op)));
                }
            }
        } catch (MongoException e) {
            throw new StoreException(StoreKind.DOCUMENT, "failed to read serverStatus", e);
        }

        return metrics;
    }

    @Override
    public Map<String, Object> healthCheck() {
        try {
            database.runCommand(new Document("ping", 1));
            Document dbStats = database.runCommand(new Document("dbStats", 1));
            int collectionCount = 0;
            for (String ignored : database.listCollectionNames()) {
                collectionCount++;
            }
            return healthMetrics(dbStats, collectionCount);
        } catch (MongoException e) {
            throw new StoreException(StoreKind.DOCUMENT, "health check failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        client.close();
    }

    static Map<String, Object> healthMetrics(Document dbStats, int collectionCount) {
        Map<String, Object> health = new LinkedHashMap<>();
        health.put("database_size", formatBytes(asLong(dbStats.get("dataSize"))));
        health.put("collection_count", collectionCount);
        health.put("index_count", asLong(dbStats.get("indexes")));
        return health;
    }

    static String formatBytes(long bytes) {
        if (bytes <= 0) {
            return "0 Bytes";
        }
        String[] units = {"Bytes", "KB", "MB", "GB", "TB"};
        int unit = 0;
        double value = bytes;
        while (value >= 1024 && unit < units.length - 1) {
            value /= 1024;
            unit++;
        }
        return String.format(Locale.ROOT, "%.2f %s", value, units[unit]).replace(".00 ", " ");
    }

    static SlowQueryRecord toRecord(Document entry) {
        Document command = commandOf(entry);
        String planSummary = entry.getString("planSummary");
        String operation = entry.getString("op");

        OperationStats stats = new OperationStats(
                operation,
                planSummary,
                asLong(entry.get("docsExamined")),
                asLong(entry.get("keysExamined")),
                asLong(entry.get("nreturned")),
                command != null && command.containsKey("sort")
                        || Boolean.TRUE.equals(entry.getBoolean("hasSortStage")),
                command != null && command.containsKey("aggregate")
        );

        return SlowQueryRecord.document(
                command != null ? command.toJson() : "{}",
                entry.getString("ns"),
                asLong(entry.get("millis")),
                stats);
    }

    static List<String> queriedFields(Document entry) {
        Document filter = entry.get("query", Document.class);
        if (filter == null) {
            Document command = entry.get("command", Document.class);
            filter = command != null ? command.get("filter", Document.class) : null;
        }
        if (filter == null) {
            return List.of();
        }

        List<String> fields = new ArrayList<>();
        for (String key : filter.keySet()) {
            if (!key.startsWith("$")) {
                fields.add(key);
            }
        }
        return fields;
    }

    private static Document commandOf(Document entry) {
        Document command = entry.get("command", Document.class);
        return command != null ? command : entry.get("query", Document.class);
    }

    private static long asLong(Object value) {
        return value instanceof Number number ? number.longValue() : 0L;
    }
}

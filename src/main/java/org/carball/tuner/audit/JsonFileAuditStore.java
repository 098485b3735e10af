package org.carball.tuner.audit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.carball.tuner.model.plan.PlanSnapshot;
import org.carball.tuner.model.query.SanitizedQueryRecord;
import org.carball.tuner.model.query.SlowQueryRecord;
import org.carball.tuner.model.query.StoreKind;
import org.carball.tuner.model.run.HistoryEntry;
import org.carball.tuner.model.run.OptimizationRun;
import org.carball.tuner.model.run.QueryLogEntry;
import org.carball.tuner.sanitize.QuerySanitizer;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.*;
import java.util.regex.Pattern;

/**
 * Keeps the audit trail as pretty-printed JSON files under one directory:
 * {@code slow-queries.json}, {@code optimization-history.json} and {@code plans/plan_<fingerprint>.json}.
 *
 * <p>Every file is replaced through a temporary sibling and an atomic move, so readers never see a
 * half-written log. Methods are synchronized; the process holds a single instance per directory.
 */
@Slf4j
public class JsonFileAuditStore implements AuditStore {

    public static final String QUERY_LOG_FILE = "slow-queries.json";
    public static final String HISTORY_LOG_FILE = "optimization-history.json";
    public static final String PLANS_DIRECTORY = "plans";

    private static final Pattern FINGERPRINT = Pattern.compile("[0-9a-f]{1,64}");

    // Fields that may carry statement text or literals taken from it
    private static final Set<String> TEXT_FIELDS = Set.of(
            "queryText", "queryPreview", "filter", "filterExpression", "errors", "error", "alerts");

    private final Path directory;
    private final int retention;
    private final ObjectMapper objectMapper;

    public JsonFileAuditStore(Path directory, int retention) {
        if (retention <= 0) {
            throw new IllegalArgumentException("Retention must be positive: " + retention);
        }
        this.directory = directory;
        this.retention = retention;

        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Override
    public synchronized void appendRun(OptimizationRun run) {
        HistoryEntry entry = new HistoryEntry(
                run.getTimestamp() != null ? run.getTimestamp() : Instant.now(),
                HistoryEntry.OPTIMIZATION_RUN,
                run);
        append(directory.resolve(HISTORY_LOG_FILE), entry);
    }

    @Override
    public synchronized void appendHistory(String action, Object details) {
        append(directory.resolve(HISTORY_LOG_FILE), new HistoryEntry(Instant.now(), action, details));
    }

    @Override
    public synchronized void appendQueryLog(StoreKind storeKind, List<SlowQueryRecord> records) {
        List<SanitizedQueryRecord> sanitized = records.stream()
                .map(QuerySanitizer::sanitize)
                .toList();
        append(directory.resolve(QUERY_LOG_FILE), new QueryLogEntry(Instant.now(), storeKind, sanitized));
    }

    @Override
    public synchronized Optional<PlanSnapshot> getLatestSnapshot(String fingerprint) {
        Path file = snapshotFile(fingerprint);
        if (!Files.exists(file)) {
            return Optional.empty();
        }

        try {
            return Optional.of(objectMapper.readValue(file.toFile(), PlanSnapshot.class));
        } catch (IOException e) {
            // An unreadable snapshot is replaced by the next capture
            log.warn("Ignoring unreadable plan snapshot {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public synchronized void putSnapshot(String fingerprint, PlanSnapshot snapshot) {
        JsonNode tree = sanitizeTree(objectMapper.valueToTree(snapshot));
        writeAtomically(snapshotFile(fingerprint), tree);
        log.debug("Stored plan snapshot for query {}", fingerprint);
    }

    @Override
    public synchronized List<JsonNode> readRunLog() {
        return toList(readLog(directory.resolve(HISTORY_LOG_FILE)));
    }

    @Override
    public synchronized List<JsonNode> readQueryLog() {
        return toList(readLog(directory.resolve(QUERY_LOG_FILE)));
    }

    public Path getDirectory() {
        return directory;
    }

    private void append(Path file, Object entry) {
        ArrayNode entries = readLog(file);
        entries.add(sanitizeTree(objectMapper.valueToTree(entry)));

        while (entries.size() > retention) {
            entries.remove(0);
        }

        writeAtomically(file, entries);
        log.debug("Appended entry to {} ({} entries)", file.getFileName(), entries.size());
    }

    private ArrayNode readLog(Path file) {
        if (!Files.exists(file)) {
            return objectMapper.createArrayNode();
        }

        try {
            JsonNode content = objectMapper.readTree(file.toFile());
            if (content instanceof ArrayNode array) {
                return array;
            }
            log.warn("Audit log {} is not a JSON array, starting fresh", file);
        } catch (IOException e) {
            log.warn("Error reading audit log {}, starting fresh: {}", file, e.getMessage());
        }
        return objectMapper.createArrayNode();
    }

    private void writeAtomically(Path file, JsonNode content) {
        try {
            Files.createDirectories(file.getParent());
            Path temp = Files.createTempFile(file.getParent(), file.getFileName().toString(), ".tmp");
            objectMapper.writeValue(temp.toFile(), content);

            try {
                Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new PersistenceException("Failed to write audit file " + file, e);
        }
    }

    private Path snapshotFile(String fingerprint) {
        if (fingerprint == null || !FINGERPRINT.matcher(fingerprint).matches()) {
            throw new IllegalArgumentException("Invalid query fingerprint: " + fingerprint);
        }
        return directory.resolve(PLANS_DIRECTORY).resolve("plan_" + fingerprint + ".json");
    }

    /**
     * Redacts every text field that may carry statement text, at any depth.
     */
    private static JsonNode sanitizeTree(JsonNode node) {
        if (node instanceof ObjectNode object) {
            Iterator<Map.Entry<String, JsonNode>> fields = object.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (TEXT_FIELDS.contains(field.getKey())) {
                    field.setValue(sanitizeText(field.getValue()));
                } else {
                    sanitizeTree(field.getValue());
                }
            }
        } else if (node instanceof ArrayNode array) {
            array.forEach(JsonFileAuditStore::sanitizeTree);
        }
        return node;
    }

    private static JsonNode sanitizeText(JsonNode value) {
        if (value.isTextual()) {
            return TextNode.valueOf(QuerySanitizer.sanitize(value.asText()));
        }
        if (value instanceof ArrayNode array) {
            for (int i = 0; i < array.size(); i++) {
                array.set(i, sanitizeText(array.get(i)));
            }
        }
        return value;
    }

    private static List<JsonNode> toList(ArrayNode array) {
        List<JsonNode> entries = new ArrayList<>();
        array.forEach(entries::add);
        return entries;
    }
}

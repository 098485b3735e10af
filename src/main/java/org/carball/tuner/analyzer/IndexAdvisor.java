package org.carball.tuner.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.tuner.config.AdvisorThresholds;
import org.carball.tuner.model.index.CollectionProfile;
import org.carball.tuner.model.index.DocumentIndexUsage;
import org.carball.tuner.model.index.IndexDescriptor;
import org.carball.tuner.model.index.TableScanStats;
import org.carball.tuner.model.query.StoreKind;
import org.carball.tuner.model.recommendation.IndexAction;
import org.carball.tuner.model.recommendation.MissingIndex;
import org.carball.tuner.model.recommendation.Recommendation;
import org.carball.tuner.model.recommendation.RedundantIndex;
import org.carball.tuner.model.recommendation.UnusedIndex;
import org.carball.tuner.store.DocumentStore;
import org.carball.tuner.store.RelationalStore;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Proposes index changes from usage statistics of both stores.
 *
 * <p>Passes are independent: a failing pass is reported in {@link IndexAdvice#errors()} and the
 * remaining passes still run. Only missing-index creation is ever executed, and only when the
 * caller asks for it; redundant and unused indexes are always left to a human.
 */
@Slf4j
public class IndexAdvisor {

    private final RelationalStore relationalStore;
    private final DocumentStore documentStore;
    private final AdvisorThresholds thresholds;

    /**
     * @param relationalStore relational gateway, or {@code null} to skip the relational passes
     * @param documentStore   document gateway, or {@code null} to skip the document pass
     */
    public IndexAdvisor(RelationalStore relationalStore, DocumentStore documentStore, AdvisorThresholds thresholds) {
        this.relationalStore = relationalStore;
        this.documentStore = documentStore;
        this.thresholds = thresholds;
    }

    public IndexAdvice advise(boolean execute) {
        List<Recommendation> recommendations = new ArrayList<>();
        List<IndexAction> actions = new ArrayList<>();
        List<String> errors = new ArrayList<>();

        if (relationalStore != null) {
            try {
                adviseMissingRelationalIndexes(execute, recommendations, actions);
            } catch (RuntimeException e) {
                log.error("Missing-index pass failed for {}: {}", StoreKind.RELATIONAL.getDisplayName(), e.getMessage());
                errors.add("missing-index pass: " + e.getMessage());
            }

            try {
                List<IndexDescriptor> indexes = relationalStore.findIndexes();
                recommendations.addAll(findRedundantIndexes(indexes));
                recommendations.addAll(findUnusedIndexes(indexes));
            } catch (RuntimeException e) {
                log.error("Index usage pass failed for {}: {}", StoreKind.RELATIONAL.getDisplayName(), e.getMessage());
                errors.add("index usage pass: " + e.getMessage());
            }
        }

        if (documentStore != null) {
            try {
                adviseDocumentIndexes(execute, recommendations, actions);
            } catch (RuntimeException e) {
                log.error("Document index pass failed for {}: {}", StoreKind.DOCUMENT.getDisplayName(), e.getMessage());
                errors.add("document index pass: " + e.getMessage());
            }
        }

        log.info("Index advisor produced {} recommendations ({} executable statements)",
                recommendations.size(), actions.size());
        return new IndexAdvice(recommendations, actions, errors);
    }

    private void adviseMissingRelationalIndexes(boolean execute, List<Recommendation> recommendations,
                                                List<IndexAction> actions) {
        List<TableScanStats> hotspots = relationalStore.findSequentialScanHotspots(
                thresholds.getMissingIndexLiveRows(),
                thresholds.getMissingIndexMinSeqScans(),
                thresholds.getMissingIndexLimit());

        for (TableScanStats stats : hotspots) {
            if (!stats.sequentialScansDominate()) {
                continue;
            }

            String indexName = "idx_" + stats.table() + "_" + stats.column();
            String command = String.format("CREATE INDEX IF NOT EXISTS \"%s\" ON \"%s\" (\"%s\");",
                    indexName, stats.table(), stats.column());
            String reason = String.format("Table has %d sequential scans vs %d index scans over %d live rows",
                    stats.seqScans(), stats.indexScans(), stats.liveRows());

            recommendations.add(new MissingIndex(StoreKind.RELATIONAL, stats.table(), stats.column(), reason, command));
            actions.add(apply(execute, command, () -> relationalStore.execute(command)));
        }
    }

    /**
     * Pairs indexes of the same table whose ordered columns are a prefix of one another, or which cover
     * the same column set, and proposes dropping the less scanned one. Primary and unique indexes are
     * never proposed for dropping.
     */
    public List<RedundantIndex> findRedundantIndexes(List<IndexDescriptor> indexes) {
        Map<String, List<IndexDescriptor>> byTable = indexes.stream()
                .collect(Collectors.groupingBy(IndexDescriptor::getOwner, LinkedHashMap::new, Collectors.toList()));

        Map<String, RedundantIndex> redundant = new LinkedHashMap<>();
        for (List<IndexDescriptor> tableIndexes : byTable.values()) {
            for (int i = 0; i < tableIndexes.size(); i++) {
                for (int j = i + 1; j < tableIndexes.size(); j++) {
                    IndexDescriptor a = tableIndexes.get(i);
                    IndexDescriptor b = tableIndexes.get(j);
                    if (!overlaps(a.getColumns(), b.getColumns())) {
                        continue;
                    }

                    IndexDescriptor drop = chooseDropCandidate(a, b);
                    IndexDescriptor keep = drop == a ? b : a;
                    if (drop.isProtected() || redundant.containsKey(drop.getName())) {
                        continue;
                    }

                    String reason = String.format(
                            "Index %s (%s) overlaps with %s (%s); %s has fewer scans (%d vs %d). "
                                    + "Review query paths before dropping",
                            a.getName(), String.join(", ", a.getColumns()),
                            b.getName(), String.join(", ", b.getColumns()),
                            drop.getName(), drop.getScanCount(), keep.getScanCount());

                    redundant.put(drop.getName(), new RedundantIndex(drop.getOwner(), keep.getName(), drop.getName(),
                            reason, String.format("DROP INDEX IF EXISTS \"%s\";", drop.getName())));
                }
            }
        }

        return new ArrayList<>(redundant.values());
    }

    List<UnusedIndex> findUnusedIndexes(List<IndexDescriptor> indexes) {
        return indexes.stream()
                .filter(index -> !index.isProtected())
                .filter(index -> index.getScanCount() < thresholds.getUnusedIndexScans())
                .filter(index -> index.getOwnerRowCount() > thresholds.getUnusedIndexLiveRows())
                .sorted(Comparator.comparingLong(IndexDescriptor::getSizeBytes).reversed())
                .map(index -> new UnusedIndex(
                        StoreKind.RELATIONAL,
                        index.getOwner(),
                        index.getName(),
                        index.getScanCount(),
                        String.format("This index has only been used %d times and takes up %s of space",
                                index.getScanCount(), formatSize(index.getSizeBytes())),
                        String.format("DROP INDEX IF EXISTS \"%s\";", index.getName())))
                .collect(Collectors.toList());
    }

    private void adviseDocumentIndexes(boolean execute, List<Recommendation> recommendations,
                                       List<IndexAction> actions) {
        for (CollectionProfile collection : documentStore.listCollections()) {
            if (collection.isSystemCollection()) {
                continue;
            }

            if (collection.documentCount() > thresholds.getDocumentCollectionSize() && collection.indexCount() <= 1) {
                adviseDocumentMissingIndex(collection, execute, recommendations, actions);
            }

            for (DocumentIndexUsage usage : documentStore.indexUsage(collection.name())) {
                if (usage.isIdentityIndex() || usage.operations() >= thresholds.getDocumentIndexMinOperations()) {
                    continue;
                }
                recommendations.add(new UnusedIndex(
                        StoreKind.DOCUMENT,
                        collection.name(),
                        usage.name(),
                        usage.operations(),
                        String.format("This index %s has only been used %d times since last server restart",
                                usage.keys(), usage.operations()),
                        String.format("db.%s.dropIndex(\"%s\")", collection.name(), usage.name())));
            }
        }
    }

    private void adviseDocumentMissingIndex(CollectionProfile collection, boolean execute,
                                            List<Recommendation> recommendations, List<IndexAction> actions) {
        String field = documentStore.recentQueryFields(collection.name(), thresholds.getDocumentProfileSample())
                .stream()
                .filter(fields -> !fields.isEmpty())
                .map(fields -> fields.get(0))
                .findFirst()
                .orElse(null);

        if (field == null) {
            recommendations.add(new MissingIndex(StoreKind.DOCUMENT, collection.name(), null,
                    String.format("Collection has %d documents and only the identity index; no queried field "
                            + "found in recent profile entries, needs review", collection.documentCount()),
                    String.format("db.getCollection(\"%s\").createIndex({ /* field */: 1 })", collection.name())));
            return;
        }

        String command = String.format("db.getCollection(\"%s\").createIndex({ \"%s\": 1 })", collection.name(), field);
        recommendations.add(new MissingIndex(StoreKind.DOCUMENT, collection.name(), field,
                String.format("Collection has %d documents and only the identity index; recent slow operations "
                        + "filter on \"%s\"", collection.documentCount(), field),
                command));
        actions.add(apply(execute, command, () -> documentStore.createIndex(collection.name(), field)));
    }

    private static IndexAction apply(boolean execute, String command, Runnable statement) {
        if (!execute) {
            return IndexAction.suggested(command);
        }

        try {
            statement.run();
            log.info("Created: {}", command);
            return IndexAction.created(command);
        } catch (RuntimeException e) {
            log.warn("Failed: {} - {}", command, e.getMessage());
            return IndexAction.failed(command, e.getMessage());
        }
    }

    static boolean overlaps(List<String> a, List<String> b) {
        if (a == null || b == null || a.isEmpty() || b.isEmpty()) {
            return false;
        }
        return isPrefix(a, b) || isPrefix(b, a) || new HashSet<>(a).equals(new HashSet<>(b));
    }

    private static boolean isPrefix(List<String> prefix, List<String> columns) {
        return prefix.size() <= columns.size() && columns.subList(0, prefix.size()).equals(prefix);
    }

    private static IndexDescriptor chooseDropCandidate(IndexDescriptor a, IndexDescriptor b) {
        if (a.getScanCount() != b.getScanCount()) {
            return a.getScanCount() < b.getScanCount() ? a : b;
        }
        if (a.isProtected() != b.isProtected()) {
            return a.isProtected() ? b : a;
        }
        return a.getName().compareTo(b.getName()) <= 0 ? a : b;
    }

    private static String formatSize(long bytes) {
        if (bytes < 1024) {
            return bytes + " bytes";
        }
        if (bytes < 1024 * 1024) {
            return String.format("%.0f kB", bytes / 1024.0);
        }
        return String.format("%.0f MB", bytes / (1024.0 * 1024.0));
    }
}

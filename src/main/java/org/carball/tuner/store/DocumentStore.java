package org.carball.tuner.store;

import org.carball.tuner.model.index.CollectionProfile;
import org.carball.tuner.model.index.DocumentIndexUsage;
import org.carball.tuner.model.query.SlowQueryRecord;

import java.util.List;
import java.util.Map;

/**
 * Read access to the profiler and index statistics of a document database. Every method throws
 * {@link StoreException} when the database call fails or times out.
 */
public interface DocumentStore extends AutoCloseable {

    String databaseName();

    /**
     * Entries of the operation profiling collection, slowest first.
     */
    List<SlowQueryRecord> findSlowOperations(int limit);

    List<CollectionProfile> listCollections();

    /**
     * Top-level field names queried by the slowest recent operations on a collection,
     * one list per profile entry, slowest entry first.
     */
    List<List<String>> recentQueryFields(String collection, int limit);

    /**
     * Usage counters of every index of a collection, including indexes that were never accessed.
     */
    List<DocumentIndexUsage> indexUsage(String collection);

    void createIndex(String collection, String field);

    /**
     * Pings the server and reads database size, collection count and index count.
     */
    Map<String, Object> healthCheck();

    Map<String, Object> collectMetrics();

    @Override
    void close();
}

package com.purchasingpower.memory.storage;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Collection-oriented vector store.
 *
 * <p>A collection that does not exist yet reads as empty on every operation. Only an
 * engine-wide failure surfaces as {@link com.purchasingpower.memory.exception.StoreUnavailableException}.
 *
 * @since 1.0.0
 */
public interface VectorStore {

    void upsert(String collection, VectorPoint point);

    /**
     * Upserts in chunks of at most 100 points.
     */
    void upsertBatch(String collection, List<VectorPoint> points);

    /**
     * Returns the point only when its {@code project_id} payload equals {@code projectId}.
     */
    Optional<VectorPoint> get(String projectId, String collection, String id);

    ScrollPage scroll(String collection, PayloadFilter filter, int limit, String offset);

    /**
     * Similarity search across collections. Hits are merged, sorted by descending score
     * and truncated to {@code limit}; hits below {@code scoreThreshold} are dropped.
     */
    List<ScoredPoint> search(List<String> collections, List<Float> vector, int limit,
                             PayloadFilter filter, Double scoreThreshold);

    /**
     * Marks the point deleted and stamps {@code updated_at}; the vector and remaining
     * payload are kept. Returns false when the point does not exist in the project.
     */
    boolean softDelete(String projectId, String collection, String id, Instant deletedAt);

    void delete(String collection, List<String> ids);

    long count(String collection, PayloadFilter filter);

    default List<VectorPoint> scrollAll(String collection, PayloadFilter filter, int pageSize) {
        List<VectorPoint> all = new ArrayList<>();
        String offset = null;
        do {
            ScrollPage page = scroll(collection, filter, pageSize, offset);
            all.addAll(page.points());
            offset = page.nextOffset();
        } while (offset != null);
        return all;
    }

    default Map<String, Long> statistics(List<String> collections, PayloadFilter filter) {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (String collection : collections) {
            counts.put(collection, count(collection, filter));
        }
        return counts;
    }
}

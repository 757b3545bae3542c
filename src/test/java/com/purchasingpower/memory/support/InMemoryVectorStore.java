package com.purchasingpower.memory.support;

import com.purchasingpower.memory.storage.PayloadFilter;
import com.purchasingpower.memory.storage.ScoredPoint;
import com.purchasingpower.memory.storage.ScrollPage;
import com.purchasingpower.memory.storage.VectorPoint;
import com.purchasingpower.memory.storage.VectorStore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Vector store double with cosine similarity and insertion-ordered scrolling. Stored
 * points are copied on the way in and out.
 */
public class InMemoryVectorStore implements VectorStore {

    private final Map<String, Map<String, VectorPoint>> collections = new ConcurrentHashMap<>();

    @Override
    public void upsert(String collection, VectorPoint point) {
        collections.computeIfAbsent(collection, key -> new LinkedHashMap<>()).put(point.getId(), point.copy());
    }

    @Override
    public void upsertBatch(String collection, List<VectorPoint> points) {
        points.forEach(point -> upsert(collection, point));
    }

    @Override
    public Optional<VectorPoint> get(String projectId, String collection, String id) {
        VectorPoint point = collection(collection).get(id);
        if (point == null || !projectId.equals(point.payloadValue("project_id"))) {
            return Optional.empty();
        }
        return Optional.of(point.copy());
    }

    @Override
    public ScrollPage scroll(String collection, PayloadFilter filter, int limit, String offset) {
        List<VectorPoint> matching = collection(collection).values().stream()
                .filter(point -> filter == null || filter.matches(point.getPayload()))
                .map(VectorPoint::copy)
                .toList();
        int start = offset != null ? Integer.parseInt(offset) : 0;
        int end = Math.min(start + limit, matching.size());
        String next = end < matching.size() ? String.valueOf(end) : null;
        return new ScrollPage(new ArrayList<>(matching.subList(start, end)), next);
    }

    @Override
    public List<ScoredPoint> search(List<String> collectionNames, List<Float> vector, int limit,
                                    PayloadFilter filter, Double scoreThreshold) {
        List<ScoredPoint> hits = new ArrayList<>();
        for (String name : collectionNames) {
            for (VectorPoint point : collection(name).values()) {
                if (filter != null && !filter.matches(point.getPayload())) {
                    continue;
                }
                double score = cosine(vector, point.getVector());
                if (scoreThreshold != null && score < scoreThreshold) {
                    continue;
                }
                hits.add(ScoredPoint.builder().collection(name).score(score).point(point.copy()).build());
            }
        }
        hits.sort(Comparator.comparingDouble(ScoredPoint::getScore).reversed());
        return hits.size() > limit ? new ArrayList<>(hits.subList(0, limit)) : hits;
    }

    @Override
    public boolean softDelete(String projectId, String collection, String id, Instant deletedAt) {
        VectorPoint point = collection(collection).get(id);
        if (point == null || !projectId.equals(point.payloadValue("project_id"))) {
            return false;
        }
        point.getPayload().put("deleted", true);
        point.getPayload().put("updated_at", deletedAt.toString());
        return true;
    }

    @Override
    public void delete(String collection, List<String> ids) {
        Map<String, VectorPoint> points = collection(collection);
        ids.forEach(points::remove);
    }

    @Override
    public long count(String collection, PayloadFilter filter) {
        return collection(collection).values().stream()
                .filter(point -> filter == null || filter.matches(point.getPayload()))
                .count();
    }

    /**
     * Direct write access for fixtures, e.g. to back-date timestamps.
     */
    public VectorPoint raw(String collection, String id) {
        return collection(collection).get(id);
    }

    public int size(String collection) {
        return collection(collection).size();
    }

    private Map<String, VectorPoint> collection(String name) {
        return collections.getOrDefault(name, Map.of());
    }

    static double cosine(List<Float> a, List<Float> b) {
        if (a == null || b == null || a.size() != b.size() || a.isEmpty()) {
            return 0;
        }
        double dot = 0;
        double normA = 0;
        double normB = 0;
        for (int i = 0; i < a.size(); i++) {
            dot += a.get(i) * b.get(i);
            normA += a.get(i) * a.get(i);
            normB += b.get(i) * b.get(i);
        }
        if (normA == 0 || normB == 0) {
            return 0;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }
}

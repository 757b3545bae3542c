package com.purchasingpower.memory.storage.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.Lists;
import com.google.protobuf.Struct;
import com.purchasingpower.memory.configuration.MemoryProperties;
import com.purchasingpower.memory.exception.MemoryServiceException;
import com.purchasingpower.memory.exception.StoreUnavailableException;
import com.purchasingpower.memory.model.CallContext;
import com.purchasingpower.memory.model.ServiceType;
import com.purchasingpower.memory.storage.PayloadFilter;
import com.purchasingpower.memory.storage.ScoredPoint;
import com.purchasingpower.memory.storage.ScrollPage;
import com.purchasingpower.memory.storage.VectorPoint;
import com.purchasingpower.memory.storage.VectorStore;
import com.purchasingpower.memory.util.ExternalCallLogger;
import io.pinecone.clients.Index;
import io.pinecone.clients.Pinecone;
import io.pinecone.proto.DescribeIndexStatsResponse;
import io.pinecone.proto.FetchResponse;
import io.pinecone.proto.ListItem;
import io.pinecone.proto.ListResponse;
import io.pinecone.proto.NamespaceSummary;
import io.pinecone.proto.Vector;
import io.pinecone.unsigned_indices_model.QueryResponseWithUnsignedIndices;
import io.pinecone.unsigned_indices_model.ScoredVectorWithUnsignedIndices;
import io.pinecone.unsigned_indices_model.VectorWithUnsignedIndices;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Pinecone implementation of {@link VectorStore}.
 *
 * <p>All collections live in one index; each collection is a namespace. A namespace that has
 * never been written reads as empty, which gives the "missing collection is zero memories"
 * behaviour for free.
 *
 * <p>Pinecone has no filtered scroll, so {@link #scroll} pages over listed ids, fetches the
 * page and applies the payload filter client-side. The returned cursor is Pinecone's
 * pagination token. Vector ids carry a fixed {@code mem#} prefix so every listing can be
 * prefix-scoped; the prefix never leaves this class.
 *
 * @since 1.0.0
 */
@Slf4j
@Component
public class PineconeVectorStore implements VectorStore {

    static final int BATCH_SIZE = 100;
    static final String ID_PREFIX = "mem#";
    private static final String STORE_NAME = "Pinecone";

    private final Pinecone client;
    private final String indexName;
    private final PineconePayloadCodec codec;
    private volatile Index index;

    public PineconeVectorStore(Pinecone client, MemoryProperties properties, ObjectMapper objectMapper) {
        this.client = client;
        this.indexName = properties.getPinecone().getIndexName();
        this.codec = new PineconePayloadCodec(objectMapper);
    }

    @Override
    public void upsert(String collection, VectorPoint point) {
        upsertBatch(collection, List.of(point));
    }

    @Override
    public void upsertBatch(String collection, List<VectorPoint> points) {
        if (points.isEmpty()) {
            return;
        }
        List<VectorWithUnsignedIndices> vectors = new ArrayList<>(points.size());
        for (VectorPoint point : points) {
            vectors.add(new VectorWithUnsignedIndices(
                    ID_PREFIX + point.getId(),
                    point.getVector(),
                    codec.encode(point.getPayload()),
                    null
            ));
        }

        int batchNum = 0;
        for (List<VectorWithUnsignedIndices> batch : Lists.partition(vectors, BATCH_SIZE)) {
            batchNum++;
            CallContext ctx = ExternalCallLogger.startCall(ServiceType.PINECONE, "Upsert", log);
            ctx.logRequest("Namespace", collection, "Batch", batchNum, "Size", batch.size());
            call(ctx, () -> index().upsert(batch, collection));
            ctx.logResponse("Upserted", batch.size());
        }
    }

    @Override
    public Optional<VectorPoint> get(String projectId, String collection, String id) {
        Map<String, Vector> vectors = fetch(collection, List.of(ID_PREFIX + id));
        Vector vector = vectors.get(ID_PREFIX + id);
        if (vector == null) {
            return Optional.empty();
        }
        VectorPoint point = toPoint(vector);
        if (!projectId.equals(point.payloadValue("project_id"))) {
            log.debug("Point {} in {} belongs to another project", id, collection);
            return Optional.empty();
        }
        return Optional.of(point);
    }

    @Override
    public ScrollPage scroll(String collection, PayloadFilter filter, int limit, String offset) {
        CallContext ctx = ExternalCallLogger.startCall(ServiceType.PINECONE, "List", log);
        ctx.logRequest("Namespace", collection, "Limit", limit, "Offset", offset, "Filter", filter);

        ListResponse listing = call(ctx, () -> offset == null
                ? index().list(collection, ID_PREFIX, limit)
                : index().list(collection, ID_PREFIX, offset, limit));
        List<String> ids = new ArrayList<>();
        for (ListItem item : listing.getVectorsList()) {
            ids.add(item.getId());
        }
        String next = listing.hasPagination() && !listing.getPagination().getNext().isEmpty()
                ? listing.getPagination().getNext()
                : null;
        ctx.logResponse("Ids", ids.size(), "Next", next);

        if (ids.isEmpty()) {
            return new ScrollPage(List.of(), next);
        }

        Map<String, Vector> fetched = fetch(collection, ids);
        List<VectorPoint> points = new ArrayList<>();
        for (String id : ids) {
            Vector vector = fetched.get(id);
            if (vector == null) {
                continue;
            }
            VectorPoint point = toPoint(vector);
            if (filter == null || filter.matches(point.getPayload())) {
                points.add(point);
            }
        }
        return new ScrollPage(points, next);
    }

    @Override
    public List<ScoredPoint> search(List<String> collections, List<Float> vector, int limit,
                                    PayloadFilter filter, Double scoreThreshold) {
        Struct pineconeFilter = codec.encodeFilter(filter);
        List<ScoredPoint> hits = new ArrayList<>();

        for (String collection : collections) {
            CallContext ctx = ExternalCallLogger.startCall(ServiceType.PINECONE, "Query", log);
            ctx.logRequest("Namespace", collection, "TopK", limit, "Filter", filter);

            QueryResponseWithUnsignedIndices response = call(ctx, () -> index().query(
                    limit,
                    vector,
                    null,
                    null,
                    null,
                    collection,
                    pineconeFilter,
                    true,
                    true
            ));

            List<ScoredVectorWithUnsignedIndices> matches = response.getMatchesList();
            int accepted = 0;
            if (matches != null) {
                for (ScoredVectorWithUnsignedIndices match : matches) {
                    if (scoreThreshold != null && match.getScore() < scoreThreshold) {
                        continue;
                    }
                    VectorPoint point = VectorPoint.builder()
                            .id(stripPrefix(match.getId()))
                            .vector(new ArrayList<>(match.getValuesList()))
                            .payload(codec.decode(match.getMetadata()))
                            .build();
                    hits.add(ScoredPoint.builder()
                            .collection(collection)
                            .score(match.getScore())
                            .point(point)
                            .build());
                    accepted++;
                }
            }
            ctx.logResponse("Matches", accepted);
        }

        hits.sort(Comparator.comparingDouble(ScoredPoint::getScore).reversed());
        return hits.size() > limit ? new ArrayList<>(hits.subList(0, limit)) : hits;
    }

    @Override
    public boolean softDelete(String projectId, String collection, String id, Instant deletedAt) {
        Optional<VectorPoint> existing = get(projectId, collection, id);
        if (existing.isEmpty()) {
            return false;
        }
        VectorPoint point = existing.get();
        point.getPayload().put("deleted", true);
        point.getPayload().put("updated_at", deletedAt.toString());
        upsert(collection, point);
        return true;
    }

    @Override
    public void delete(String collection, List<String> ids) {
        if (ids.isEmpty()) {
            return;
        }
        List<String> keys = ids.stream().map(id -> ID_PREFIX + id).toList();
        for (List<String> batch : Lists.partition(keys, BATCH_SIZE)) {
            CallContext ctx = ExternalCallLogger.startCall(ServiceType.PINECONE, "Delete", log);
            ctx.logRequest("Namespace", collection, "Ids", batch.size());
            call(ctx, () -> {
                index().deleteByIds(batch, collection);
                return null;
            });
            ctx.logResponse("Deleted", batch.size());
        }
    }

    @Override
    public long count(String collection, PayloadFilter filter) {
        if (filter == null || filter.isEmpty()) {
            CallContext ctx = ExternalCallLogger.startCall(ServiceType.PINECONE, "DescribeIndexStats", log);
            ctx.logRequest("Namespace", collection);
            DescribeIndexStatsResponse stats = call(ctx, () -> index().describeIndexStats());
            NamespaceSummary summary = stats.getNamespacesMap().get(collection);
            ctx.logResponse("Vectors", summary != null ? summary.getVectorCount() : 0);
            return summary != null ? summary.getVectorCount() : 0;
        }
        return scrollAll(collection, filter, BATCH_SIZE).size();
    }

    private Map<String, Vector> fetch(String collection, List<String> ids) {
        CallContext ctx = ExternalCallLogger.startCall(ServiceType.PINECONE, "Fetch", log);
        ctx.logRequest("Namespace", collection, "Ids", ids.size());
        FetchResponse response = call(ctx, () -> index().fetch(ids, collection));
        Map<String, Vector> vectors = response != null ? response.getVectorsMap() : Map.of();
        ctx.logResponse("Found", vectors.size());
        return vectors;
    }

    private VectorPoint toPoint(Vector vector) {
        return VectorPoint.builder()
                .id(stripPrefix(vector.getId()))
                .vector(new ArrayList<>(vector.getValuesList()))
                .payload(codec.decode(vector.getMetadata()))
                .build();
    }

    private static String stripPrefix(String key) {
        return key.startsWith(ID_PREFIX) ? key.substring(ID_PREFIX.length()) : key;
    }

    private Index index() {
        Index current = index;
        if (current == null) {
            synchronized (this) {
                if (index == null) {
                    index = client.getIndexConnection(indexName);
                }
                current = index;
            }
        }
        return current;
    }

    private <T> T call(CallContext ctx, Supplier<T> action) {
        try {
            return action.get();
        } catch (MemoryServiceException e) {
            throw e;
        } catch (RuntimeException e) {
            ctx.logError(e.getMessage(), e);
            throw new StoreUnavailableException(STORE_NAME, e.getMessage(), e);
        }
    }
}

package com.purchasingpower.memory.support;

import com.purchasingpower.memory.configuration.MemoryProperties;
import com.purchasingpower.memory.core.Memory;
import com.purchasingpower.memory.core.MemoryDraft;
import com.purchasingpower.memory.core.MemoryType;
import com.purchasingpower.memory.maintenance.impl.TestResultRetentionServiceImpl;
import com.purchasingpower.memory.memory.GraphMirror;
import com.purchasingpower.memory.memory.MemoryPointMapper;
import com.purchasingpower.memory.memory.impl.MemoryServiceImpl;
import com.purchasingpower.memory.storage.VectorPoint;

import java.time.Instant;
import java.util.Map;

/**
 * Real services wired over in-memory stores, a hashing embedder and a settable clock.
 */
public class MemoryFixture {

    public static final String PROJECT = "demo-project";
    public static final Instant START = Instant.parse("2024-06-01T10:00:00Z");

    public final MemoryProperties properties = new MemoryProperties();
    public final InMemoryVectorStore vectorStore = new InMemoryVectorStore();
    public final InMemoryGraphStore graphStore = new InMemoryGraphStore();
    public final HashingEmbeddingProvider embeddings = new HashingEmbeddingProvider();
    public final MutableClock clock = new MutableClock(START);
    public final MemoryPointMapper mapper = new MemoryPointMapper(properties);
    public final GraphMirror graphMirror = new GraphMirror(graphStore, vectorStore, mapper, properties);
    public final TestResultRetentionServiceImpl retention =
            new TestResultRetentionServiceImpl(vectorStore, graphMirror, properties, clock);
    public final MemoryServiceImpl memoryService =
            new MemoryServiceImpl(vectorStore, embeddings, graphMirror, mapper, retention, properties, clock);

    public String create(MemoryType type, String content) {
        return create(type, content, Map.of());
    }

    public String create(MemoryType type, String content, Map<String, Object> metadata) {
        return memoryService.create(PROJECT, MemoryDraft.builder()
                .type(type)
                .content(content)
                .metadata(metadata)
                .build()).getMemoryId();
    }

    public Memory load(MemoryType type, String id) {
        VectorPoint point = vectorStore.raw(type.collectionName(PROJECT), id);
        return point != null ? mapper.toMemory(point, type) : null;
    }

    /**
     * Overwrites a stored timestamp, for age-based retention scenarios.
     */
    public void backdate(MemoryType type, String id, String field, Instant at) {
        vectorStore.raw(type.collectionName(PROJECT), id).getPayload().put(field, at.toString());
    }
}

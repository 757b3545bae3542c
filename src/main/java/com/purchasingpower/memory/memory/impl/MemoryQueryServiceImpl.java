package com.purchasingpower.memory.memory.impl;

import com.purchasingpower.memory.core.Memory;
import com.purchasingpower.memory.core.MemoryType;
import com.purchasingpower.memory.core.ProjectIds;
import com.purchasingpower.memory.embedding.EmbeddingProvider;
import com.purchasingpower.memory.exception.MemoryValidationException;
import com.purchasingpower.memory.memory.MemoryPage;
import com.purchasingpower.memory.memory.MemoryPointMapper;
import com.purchasingpower.memory.memory.MemoryQueryService;
import com.purchasingpower.memory.memory.MemoryStatistics;
import com.purchasingpower.memory.memory.SearchHit;
import com.purchasingpower.memory.memory.SearchQuery;
import com.purchasingpower.memory.storage.GraphStatistics;
import com.purchasingpower.memory.storage.GraphStore;
import com.purchasingpower.memory.storage.PayloadFilter;
import com.purchasingpower.memory.storage.ScoredPoint;
import com.purchasingpower.memory.storage.ScrollPage;
import com.purchasingpower.memory.storage.VectorPoint;
import com.purchasingpower.memory.storage.VectorStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class MemoryQueryServiceImpl implements MemoryQueryService {

    static final int MAX_LIMIT = 100;

    private final VectorStore vectorStore;
    private final GraphStore graphStore;
    private final EmbeddingProvider embeddingProvider;
    private final MemoryPointMapper mapper;

    @Override
    public List<SearchHit> search(String projectId, SearchQuery query) {
        ProjectIds.requireValid(projectId);
        if (query.getQuery() == null || query.getQuery().isBlank()) {
            throw new MemoryValidationException("Search query must not be empty");
        }
        int limit = clampLimit(query.getLimit());
        List<MemoryType> types = query.getTypes() == null || query.getTypes().isEmpty()
                ? MemoryType.all()
                : query.getTypes();

        Map<String, MemoryType> collections = new LinkedHashMap<>();
        for (MemoryType type : types) {
            collections.put(type.collectionName(projectId), type);
        }

        PayloadFilter filter = MemoryPointMapper.activeFilter(projectId);
        if (query.getMetadata() != null) {
            for (Map.Entry<String, Object> entry : query.getMetadata().entrySet()) {
                filter = filter.and(MemoryPointMapper.METADATA + "." + entry.getKey(), entry.getValue());
            }
        }

        List<Float> vector = embeddingProvider.embed(query.getQuery());
        List<ScoredPoint> hits = vectorStore.search(new ArrayList<>(collections.keySet()), vector, limit,
                filter, query.getScoreThreshold());

        List<SearchHit> results = new ArrayList<>(hits.size());
        for (ScoredPoint hit : hits) {
            Memory memory = mapper.toMemory(hit.getPoint(), collections.get(hit.getCollection()));
            results.add(new SearchHit(memory, hit.getScore()));
        }
        log.info("🔍 Search in {} over {} collections returned {} hits", projectId, collections.size(), results.size());
        return results;
    }

    @Override
    public MemoryPage list(String projectId, MemoryType type, int limit, String offset, boolean includeDeleted) {
        ProjectIds.requireValid(projectId);
        PayloadFilter filter = includeDeleted
                ? MemoryPointMapper.projectFilter(projectId)
                : MemoryPointMapper.activeFilter(projectId);

        ScrollPage page = vectorStore.scroll(type.collectionName(projectId), filter, clampLimit(limit), offset);
        List<Memory> memories = new ArrayList<>(page.points().size());
        for (VectorPoint point : page.points()) {
            memories.add(mapper.toMemory(point, type));
        }
        return new MemoryPage(memories, page.nextOffset());
    }

    @Override
    public MemoryStatistics statistics(String projectId) {
        ProjectIds.requireValid(projectId);
        PayloadFilter active = MemoryPointMapper.activeFilter(projectId);

        Map<String, Long> byType = new LinkedHashMap<>();
        long total = 0;
        for (MemoryType type : MemoryType.values()) {
            long count = vectorStore.count(type.collectionName(projectId), active);
            byType.put(type.getWireName(), count);
            total += count;
        }

        GraphStatistics graph = null;
        try {
            graph = graphStore.statistics(projectId);
        } catch (RuntimeException e) {
            log.warn("⚠️  Graph statistics unavailable for {}: {}", projectId, e.getMessage());
        }

        return MemoryStatistics.builder()
                .projectId(projectId)
                .memoriesByType(byType)
                .totalMemories(total)
                .graph(graph)
                .build();
    }

    private static int clampLimit(int limit) {
        if (limit < 1) {
            return 1;
        }
        return Math.min(limit, MAX_LIMIT);
    }
}

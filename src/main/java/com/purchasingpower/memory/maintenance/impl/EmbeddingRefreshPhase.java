package com.purchasingpower.memory.maintenance.impl;

import com.purchasingpower.memory.configuration.MemoryProperties;
import com.purchasingpower.memory.core.MemoryType;
import com.purchasingpower.memory.embedding.EmbeddingProvider;
import com.purchasingpower.memory.exception.MemoryServiceException;
import com.purchasingpower.memory.maintenance.MaintenancePhase;
import com.purchasingpower.memory.maintenance.NormalizationPhase;
import com.purchasingpower.memory.maintenance.PhaseResult;
import com.purchasingpower.memory.memory.MemoryPointMapper;
import com.purchasingpower.memory.storage.VectorPoint;
import com.purchasingpower.memory.storage.VectorStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Re-embeds memories whose stored vector looks like a placeholder: all zeros or
 * near-constant.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EmbeddingRefreshPhase implements MaintenancePhase {

    private final VectorStore vectorStore;
    private final EmbeddingProvider embeddingProvider;
    private final MemoryProperties properties;
    private final Clock clock;

    @Override
    public NormalizationPhase phase() {
        return NormalizationPhase.EMBEDDING_REFRESH;
    }

    @Override
    public PhaseResult run(String projectId, boolean dryRun) {
        double epsilon = properties.getNormalization().getVarianceEpsilon();
        List<String> details = new ArrayList<>();
        int total = 0;

        for (MemoryType type : MemoryType.all()) {
            String collection = type.collectionName(projectId);
            List<VectorPoint> stale = new ArrayList<>();
            try {
                for (VectorPoint point : vectorStore.scrollAll(collection, MemoryPointMapper.activeFilter(projectId),
                        properties.getNormalization().getScrollPageSize())) {
                    if (needsRefresh(point.getVector(), epsilon)) {
                        stale.add(point);
                    }
                }
            } catch (MemoryServiceException e) {
                log.warn("⚠️  Embedding refresh of {} skipped: {}", collection, e.getMessage());
                details.add(type.getWireName() + ": " + e.getMessage());
                continue;
            }
            if (stale.isEmpty()) {
                continue;
            }

            details.add(type.getWireName() + ": " + stale.size() + " embeddings to refresh");
            total += stale.size();
            if (!dryRun) {
                for (VectorPoint point : stale) {
                    try {
                        Object content = point.getPayload().get(MemoryPointMapper.CONTENT);
                        VectorPoint refreshed = point.copy();
                        refreshed.setVector(embeddingProvider.embed(content != null ? content.toString() : ""));
                        refreshed.getPayload().put(MemoryPointMapper.UPDATED_AT, clock.instant().toString());
                        vectorStore.upsert(collection, refreshed);
                    } catch (MemoryServiceException e) {
                        details.add(type.getWireName() + "/" + point.getId() + ": " + e.getMessage());
                    }
                }
            }
        }

        log.info("🧹 Embedding refresh for {}: {} vectors{}", projectId, total, dryRun ? " (dry run)" : "");
        return PhaseResult.of(phase(), total, details, "No embeddings need refresh");
    }

    static boolean needsRefresh(List<Float> vector, double epsilon) {
        if (vector == null || vector.isEmpty()) {
            return true;
        }
        boolean allZeros = true;
        double sum = 0;
        for (Float value : vector) {
            if (value != 0f) {
                allZeros = false;
            }
            sum += value;
        }
        if (allZeros) {
            return true;
        }
        double mean = sum / vector.size();
        double squares = 0;
        for (Float value : vector) {
            squares += (value - mean) * (value - mean);
        }
        return squares / vector.size() < epsilon;
    }
}

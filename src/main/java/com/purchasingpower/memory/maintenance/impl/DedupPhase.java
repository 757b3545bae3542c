package com.purchasingpower.memory.maintenance.impl;

import com.purchasingpower.memory.configuration.MemoryProperties;
import com.purchasingpower.memory.configuration.NormalizationProperties;
import com.purchasingpower.memory.core.MemoryType;
import com.purchasingpower.memory.exception.MemoryServiceException;
import com.purchasingpower.memory.maintenance.MaintenancePhase;
import com.purchasingpower.memory.maintenance.NormalizationPhase;
import com.purchasingpower.memory.maintenance.PhaseResult;
import com.purchasingpower.memory.memory.MemoryPointMapper;
import com.purchasingpower.memory.memory.MemoryService;
import com.purchasingpower.memory.storage.PayloadFilter;
import com.purchasingpower.memory.storage.ScoredPoint;
import com.purchasingpower.memory.storage.VectorPoint;
import com.purchasingpower.memory.storage.VectorStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Soft-deletes near-identical memories of the same type. Points are visited in scroll
 * order and the first one visited survives.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DedupPhase implements MaintenancePhase {

    private final VectorStore vectorStore;
    private final MemoryService memoryService;
    private final MemoryProperties properties;

    @Override
    public NormalizationPhase phase() {
        return NormalizationPhase.DEDUP;
    }

    @Override
    public PhaseResult run(String projectId, boolean dryRun) {
        NormalizationProperties settings = properties.getNormalization();
        PayloadFilter active = MemoryPointMapper.activeFilter(projectId);
        List<String> details = new ArrayList<>();
        int total = 0;

        for (MemoryType type : MemoryType.all()) {
            String collection = type.collectionName(projectId);
            List<String> duplicates;
            try {
                duplicates = findDuplicates(collection, active, settings);
            } catch (MemoryServiceException e) {
                log.warn("⚠️  Dedup of {} skipped: {}", collection, e.getMessage());
                details.add(type.getWireName() + ": " + e.getMessage());
                continue;
            }
            if (duplicates.isEmpty()) {
                continue;
            }

            details.add(type.getWireName() + ": " + duplicates.size() + " potential duplicates found");
            total += duplicates.size();
            if (!dryRun) {
                for (String duplicateId : duplicates) {
                    try {
                        memoryService.delete(projectId, type, duplicateId, false);
                    } catch (MemoryServiceException e) {
                        details.add(type.getWireName() + "/" + duplicateId + ": " + e.getMessage());
                    }
                }
            }
        }

        log.info("🧹 Dedup for {}: {} duplicates{}", projectId, total, dryRun ? " (dry run)" : "");
        return PhaseResult.of(phase(), total, details, "No duplicates found");
    }

    /**
     * Ids of every point that is a near-copy of an earlier point in scroll order.
     *
     * <p>Hits already claimed by an earlier point still occupy search slots, so a full page
     * is searched again with twice the limit until it comes back short. The limit never
     * needs to exceed the collection size.
     */
    private List<String> findDuplicates(String collection, PayloadFilter active, NormalizationProperties settings) {
        List<VectorPoint> points = vectorStore.scrollAll(collection, active, settings.getScrollPageSize());
        Set<String> processed = new HashSet<>();
        List<String> duplicates = new ArrayList<>();

        for (VectorPoint point : points) {
            if (!processed.add(point.getId())) {
                continue;
            }
            int limit = settings.getDuplicateSearchLimit();
            while (true) {
                List<ScoredPoint> similar = vectorStore.search(List.of(collection), point.getVector(),
                        limit, active, settings.getDuplicateThreshold());
                for (ScoredPoint hit : similar) {
                    if (!hit.getId().equals(point.getId()) && processed.add(hit.getId())) {
                        duplicates.add(hit.getId());
                    }
                }
                if (similar.size() < limit || limit >= points.size()) {
                    break;
                }
                limit = Math.min(limit * 2, points.size());
            }
        }
        return duplicates;
    }
}

package com.purchasingpower.memory.maintenance.impl;

import com.purchasingpower.memory.configuration.MemoryProperties;
import com.purchasingpower.memory.core.MemoryType;
import com.purchasingpower.memory.exception.MemoryServiceException;
import com.purchasingpower.memory.maintenance.MaintenancePhase;
import com.purchasingpower.memory.maintenance.NormalizationPhase;
import com.purchasingpower.memory.maintenance.PhaseResult;
import com.purchasingpower.memory.memory.GraphMirror;
import com.purchasingpower.memory.memory.MemoryPointMapper;
import com.purchasingpower.memory.storage.VectorPoint;
import com.purchasingpower.memory.storage.VectorStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Purges memories that have stayed soft-deleted past the retention window.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CleanupPhase implements MaintenancePhase {

    private final VectorStore vectorStore;
    private final GraphMirror graphMirror;
    private final MemoryProperties properties;
    private final Clock clock;

    @Override
    public NormalizationPhase phase() {
        return NormalizationPhase.CLEANUP;
    }

    @Override
    public PhaseResult run(String projectId, boolean dryRun) {
        Instant cutoff = clock.instant().minus(Duration.ofDays(properties.getNormalization().getRetentionDays()));
        List<String> details = new ArrayList<>();
        int total = 0;

        for (MemoryType type : MemoryType.all()) {
            String collection = type.collectionName(projectId);
            List<String> expired;
            try {
                expired = findExpired(collection, projectId, cutoff);
            } catch (MemoryServiceException e) {
                log.warn("⚠️  Cleanup of {} skipped: {}", collection, e.getMessage());
                details.add(type.getWireName() + ": " + e.getMessage());
                continue;
            }
            if (expired.isEmpty()) {
                continue;
            }

            if (dryRun) {
                details.add(type.getWireName() + ": " + expired.size() + " memories to cleanup");
                total += expired.size();
                continue;
            }
            try {
                vectorStore.delete(collection, expired);
            } catch (MemoryServiceException e) {
                log.warn("⚠️  Cleanup of {} failed: {}", collection, e.getMessage());
                details.add(type.getWireName() + ": " + e.getMessage());
                continue;
            }
            if (type.isGraphEligible()) {
                expired.forEach(id -> graphMirror.remove(projectId, id));
            }
            details.add(type.getWireName() + ": " + expired.size() + " memories to cleanup");
            total += expired.size();
        }

        log.info("🧹 Cleanup for {}: {} expired memories{}", projectId, total, dryRun ? " (dry run)" : "");
        return PhaseResult.of(phase(), total, details, "No memories to cleanup");
    }

    private List<String> findExpired(String collection, String projectId, Instant cutoff) {
        List<String> expired = new ArrayList<>();
        for (VectorPoint point : vectorStore.scrollAll(collection, MemoryPointMapper.deletedFilter(projectId),
                properties.getNormalization().getScrollPageSize())) {
            Instant updatedAt = MemoryPointMapper.parseInstant(point.getPayload().get(MemoryPointMapper.UPDATED_AT));
            // no timestamp, no way to tell its age
            if (updatedAt != null && updatedAt.isBefore(cutoff)) {
                expired.add(point.getId());
            }
        }
        return expired;
    }
}

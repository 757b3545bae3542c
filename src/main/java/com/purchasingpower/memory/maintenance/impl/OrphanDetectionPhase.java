package com.purchasingpower.memory.maintenance.impl;

import com.purchasingpower.memory.core.MemoryType;
import com.purchasingpower.memory.exception.MemoryServiceException;
import com.purchasingpower.memory.maintenance.MaintenancePhase;
import com.purchasingpower.memory.maintenance.NormalizationPhase;
import com.purchasingpower.memory.maintenance.PhaseResult;
import com.purchasingpower.memory.storage.GraphNodeRef;
import com.purchasingpower.memory.storage.GraphStore;
import com.purchasingpower.memory.storage.VectorStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Removes graph nodes whose memory no longer exists in the vector store. The vector store
 * is authoritative, so the node is what goes.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OrphanDetectionPhase implements MaintenancePhase {

    private final GraphStore graphStore;
    private final VectorStore vectorStore;

    @Override
    public NormalizationPhase phase() {
        return NormalizationPhase.ORPHAN_DETECTION;
    }

    @Override
    public PhaseResult run(String projectId, boolean dryRun) {
        List<String> details = new ArrayList<>();
        int orphans = 0;

        for (GraphNodeRef node : graphStore.listNodes(projectId)) {
            if (node.memoryId() == null) {
                continue;
            }
            Optional<MemoryType> type = MemoryType.find(node.type());
            String reason;
            if (type.isEmpty()) {
                reason = "unknown type";
            } else if (vectorStore.get(projectId, type.get().collectionName(projectId), node.memoryId()).isEmpty()) {
                reason = "no vector data";
            } else {
                continue;
            }

            orphans++;
            details.add("Orphan: " + node.type() + "/" + node.memoryId() + " (" + reason + ")");
            if (!dryRun) {
                try {
                    graphStore.removeNode(projectId, node.memoryId());
                } catch (MemoryServiceException e) {
                    details.add(node.memoryId() + ": " + e.getMessage());
                }
            }
        }

        log.info("🧹 Orphan detection for {}: {} orphans{}", projectId, orphans, dryRun ? " (dry run)" : "");
        return PhaseResult.of(phase(), orphans, details, "No orphans found");
    }
}

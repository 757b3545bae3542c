package com.purchasingpower.memory.memory;

import com.purchasingpower.memory.configuration.InferenceProperties;
import com.purchasingpower.memory.configuration.MemoryProperties;
import com.purchasingpower.memory.core.Memory;
import com.purchasingpower.memory.core.MemoryType;
import com.purchasingpower.memory.core.RelationshipRef;
import com.purchasingpower.memory.storage.GraphStore;
import com.purchasingpower.memory.storage.ScoredPoint;
import com.purchasingpower.memory.storage.VectorStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Mirrors graph-eligible memories into the graph store.
 *
 * <p>Every method here is best-effort: graph failures are logged at WARN and reported as
 * "nothing done", never thrown, so they cannot undo a vector write.
 *
 * @since 1.0.0
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GraphMirror {

    private final GraphStore graphStore;
    private final VectorStore vectorStore;
    private final MemoryPointMapper mapper;
    private final MemoryProperties properties;

    /**
     * Creates the node, the caller's explicit edges and the inferred edges.
     *
     * @return number of inferred edges, or 0 when the node could not be created
     */
    public int mirrorCreated(Memory memory, List<RelationshipRef> explicit) {
        if (!createNode(memory)) {
            return 0;
        }
        createExplicit(memory, explicit);
        return inferRelationships(memory);
    }

    public boolean createNode(Memory memory) {
        try {
            graphStore.createNode(memory.getProjectId(), memory.getType().getGraphLabel(),
                    memory.getId(), mapper.nodeProperties(memory));
            return true;
        } catch (RuntimeException e) {
            log.warn("⚠️  Graph node for {} {} not created: {}", memory.getType().getWireName(),
                    memory.getId(), e.getMessage());
            return false;
        }
    }

    public void updateNode(Memory memory) {
        try {
            if (!graphStore.updateNode(memory.getProjectId(), memory.getId(), mapper.nodeProperties(memory))) {
                log.warn("⚠️  Graph node for {} missing on update; orphan detection will not recreate it",
                        memory.getId());
            }
        } catch (RuntimeException e) {
            log.warn("⚠️  Graph node for {} not updated: {}", memory.getId(), e.getMessage());
        }
    }

    /**
     * Applies explicit relationships supplied with an update.
     */
    public void replaceExplicit(Memory memory, List<RelationshipRef> explicit, RelationshipUpdatePolicy policy) {
        if (policy == RelationshipUpdatePolicy.REPLACE) {
            try {
                int removed = graphStore.deleteRelationships(memory.getProjectId(), memory.getId(),
                        RelationshipOrigin.EXPLICIT.getValue());
                log.debug("Removed {} explicit edges of {}", removed, memory.getId());
            } catch (RuntimeException e) {
                log.warn("⚠️  Explicit edges of {} not removed: {}", memory.getId(), e.getMessage());
                return;
            }
        }
        createExplicit(memory, explicit);
    }

    public void markDeleted(String projectId, String memoryId) {
        try {
            graphStore.deleteNode(projectId, memoryId);
        } catch (RuntimeException e) {
            log.warn("⚠️  Graph node {} not soft-deleted: {}", memoryId, e.getMessage());
        }
    }

    public void remove(String projectId, String memoryId) {
        try {
            graphStore.removeNode(projectId, memoryId);
        } catch (RuntimeException e) {
            log.warn("⚠️  Graph node {} not removed: {}", memoryId, e.getMessage());
        }
    }

    private int createExplicit(Memory memory, List<RelationshipRef> explicit) {
        if (explicit == null || explicit.isEmpty()) {
            return 0;
        }
        int created = 0;
        for (RelationshipRef ref : explicit) {
            String type = ref.getType() != null ? ref.getType().trim().toUpperCase(Locale.ROOT) : null;
            try {
                Map<String, Object> props = new LinkedHashMap<>();
                props.put("origin", RelationshipOrigin.EXPLICIT.getValue());
                if (graphStore.createRelationship(memory.getProjectId(), memory.getId(), type,
                        ref.getTargetId(), props)) {
                    created++;
                } else {
                    log.warn("⚠️  Explicit {} edge {} -> {} skipped: target not in graph",
                            type, memory.getId(), ref.getTargetId());
                }
            } catch (RuntimeException e) {
                log.warn("⚠️  Explicit {} edge {} -> {} failed: {}", type, memory.getId(),
                        ref.getTargetId(), e.getMessage());
            }
        }
        return created;
    }

    /**
     * Searches every other graph-eligible collection for similar active memories and links
     * them with the label from {@link RelationshipInference}.
     */
    int inferRelationships(Memory memory) {
        InferenceProperties inference = properties.getInference();
        int created = 0;
        for (MemoryType target : MemoryType.graphEligibleTypes()) {
            if (target == memory.getType()) {
                continue;
            }
            try {
                List<ScoredPoint> hits = vectorStore.search(
                        List.of(target.collectionName(memory.getProjectId())),
                        memory.getVector(),
                        inference.getMaxMatches(),
                        MemoryPointMapper.activeFilter(memory.getProjectId()),
                        inference.getScoreThreshold());

                String label = RelationshipInference.infer(memory.getType(), target);
                for (ScoredPoint hit : hits) {
                    if (hit.getId().equals(memory.getId())) {
                        continue;
                    }
                    Map<String, Object> props = new LinkedHashMap<>();
                    props.put("origin", RelationshipOrigin.INFERRED.getValue());
                    props.put("score", hit.getScore());
                    if (graphStore.createRelationship(memory.getProjectId(), memory.getId(), label,
                            hit.getId(), props)) {
                        created++;
                    }
                }
            } catch (RuntimeException e) {
                log.warn("⚠️  Relationship inference against {} failed for {}: {}",
                        target.getWireName(), memory.getId(), e.getMessage());
            }
        }
        if (created > 0) {
            log.info("🔗 Inferred {} relationships for {} {}", created, memory.getType().getWireName(), memory.getId());
        }
        return created;
    }
}

package com.purchasingpower.memory.storage;

import java.util.List;
import java.util.Map;

/**
 * Project-scoped knowledge graph of memories.
 *
 * <p>Nodes are keyed by {@code (projectId, memoryId)}. Every read excludes other projects;
 * traversals additionally exclude soft-deleted nodes.
 *
 * @since 1.0.0
 */
public interface GraphStore {

    /**
     * Creates (or re-creates) the node for a memory. Stamps {@code project_id},
     * {@code created_at} and {@code deleted=false}.
     */
    void createNode(String projectId, String label, String memoryId, Map<String, Object> properties);

    /**
     * Merges properties into an existing node and bumps {@code updated_at}.
     *
     * @return false when no such node exists
     */
    boolean updateNode(String projectId, String memoryId, Map<String, Object> properties);

    /**
     * Soft delete: the node stays, flagged {@code deleted=true}.
     */
    boolean deleteNode(String projectId, String memoryId);

    /**
     * Hard delete: the node and all its edges are removed.
     */
    boolean removeNode(String projectId, String memoryId);

    List<GraphNodeRef> listNodes(String projectId);

    /**
     * @return false when either endpoint is missing from the project
     */
    boolean createRelationship(String projectId, String sourceId, String relationshipType,
                               String targetId, Map<String, Object> properties);

    /**
     * Removes the outgoing edges of a node that carry the given {@code origin} property.
     */
    int deleteRelationships(String projectId, String sourceId, String origin);

    /**
     * Nodes reachable from {@code memoryId} within {@code depth} hops (1..5) over the given
     * relationship types (all types when empty), nearest first, at most 50.
     */
    List<RelatedNode> getRelated(String projectId, String memoryId, List<String> relationshipTypes, int depth);

    /**
     * Runs a read-only statement. {@code $projectId} is always bound to {@code projectId}.
     */
    List<Map<String, Object>> query(String projectId, String cypher, Map<String, Object> params);

    GraphStatistics statistics(String projectId);
}

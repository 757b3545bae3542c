package com.purchasingpower.memory.memory;

import com.purchasingpower.memory.core.Memory;
import com.purchasingpower.memory.core.MemoryDraft;
import com.purchasingpower.memory.core.MemoryType;

import java.util.List;

/**
 * Create, read, update and delete memories across the vector and graph stores.
 *
 * <p>The vector store is written first and is authoritative. Graph mirroring for
 * graph-eligible types is best-effort: graph failures are logged and never undo the vector
 * write. Drift is repaired later by the orphan detection phase of normalization.
 *
 * @since 1.0.0
 */
public interface MemoryService {

    CreateResult create(String projectId, MemoryDraft draft);

    /**
     * @throws com.purchasingpower.memory.exception.MemoryNotFoundException when absent or soft-deleted
     */
    Memory get(String projectId, MemoryType type, String memoryId);

    /**
     * Re-embeds only when the content actually changes.
     *
     * @throws com.purchasingpower.memory.exception.MemoryConflictException when the memory is soft-deleted
     */
    Memory update(String projectId, MemoryType type, String memoryId, MemoryUpdate update);

    /**
     * Soft delete flags the memory in both stores; hard delete removes it from both.
     */
    void delete(String projectId, MemoryType type, String memoryId, boolean hard);

    /**
     * Batched create of 1..100 memories: one embedding call and one upsert per type.
     * Bulk writes are not mirrored into the graph.
     */
    BulkCreateResult bulkCreate(String projectId, List<MemoryDraft> drafts);
}

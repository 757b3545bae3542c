package com.purchasingpower.memory.memory;

import com.purchasingpower.memory.core.MemoryType;

import java.util.List;

/**
 * Read-side queries over memories. Soft-deleted memories are excluded unless asked for.
 *
 * @since 1.0.0
 */
public interface MemoryQueryService {

    List<SearchHit> search(String projectId, SearchQuery query);

    MemoryPage list(String projectId, MemoryType type, int limit, String offset, boolean includeDeleted);

    MemoryStatistics statistics(String projectId);
}

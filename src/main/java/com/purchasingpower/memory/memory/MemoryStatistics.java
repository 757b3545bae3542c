package com.purchasingpower.memory.memory;

import com.purchasingpower.memory.storage.GraphStatistics;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MemoryStatistics {

    private String projectId;

    /** Active memories per type wire name. */
    @Builder.Default
    private Map<String, Long> memoriesByType = new LinkedHashMap<>();

    private long totalMemories;

    /** Null when the graph store could not be reached. */
    private GraphStatistics graph;
}

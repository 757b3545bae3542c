package com.purchasingpower.memory.storage;

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
public class GraphStatistics {

    private long nodeCount;
    private long relationshipCount;

    @Builder.Default
    private Map<String, Long> nodesByType = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, Long> relationshipsByType = new LinkedHashMap<>();
}

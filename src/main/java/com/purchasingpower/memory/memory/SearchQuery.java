package com.purchasingpower.memory.memory;

import com.purchasingpower.memory.core.MemoryType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Semantic search over a project's memories. Empty {@code types} means every type.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchQuery {

    private String query;

    @Builder.Default
    private List<MemoryType> types = new ArrayList<>();

    @Builder.Default
    private int limit = 10;

    private Double scoreThreshold;

    /** Equality filters on metadata keys. */
    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();
}

package com.purchasingpower.memory.memory;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateResult {

    private String memoryId;

    /** Inferred edges created; null when the type is not mirrored into the graph. */
    private Integer autoRelationships;

    /** Older results of the same suite removed on write; null for other types. */
    private Integer oldTestResultsCleaned;
}

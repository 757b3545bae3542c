package com.purchasingpower.memory.api;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Read-only Cypher. {@code $projectId} is bound by the server and cannot be overridden.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GraphQueryRequest {

    @NotBlank
    private String cypher;

    private Map<String, Object> parameters;
}

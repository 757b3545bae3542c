package com.purchasingpower.memory.core;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * A discrete unit of project knowledge. The vector store copy is authoritative.
 *
 * @since 1.0.0
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Memory {

    private String id;
    private MemoryType type;
    private String content;

    @Builder.Default
    private Map<String, Object> metadata = new HashMap<>();

    @JsonIgnore
    private List<Float> vector;

    private String projectId;
    private Instant createdAt;
    private Instant updatedAt;
    private boolean deleted;

    public String collectionName() {
        return type.collectionName(projectId);
    }

    public Object metadataValue(String key) {
        return metadata != null ? metadata.get(key) : null;
    }
}

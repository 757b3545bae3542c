package com.purchasingpower.memory.api;

import com.purchasingpower.memory.core.RelationshipRef;
import com.purchasingpower.memory.memory.MemoryUpdate;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Omitted fields stay unchanged. A present {@code relationships} list is applied with the
 * configured update policy.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateMemoryRequest {

    private String content;
    private Map<String, Object> metadata;
    private List<RelationshipRef> relationships;

    public MemoryUpdate toUpdate() {
        return MemoryUpdate.builder()
                .content(content)
                .metadata(metadata)
                .relationships(relationships)
                .build();
    }
}

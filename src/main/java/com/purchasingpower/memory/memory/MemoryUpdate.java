package com.purchasingpower.memory.memory;

import com.purchasingpower.memory.core.RelationshipRef;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Partial update. Null fields are left unchanged; metadata is merged key by key.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MemoryUpdate {

    private String content;
    private Map<String, Object> metadata;
    private List<RelationshipRef> relationships;
}

package com.purchasingpower.memory.api;

import com.purchasingpower.memory.core.MemoryDraft;
import com.purchasingpower.memory.core.MemoryType;
import com.purchasingpower.memory.core.RelationshipRef;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateMemoryRequest {

    @NotNull
    private MemoryType type;

    @NotBlank
    private String content;

    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();

    @Builder.Default
    private List<RelationshipRef> relationships = new ArrayList<>();

    public MemoryDraft toDraft() {
        return MemoryDraft.builder()
                .type(type)
                .content(content)
                .metadata(metadata != null ? metadata : new LinkedHashMap<>())
                .relationships(relationships != null ? relationships : new ArrayList<>())
                .build();
    }
}

package com.purchasingpower.memory.storage;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RelatedNode {

    private String memoryId;
    private String type;
    private Map<String, Object> properties;
    private int distance;
}
